package io.github.tripaggregation.model;

import java.net.URI;
import java.time.Duration;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Names and endpoints the pipeline works against.
 */
@Value.Immutable
public interface Configuration {

  /**
   * Table holding trip summaries, keyed by {@code trip_id}.
   *
   * @return the summary table name
   */
  String tripSummariesTableName();

  /**
   * Bucket aggregated trips are cached in.
   *
   * @return the trip records bucket name
   */
  String tripRecordsBucketName();

  /**
   * Catalog database of the raw event table.
   *
   * @return the query database name
   */
  String queryDatabaseName();

  /**
   * Partitioned raw event table.
   *
   * @return the query table name
   */
  String queryTableName();

  /**
   * Work group queries are submitted to.
   *
   * @return the work group
   */
  String queryWorkGroup();

  /**
   * Output location for query results. When absent the work group's location is used.
   *
   * @return the output location
   */
  Optional<String> queryOutputLocation();

  /**
   * Interval between two polls of a running query.
   *
   * @return the poll interval
   */
  @Value.Default
  default Duration queryPollInterval() {
    return Duration.ofSeconds(1);
  }

  Optional<String> region();

  /**
   * Endpoint override for all AWS clients, e.g. a local emulator.
   *
   * @return the endpoint
   */
  Optional<URI> endpointOverride();
}
