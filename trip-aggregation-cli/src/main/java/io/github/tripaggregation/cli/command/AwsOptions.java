package io.github.tripaggregation.cli.command;

import io.github.tripaggregation.model.Configuration;
import io.github.tripaggregation.model.ImmutableConfiguration;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import picocli.CommandLine.Option;

/**
 * Options naming the tables, buckets and query engine resources, shared by every command.
 */
public class AwsOptions {

  @Option(
      names = {"--summaries-table"},
      description = "Trip summaries table (default: env TRIP_SUMMARIES_TABLE_NAME)",
      defaultValue = "${TRIP_SUMMARIES_TABLE_NAME}")
  String summariesTable;

  @Option(
      names = {"--records-bucket"},
      description = "Bucket for aggregated trips (default: env TRIP_RECORDS_BUCKET_NAME)",
      defaultValue = "${TRIP_RECORDS_BUCKET_NAME}")
  String recordsBucket;

  @Option(
      names = {"--athena-database"},
      description = "Database of the raw event table (default: env ATHENA_DATABASE_NAME)",
      defaultValue = "${ATHENA_DATABASE_NAME}")
  String athenaDatabase;

  @Option(
      names = {"--athena-table"},
      description = "Raw event table (default: env ATHENA_TABLE_NAME)",
      defaultValue = "${ATHENA_TABLE_NAME}")
  String athenaTable;

  @Option(
      names = {"--athena-work-group"},
      description = "Work group queries run in (default: env ATHENA_WORK_GROUP or TripReduction)",
      defaultValue = "${ATHENA_WORK_GROUP:-TripReduction}")
  String athenaWorkGroup;

  @Option(
      names = {"--athena-output-location"},
      description = "Query result location, overrides the work group's (default: env ATHENA_OUTPUT_LOCATION)",
      defaultValue = "${ATHENA_OUTPUT_LOCATION}")
  String athenaOutputLocation;

  @Option(
      names = {"--poll-interval-ms"},
      description = "Milliseconds between two query status polls (default: 1000)",
      defaultValue = "1000")
  long pollIntervalMillis;

  @Option(
      names = {"--region"},
      description = "AWS region (default: env AWS_REGION)",
      defaultValue = "${AWS_REGION}")
  String region;

  @Option(
      names = {"--endpoint-url"},
      description = "Endpoint override for all AWS services (default: env AWS_ENDPOINT_URL)",
      defaultValue = "${AWS_ENDPOINT_URL}")
  String endpointUrl;

  /**
   * Names of required options that have no value.
   *
   * @return the missing options
   */
  public List<String> missingOptions() {
    final List<String> missing = new ArrayList<>();
    if (isBlank(summariesTable)) {
      missing.add("--summaries-table");
    }
    if (isBlank(recordsBucket)) {
      missing.add("--records-bucket");
    }
    if (isBlank(athenaDatabase)) {
      missing.add("--athena-database");
    }
    if (isBlank(athenaTable)) {
      missing.add("--athena-table");
    }
    if (isBlank(athenaWorkGroup)) {
      missing.add("--athena-work-group");
    }
    return missing;
  }

  /**
   * Configuration of these options.
   *
   * @return the configuration
   */
  public Configuration toConfiguration() {
    final ImmutableConfiguration.Builder builder = ImmutableConfiguration.builder()
        .tripSummariesTableName(summariesTable)
        .tripRecordsBucketName(recordsBucket)
        .queryDatabaseName(athenaDatabase)
        .queryTableName(athenaTable)
        .queryWorkGroup(athenaWorkGroup)
        .queryPollInterval(Duration.ofMillis(pollIntervalMillis));
    if (!isBlank(athenaOutputLocation)) {
      builder.queryOutputLocation(athenaOutputLocation);
    }
    if (!isBlank(region)) {
      builder.region(region);
    }
    if (!isBlank(endpointUrl)) {
      builder.endpointOverride(URI.create(endpointUrl));
    }
    return builder.build();
  }

  private static boolean isBlank(final String value) {
    return value == null || value.isBlank();
  }
}
