package io.github.tripaggregation.query;

import io.github.tripaggregation.model.Configuration;
import io.github.tripaggregation.model.ImmutableReductionInput;
import io.github.tripaggregation.model.PartitionKey;
import io.github.tripaggregation.model.ReductionInput;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Renders the queries of a reduction cycle. Templates are classpath resources with {@code {table}}
 * and {@code {filter}} placeholders.
 */
@Singleton
public class QueryTemplateEngine {

  /**
   * The constant TRIP_SUMMARY_TEMPLATE.
   */
  public static final String TRIP_SUMMARY_TEMPLATE = "queries/trip-summary.sql";

  /**
   * The constant REDUCED_TRIP_RECORDS_TEMPLATE.
   */
  public static final String REDUCED_TRIP_RECORDS_TEMPLATE = "queries/reduced-trip-records.sql";

  private static final String TABLE_PLACEHOLDER = "{table}";
  private static final String FILTER_PLACEHOLDER = "{filter}";

  private final String tableName;
  private final String tripSummaryTemplate;
  private final String reducedTripRecordsTemplate;

  /**
   * Instantiates a new Query template engine.
   *
   * @param configuration the configuration
   */
  @Inject
  public QueryTemplateEngine(final Configuration configuration) {
    this(configuration.queryTableName(),
        loadTemplate(TRIP_SUMMARY_TEMPLATE),
        loadTemplate(REDUCED_TRIP_RECORDS_TEMPLATE));
  }

  /**
   * Instantiates a new Query template engine with explicit templates.
   *
   * @param tableName                  the table name
   * @param tripSummaryTemplate        the trip summary template
   * @param reducedTripRecordsTemplate the reduced trip records template
   */
  public QueryTemplateEngine(final String tableName,
                             final String tripSummaryTemplate,
                             final String reducedTripRecordsTemplate) {
    this.tableName = tableName;
    this.tripSummaryTemplate = tripSummaryTemplate.replace(TABLE_PLACEHOLDER, tableName);
    this.reducedTripRecordsTemplate = reducedTripRecordsTemplate.replace(TABLE_PLACEHOLDER, tableName);
  }

  /**
   * Render both queries for a partition.
   *
   * @param partitionKey the partition key
   * @return the reduction input
   */
  public ReductionInput render(final PartitionKey partitionKey) {
    final String filter = filterExpression(partitionKey);
    return ImmutableReductionInput.builder()
        .partitionKey(partitionKey)
        .queryFilterExpression(filter)
        .tripSummaryQuery(tripSummaryQuery(filter))
        .reducedTripRecordsQuery(reducedTripRecordsQuery(filter))
        .formattedDate(partitionKey.formattedDate())
        .build();
  }

  /**
   * Predicate selecting exactly the partition, e.g.
   * {@code a.year = '2023' and a.month = '01' and ...}.
   *
   * @param partitionKey the partition key
   * @return the filter expression
   */
  public String filterExpression(final PartitionKey partitionKey) {
    final List<String> clauses = new ArrayList<>();
    final List<String> values = partitionKey.values();
    for (int i = 0; i < PartitionKey.NAMES.size(); i++) {
      clauses.add("a." + PartitionKey.NAMES.get(i) + " = '" + values.get(i).replace("'", "''") + "'");
    }
    return String.join(" and ", clauses);
  }

  /**
   * Finished trips of the filtered partitions joined with their engine start.
   *
   * @param filterExpression the filter expression
   * @return the query
   */
  public String tripSummaryQuery(final String filterExpression) {
    return tripSummaryTemplate.replace(FILTER_PLACEHOLDER, filterExpression);
  }

  /**
   * Every record of the trips finished in the filtered partitions, ordered by trip and date.
   *
   * @param filterExpression the filter expression
   * @return the query
   */
  public String reducedTripRecordsQuery(final String filterExpression) {
    return reducedTripRecordsTemplate.replace(FILTER_PLACEHOLDER, filterExpression);
  }

  /**
   * Statement reconciling the partition catalog with the storage layout.
   *
   * @return the statement
   */
  public String partitionRefreshStatement() {
    return "MSCK REPAIR TABLE " + tableName + ";";
  }

  private static String loadTemplate(final String resource) {
    try (InputStream in = QueryTemplateEngine.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalStateException("Query template not found on classpath: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read query template " + resource, e);
    }
  }
}
