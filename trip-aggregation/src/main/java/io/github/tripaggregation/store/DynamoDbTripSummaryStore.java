package io.github.tripaggregation.store;

import static io.github.tripaggregation.converter.TripSummaryConverter.AGGREGATION_EXECUTED;
import static io.github.tripaggregation.converter.TripSummaryConverter.TRIP_ID;

import io.github.tripaggregation.converter.TripSummaryConverter;
import io.github.tripaggregation.exception.TripAggregationException;
import io.github.tripaggregation.exception.TripNotFoundException;
import io.github.tripaggregation.model.Configuration;
import io.github.tripaggregation.model.TripSummary;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.ConditionalCheckFailedException;
import software.amazon.awssdk.services.dynamodb.model.DynamoDbException;
import software.amazon.awssdk.services.dynamodb.model.GetItemRequest;
import software.amazon.awssdk.services.dynamodb.model.GetItemResponse;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

/**
 * Trip summaries in a DynamoDB table keyed by {@code trip_id}.
 *
 * <p>Both write paths are field scoped: a refresh sets the derived fields and only initialises the
 * aggregation flag when it is missing, and marking a trip aggregated sets nothing but the flag.
 * A reduction cycle replayed after a trip was aggregated therefore cannot reset the flag. Summaries
 * are updated one item at a time, so overlapping cycles touching the same trips do not conflict.
 */
@Singleton
public class DynamoDbTripSummaryStore implements TripSummaryReader, TripSummaryRefresher, AggregationMarker {

  private static final Logger log = LoggerFactory.getLogger(DynamoDbTripSummaryStore.class);

  private static final String NOT_AGGREGATED = ":not_aggregated";
  private static final String AGGREGATED = ":aggregated";

  private final DynamoDbClient dynamoDbClient;
  private final TripSummaryConverter converter;
  private final String tableName;

  /**
   * Instantiates a new Dynamo db trip summary store.
   *
   * @param dynamoDbClient the dynamo db client
   * @param converter      the converter
   * @param configuration  the configuration
   */
  @Inject
  public DynamoDbTripSummaryStore(final DynamoDbClient dynamoDbClient,
                                  final TripSummaryConverter converter,
                                  final Configuration configuration) {
    this.dynamoDbClient = dynamoDbClient;
    this.converter = converter;
    this.tableName = configuration.tripSummariesTableName();
  }

  @Override
  public Optional<TripSummary> get(final String tripId) {
    log.trace("get({})", tripId);
    final GetItemResponse response = dynamoDbClient.getItem(GetItemRequest.builder()
        .tableName(tableName)
        .key(converter.key(tripId))
        .consistentRead(true)
        .build());
    if (!response.hasItem() || response.item().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(converter.fromItem(response.item()));
  }

  @Override
  public void refreshDerivedFields(final List<TripSummary> summaries) {
    if (summaries.isEmpty()) {
      return;
    }
    if (summaries.size() > MAX_BATCH_SIZE) {
      throw new IllegalArgumentException(
          "At most " + MAX_BATCH_SIZE + " summaries per batch, got " + summaries.size());
    }

    final List<DynamoDbException> failures = new ArrayList<>();
    for (TripSummary summary : summaries) {
      try {
        dynamoDbClient.updateItem(derivedFieldsUpdate(summary));
      } catch (DynamoDbException e) {
        log.warn("Refresh of trip summary {} failed: {}", summary.tripId(), e.getMessage());
        failures.add(e);
      }
    }
    if (!failures.isEmpty()) {
      final TripAggregationException exception = new TripAggregationException(
          "Refresh of " + failures.size() + " of " + summaries.size() + " trip summaries failed",
          failures.get(0));
      failures.stream().skip(1).forEach(exception::addSuppressed);
      throw exception;
    }
    log.debug("Refreshed {} trip summaries in {}", summaries.size(), tableName);
  }

  @Override
  public void markAggregated(final String tripId) {
    try {
      dynamoDbClient.updateItem(UpdateItemRequest.builder()
          .tableName(tableName)
          .key(converter.key(tripId))
          .updateExpression("SET #" + AGGREGATION_EXECUTED + " = " + AGGREGATED)
          .conditionExpression("attribute_exists(#" + TRIP_ID + ")")
          .expressionAttributeNames(Map.of(
              "#" + AGGREGATION_EXECUTED, AGGREGATION_EXECUTED,
              "#" + TRIP_ID, TRIP_ID))
          .expressionAttributeValues(Map.of(AGGREGATED, AttributeValue.builder().bool(true).build()))
          .build());
    } catch (ConditionalCheckFailedException e) {
      throw new TripNotFoundException(tripId);
    }
  }

  /**
   * Update of the derived fields of a summary.
   *
   * @param summary the summary
   * @return the update request
   */
  UpdateItemRequest derivedFieldsUpdate(final TripSummary summary) {
    final Map<String, String> names = new HashMap<>();
    final Map<String, AttributeValue> values = new HashMap<>();
    final List<String> assignments = new ArrayList<>();

    converter.derivedAttributes(summary).forEach((name, value) -> {
      names.put("#" + name, name);
      values.put(":" + name, value);
      assignments.add("#" + name + " = :" + name);
    });
    names.put("#" + AGGREGATION_EXECUTED, AGGREGATION_EXECUTED);
    values.put(NOT_AGGREGATED, AttributeValue.builder().bool(false).build());
    assignments.add("#" + AGGREGATION_EXECUTED
        + " = if_not_exists(#" + AGGREGATION_EXECUTED + ", " + NOT_AGGREGATED + ")");

    final StringBuilder expression = new StringBuilder("SET ").append(String.join(", ", assignments));
    final List<String> absent = converter.absentDerivedAttributes(summary);
    if (!absent.isEmpty()) {
      absent.forEach(name -> names.put("#" + name, name));
      expression.append(" REMOVE ")
          .append(absent.stream().map(name -> "#" + name).collect(Collectors.joining(", ")));
    }

    return UpdateItemRequest.builder()
        .tableName(tableName)
        .key(converter.key(summary.tripId()))
        .updateExpression(expression.toString())
        .expressionAttributeNames(names)
        .expressionAttributeValues(values)
        .build();
  }
}
