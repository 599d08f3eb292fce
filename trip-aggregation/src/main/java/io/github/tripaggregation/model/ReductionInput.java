package io.github.tripaggregation.model;

import org.immutables.value.Value;

/**
 * Rendered queries of one reduction cycle.
 */
@Value.Immutable
public interface ReductionInput {

  PartitionKey partitionKey();

  /**
   * Predicate over the partition columns both queries are scoped by.
   *
   * @return the filter expression
   */
  String queryFilterExpression();

  String tripSummaryQuery();

  String reducedTripRecordsQuery();

  /**
   * Tag for logs, {@code year-month-day-hour-minute}.
   *
   * @return the formatted date
   */
  String formattedDate();
}
