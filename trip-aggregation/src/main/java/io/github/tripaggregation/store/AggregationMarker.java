package io.github.tripaggregation.store;

import io.github.tripaggregation.exception.TripNotFoundException;

/**
 * Flags a trip summary once its aggregated trip has been stored.
 */
public interface AggregationMarker {

  /**
   * Set the aggregation flag of an existing summary, leaving every other field untouched.
   *
   * @param tripId the trip id
   * @throws TripNotFoundException if there is no summary for the trip
   */
  void markAggregated(String tripId);
}
