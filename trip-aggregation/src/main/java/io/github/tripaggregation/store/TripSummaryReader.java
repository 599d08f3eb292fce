package io.github.tripaggregation.store;

import io.github.tripaggregation.model.TripSummary;
import java.util.Optional;

/**
 * Read access to trip summaries.
 */
public interface TripSummaryReader {

  /**
   * Fetch the summary of a trip.
   *
   * @param tripId the trip id
   * @return the summary, empty if unknown
   */
  Optional<TripSummary> get(String tripId);
}
