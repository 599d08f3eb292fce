package io.github.tripaggregation.exception;

/**
 * The requested trip has no summary. A client error, never retried.
 */
public class TripNotFoundException extends TripAggregationException {

  private final String tripId;

  /**
   * Instantiates a new Trip not found exception.
   *
   * @param tripId the trip id
   */
  public TripNotFoundException(final String tripId) {
    super("Trip not found: " + tripId);
    this.tripId = tripId;
  }

  /**
   * Trip id.
   *
   * @return the trip id
   */
  public String tripId() {
    return tripId;
  }
}
