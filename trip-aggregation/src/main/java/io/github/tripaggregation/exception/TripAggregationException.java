package io.github.tripaggregation.exception;

/**
 * Base exception of the trip aggregation pipeline.
 */
public class TripAggregationException extends RuntimeException {

  /**
   * Instantiates a new Trip aggregation exception.
   *
   * @param message the message
   */
  public TripAggregationException(final String message) {
    super(message);
  }

  /**
   * Instantiates a new Trip aggregation exception.
   *
   * @param message the message
   * @param cause   the cause
   */
  public TripAggregationException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
