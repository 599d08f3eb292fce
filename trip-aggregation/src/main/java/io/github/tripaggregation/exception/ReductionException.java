package io.github.tripaggregation.exception;

import io.github.tripaggregation.model.ReductionState;

/**
 * A stage of a reduction cycle failed.
 */
public class ReductionException extends TripAggregationException {

  private final ReductionState state;

  /**
   * Instantiates a new Reduction exception.
   *
   * @param state   the state that failed
   * @param message the message
   * @param cause   the cause
   */
  public ReductionException(final ReductionState state, final String message, final Throwable cause) {
    super(message, cause);
    this.state = state;
  }

  /**
   * State the cycle failed in.
   *
   * @return the state
   */
  public ReductionState state() {
    return state;
  }
}
