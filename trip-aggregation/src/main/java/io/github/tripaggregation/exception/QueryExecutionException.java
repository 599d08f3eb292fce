package io.github.tripaggregation.exception;

import java.util.Optional;

/**
 * A query did not succeed.
 */
public class QueryExecutionException extends TripAggregationException {

  private final String executionId;

  /**
   * Instantiates a new Query execution exception.
   *
   * @param executionId the execution id, null when the query was never submitted
   * @param message     the message
   */
  public QueryExecutionException(final String executionId, final String message) {
    super(message);
    this.executionId = executionId;
  }

  /**
   * Instantiates a new Query execution exception.
   *
   * @param executionId the execution id, null when the query was never submitted
   * @param message     the message
   * @param cause       the cause
   */
  public QueryExecutionException(final String executionId, final String message, final Throwable cause) {
    super(message, cause);
    this.executionId = executionId;
  }

  /**
   * Execution id.
   *
   * @return the execution id
   */
  public Optional<String> executionId() {
    return Optional.ofNullable(executionId);
  }
}
