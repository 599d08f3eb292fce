package io.github.tripaggregation.engine;

import io.github.tripaggregation.exception.QueryExecutionException;
import io.github.tripaggregation.model.QueryExecutionResult;

/**
 * Engine running SQL-like queries over the partitioned event log.
 */
public interface BatchQueryEngine {

  /**
   * Submit a query for asynchronous execution.
   *
   * @param queryString the query string
   * @return the execution id
   * @throws QueryExecutionException if the engine rejects the query
   */
  String submit(String queryString);

  /**
   * Block until the execution reaches a terminal state.
   *
   * @param executionId the execution id
   * @return the result of a succeeded execution
   * @throws QueryExecutionException if the execution failed or was cancelled
   */
  QueryExecutionResult awaitCompletion(String executionId);

  /**
   * Submit a query and wait for its result.
   *
   * @param queryString the query string
   * @return the result
   */
  default QueryExecutionResult execute(final String queryString) {
    return awaitCompletion(submit(queryString));
  }
}
