package io.github.tripaggregation.model;

import org.immutables.value.Value;

/**
 * A successfully completed query execution.
 */
@Value.Immutable
public interface QueryExecutionResult {

  /**
   * Execution id assigned by the query engine.
   *
   * @return the execution id
   */
  String executionId();

  /**
   * Where the engine wrote the result file.
   *
   * @return the output location
   */
  S3Location outputLocation();
}
