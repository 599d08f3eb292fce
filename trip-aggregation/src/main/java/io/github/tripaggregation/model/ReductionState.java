package io.github.tripaggregation.model;

/**
 * States of a reduction cycle.
 */
public enum ReductionState {
  START,
  PREPARE_INPUT,
  REFRESH_PARTITIONS,
  RUN_QUERIES,
  WRITE_SUMMARIES,
  DONE,
  FAILED
}
