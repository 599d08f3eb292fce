package io.github.tripaggregation.model;

/**
 * Serialization of an object a selective scan reads.
 */
public enum ScanInputFormat {
  /**
   * Comma separated values with a header row naming the columns.
   */
  CSV,

  /**
   * One JSON object per line.
   */
  JSON_LINES
}
