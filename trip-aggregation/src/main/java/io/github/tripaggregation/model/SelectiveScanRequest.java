package io.github.tripaggregation.model;

import org.immutables.value.Value;

/**
 * Server side filtered read of the rows of an object where one column equals a value.
 */
@Value.Immutable
public interface SelectiveScanRequest {

  S3Location location();

  /**
   * Column the predicate applies to.
   *
   * @return the column
   */
  String column();

  /**
   * Value the column must equal.
   *
   * @return the value
   */
  String value();

  @Value.Default
  default ScanInputFormat inputFormat() {
    return ScanInputFormat.CSV;
  }

  /**
   * Predicate expression, with single quotes in the value doubled.
   *
   * @return the expression
   */
  default String expression() {
    return "select * from s3object s where s.\"" + column() + "\" = '"
        + value().replace("'", "''") + "'";
  }
}
