package io.github.tripaggregation.model;

import java.util.List;
import org.immutables.value.Value;

/**
 * Time partition of the raw event log a batch file belongs to.
 */
@Value.Immutable
public interface PartitionKey {

  /**
   * Partition names, in the order the storage layout nests them.
   */
  List<String> NAMES = List.of("year", "month", "day", "hour", "minute");

  /**
   * Year.
   *
   * @return the year
   */
  String year();

  /**
   * Month.
   *
   * @return the month
   */
  String month();

  /**
   * Day.
   *
   * @return the day
   */
  String day();

  /**
   * Hour.
   *
   * @return the hour
   */
  String hour();

  /**
   * Minute.
   *
   * @return the minute
   */
  String minute();

  /**
   * Values in the order of {@link #NAMES}.
   *
   * @return the values
   */
  default List<String> values() {
    return List.of(year(), month(), day(), hour(), minute());
  }

  /**
   * Human readable tag, e.g. {@code 2023-01-02-03-04}.
   *
   * @return the formatted date
   */
  default String formattedDate() {
    return String.join("-", values());
  }
}
