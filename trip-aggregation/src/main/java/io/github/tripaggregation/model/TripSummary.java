package io.github.tripaggregation.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * Summary of one finished trip, as derived by a reduction cycle.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableTripSummary.class)
@JsonDeserialize(as = ImmutableTripSummary.class)
public interface TripSummary {

  /**
   * Unique id of the trip.
   *
   * @return the trip id
   */
  String tripId();

  /**
   * Id of the vehicle driving this trip.
   *
   * @return the device id
   */
  String deviceId();

  /**
   * Date of the engine start event. Absent when no engine start was found.
   *
   * @return the start date
   */
  Optional<String> startDate();

  /**
   * Date of the trip finished event.
   *
   * @return the end date
   */
  String endDate();

  /**
   * Whole seconds between start and end. Absent when no engine start was found.
   *
   * @return the duration in seconds
   */
  Optional<Long> durationSeconds();

  /**
   * Number of events recorded for this trip.
   *
   * @return the event count
   */
  long eventCount();

  /**
   * Reduced records file holding every record of this trip.
   *
   * @return the records file
   */
  S3Location recordsFile();

  /**
   * Whether the aggregated trip has been materialized.
   *
   * @return true once aggregated
   */
  @Value.Default
  default boolean aggregationExecuted() {
    return false;
  }

  /**
   * Events received vs events expected, one per second.
   *
   * @return the data integrity rate
   */
  Optional<Double> dataIntegrityRate();
}
