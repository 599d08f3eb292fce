package io.github.tripaggregation.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.List;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * A trip summary together with every record of the trip.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableAggregatedTrip.class)
@JsonDeserialize(as = ImmutableAggregatedTrip.class)
public interface AggregatedTrip {

  String tripId();

  String deviceId();

  Optional<String> startDate();

  String endDate();

  Optional<Long> durationSeconds();

  long eventCount();

  Optional<Double> dataIntegrityRate();

  S3Location recordsFile();

  /**
   * Whether the trip was aggregated. Stored and served aggregated trips always carry {@code true}.
   *
   * @return the aggregation flag
   */
  @Value.Default
  default boolean aggregationExecuted() {
    return true;
  }

  /**
   * Telemetry records of the trip, ordered by event time.
   *
   * @return the records
   */
  List<EventRecord> records();

  /**
   * Compose an aggregated trip. The summary's aggregation flag is superseded, since the result
   * is what aggregation produces.
   *
   * @param summary the summary
   * @param records the records
   * @return the aggregated trip
   */
  static AggregatedTrip of(final TripSummary summary, final List<EventRecord> records) {
    return ImmutableAggregatedTrip.builder()
        .tripId(summary.tripId())
        .deviceId(summary.deviceId())
        .startDate(summary.startDate())
        .endDate(summary.endDate())
        .durationSeconds(summary.durationSeconds())
        .eventCount(summary.eventCount())
        .dataIntegrityRate(summary.dataIntegrityRate())
        .recordsFile(summary.recordsFile())
        .aggregationExecuted(true)
        .records(records)
        .build();
  }
}
