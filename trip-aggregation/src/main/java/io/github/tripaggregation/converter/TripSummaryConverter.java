package io.github.tripaggregation.converter;

import io.github.tripaggregation.model.ImmutableTripSummary;
import io.github.tripaggregation.model.S3Location;
import io.github.tripaggregation.model.TripSummary;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Maps trip summaries to and from summary table items.
 */
@Singleton
public class TripSummaryConverter {

  public static final String TRIP_ID = "trip_id";
  public static final String DEVICE_ID = "device_id";
  public static final String START_DATE = "start_date";
  public static final String END_DATE = "end_date";
  public static final String DURATION_SECONDS = "duration_seconds";
  public static final String EVENT_COUNT = "event_count";
  public static final String RECORDS_FILE = "records_file";
  public static final String AGGREGATION_EXECUTED = "aggregation_executed";
  public static final String DATA_INTEGRITY_RATE = "data_integrity_rate";

  private static final String BUCKET = "bucket";
  private static final String KEY = "key";

  /**
   * Instantiates a new Trip summary converter.
   */
  @Inject
  public TripSummaryConverter() {
    // Stateless
  }

  /**
   * Primary key of a summary item.
   *
   * @param tripId the trip id
   * @return the key
   */
  public Map<String, AttributeValue> key(final String tripId) {
    return Map.of(TRIP_ID, string(tripId));
  }

  /**
   * Derived fields that have a value, in a stable order. Excludes the key and the aggregation flag.
   *
   * @param summary the summary
   * @return the attributes
   */
  public Map<String, AttributeValue> derivedAttributes(final TripSummary summary) {
    final Map<String, AttributeValue> attributes = new LinkedHashMap<>();
    attributes.put(DEVICE_ID, string(summary.deviceId()));
    summary.startDate().ifPresent(v -> attributes.put(START_DATE, string(v)));
    attributes.put(END_DATE, string(summary.endDate()));
    summary.durationSeconds().ifPresent(v -> attributes.put(DURATION_SECONDS, number(v)));
    attributes.put(EVENT_COUNT, number(summary.eventCount()));
    attributes.put(RECORDS_FILE, location(summary.recordsFile()));
    summary.dataIntegrityRate().ifPresent(v -> attributes.put(DATA_INTEGRITY_RATE, number(v)));
    return attributes;
  }

  /**
   * Derived fields without a value, which must be removed from a stored item.
   *
   * @param summary the summary
   * @return the attribute names
   */
  public List<String> absentDerivedAttributes(final TripSummary summary) {
    final List<String> absent = new ArrayList<>();
    if (summary.startDate().isEmpty()) {
      absent.add(START_DATE);
    }
    if (summary.durationSeconds().isEmpty()) {
      absent.add(DURATION_SECONDS);
    }
    if (summary.dataIntegrityRate().isEmpty()) {
      absent.add(DATA_INTEGRITY_RATE);
    }
    return absent;
  }

  /**
   * Full item of a summary.
   *
   * @param summary the summary
   * @return the item
   */
  public Map<String, AttributeValue> toItem(final TripSummary summary) {
    final Map<String, AttributeValue> item = new LinkedHashMap<>(key(summary.tripId()));
    item.putAll(derivedAttributes(summary));
    item.put(AGGREGATION_EXECUTED, AttributeValue.builder().bool(summary.aggregationExecuted()).build());
    return item;
  }

  /**
   * Summary of a stored item.
   *
   * @param item the item
   * @return the summary
   */
  public TripSummary fromItem(final Map<String, AttributeValue> item) {
    final AttributeValue recordsFile = item.get(RECORDS_FILE);
    final AttributeValue aggregationExecuted = item.get(AGGREGATION_EXECUTED);
    return ImmutableTripSummary.builder()
        .tripId(requiredString(item, TRIP_ID))
        .deviceId(requiredString(item, DEVICE_ID))
        .startDate(optionalString(item, START_DATE))
        .endDate(requiredString(item, END_DATE))
        .durationSeconds(optionalNumber(item, DURATION_SECONDS).map(Long::parseLong))
        .eventCount(optionalNumber(item, EVENT_COUNT).map(Long::parseLong).orElse(0L))
        .recordsFile(S3Location.of(
            recordsFile.m().get(BUCKET).s(),
            recordsFile.m().get(KEY).s()))
        .aggregationExecuted(aggregationExecuted != null && Boolean.TRUE.equals(aggregationExecuted.bool()))
        .dataIntegrityRate(optionalNumber(item, DATA_INTEGRITY_RATE).map(Double::parseDouble))
        .build();
  }

  private static AttributeValue string(final String value) {
    return AttributeValue.builder().s(value).build();
  }

  private static AttributeValue number(final Number value) {
    return AttributeValue.builder().n(value.toString()).build();
  }

  private static AttributeValue location(final S3Location location) {
    return AttributeValue.builder()
        .m(Map.of(BUCKET, string(location.bucket()), KEY, string(location.key())))
        .build();
  }

  private static String requiredString(final Map<String, AttributeValue> item, final String name) {
    return optionalString(item, name)
        .orElseThrow(() -> new IllegalArgumentException("Summary item has no " + name + ": " + item));
  }

  private static Optional<String> optionalString(final Map<String, AttributeValue> item, final String name) {
    return Optional.ofNullable(item.get(name)).map(AttributeValue::s);
  }

  private static Optional<String> optionalNumber(final Map<String, AttributeValue> item, final String name) {
    return Optional.ofNullable(item.get(name)).map(AttributeValue::n);
  }
}
