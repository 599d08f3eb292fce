package io.github.tripaggregation.converter;

import io.github.tripaggregation.model.EventRecord;
import io.github.tripaggregation.model.EventType;
import io.github.tripaggregation.model.ImmutableEventRecord;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts rows of the raw event table into event records. Column names are matched ignoring case.
 */
@Singleton
public class EventRecordConverter {

  private static final Logger log = LoggerFactory.getLogger(EventRecordConverter.class);

  /**
   * Instantiates a new Event record converter.
   */
  @Inject
  public EventRecordConverter() {
    // Stateless
  }

  /**
   * Event record of a row.
   *
   * @param row the row
   * @return the record, empty if the row is missing a required column or holds an invalid value
   */
  public Optional<EventRecord> fromRow(final Map<String, String> row) {
    final Map<String, String> columns = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    columns.putAll(row);

    final String eventId = value(columns, "eventid");
    final String tripId = value(columns, "tripid");
    final String deviceId = value(columns, "deviceid");
    final String eventType = value(columns, "eventtype");
    final String eventDate = value(columns, "eventdate");
    final String eventTime = value(columns, "eventtime");
    if (eventId == null || tripId == null || deviceId == null || eventType == null
        || (eventDate == null && eventTime == null)) {
      log.warn("Skipping event row with missing columns: {}", row);
      return Optional.empty();
    }

    try {
      final long epochMillis = eventTime != null
          ? Long.parseLong(eventTime)
          : Instant.parse(eventDate).toEpochMilli();
      return Optional.of(ImmutableEventRecord.builder()
          .eventId(eventId)
          .tripId(tripId)
          .deviceId(deviceId)
          .eventTime(epochMillis)
          .eventDate(eventDate != null ? eventDate : Instant.ofEpochMilli(epochMillis).toString())
          .eventType(EventType.fromValue(eventType))
          .randomData(Optional.ofNullable(value(columns, "randomdata")))
          .build());
    } catch (NumberFormatException | DateTimeParseException e) {
      log.warn("Skipping event row without a usable time: {}", row);
    } catch (IllegalArgumentException e) {
      log.warn("Skipping event row: {}", e.getMessage());
    }
    return Optional.empty();
  }

  private static String value(final Map<String, String> columns, final String name) {
    final String value = columns.get(name);
    return value == null || value.isEmpty() ? null : value;
  }
}
