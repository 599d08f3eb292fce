package io.github.tripaggregation.converter;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.tripaggregation.model.EventRecord;
import io.github.tripaggregation.model.EventType;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventRecordConverterTest {

  private EventRecordConverter converter;

  @BeforeEach
  void setUp() {
    converter = new EventRecordConverter();
  }

  @Test
  void fromRow_withCompleteRow_returnsRecord() {
    // Given
    final Map<String, String> row = row();

    // When
    final Optional<EventRecord> record = converter.fromRow(row);

    // Then
    assertThat(record).hasValueSatisfying(r -> {
      assertThat(r.eventId()).isEqualTo("e-1");
      assertThat(r.tripId()).isEqualTo("trip-1");
      assertThat(r.deviceId()).isEqualTo("device-1");
      assertThat(r.eventTime()).isEqualTo(1672628400000L);
      assertThat(r.eventDate()).isEqualTo("2023-01-02T03:00:00Z");
      assertThat(r.eventType()).isEqualTo(EventType.ENGINE_START);
      assertThat(r.randomData()).contains("xyz");
    });
  }

  @Test
  void fromRow_withUpperCaseColumns_matchesIgnoringCase() {
    // Given
    final Map<String, String> row = new HashMap<>();
    row().forEach((k, v) -> row.put(k.toUpperCase(), v));

    // When / Then
    assertThat(converter.fromRow(row)).isPresent();
  }

  @Test
  void fromRow_withoutEventTime_derivesItFromDate() {
    // Given
    final Map<String, String> row = row();
    row.remove("eventtime");

    // When / Then
    assertThat(converter.fromRow(row)).hasValueSatisfying(r ->
        assertThat(r.eventTime()).isEqualTo(1672628400000L));
  }

  @Test
  void fromRow_withoutEventDate_derivesItFromTime() {
    // Given
    final Map<String, String> row = row();
    row.put("eventdate", "");

    // When / Then
    assertThat(converter.fromRow(row)).hasValueSatisfying(r ->
        assertThat(r.eventDate()).isEqualTo("2023-01-02T03:00:00Z"));
  }

  @Test
  void fromRow_withMissingTripId_returnsEmpty() {
    // Given
    final Map<String, String> row = row();
    row.remove("tripid");

    // When / Then
    assertThat(converter.fromRow(row)).isEmpty();
  }

  @Test
  void fromRow_withInvalidTime_returnsEmpty() {
    // Given
    final Map<String, String> row = row();
    row.put("eventtime", "not-a-number");

    // When / Then
    assertThat(converter.fromRow(row)).isEmpty();
  }

  @Test
  void fromRow_withUnknownType_returnsEmpty() {
    // Given
    final Map<String, String> row = row();
    row.put("eventtype", "engine-stall");

    // When / Then
    assertThat(converter.fromRow(row)).isEmpty();
  }

  private static Map<String, String> row() {
    final Map<String, String> row = new HashMap<>();
    row.put("eventid", "e-1");
    row.put("tripid", "trip-1");
    row.put("deviceid", "device-1");
    row.put("eventtime", "1672628400000");
    row.put("eventdate", "2023-01-02T03:00:00Z");
    row.put("eventtype", "engine-start");
    row.put("randomdata", "xyz");
    row.put("year", "2023");
    return row;
  }
}
