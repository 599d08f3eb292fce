package io.github.tripaggregation.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import java.util.Optional;
import org.immutables.value.Value;

/**
 * One telemetry datum of a device.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableEventRecord.class)
@JsonDeserialize(as = ImmutableEventRecord.class)
public interface EventRecord {

  /**
   * Unique id of the event.
   *
   * @return the event id
   */
  String eventId();

  /**
   * Trip this event belongs to.
   *
   * @return the trip id
   */
  String tripId();

  /**
   * Device that emitted the event.
   *
   * @return the device id
   */
  String deviceId();

  /**
   * Dispatch time in epoch millis.
   *
   * @return the event time
   */
  long eventTime();

  /**
   * Dispatch time as an ISO-8601 string.
   *
   * @return the event date
   */
  String eventDate();

  /**
   * Event type.
   *
   * @return the event type
   */
  EventType eventType();

  /**
   * Free form payload used to size up events.
   *
   * @return the payload
   */
  Optional<String> randomData();
}
