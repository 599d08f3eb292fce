package io.github.tripaggregation.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Type of a telemetry event. The wire value is what the raw event log and the reduction queries use.
 */
public enum EventType {
  /**
   * First event of a trip.
   */
  ENGINE_START("engine-start"),

  /**
   * Periodic event while the trip is running.
   */
  KEEP_ALIVE("keep-alive"),

  /**
   * Last event of a trip.
   */
  TRIP_FINISHED("trip-finished");

  private final String wireValue;

  EventType(final String wireValue) {
    this.wireValue = wireValue;
  }

  /**
   * Wire value.
   *
   * @return the wire value
   */
  @JsonValue
  public String wireValue() {
    return wireValue;
  }

  /**
   * Resolve an event type from its wire value or enum name, ignoring case.
   *
   * @param value the value
   * @return the event type
   */
  @JsonCreator
  public static EventType fromValue(final String value) {
    for (final EventType type : values()) {
      if (type.wireValue.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown event type: " + value);
  }
}
