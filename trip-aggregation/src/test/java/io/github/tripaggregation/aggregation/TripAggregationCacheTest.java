package io.github.tripaggregation.aggregation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.tripaggregation.converter.EventRecordConverter;
import io.github.tripaggregation.exception.TripNotFoundException;
import io.github.tripaggregation.model.AggregatedTrip;
import io.github.tripaggregation.model.EventRecord;
import io.github.tripaggregation.model.EventType;
import io.github.tripaggregation.model.ImmutableTripSummary;
import io.github.tripaggregation.model.S3Location;
import io.github.tripaggregation.testutil.InMemoryObjectStore;
import io.github.tripaggregation.testutil.InMemoryTripSummaryStore;
import io.github.tripaggregation.testutil.TripFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class TripAggregationCacheTest {

  private InMemoryTripSummaryStore summaryStore;
  private InMemoryObjectStore objectStore;
  private TripAggregationCache cache;

  @BeforeEach
  void setUp() {
    summaryStore = new InMemoryTripSummaryStore();
    objectStore = new InMemoryObjectStore();
    cache = new TripAggregationCache(summaryStore, summaryStore, objectStore, new EventRecordConverter(),
        TripFixtures.objectMapper(), TripFixtures.configuration());

    summaryStore.put(TripFixtures.summary("trip-1"));
    summaryStore.put(TripFixtures.summary("trip-2"));
    objectStore.putString(TripFixtures.RECORDS_FILE, String.join("\n",
        TripFixtures.RECORDS_HEADER,
        TripFixtures.recordRow("e-3", "trip-1", 1672628640000L, "trip-finished"),
        TripFixtures.recordRow("e-9", "trip-2", 1672628400000L, "engine-start"),
        TripFixtures.recordRow("e-1", "trip-1", 1672628400000L, "engine-start"),
        TripFixtures.recordRow("e-2", "trip-1", 1672628520000L, "keep-alive")) + "\n");
  }

  @Test
  void getAggregatedTrip_firstRequest_scansStoresAndMarks() {
    // When
    final AggregatedTrip trip = cache.getAggregatedTrip("trip-1");

    // Then
    assertThat(trip.tripId()).isEqualTo("trip-1");
    assertThat(trip.deviceId()).isEqualTo("device-trip-1");
    assertThat(trip.durationSeconds()).contains(240L);
    assertThat(trip.aggregationExecuted()).isTrue();
    assertThat(trip.records()).extracting(EventRecord::eventId).containsExactly("e-1", "e-2", "e-3");
    assertThat(trip.records()).extracting(EventRecord::eventType)
        .containsExactly(EventType.ENGINE_START, EventType.KEEP_ALIVE, EventType.TRIP_FINISHED);
    assertThat(objectStore.scanCalls()).isEqualTo(1);
    assertThat(objectStore.getString(S3Location.of(TripFixtures.RECORDS_BUCKET, "trips/trip-1.json"))).isPresent();
    assertThat(summaryStore.get("trip-1")).hasValueSatisfying(s -> assertThat(s.aggregationExecuted()).isTrue());
    assertThat(summaryStore.get("trip-2")).hasValueSatisfying(s -> assertThat(s.aggregationExecuted()).isFalse());
  }

  @Test
  void getAggregatedTrip_secondRequest_servesStoredObjectWithoutScan() {
    // Given
    final AggregatedTrip cold = cache.getAggregatedTrip("trip-1");

    // When
    final AggregatedTrip warm = cache.getAggregatedTrip("trip-1");

    // Then
    assertThat(warm).isEqualTo(cold);
    assertThat(warm.aggregationExecuted()).isTrue();
    assertThat(objectStore.scanCalls()).isEqualTo(1);
    assertThat(objectStore.putCalls()).isEqualTo(1);
  }

  @Test
  void getAggregatedTrip_withUnknownTrip_throwsWithoutTouchingObjects() {
    // When / Then
    assertThatThrownBy(() -> cache.getAggregatedTrip("unknown"))
        .isInstanceOf(TripNotFoundException.class)
        .hasMessageContaining("unknown");
    assertThat(objectStore.scanCalls()).isZero();
    assertThat(objectStore.putCalls()).isZero();
    assertThat(objectStore.getCalls()).isZero();
  }

  @Test
  void getAggregatedTrip_markedButObjectMissing_aggregatesAgain() {
    // Given
    summaryStore.put(ImmutableTripSummary.copyOf(TripFixtures.summary("trip-1")).withAggregationExecuted(true));

    // When
    final AggregatedTrip trip = cache.getAggregatedTrip("trip-1");

    // Then
    assertThat(trip.records()).hasSize(3);
    assertThat(objectStore.getCalls()).isEqualTo(1);
    assertThat(objectStore.scanCalls()).isEqualTo(1);
    assertThat(objectStore.putCalls()).isEqualTo(1);
  }

  @Test
  void getAggregatedTrip_withRecordsOfEqualTime_keepsScanOrder() {
    // Given
    objectStore.putString(TripFixtures.RECORDS_FILE, String.join("\n",
        TripFixtures.RECORDS_HEADER,
        TripFixtures.recordRow("e-b", "trip-1", 1000L, "keep-alive"),
        TripFixtures.recordRow("e-a", "trip-1", 1000L, "keep-alive"),
        TripFixtures.recordRow("e-0", "trip-1", 500L, "engine-start")) + "\n");

    // When
    final AggregatedTrip trip = cache.getAggregatedTrip("trip-1");

    // Then
    assertThat(trip.records()).extracting(EventRecord::eventId).containsExactly("e-0", "e-b", "e-a");
  }

  @Test
  void location_usesRecordsBucketAndTripId() {
    assertThat(cache.location("trip-7")).isEqualTo(S3Location.of(TripFixtures.RECORDS_BUCKET, "trips/trip-7.json"));
  }
}
