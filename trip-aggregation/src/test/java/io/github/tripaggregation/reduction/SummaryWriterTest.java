package io.github.tripaggregation.reduction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import io.github.tripaggregation.exception.TripAggregationException;
import io.github.tripaggregation.model.TripSummary;
import io.github.tripaggregation.store.TripSummaryRefresher;
import io.github.tripaggregation.testutil.InMemoryObjectStore;
import io.github.tripaggregation.testutil.InMemoryTripSummaryStore;
import io.github.tripaggregation.testutil.TripFixtures;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SummaryWriterTest {

  @Mock private TripSummaryRefresher refresher;

  @Captor private ArgumentCaptor<List<TripSummary>> batchCaptor;

  private InMemoryObjectStore objectStore;
  private SummaryWriter writer;

  @BeforeEach
  void setUp() {
    objectStore = new InMemoryObjectStore();
    writer = new SummaryWriter(objectStore, new SummaryFileParser(), refresher);
  }

  @Test
  void write_withThirtyTrips_writesTwoBatches() {
    // Given
    objectStore.putString(TripFixtures.SUMMARY_FILE, summaryFile(30));

    // When
    final int written = writer.write(TripFixtures.SUMMARY_FILE, TripFixtures.RECORDS_FILE);

    // Then
    assertThat(written).isEqualTo(30);
    verify(refresher, times(2)).refreshDerivedFields(batchCaptor.capture());
    assertThat(batchCaptor.getAllValues()).extracting(List::size).containsExactly(25, 5);
    assertThat(batchCaptor.getAllValues().get(1)).allSatisfy(summary ->
        assertThat(summary.recordsFile()).isEqualTo(TripFixtures.RECORDS_FILE));
  }

  @Test
  void write_calledTwice_sendsIdenticalBatches() {
    // Given
    objectStore.putString(TripFixtures.SUMMARY_FILE, summaryFile(3));

    // When
    writer.write(TripFixtures.SUMMARY_FILE, TripFixtures.RECORDS_FILE);
    writer.write(TripFixtures.SUMMARY_FILE, TripFixtures.RECORDS_FILE);

    // Then
    verify(refresher, times(2)).refreshDerivedFields(batchCaptor.capture());
    assertThat(batchCaptor.getAllValues().get(0)).isEqualTo(batchCaptor.getAllValues().get(1));
  }

  @Test
  void write_withEmptyResult_writesNothing() {
    // Given
    objectStore.putString(TripFixtures.SUMMARY_FILE, summaryFile(0));

    // When
    final int written = writer.write(TripFixtures.SUMMARY_FILE, TripFixtures.RECORDS_FILE);

    // Then
    assertThat(written).isZero();
    verifyNoInteractions(refresher);
  }

  @Test
  void write_withMissingFile_throwsException() {
    assertThatThrownBy(() -> writer.write(TripFixtures.SUMMARY_FILE, TripFixtures.RECORDS_FILE))
        .isInstanceOf(TripAggregationException.class)
        .hasMessageContaining(TripFixtures.SUMMARY_FILE.toUri());
    verifyNoInteractions(refresher);
  }

  @Test
  void write_whenBatchFails_propagatesAndStops() {
    // Given
    objectStore.putString(TripFixtures.SUMMARY_FILE, summaryFile(60));
    doThrow(new IllegalStateException("throttled")).when(refresher).refreshDerivedFields(anyList());

    // When / Then
    assertThatThrownBy(() -> writer.write(TripFixtures.SUMMARY_FILE, TripFixtures.RECORDS_FILE))
        .isInstanceOf(IllegalStateException.class);
    verify(refresher, times(1)).refreshDerivedFields(anyList());
  }

  @Test
  void write_withDuplicateRowsAcrossCycles_keepsOneSummaryPerTripAndAggregationFlag() {
    // Given
    final InMemoryTripSummaryStore summaryStore = new InMemoryTripSummaryStore();
    final SummaryWriter storeWriter = new SummaryWriter(objectStore, new SummaryFileParser(), summaryStore);
    objectStore.putString(TripFixtures.SUMMARY_FILE, summaryFile(2) + row(1, 99));
    storeWriter.write(TripFixtures.SUMMARY_FILE, TripFixtures.RECORDS_FILE);
    summaryStore.markAggregated("trip-1");

    // When
    storeWriter.write(TripFixtures.SUMMARY_FILE, TripFixtures.RECORDS_FILE);

    // Then
    assertThat(summaryStore.size()).isEqualTo(2);
    assertThat(summaryStore.get("trip-1")).hasValueSatisfying(summary -> {
      assertThat(summary.eventCount()).isEqualTo(99L);
      assertThat(summary.aggregationExecuted()).isTrue();
    });
    assertThat(summaryStore.get("trip-0")).hasValueSatisfying(summary ->
        assertThat(summary.aggregationExecuted()).isFalse());
  }

  private static String summaryFile(final int trips) {
    final List<String> lines = new ArrayList<>();
    lines.add("vehicle_id,trip_id,start_date,end_date,duration,event_count");
    for (int i = 0; i < trips; i++) {
      lines.add(row(i, 10).strip());
    }
    return String.join("\n", lines) + "\n";
  }

  private static String row(final int trip, final long eventCount) {
    return "device-" + trip + ",trip-" + trip
        + ",2023-01-02T03:00:00Z,2023-01-02T03:04:00Z,240," + eventCount + "\n";
  }
}
