package io.github.tripaggregation.aggregation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.tripaggregation.converter.EventRecordConverter;
import io.github.tripaggregation.exception.TripAggregationException;
import io.github.tripaggregation.exception.TripNotFoundException;
import io.github.tripaggregation.model.AggregatedTrip;
import io.github.tripaggregation.model.Configuration;
import io.github.tripaggregation.model.EventRecord;
import io.github.tripaggregation.model.ImmutableSelectiveScanRequest;
import io.github.tripaggregation.model.S3Location;
import io.github.tripaggregation.model.ScanInputFormat;
import io.github.tripaggregation.model.TripSummary;
import io.github.tripaggregation.store.AggregationMarker;
import io.github.tripaggregation.store.ObjectStore;
import io.github.tripaggregation.store.TripSummaryReader;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Read path for aggregated trips. The first request of a trip scans its records out of the shared
 * reduced records file and stores the result; later requests fetch the stored object.
 *
 * <p>Concurrent first requests of the same trip each compute and store an equal object.
 */
@Singleton
public class TripAggregationCache {

  /**
   * Column of the reduced records file holding the trip id.
   */
  public static final String TRIP_ID_COLUMN = "tripid";

  private static final Logger log = LoggerFactory.getLogger(TripAggregationCache.class);

  private final TripSummaryReader summaryReader;
  private final AggregationMarker aggregationMarker;
  private final ObjectStore objectStore;
  private final EventRecordConverter eventRecordConverter;
  private final ObjectMapper objectMapper;
  private final String tripRecordsBucket;

  /**
   * Instantiates a new Trip aggregation cache.
   *
   * @param summaryReader        the summary reader
   * @param aggregationMarker    the aggregation marker
   * @param objectStore          the object store
   * @param eventRecordConverter the event record converter
   * @param objectMapper         the object mapper
   * @param configuration        the configuration
   */
  @Inject
  public TripAggregationCache(final TripSummaryReader summaryReader,
                              final AggregationMarker aggregationMarker,
                              final ObjectStore objectStore,
                              final EventRecordConverter eventRecordConverter,
                              final ObjectMapper objectMapper,
                              final Configuration configuration) {
    this.summaryReader = summaryReader;
    this.aggregationMarker = aggregationMarker;
    this.objectStore = objectStore;
    this.eventRecordConverter = eventRecordConverter;
    this.objectMapper = objectMapper;
    this.tripRecordsBucket = configuration.tripRecordsBucketName();
  }

  /**
   * Aggregated trip of a finished trip.
   *
   * @param tripId the trip id
   * @return the aggregated trip
   * @throws TripNotFoundException if no summary exists for the trip
   */
  public AggregatedTrip getAggregatedTrip(final String tripId) {
    log.debug("Fetching trip summary information for {}", tripId);
    final TripSummary summary = summaryReader.get(tripId)
        .orElseThrow(() -> new TripNotFoundException(tripId));

    if (summary.aggregationExecuted()) {
      final Optional<AggregatedTrip> cached = fetch(tripId);
      if (cached.isPresent()) {
        log.info("Aggregation of trip {} was already executed, serving stored object", tripId);
        return cached.get();
      }
      log.warn("Trip {} is marked aggregated but {} is missing, aggregating again",
          tripId, location(tripId).toUri());
    }

    log.info("Aggregating trip {}", tripId);
    final AggregatedTrip aggregatedTrip = AggregatedTrip.of(summary, scanRecords(summary));
    objectStore.put(location(tripId), serialize(aggregatedTrip));
    aggregationMarker.markAggregated(tripId);
    log.info("Stored aggregated trip {} with {} records", tripId, aggregatedTrip.records().size());
    return aggregatedTrip;
  }

  /**
   * Canonical location of the aggregated trip.
   *
   * @param tripId the trip id
   * @return the location
   */
  public S3Location location(final String tripId) {
    return S3Location.of(tripRecordsBucket, "trips/" + tripId + ".json");
  }

  /**
   * Records of the trip, stably sorted by event time. Rows of equal time keep scan order.
   */
  private List<EventRecord> scanRecords(final TripSummary summary) {
    final List<EventRecord> records = new ArrayList<>();
    objectStore.selectiveScan(ImmutableSelectiveScanRequest.builder()
            .location(summary.recordsFile())
            .column(TRIP_ID_COLUMN)
            .value(summary.tripId())
            .inputFormat(ScanInputFormat.CSV)
            .build(),
        page -> page.forEach(row -> eventRecordConverter.fromRow(row).ifPresent(records::add)));
    records.sort(Comparator.comparingLong(EventRecord::eventTime));
    log.debug("Trip records of {} fetched successfully: {}", summary.tripId(), records.size());
    return records;
  }

  private Optional<AggregatedTrip> fetch(final String tripId) {
    return objectStore.get(location(tripId)).map(content -> {
      try {
        return objectMapper.readValue(content, AggregatedTrip.class);
      } catch (IOException e) {
        throw new TripAggregationException("Stored aggregated trip " + tripId + " is unreadable", e);
      }
    });
  }

  private byte[] serialize(final AggregatedTrip aggregatedTrip) {
    try {
      return objectMapper.writeValueAsBytes(aggregatedTrip);
    } catch (JsonProcessingException e) {
      throw new TripAggregationException("Unable to serialize aggregated trip " + aggregatedTrip.tripId(), e);
    }
  }
}
