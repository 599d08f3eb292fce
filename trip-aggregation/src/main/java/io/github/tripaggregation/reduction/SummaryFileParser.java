package io.github.tripaggregation.reduction;

import io.github.tripaggregation.model.ImmutableTripSummary;
import io.github.tripaggregation.model.S3Location;
import io.github.tripaggregation.model.TripSummary;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the result file of the trip summary query, one row per finished trip.
 */
@Singleton
public class SummaryFileParser {

  public static final String VEHICLE_ID = "vehicle_id";
  public static final String TRIP_ID = "trip_id";
  public static final String START_DATE = "start_date";
  public static final String END_DATE = "end_date";
  public static final String DURATION = "duration";
  public static final String EVENT_COUNT = "event_count";

  private static final Logger log = LoggerFactory.getLogger(SummaryFileParser.class);

  private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
      .setHeader()
      .setSkipHeaderRecord(true)
      .setIgnoreHeaderCase(true)
      .setIgnoreEmptyLines(true)
      .setTrim(true)
      .build();

  /**
   * Instantiates a new Summary file parser.
   */
  @Inject
  public SummaryFileParser() {
    // Stateless
  }

  /**
   * Parse the summaries of a result file. Malformed rows are skipped. When a trip appears more
   * than once the last row wins, so every trip id occurs at most once in the result.
   *
   * @param content     the result file
   * @param recordsFile the reduced records file of the same cycle, attached to every summary
   * @return the summaries in file order
   */
  public List<TripSummary> parse(final byte[] content, final S3Location recordsFile) {
    final Map<String, TripSummary> summaries = new LinkedHashMap<>();
    try (Reader reader = new StringReader(new String(content, StandardCharsets.UTF_8));
         CSVParser parser = FORMAT.parse(reader)) {
      for (final CSVRecord record : parser) {
        toSummary(record, recordsFile).ifPresent(summary -> {
          if (summaries.remove(summary.tripId()) != null) {
            log.debug("Trip {} appears more than once, keeping the last row", summary.tripId());
          }
          summaries.put(summary.tripId(), summary);
        });
      }
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read trip summary file", e);
    }
    return new ArrayList<>(summaries.values());
  }

  private Optional<TripSummary> toSummary(final CSVRecord record, final S3Location recordsFile) {
    final String tripId = column(record, TRIP_ID);
    final String deviceId = column(record, VEHICLE_ID);
    final String endDate = column(record, END_DATE);
    final String eventCountValue = column(record, EVENT_COUNT);
    if (tripId == null || deviceId == null || endDate == null || eventCountValue == null) {
      log.warn("Skipping summary row {} with missing columns", record.getRecordNumber());
      return Optional.empty();
    }

    try {
      final Optional<Long> duration = Optional.ofNullable(column(record, DURATION)).map(Long::parseLong);
      final long eventCount = Long.parseLong(eventCountValue);
      return Optional.of(ImmutableTripSummary.builder()
          .tripId(tripId)
          .deviceId(deviceId)
          .startDate(Optional.ofNullable(column(record, START_DATE)))
          .endDate(endDate)
          .durationSeconds(duration)
          .eventCount(eventCount)
          .recordsFile(recordsFile)
          .dataIntegrityRate(duration.filter(seconds -> seconds > 0)
              .map(seconds -> (double) eventCount / seconds))
          .build());
    } catch (NumberFormatException e) {
      log.warn("Skipping summary row {} of trip {}: {}", record.getRecordNumber(), tripId, e.getMessage());
      return Optional.empty();
    }
  }

  private static String column(final CSVRecord record, final String name) {
    if (!record.isMapped(name) || !record.isSet(name)) {
      return null;
    }
    final String value = record.get(name);
    return value == null || value.isEmpty() ? null : value;
  }
}
