package io.github.tripaggregation.reduction;

import io.github.tripaggregation.exception.TripAggregationException;
import io.github.tripaggregation.model.S3Location;
import io.github.tripaggregation.model.TripSummary;
import io.github.tripaggregation.store.ObjectStore;
import io.github.tripaggregation.store.TripSummaryRefresher;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores one summary per finished trip of a reduction cycle.
 */
@Singleton
public class SummaryWriter {

  private static final Logger log = LoggerFactory.getLogger(SummaryWriter.class);

  private final ObjectStore objectStore;
  private final SummaryFileParser parser;
  private final TripSummaryRefresher refresher;

  /**
   * Instantiates a new Summary writer.
   *
   * @param objectStore the object store
   * @param parser      the parser
   * @param refresher   the refresher
   */
  @Inject
  public SummaryWriter(final ObjectStore objectStore,
                       final SummaryFileParser parser,
                       final TripSummaryRefresher refresher) {
    this.objectStore = objectStore;
    this.parser = parser;
    this.refresher = refresher;
  }

  /**
   * Read the summary result file and write its summaries in batches. Batches already written stay
   * written when a later one fails.
   *
   * @param summaryLocation result of the trip summary query
   * @param recordsLocation result of the reduced trip records query
   * @return the number of summaries written
   */
  public int write(final S3Location summaryLocation, final S3Location recordsLocation) {
    log.debug("Reading trip summary file {}", summaryLocation.toUri());
    final byte[] content = objectStore.get(summaryLocation)
        .orElseThrow(() -> new TripAggregationException("Trip summary file not found: " + summaryLocation.toUri()));

    final List<TripSummary> summaries = parser.parse(content, recordsLocation);
    final int batchSize = TripSummaryRefresher.MAX_BATCH_SIZE;
    log.info("Storing {} trip summaries in {} batches", summaries.size(),
        (summaries.size() + batchSize - 1) / batchSize);

    for (int i = 0; i < summaries.size(); i += batchSize) {
      final List<TripSummary> batch = summaries.subList(i, Math.min(i + batchSize, summaries.size()));
      refresher.refreshDerivedFields(batch);
      log.debug("Stored trip summaries {} to {}", i + 1, i + batch.size());
    }

    log.info("Trip summaries stored successfully");
    return summaries.size();
  }
}
