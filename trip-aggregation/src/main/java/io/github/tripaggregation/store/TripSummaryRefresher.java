package io.github.tripaggregation.store;

import io.github.tripaggregation.model.TripSummary;
import java.util.List;

/**
 * Creates summaries or refreshes their derived fields. Never changes the aggregation flag of an
 * existing summary.
 */
public interface TripSummaryRefresher {

  /**
   * Most summaries a single bulk write accepts.
   */
  int MAX_BATCH_SIZE = 25;

  /**
   * Write the derived fields of a batch of summaries. Each summary is written on its own, so a
   * failing summary does not keep the others from being written; failures are raised once the
   * whole batch was attempted.
   *
   * @param summaries at most {@link #MAX_BATCH_SIZE} summaries with distinct trip ids
   */
  void refreshDerivedFields(List<TripSummary> summaries);
}
