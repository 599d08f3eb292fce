package io.github.tripaggregation.reduction;

import io.github.tripaggregation.engine.BatchQueryEngine;
import io.github.tripaggregation.exception.ReductionException;
import io.github.tripaggregation.model.ImmutableReductionOutcome;
import io.github.tripaggregation.model.PartitionKey;
import io.github.tripaggregation.model.QueryExecutionResult;
import io.github.tripaggregation.model.ReductionInput;
import io.github.tripaggregation.model.ReductionOutcome;
import io.github.tripaggregation.model.ReductionState;
import io.github.tripaggregation.model.S3Location;
import io.github.tripaggregation.partition.PartitionKeyExtractor;
import io.github.tripaggregation.query.QueryTemplateEngine;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;
import javax.inject.Inject;
import javax.inject.Named;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one reduction cycle per batch file: prepare the queries, refresh the partition catalog, run
 * both queries in parallel and write the summaries. A failure in any state ends the cycle in
 * {@link ReductionState#FAILED}; summaries are only written once both queries succeeded.
 */
@Singleton
public class ReductionOrchestrator {

  /**
   * Name of the executor the queries of a cycle run on.
   */
  public static final String REDUCTION_EXECUTOR = "reductionExecutor";

  private static final Logger log = LoggerFactory.getLogger(ReductionOrchestrator.class);

  private final PartitionKeyExtractor partitionKeyExtractor;
  private final QueryTemplateEngine queryTemplateEngine;
  private final BatchQueryEngine batchQueryEngine;
  private final SummaryWriter summaryWriter;
  private final ExecutorService executor;

  /**
   * Instantiates a new Reduction orchestrator.
   *
   * @param partitionKeyExtractor the partition key extractor
   * @param queryTemplateEngine   the query template engine
   * @param batchQueryEngine      the batch query engine
   * @param summaryWriter         the summary writer
   * @param executor              the executor
   */
  @Inject
  public ReductionOrchestrator(final PartitionKeyExtractor partitionKeyExtractor,
                               final QueryTemplateEngine queryTemplateEngine,
                               final BatchQueryEngine batchQueryEngine,
                               final SummaryWriter summaryWriter,
                               @Named(REDUCTION_EXECUTOR) final ExecutorService executor) {
    this.partitionKeyExtractor = partitionKeyExtractor;
    this.queryTemplateEngine = queryTemplateEngine;
    this.batchQueryEngine = batchQueryEngine;
    this.summaryWriter = summaryWriter;
    this.executor = executor;
  }

  /**
   * Run a reduction cycle for a newly written batch file.
   *
   * @param objectKey the key of the batch file
   * @return the outcome
   */
  public ReductionOutcome run(final String objectKey) {
    final ImmutableReductionOutcome.Builder outcome = ImmutableReductionOutcome.builder().objectKey(objectKey);
    log.info("Processing new incoming partition {}", objectKey);

    try {
      final ReductionInput input = stage(objectKey, ReductionState.PREPARE_INPUT, () -> prepareInput(objectKey));
      outcome.formattedDate(input.formattedDate());

      stage(objectKey, ReductionState.REFRESH_PARTITIONS,
          () -> batchQueryEngine.execute(queryTemplateEngine.partitionRefreshStatement()));

      final List<QueryExecutionResult> results = stage(objectKey, ReductionState.RUN_QUERIES, () -> {
        final CompletableFuture<QueryExecutionResult> summaries =
            runAsync(() -> batchQueryEngine.execute(input.tripSummaryQuery()));
        final CompletableFuture<QueryExecutionResult> records =
            runAsync(() -> batchQueryEngine.execute(input.reducedTripRecordsQuery()));
        awaitBoth(summaries, records);
        return List.of(summaries.join(), records.join());
      });
      final S3Location summaryLocation = results.get(0).outputLocation();
      final S3Location recordsLocation = results.get(1).outputLocation();
      outcome.summaryLocation(summaryLocation).recordsLocation(recordsLocation);

      final int written = stage(objectKey, ReductionState.WRITE_SUMMARIES,
          () -> summaryWriter.write(summaryLocation, recordsLocation));

      log.info("Reduction of {} entering {}", objectKey, ReductionState.DONE);
      return outcome.state(ReductionState.DONE).summariesWritten(written).build();
    } catch (ReductionException e) {
      final Throwable cause = e.getCause();
      log.error("Reduction of {} failed in state {}", objectKey, e.state(), cause);
      return outcome.state(ReductionState.FAILED)
          .failedState(e.state())
          .failureReason(cause.getMessage() != null ? cause.getMessage() : cause.getClass().getName())
          .build();
    }
  }

  /**
   * Run one state of the cycle. Any failure is rethrown as a {@link ReductionException} naming the state.
   */
  private static <T> T stage(final String objectKey, final ReductionState state, final Supplier<T> action) {
    log.info("Reduction of {} entering {}", objectKey, state);
    try {
      return action.get();
    } catch (RuntimeException e) {
      final Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
      throw new ReductionException(state, "Reduction failed in state " + state, cause);
    }
  }

  private ReductionInput prepareInput(final String objectKey) {
    final PartitionKey partitionKey = partitionKeyExtractor.partitionKey(objectKey);
    final ReductionInput input = queryTemplateEngine.render(partitionKey);
    log.info("Successfully prepared execution input for {}", input.formattedDate());
    log.debug("Trip summary query: {}", input.tripSummaryQuery());
    log.debug("Reduced trip records query: {}", input.reducedTripRecordsQuery());
    return input;
  }

  private CompletableFuture<QueryExecutionResult> runAsync(final Supplier<QueryExecutionResult> query) {
    return CompletableFuture.supplyAsync(query, executor);
  }

  /**
   * Wait until both queries succeeded, or until the first one fails.
   */
  private static void awaitBoth(final CompletableFuture<?> first, final CompletableFuture<?> second) {
    final CompletableFuture<Void> firstFailure = new CompletableFuture<>();
    first.whenComplete((result, error) -> {
      if (error != null) {
        firstFailure.completeExceptionally(error);
      }
    });
    second.whenComplete((result, error) -> {
      if (error != null) {
        firstFailure.completeExceptionally(error);
      }
    });
    CompletableFuture.anyOf(CompletableFuture.allOf(first, second), firstFailure).join();
  }
}
