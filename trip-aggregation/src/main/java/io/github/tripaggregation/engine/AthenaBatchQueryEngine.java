package io.github.tripaggregation.engine;

import io.github.tripaggregation.exception.QueryExecutionException;
import io.github.tripaggregation.model.Configuration;
import io.github.tripaggregation.model.ImmutableQueryExecutionResult;
import io.github.tripaggregation.model.QueryExecutionResult;
import io.github.tripaggregation.model.S3Location;
import java.time.Duration;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.athena.model.GetQueryExecutionRequest;
import software.amazon.awssdk.services.athena.model.QueryExecution;
import software.amazon.awssdk.services.athena.model.QueryExecutionContext;
import software.amazon.awssdk.services.athena.model.QueryExecutionState;
import software.amazon.awssdk.services.athena.model.ResultConfiguration;
import software.amazon.awssdk.services.athena.model.StartQueryExecutionRequest;

/**
 * Batch query engine backed by Amazon Athena. Completion is detected by polling.
 */
@Singleton
public class AthenaBatchQueryEngine implements BatchQueryEngine {

  private static final Logger log = LoggerFactory.getLogger(AthenaBatchQueryEngine.class);

  private final AthenaClient athenaClient;
  private final Configuration configuration;
  private final Duration pollInterval;

  /**
   * Instantiates a new Athena batch query engine.
   *
   * @param athenaClient  the athena client
   * @param configuration the configuration
   */
  @Inject
  public AthenaBatchQueryEngine(final AthenaClient athenaClient, final Configuration configuration) {
    this.athenaClient = athenaClient;
    this.configuration = configuration;
    this.pollInterval = configuration.queryPollInterval();
  }

  @Override
  public String submit(final String queryString) {
    final StartQueryExecutionRequest.Builder request = StartQueryExecutionRequest.builder()
        .queryString(queryString)
        .workGroup(configuration.queryWorkGroup())
        .queryExecutionContext(QueryExecutionContext.builder()
            .database(configuration.queryDatabaseName())
            .build());
    configuration.queryOutputLocation().ifPresent(location ->
        request.resultConfiguration(ResultConfiguration.builder().outputLocation(location).build()));

    try {
      final String executionId = athenaClient.startQueryExecution(request.build()).queryExecutionId();
      log.debug("Submitted query {}: {}", executionId, queryString);
      return executionId;
    } catch (SdkException e) {
      throw new QueryExecutionException(null, "Unable to submit query: " + e.getMessage(), e);
    }
  }

  @Override
  public QueryExecutionResult awaitCompletion(final String executionId) {
    final GetQueryExecutionRequest request = GetQueryExecutionRequest.builder()
        .queryExecutionId(executionId)
        .build();

    while (true) {
      final QueryExecution execution;
      try {
        execution = athenaClient.getQueryExecution(request).queryExecution();
      } catch (SdkException e) {
        throw new QueryExecutionException(executionId,
            "Unable to read status of query " + executionId + ": " + e.getMessage(), e);
      }

      final QueryExecutionState state = execution.status() == null ? null : execution.status().state();
      if (state == null) {
        throw new QueryExecutionException(executionId, "Query " + executionId + " reported no state");
      }
      switch (state) {
        case SUCCEEDED:
          log.debug("Query {} succeeded", executionId);
          return ImmutableQueryExecutionResult.builder()
              .executionId(executionId)
              .outputLocation(S3Location.parse(execution.resultConfiguration().outputLocation()))
              .build();
        case FAILED:
        case CANCELLED:
          throw new QueryExecutionException(executionId,
              "Query " + executionId + " " + state + ": " + execution.status().stateChangeReason());
        case QUEUED:
        case RUNNING:
          log.trace("Query {} is {}", executionId, state);
          pause(executionId);
          break;
        default:
          throw new QueryExecutionException(executionId,
              "Query " + executionId + " is in unsupported state " + execution.status().stateAsString());
      }
    }
  }

  private void pause(final String executionId) {
    try {
      Thread.sleep(pollInterval.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new QueryExecutionException(executionId, "Interrupted while waiting for query " + executionId, e);
    }
  }
}
