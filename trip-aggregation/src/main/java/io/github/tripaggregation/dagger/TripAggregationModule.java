package io.github.tripaggregation.dagger;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dagger.Binds;
import dagger.Module;
import dagger.Provides;
import io.github.tripaggregation.engine.AthenaBatchQueryEngine;
import io.github.tripaggregation.engine.BatchQueryEngine;
import io.github.tripaggregation.reduction.ReductionOrchestrator;
import io.github.tripaggregation.store.AggregationMarker;
import io.github.tripaggregation.store.DynamoDbTripSummaryStore;
import io.github.tripaggregation.store.ObjectStore;
import io.github.tripaggregation.store.S3ObjectStore;
import io.github.tripaggregation.store.TripSummaryReader;
import io.github.tripaggregation.store.TripSummaryRefresher;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import javax.inject.Named;
import javax.inject.Singleton;

/**
 * The type Trip aggregation module.
 */
@Module(includes = TripAggregationModule.Binder.class)
public class TripAggregationModule {

  /**
   * Instantiates a new Trip aggregation module.
   */
  public TripAggregationModule() {
    // Default constructor
  }

  /**
   * Object mapper for JSON serialization.
   *
   * @return the object mapper
   */
  @Provides
  @Singleton
  public ObjectMapper objectMapper() {
    final ObjectMapper objectMapper = new ObjectMapper();
    // Optional and java.time support
    objectMapper.findAndRegisterModules();
    objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    return objectMapper;
  }

  /**
   * Executor the two queries of a reduction cycle run on.
   *
   * @return the executor service
   */
  @Provides
  @Singleton
  @Named(ReductionOrchestrator.REDUCTION_EXECUTOR)
  public ExecutorService reductionExecutor() {
    final AtomicInteger threadCount = new AtomicInteger();
    return Executors.newCachedThreadPool(runnable -> {
      final Thread thread = new Thread(runnable, "reduction-query-" + threadCount.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Interface bindings.
   */
  @Module
  interface Binder {

    @Binds
    BatchQueryEngine batchQueryEngine(AthenaBatchQueryEngine engine);

    @Binds
    ObjectStore objectStore(S3ObjectStore store);

    @Binds
    TripSummaryReader tripSummaryReader(DynamoDbTripSummaryStore store);

    @Binds
    TripSummaryRefresher tripSummaryRefresher(DynamoDbTripSummaryStore store);

    @Binds
    AggregationMarker aggregationMarker(DynamoDbTripSummaryStore store);
  }
}
