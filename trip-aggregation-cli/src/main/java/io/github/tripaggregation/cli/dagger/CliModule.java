package io.github.tripaggregation.cli.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Module;
import dagger.Provides;
import io.github.tripaggregation.aggregation.TripAggregationCache;
import io.github.tripaggregation.cli.api.TripsApiHandler;
import javax.inject.Singleton;

/**
 * Dagger module providing CLI dependencies.
 */
@Module
public class CliModule {

  /**
   * Provide the trips API handler.
   *
   * @param tripAggregationCache the trip aggregation cache
   * @param objectMapper         the object mapper
   * @return the trips api handler
   */
  @Provides
  @Singleton
  public TripsApiHandler tripsApiHandler(
      final TripAggregationCache tripAggregationCache, final ObjectMapper objectMapper) {
    return new TripsApiHandler(tripAggregationCache, objectMapper);
  }
}
