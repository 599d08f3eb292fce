package io.github.tripaggregation.cli.dagger;

import com.fasterxml.jackson.databind.ObjectMapper;
import dagger.Component;
import io.github.tripaggregation.aggregation.TripAggregationCache;
import io.github.tripaggregation.cli.api.TripsApiHandler;
import io.github.tripaggregation.dagger.AwsModule;
import io.github.tripaggregation.dagger.ConfigurationModule;
import io.github.tripaggregation.dagger.TripAggregationModule;
import io.github.tripaggregation.model.Configuration;
import io.github.tripaggregation.router.NotificationRouter;
import javax.inject.Singleton;

/**
 * Dagger component for CLI tool.
 */
@Singleton
@Component(
    modules = {CliModule.class, TripAggregationModule.class, ConfigurationModule.class, AwsModule.class})
public interface CliComponent {

  /**
   * Create CLI component with configuration.
   *
   * @param configuration the configuration
   * @return the CLI component
   */
  static CliComponent create(final Configuration configuration) {
    return DaggerCliComponent.builder()
        .configurationModule(new ConfigurationModule(configuration))
        .build();
  }

  /**
   * Notification router.
   *
   * @return the notification router
   */
  NotificationRouter notificationRouter();

  /**
   * Trip aggregation cache.
   *
   * @return the trip aggregation cache
   */
  TripAggregationCache tripAggregationCache();

  /**
   * Object mapper.
   *
   * @return the object mapper
   */
  ObjectMapper objectMapper();

  /**
   * Handler of the trips read API.
   *
   * @return the trips api handler
   */
  TripsApiHandler tripsApiHandler();
}
