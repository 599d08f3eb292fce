package io.github.tripaggregation.dagger;

import dagger.Component;
import io.github.tripaggregation.aggregation.TripAggregationCache;
import io.github.tripaggregation.model.Configuration;
import io.github.tripaggregation.reduction.ReductionOrchestrator;
import io.github.tripaggregation.router.NotificationRouter;
import javax.inject.Singleton;

/**
 * The interface Trip aggregation component.
 */
@Singleton
@Component(modules = {TripAggregationModule.class, ConfigurationModule.class, AwsModule.class})
public interface TripAggregationComponent {

  /**
   * Instance trip aggregation component.
   *
   * @param configuration the configuration
   * @return the trip aggregation component
   */
  static TripAggregationComponent instance(final Configuration configuration) {
    return DaggerTripAggregationComponent.builder()
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
   * Reduction orchestrator.
   *
   * @return the reduction orchestrator
   */
  ReductionOrchestrator reductionOrchestrator();

  /**
   * Trip aggregation cache.
   *
   * @return the trip aggregation cache
   */
  TripAggregationCache tripAggregationCache();
}
