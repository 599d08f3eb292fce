package io.github.tripaggregation.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.tripaggregation.model.Configuration;
import javax.inject.Singleton;

/**
 * Provides the configuration a component is created with.
 */
@Module
public class ConfigurationModule {

  private final Configuration configuration;

  /**
   * Instantiates a new Configuration module.
   *
   * @param configuration the configuration
   */
  public ConfigurationModule(final Configuration configuration) {
    this.configuration = configuration;
  }

  /**
   * Configuration.
   *
   * @return the configuration
   */
  @Provides
  @Singleton
  public Configuration configuration() {
    return configuration;
  }
}
