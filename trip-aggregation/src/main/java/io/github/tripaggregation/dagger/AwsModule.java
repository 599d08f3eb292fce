package io.github.tripaggregation.dagger;

import dagger.Module;
import dagger.Provides;
import io.github.tripaggregation.model.Configuration;
import javax.inject.Singleton;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.athena.AthenaClient;
import software.amazon.awssdk.services.athena.AthenaClientBuilder;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;
import software.amazon.awssdk.services.dynamodb.DynamoDbClientBuilder;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3AsyncClientBuilder;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;

/**
 * AWS clients. Region and endpoint come from the configuration when set, otherwise from the SDK's
 * default provider chains.
 */
@Module
public class AwsModule {

  /**
   * Instantiates a new Aws module.
   */
  public AwsModule() {
    // Default constructor
  }

  /**
   * Dynamo db client.
   *
   * @param configuration the configuration
   * @return the dynamo db client
   */
  @Provides
  @Singleton
  public DynamoDbClient dynamoDbClient(final Configuration configuration) {
    final DynamoDbClientBuilder builder = DynamoDbClient.builder();
    configuration.region().map(Region::of).ifPresent(builder::region);
    configuration.endpointOverride().ifPresent(builder::endpointOverride);
    return builder.build();
  }

  /**
   * S3 client.
   *
   * @param configuration the configuration
   * @return the s3 client
   */
  @Provides
  @Singleton
  public S3Client s3Client(final Configuration configuration) {
    final S3ClientBuilder builder = S3Client.builder();
    configuration.region().map(Region::of).ifPresent(builder::region);
    configuration.endpointOverride().ifPresent(endpoint -> builder.endpointOverride(endpoint).forcePathStyle(true));
    return builder.build();
  }

  /**
   * S3 async client, needed for selective scans.
   *
   * @param configuration the configuration
   * @return the s3 async client
   */
  @Provides
  @Singleton
  public S3AsyncClient s3AsyncClient(final Configuration configuration) {
    final S3AsyncClientBuilder builder = S3AsyncClient.builder();
    configuration.region().map(Region::of).ifPresent(builder::region);
    configuration.endpointOverride().ifPresent(endpoint -> builder.endpointOverride(endpoint).forcePathStyle(true));
    return builder.build();
  }

  /**
   * Athena client.
   *
   * @param configuration the configuration
   * @return the athena client
   */
  @Provides
  @Singleton
  public AthenaClient athenaClient(final Configuration configuration) {
    final AthenaClientBuilder builder = AthenaClient.builder();
    configuration.region().map(Region::of).ifPresent(builder::region);
    configuration.endpointOverride().ifPresent(builder::endpointOverride);
    return builder.build();
  }
}
