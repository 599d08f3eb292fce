package io.github.tripaggregation.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Notification that a batch file was written by the event batch source.
 */
@Value.Immutable
@JsonSerialize(as = ImmutableBatchFileNotification.class)
@JsonDeserialize(as = ImmutableBatchFileNotification.class)
public interface BatchFileNotification {

  /**
   * Bucket the batch file was written to.
   *
   * @return the bucket name
   */
  String bucketName();

  /**
   * Key of the batch file, e.g. {@code raw/year=2023/month=01/day=02/hour=03/minute=04/part-0001}.
   *
   * @return the key
   */
  String key();
}
