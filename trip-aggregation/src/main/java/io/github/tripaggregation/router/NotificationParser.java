package io.github.tripaggregation.router;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.tripaggregation.model.BatchFileNotification;
import io.github.tripaggregation.model.ImmutableBatchFileNotification;
import java.io.IOException;
import java.io.UncheckedIOException;
import javax.inject.Inject;
import javax.inject.Singleton;

/**
 * Reads batch file notifications. Accepts the bare {@code {bucketName, key}} form and the
 * EventBridge envelope of a CloudTrail {@code PutObject} event, whose {@code detail.requestParameters}
 * holds the same fields.
 */
@Singleton
public class NotificationParser {

  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new Notification parser.
   *
   * @param objectMapper the object mapper
   */
  @Inject
  public NotificationParser(final ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Parse a notification.
   *
   * @param json the json
   * @return the notification
   * @throws IllegalArgumentException if the document has no bucket name and key
   */
  public BatchFileNotification parse(final String json) {
    final JsonNode root;
    try {
      root = objectMapper.readTree(json);
    } catch (IOException e) {
      throw new UncheckedIOException("Notification is not valid JSON", e);
    }

    final JsonNode parameters = root.path("detail").path("requestParameters");
    final JsonNode source = parameters.isObject() ? parameters : root;
    final String bucketName = source.path("bucketName").asText(null);
    final String key = source.path("key").asText(null);
    if (bucketName == null || key == null) {
      throw new IllegalArgumentException("Notification has no bucketName and key: " + json);
    }
    return ImmutableBatchFileNotification.builder().bucketName(bucketName).key(key).build();
  }
}
