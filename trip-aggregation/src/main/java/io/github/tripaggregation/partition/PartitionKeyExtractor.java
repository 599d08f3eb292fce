package io.github.tripaggregation.partition;

import io.github.tripaggregation.model.ImmutablePartitionKey;
import io.github.tripaggregation.model.PartitionKey;
import java.util.LinkedHashMap;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the time partition of a batch file from the {@code name=value} segments of its key.
 */
@Singleton
public class PartitionKeyExtractor {

  private static final Logger log = LoggerFactory.getLogger(PartitionKeyExtractor.class);

  /**
   * Instantiates a new Partition key extractor.
   */
  @Inject
  public PartitionKeyExtractor() {
    // Stateless
  }

  /**
   * Extract every {@code name=value} segment of the key. The partition names are always present
   * and default to an empty string. Segments without a name are skipped.
   *
   * @param objectKey the object key
   * @return the partition values by name
   */
  public Map<String, String> extract(final String objectKey) {
    final Map<String, String> values = new LinkedHashMap<>();
    PartitionKey.NAMES.forEach(name -> values.put(name, ""));
    if (objectKey == null) {
      return values;
    }

    for (final String segment : objectKey.split("/")) {
      final int separator = segment.indexOf('=');
      if (separator <= 0) {
        if (separator == 0) {
          log.warn("Skipping key segment without a name: '{}'", segment);
        }
        continue;
      }
      values.put(segment.substring(0, separator), segment.substring(separator + 1));
    }
    return values;
  }

  /**
   * Typed partition key of the object key.
   *
   * @param objectKey the object key
   * @return the partition key
   */
  public PartitionKey partitionKey(final String objectKey) {
    final Map<String, String> values = extract(objectKey);
    return ImmutablePartitionKey.builder()
        .year(values.get("year"))
        .month(values.get("month"))
        .day(values.get("day"))
        .hour(values.get("hour"))
        .minute(values.get("minute"))
        .build();
  }
}
