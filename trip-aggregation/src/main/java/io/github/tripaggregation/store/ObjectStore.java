package io.github.tripaggregation.store;

import io.github.tripaggregation.model.S3Location;
import io.github.tripaggregation.model.SelectiveScanRequest;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable blob store.
 */
public interface ObjectStore {

  /**
   * Read a whole object.
   *
   * @param location the location
   * @return the content, empty if there is no such object
   */
  Optional<byte[]> get(S3Location location);

  /**
   * Create or overwrite an object.
   *
   * @param location the location
   * @param content  the content
   */
  void put(S3Location location, byte[] content);

  /**
   * Stream the rows matching the request's predicate, filtered server side. Pages are delivered in
   * the order the store produces them; each row maps column names to values.
   *
   * @param request      the request
   * @param pageConsumer receives each page of rows
   */
  void selectiveScan(SelectiveScanRequest request, Consumer<List<Map<String, String>>> pageConsumer);
}
