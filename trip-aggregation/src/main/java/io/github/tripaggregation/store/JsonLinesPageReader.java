package io.github.tripaggregation.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns chunks of newline delimited JSON into pages of rows. A chunk may end in the middle of a
 * line, or in the middle of a multibyte character; the remainder is kept as bytes until the next
 * chunk or {@link #finish()} and lines are decoded as UTF-8 only once complete.
 */
public class JsonLinesPageReader {

  private static final Logger log = LoggerFactory.getLogger(JsonLinesPageReader.class);
  private static final TypeReference<LinkedHashMap<String, Object>> ROW_TYPE = new TypeReference<>() {
  };

  private final ObjectMapper objectMapper;
  private final Consumer<List<Map<String, String>>> pageConsumer;
  private final ByteArrayOutputStream remainder = new ByteArrayOutputStream();
  private long rowCount;
  private long skippedCount;

  /**
   * Instantiates a new Json lines page reader.
   *
   * @param objectMapper the object mapper
   * @param pageConsumer the page consumer
   */
  public JsonLinesPageReader(final ObjectMapper objectMapper,
                             final Consumer<List<Map<String, String>>> pageConsumer) {
    this.objectMapper = objectMapper;
    this.pageConsumer = pageConsumer;
  }

  /**
   * Consume a chunk and deliver the complete lines it closes as one page.
   *
   * @param chunk the chunk
   */
  public void accept(final byte[] chunk) {
    final List<Map<String, String>> page = new ArrayList<>();
    int start = 0;
    for (int i = 0; i < chunk.length; i++) {
      if (chunk[i] == '\n') {
        remainder.write(chunk, start, i - start);
        parse(takeRemainder()).ifPresent(page::add);
        start = i + 1;
      }
    }
    remainder.write(chunk, start, chunk.length - start);
    deliver(page);
  }

  /**
   * Deliver a trailing line that had no newline.
   */
  public void finish() {
    parse(takeRemainder()).ifPresent(row -> deliver(List.of(row)));
  }

  /**
   * Rows delivered so far.
   *
   * @return the row count
   */
  public long rowCount() {
    return rowCount;
  }

  /**
   * Malformed lines skipped so far.
   *
   * @return the skipped count
   */
  public long skippedCount() {
    return skippedCount;
  }

  private String takeRemainder() {
    final String line = remainder.toString(StandardCharsets.UTF_8);
    remainder.reset();
    return line;
  }

  private void deliver(final List<Map<String, String>> page) {
    if (!page.isEmpty()) {
      rowCount += page.size();
      pageConsumer.accept(page);
    }
  }

  private Optional<Map<String, String>> parse(final String line) {
    if (line.isBlank()) {
      return Optional.empty();
    }
    try {
      final Map<String, Object> parsed = objectMapper.readValue(line, ROW_TYPE);
      final Map<String, String> row = new LinkedHashMap<>();
      parsed.forEach((column, value) -> {
        if (value != null) {
          row.put(column, String.valueOf(value));
        }
      });
      return Optional.of(row);
    } catch (JsonProcessingException e) {
      skippedCount++;
      log.warn("Skipping malformed scan row: {}", e.getOriginalMessage());
      return Optional.empty();
    }
  }
}
