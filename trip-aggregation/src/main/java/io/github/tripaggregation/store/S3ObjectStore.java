package io.github.tripaggregation.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.tripaggregation.exception.TripAggregationException;
import io.github.tripaggregation.model.S3Location;
import io.github.tripaggregation.model.ScanInputFormat;
import io.github.tripaggregation.model.SelectiveScanRequest;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.function.Consumer;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3AsyncClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.CSVInput;
import software.amazon.awssdk.services.s3.model.ExpressionType;
import software.amazon.awssdk.services.s3.model.FileHeaderInfo;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.InputSerialization;
import software.amazon.awssdk.services.s3.model.JSONInput;
import software.amazon.awssdk.services.s3.model.JSONOutput;
import software.amazon.awssdk.services.s3.model.JSONType;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.OutputSerialization;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.SelectObjectContentRequest;
import software.amazon.awssdk.services.s3.model.SelectObjectContentResponseHandler;

/**
 * Object store backed by S3. Selective scans use S3 Select, which only the async client offers.
 */
@Singleton
public class S3ObjectStore implements ObjectStore {

  private static final Logger log = LoggerFactory.getLogger(S3ObjectStore.class);

  private final S3Client s3Client;
  private final S3AsyncClient s3AsyncClient;
  private final ObjectMapper objectMapper;

  /**
   * Instantiates a new S3 object store.
   *
   * @param s3Client      the s3 client
   * @param s3AsyncClient the s3 async client
   * @param objectMapper  the object mapper
   */
  @Inject
  public S3ObjectStore(final S3Client s3Client,
                       final S3AsyncClient s3AsyncClient,
                       final ObjectMapper objectMapper) {
    this.s3Client = s3Client;
    this.s3AsyncClient = s3AsyncClient;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<byte[]> get(final S3Location location) {
    try {
      return Optional.of(s3Client.getObjectAsBytes(GetObjectRequest.builder()
          .bucket(location.bucket())
          .key(location.key())
          .build()).asByteArray());
    } catch (NoSuchKeyException e) {
      log.debug("No object at {}", location.toUri());
      return Optional.empty();
    }
  }

  @Override
  public void put(final S3Location location, final byte[] content) {
    s3Client.putObject(PutObjectRequest.builder()
            .bucket(location.bucket())
            .key(location.key())
            .build(),
        RequestBody.fromBytes(content));
    log.debug("Stored {} bytes at {}", content.length, location.toUri());
  }

  @Override
  public void selectiveScan(final SelectiveScanRequest request,
                            final Consumer<List<Map<String, String>>> pageConsumer) {
    final JsonLinesPageReader reader = new JsonLinesPageReader(objectMapper, pageConsumer);
    final SelectObjectContentResponseHandler handler = SelectObjectContentResponseHandler.builder()
        .subscriber(SelectObjectContentResponseHandler.Visitor.builder()
            .onRecords(event -> reader.accept(event.payload().asByteArray()))
            .onEnd(event -> log.trace("Selective scan of {} ended", request.location().toUri()))
            .build())
        .build();

    try {
      s3AsyncClient.selectObjectContent(selectRequest(request), handler).join();
    } catch (CompletionException e) {
      if (e.getCause() instanceof RuntimeException) {
        throw (RuntimeException) e.getCause();
      }
      throw new TripAggregationException("Selective scan of " + request.location().toUri() + " failed", e);
    }
    reader.finish();
    log.debug("Selective scan of {} returned {} rows, skipped {}",
        request.location().toUri(), reader.rowCount(), reader.skippedCount());
  }

  private SelectObjectContentRequest selectRequest(final SelectiveScanRequest request) {
    return SelectObjectContentRequest.builder()
        .bucket(request.location().bucket())
        .key(request.location().key())
        .expressionType(ExpressionType.SQL)
        .expression(request.expression())
        .inputSerialization(inputSerialization(request.inputFormat()))
        .outputSerialization(OutputSerialization.builder()
            .json(JSONOutput.builder().recordDelimiter("\n").build())
            .build())
        .build();
  }

  private static InputSerialization inputSerialization(final ScanInputFormat format) {
    switch (format) {
      case CSV:
        return InputSerialization.builder()
            .csv(CSVInput.builder().fileHeaderInfo(FileHeaderInfo.USE).build())
            .build();
      case JSON_LINES:
        return InputSerialization.builder()
            .json(JSONInput.builder().type(JSONType.LINES).build())
            .build();
      default:
        throw new IllegalArgumentException("Unsupported scan input format: " + format);
    }
  }
}
