package io.github.tripaggregation.cli.command;

import io.github.tripaggregation.cli.dagger.CliComponent;
import io.github.tripaggregation.model.Configuration;
import io.github.tripaggregation.model.ImmutableBatchFileNotification;
import io.github.tripaggregation.model.ReductionOutcome;
import io.github.tripaggregation.router.NotificationRouter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Runs one reduction cycle for a batch file.
 */
@Command(
    name = "reduce",
    description = "Reduce the batch file given by bucket and key, or by a notification document")
public class ReduceCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(ReduceCommand.class);

  @Mixin
  private AwsOptions awsOptions;

  @Option(
      names = {"--bucket", "-b"},
      description = "Bucket the batch file was written to")
  private String bucket;

  @Option(
      names = {"--key", "-k"},
      description = "Key of the batch file, e.g. raw/year=2023/month=01/day=02/hour=03/minute=04/part-0001")
  private String key;

  @Option(
      names = {"--event-file", "-e"},
      description = "JSON notification, either {bucketName, key} or an EventBridge S3 PutObject event")
  private Path eventFile;

  private final Function<Configuration, CliComponent> componentFactory;

  /**
   * Instantiates a new Reduce command.
   */
  public ReduceCommand() {
    this(CliComponent::create);
  }

  ReduceCommand(final Function<Configuration, CliComponent> componentFactory) {
    this.componentFactory = componentFactory;
  }

  @Override
  public Integer call() throws Exception {
    if (eventFile == null && key == null) {
      log.error("Either --key or --event-file is required");
      return 1;
    }

    final List<String> missing = awsOptions.missingOptions();
    if (!missing.isEmpty()) {
      log.error("Missing required options: {}", missing);
      return 1;
    }

    final NotificationRouter router = componentFactory.apply(awsOptions.toConfiguration()).notificationRouter();
    final ReductionOutcome outcome;
    if (eventFile != null) {
      outcome = router.route(Files.readString(eventFile));
    } else {
      outcome = router.route(ImmutableBatchFileNotification.builder()
          .bucketName(bucket != null ? bucket : "")
          .key(key)
          .build());
    }

    if (!outcome.succeeded()) {
      log.error("Reduction failed in state {}: {}",
          outcome.failedState().orElse(null), outcome.failureReason().orElse("unknown"));
      return 1;
    }
    log.info("Reduction of {} completed, {} trip summaries written",
        outcome.formattedDate().orElse(outcome.objectKey()), outcome.summariesWritten());
    return 0;
  }
}
