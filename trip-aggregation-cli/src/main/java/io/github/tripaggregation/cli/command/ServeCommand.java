package io.github.tripaggregation.cli.command;

import io.github.tripaggregation.cli.api.TripsHttpServer;
import io.github.tripaggregation.cli.dagger.CliComponent;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

/**
 * Serves the trips read API until the process is stopped.
 */
@Command(
    name = "serve",
    description = "Serve GET /trips/{tripId} over HTTP")
public class ServeCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(ServeCommand.class);

  @Mixin
  private AwsOptions awsOptions;

  @Option(
      names = {"--port", "-p"},
      description = "Port to listen on (default: 8080)",
      defaultValue = "8080")
  private int port;

  @Option(
      names = {"--threads"},
      description = "Request threads (default: 16)",
      defaultValue = "16")
  private int threads;

  @Override
  public Integer call() throws Exception {
    final List<String> missing = awsOptions.missingOptions();
    if (!missing.isEmpty()) {
      log.error("Missing required options: {}", missing);
      return 1;
    }

    final CliComponent component = CliComponent.create(awsOptions.toConfiguration());
    final TripsHttpServer server = new TripsHttpServer(component.tripsApiHandler(), port, threads);
    final CountDownLatch stopped = new CountDownLatch(1);
    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
      log.info("Stopping trips API");
      server.stop();
      stopped.countDown();
    }));

    server.start();
    stopped.await();
    return 0;
  }
}
