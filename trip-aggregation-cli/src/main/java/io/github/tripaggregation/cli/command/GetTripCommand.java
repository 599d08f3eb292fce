package io.github.tripaggregation.cli.command;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.tripaggregation.cli.dagger.CliComponent;
import io.github.tripaggregation.exception.TripNotFoundException;
import io.github.tripaggregation.model.AggregatedTrip;
import io.github.tripaggregation.model.Configuration;
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
 * Prints the aggregated trip of a finished trip, aggregating it first if needed.
 */
@Command(
    name = "get-trip",
    description = "Fetch the aggregated trip of a finished trip")
public class GetTripCommand implements Callable<Integer> {

  private static final Logger log = LoggerFactory.getLogger(GetTripCommand.class);

  @Mixin
  private AwsOptions awsOptions;

  @Option(
      names = {"--trip-id", "-t"},
      description = "Trip id",
      required = true)
  private String tripId;

  @Option(
      names = {"--output", "-o"},
      description = "File to write the JSON to (default: standard output)")
  private Path output;

  private final Function<Configuration, CliComponent> componentFactory;

  /**
   * Instantiates a new Get trip command.
   */
  public GetTripCommand() {
    this(CliComponent::create);
  }

  GetTripCommand(final Function<Configuration, CliComponent> componentFactory) {
    this.componentFactory = componentFactory;
  }

  @Override
  public Integer call() throws Exception {
    final List<String> missing = awsOptions.missingOptions();
    if (!missing.isEmpty()) {
      log.error("Missing required options: {}", missing);
      return 1;
    }

    final CliComponent component = componentFactory.apply(awsOptions.toConfiguration());
    final AggregatedTrip trip;
    try {
      trip = component.tripAggregationCache().getAggregatedTrip(tripId);
    } catch (TripNotFoundException e) {
      log.error("Trip '{}' not found", tripId);
      return 1;
    }

    final ObjectMapper objectMapper = component.objectMapper();
    final String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(trip);
    if (output != null) {
      Files.writeString(output, json);
      log.info("Aggregated trip {} written to {}", tripId, output);
    } else {
      System.out.println(json);
    }
    return 0;
  }
}
