package io.github.tripaggregation.cli;

import io.github.tripaggregation.cli.command.GetTripCommand;
import io.github.tripaggregation.cli.command.ReduceCommand;
import io.github.tripaggregation.cli.command.ServeCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Main CLI entry point for the trip aggregation pipeline.
 */
@Command(
    name = "trip-aggregation",
    description = "Reduce telemetry batch files into trip summaries and serve aggregated trips",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {ReduceCommand.class, GetTripCommand.class, ServeCommand.class})
public class TripAggregationCli implements Runnable {

  /**
   * Main entry point.
   *
   * @param args command line arguments
   */
  public static void main(String[] args) {
    final int exitCode = new CommandLine(new TripAggregationCli()).execute(args);
    System.exit(exitCode);
  }

  @Override
  public void run() {
    // Show help when no subcommand is specified
    CommandLine.usage(this, System.out);
  }
}
