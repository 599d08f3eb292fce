package io.github.tripaggregation.model;

import java.util.Optional;
import org.immutables.value.Value;

/**
 * Result of one reduction cycle.
 */
@Value.Immutable
public interface ReductionOutcome {

  /**
   * Key of the batch file that triggered the cycle.
   *
   * @return the object key
   */
  String objectKey();

  /**
   * Terminal state, {@link ReductionState#DONE} or {@link ReductionState#FAILED}.
   *
   * @return the state
   */
  ReductionState state();

  /**
   * State the cycle was in when it failed.
   *
   * @return the failed state
   */
  Optional<ReductionState> failedState();

  Optional<String> failureReason();

  Optional<String> formattedDate();

  Optional<S3Location> summaryLocation();

  Optional<S3Location> recordsLocation();

  @Value.Default
  default int summariesWritten() {
    return 0;
  }

  /**
   * Whether the cycle reached {@link ReductionState#DONE}.
   *
   * @return true when done
   */
  default boolean succeeded() {
    return state() == ReductionState.DONE;
  }
}
