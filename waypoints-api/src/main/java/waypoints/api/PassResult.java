package waypoints.api;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.Immutable;

import java.util.Optional;

/**
 * The outcome of passing a waypoint. Failures are ordinary values; use {@link #orThrow()} to turn
 * them into exceptions when the caller treats any failure as fatal.
 */
@Immutable
public sealed interface PassResult permits PassResult.Passed, PassResult.Failed {

  /**
   * @return the waypoint the caller asked for, or for a range pass the cursor value it passed
   */
  long waypoint();

  Optional<GateError> error();

  /**
   * @return this result if the pass succeeded
   * @throws WaypointTimeoutException if the wait timed out
   * @throws WaypointAlreadyPassedException if the waypoint was already passed
   */
  @CanIgnoreReturnValue
  PassResult orThrow();

  default boolean isPassed() {
    return this instanceof PassResult.Passed;
  }

  default boolean isFailed() {
    return this instanceof PassResult.Failed;
  }

  static PassResult passed(long waypoint) {
    return new Passed(waypoint);
  }

  static PassResult timedOut(long waypoint, long cursor) {
    return new Failed(GateError.TIMED_OUT, waypoint, cursor);
  }

  static PassResult alreadyPassed(long waypoint, long cursor) {
    return new Failed(GateError.ALREADY_PASSED, waypoint, cursor);
  }

  record Passed(long waypoint) implements PassResult {
    @Override
    public Optional<GateError> error() {
      return Optional.empty();
    }

    @Override
    public PassResult orThrow() {
      return this;
    }
  }

  /**
   * @param reason why the pass failed
   * @param waypoint the waypoint the caller asked for
   * @param cursor the cursor value the caller observed when it gave up
   */
  record Failed(GateError reason, long waypoint, long cursor) implements PassResult {
    @Override
    public Optional<GateError> error() {
      return Optional.of(reason);
    }

    @Override
    public PassResult orThrow() {
      switch (reason) {
        case TIMED_OUT:
          throw new WaypointTimeoutException(waypoint, cursor);
        case ALREADY_PASSED:
          throw new WaypointAlreadyPassedException(waypoint, cursor);
        default:
          throw new AssertionError("Unknown gate error " + reason);
      }
    }
  }
}
