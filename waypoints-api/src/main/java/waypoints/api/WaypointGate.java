package waypoints.api;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import com.google.errorprone.annotations.ThreadSafe;

import java.time.Duration;

/**
 * A series of numbered waypoints shared by several threads.
 *
 * <p>The gate holds a cursor, the number of the next waypoint that may be passed. It starts at 0.
 * A thread calling {@link #pass(long, Duration)} blocks until the cursor equals its waypoint, then
 * advances the cursor by one and wakes every other waiting thread. Threads that target consecutive
 * waypoints from different places in the code therefore execute those places in waypoint order,
 * whatever the scheduler does:
 *
 * <pre>{@code
 * WaypointGate gate = Waypoints.newGate();
 *
 * // thread 1                  // thread 2
 * log.add(0);                  gate.pass(1);
 * log.add(1);                  log.add(2);
 * gate.pass(0);                log.add(3);
 * gate.pass(3);                gate.pass(2);
 * log.add(4);
 * log.add(5);
 *
 * // log is always [0, 1, 2, 3, 4, 5]
 * }</pre>
 *
 * <p>The cursor never decreases. A waypoint below the cursor can never be passed again and is
 * reported as {@link GateError#ALREADY_PASSED} without blocking.
 *
 * <p>Failures are returned as {@link PassResult} values rather than thrown. The gate stays valid
 * after any number of failed calls.
 */
@ThreadSafe
public interface WaypointGate {

  /**
   * Passes {@code waypoint}, waiting for at most the gate's default timeout.
   *
   * @see #pass(long, Duration, Duration)
   */
  @CanIgnoreReturnValue
  default PassResult pass(long waypoint) throws InterruptedException {
    return pass(waypoint, null, null);
  }

  /**
   * Passes {@code waypoint}, waiting for at most {@code timeout}.
   *
   * @see #pass(long, Duration, Duration)
   */
  @CanIgnoreReturnValue
  default PassResult pass(long waypoint, Duration timeout) throws InterruptedException {
    return pass(waypoint, timeout, null);
  }

  /**
   * Blocks until the cursor reaches {@code waypoint}, then advances it to {@code waypoint + 1}.
   *
   * <ul>
   *   <li>cursor above {@code waypoint}: returns {@link GateError#ALREADY_PASSED} immediately;
   *   <li>cursor equal to {@code waypoint}: advances, wakes all waiters and returns {@code
   *       Passed};
   *   <li>cursor below {@code waypoint}: waits for the cursor to move and checks again, or returns
   *       {@link GateError#TIMED_OUT} once {@code timeout} has elapsed. The cursor is not touched
   *       on timeout.
   * </ul>
   *
   * @param waypoint the waypoint to pass, in {@code [0, Long.MAX_VALUE)}
   * @param timeout maximum time to wait; {@code null} uses the gate's default timeout
   * @param headStart if not {@code null}, the next waypoint may not be passed before this much time
   *     has elapsed since this pass
   * @throws InterruptedException if the thread is interrupted while waiting; the cursor is unchanged
   * @throws IllegalArgumentException if {@code waypoint} is out of range
   * @throws WaypointStateException if the gate has been closed
   */
  @CanIgnoreReturnValue
  default PassResult pass(long waypoint, Duration timeout, Duration headStart)
      throws InterruptedException {
    return passRange(waypoint, waypoint, timeout, headStart);
  }

  /**
   * Passes the cursor once it is anywhere in {@code [low, high]}, waiting for at most {@code
   * timeout}.
   *
   * @see #passRange(long, long, Duration, Duration)
   */
  @CanIgnoreReturnValue
  default PassResult passRange(long low, long high, Duration timeout)
      throws InterruptedException {
    return passRange(low, high, timeout, null);
  }

  /**
   * Like {@link #pass(long, Duration, Duration)} but accepts any cursor value in {@code [low,
   * high]}. Several threads each passing the same range may do so in any order, so the code
   * between their waypoints runs concurrently rather than in a fixed sequence.
   *
   * <p>The result's {@link PassResult#waypoint()} is the cursor value actually passed on success,
   * and {@code low} on failure.
   *
   * @throws IllegalArgumentException if {@code low > high} or either bound is out of range
   */
  @CanIgnoreReturnValue
  PassResult passRange(long low, long high, Duration timeout, Duration headStart)
      throws InterruptedException;

  /**
   * Moves the cursor forward to {@code waypoint} and wakes all waiters. Waypoints in between become
   * {@link GateError#ALREADY_PASSED}.
   *
   * @return {@code false}, leaving the gate unchanged, if the cursor is already at or beyond {@code
   *     waypoint}
   */
  @CanIgnoreReturnValue
  boolean skipTo(long waypoint);

  /**
   * @return the next waypoint that may be passed
   */
  long cursor();

  /**
   * @return an estimate of the number of threads currently blocked in {@code pass} or {@code
   *     passRange}
   */
  int getNumberWaiting();

  String name();
}
