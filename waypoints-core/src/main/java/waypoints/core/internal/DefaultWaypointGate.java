package waypoints.core.internal;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import com.google.common.math.LongMath;
import com.google.errorprone.annotations.ThreadSafe;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import waypoints.api.GateOptions;
import waypoints.api.PassResult;
import waypoints.api.WaypointGate;
import waypoints.api.WaypointStateException;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The in-process {@link WaypointGate}.
 *
 * <h3>Implementation Overview</h3>
 *
 * <p>All state lives behind a single {@link ReentrantLock}: the cursor, the head start deadline
 * and the closed flag. Waiting threads block on one {@link Condition}. Every change of state
 * signals <em>all</em> waiters, since each of them waits for a different waypoint and only the
 * waiter itself can tell whether the new cursor concerns it.
 *
 * <p>A woken thread assumes nothing about why it was woken. It loops back and re-evaluates, in
 * order: closed, already passed, due (and head start elapsed), timeout. Spurious wake-ups are
 * therefore harmless.
 *
 * <h4>Head start</h4>
 *
 * <p>A pass made with a head start records a deadline ({@link System#nanoTime()} based) before
 * which the next waypoint may not be passed. A thread whose waypoint is due but whose deadline is
 * still ahead waits on the condition for the remainder, bounded by its own timeout. Because a pass
 * can only happen once the previous deadline has elapsed, a pass without a head start simply
 * clears it.
 *
 * @see waypoints.api.WaypointGate
 */
@ThreadSafe
public class DefaultWaypointGate implements WaypointGate {
  private static final Logger LOGGER = LoggerFactory.getLogger(DefaultWaypointGate.class);

  private final GateOptions options;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition cursorMoved = lock.newCondition();

  @GuardedBy("lock")
  private long cursor;

  @GuardedBy("lock")
  private boolean headStartPending;

  // System.nanoTime() value before which the next waypoint may not be passed
  @GuardedBy("lock")
  private long notBeforeNanos;

  @GuardedBy("lock")
  private boolean closed;

  public DefaultWaypointGate(GateOptions options) {
    this.options = checkNotNull(options, "options");
  }

  public DefaultWaypointGate() {
    this(GateOptions.defaults());
  }

  @Override
  public PassResult passRange(long low, long high, Duration timeout, Duration headStart)
      throws InterruptedException {
    checkArgument(low >= 0, "waypoint must not be negative: %s", low);
    checkArgument(high < Long.MAX_VALUE, "waypoint must be below Long.MAX_VALUE: %s", high);
    checkArgument(low <= high, "low (%s) must not exceed high (%s)", low, high);
    checkArgument(
        headStart == null || !headStart.isNegative(),
        "head start must not be negative: %s",
        headStart);

    Duration waitTime = timeout != null ? timeout : options.defaultTimeout();
    final boolean timed = waitTime != null;
    long remainingNanos = timed ? Math.max(0L, toNanosSaturated(waitTime)) : 0L;

    lock.lock();
    try {
      for (; ; ) {
        ensureOpen();
        if (cursor > high) {
          LOGGER.debug(
              "[{}] {} arrived late for waypoint {}, cursor is at {}",
              options.name(),
              ThreadUtils.getCurrentThreadId(),
              high,
              cursor);
          return PassResult.alreadyPassed(low, cursor);
        }

        long waitNanos = Long.MAX_VALUE;
        if (cursor >= low) {
          long now = System.nanoTime();
          long headStartLeft = headStartPending ? notBeforeNanos - now : 0L;
          if (headStartLeft <= 0) {
            return advance(headStart, now);
          }
          waitNanos = headStartLeft;
        }

        if (timed) {
          if (remainingNanos <= 0) {
            LOGGER.debug(
                "[{}] {} timed out waiting for waypoint {}, cursor is at {}",
                options.name(),
                ThreadUtils.getCurrentThreadId(),
                low,
                cursor);
            return PassResult.timedOut(low, cursor);
          }
          long start = System.nanoTime();
          cursorMoved.awaitNanos(Math.min(waitNanos, remainingNanos));
          remainingNanos -= System.nanoTime() - start;
        } else if (waitNanos == Long.MAX_VALUE) {
          LOGGER.trace(
              "[{}] {} waiting for waypoint {}, cursor is at {}",
              options.name(),
              ThreadUtils.getCurrentThreadId(),
              low,
              cursor);
          cursorMoved.await();
        } else {
          cursorMoved.awaitNanos(waitNanos);
        }
      }
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private PassResult advance(Duration headStart, long now) {
    long passed = cursor;
    cursor = passed + 1;
    headStartPending = headStart != null;
    if (headStartPending) {
      notBeforeNanos = LongMath.saturatedAdd(now, toNanosSaturated(headStart));
    }
    cursorMoved.signalAll();
    LOGGER.debug(
        "[{}] {} passed waypoint {}", options.name(), ThreadUtils.getCurrentThreadId(), passed);
    return PassResult.passed(passed);
  }

  @Override
  public boolean skipTo(long waypoint) {
    checkArgument(waypoint >= 0, "waypoint must not be negative: %s", waypoint);
    lock.lock();
    try {
      ensureOpen();
      if (waypoint <= cursor) {
        return false;
      }
      LOGGER.debug("[{}] skipping from waypoint {} to {}", options.name(), cursor, waypoint);
      cursor = waypoint;
      cursorMoved.signalAll();
      return true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public long cursor() {
    lock.lock();
    try {
      return cursor;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int getNumberWaiting() {
    lock.lock();
    try {
      return lock.getWaitQueueLength(cursorMoved);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String name() {
    return options.name();
  }

  /**
   * Closes the gate. Threads blocked in {@link #passRange} are woken and fail with a {@link
   * WaypointStateException}, as does every later call. Closing twice is a no-op.
   */
  public void close() {
    lock.lock();
    try {
      if (!closed) {
        closed = true;
        LOGGER.debug("[{}] closed at waypoint {}", options.name(), cursor);
        cursorMoved.signalAll();
      }
    } finally {
      lock.unlock();
    }
  }

  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  @GuardedBy("lock")
  private void ensureOpen() {
    if (closed) {
      throw new WaypointStateException("Gate '" + options.name() + "' is closed");
    }
  }

  private static long toNanosSaturated(Duration duration) {
    try {
      return duration.toNanos();
    } catch (ArithmeticException e) {
      return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", options.name())
        .add("cursor", cursor())
        .add("closed", isClosed())
        .toString();
  }
}
