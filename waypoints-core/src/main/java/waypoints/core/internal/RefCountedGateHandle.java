package waypoints.core.internal;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.MustBeClosed;
import com.google.errorprone.annotations.ThreadSafe;
import waypoints.api.GateHandle;
import waypoints.api.PassResult;
import waypoints.api.WaypointStateException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A {@link GateHandle} counting the open handles of one {@link DefaultWaypointGate}.
 *
 * <p>Every handle holds exactly one reference. {@link #share()} adds a reference only while the
 * count is still positive, so a handle can never be created for a gate whose last handle is
 * concurrently being closed. The thread that drops the count to zero closes the gate.
 */
@ThreadSafe
final class RefCountedGateHandle implements GateHandle {

  private final DefaultWaypointGate gate;
  private final AtomicInteger references;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  private RefCountedGateHandle(DefaultWaypointGate gate, AtomicInteger references) {
    this.gate = gate;
    this.references = references;
  }

  /** Wraps {@code gate} in its first handle. */
  @MustBeClosed
  static RefCountedGateHandle wrap(DefaultWaypointGate gate) {
    return new RefCountedGateHandle(checkNotNull(gate, "gate"), new AtomicInteger(1));
  }

  @Override
  public GateHandle share() {
    ensureOpen();
    for (; ; ) {
      int current = references.get();
      if (current <= 0) {
        throw new WaypointStateException("Gate '" + gate.name() + "' is closed");
      }
      if (references.compareAndSet(current, current + 1)) {
        return new RefCountedGateHandle(gate, references);
      }
    }
  }

  @Override
  public PassResult passRange(long low, long high, Duration timeout, Duration headStart)
      throws InterruptedException {
    ensureOpen();
    return gate.passRange(low, high, timeout, headStart);
  }

  @Override
  public boolean skipTo(long waypoint) {
    ensureOpen();
    return gate.skipTo(waypoint);
  }

  @Override
  public long cursor() {
    return gate.cursor();
  }

  @Override
  public int getNumberWaiting() {
    return gate.getNumberWaiting();
  }

  @Override
  public String name() {
    return gate.name();
  }

  @Override
  public int references() {
    return Math.max(0, references.get());
  }

  @Override
  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      if (references.decrementAndGet() == 0) {
        gate.close();
      }
    }
  }

  @VisibleForTesting
  DefaultWaypointGate gate() {
    return gate;
  }

  private void ensureOpen() {
    if (closed.get()) {
      throw new WaypointStateException("Handle to gate '" + gate.name() + "' is closed");
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("gate", gate)
        .add("references", references())
        .add("closed", isClosed())
        .toString();
  }
}
