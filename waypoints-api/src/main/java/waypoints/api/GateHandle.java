package waypoints.api;

import com.google.errorprone.annotations.MustBeClosed;
import com.google.errorprone.annotations.ThreadSafe;

/**
 * A reference-counted handle to a {@link WaypointGate}, meant to be handed to each thread that takes
 * part in a sequence.
 *
 * <p>All handles obtained from one another through {@link #share()} drive the same gate and observe
 * the same cursor. Each handle must be closed exactly once (closing again is a no-op). When the last
 * handle is closed the gate is closed too: threads still waiting on it are released with a {@link
 * WaypointStateException}, and so is every later call.
 */
@ThreadSafe
public interface GateHandle extends WaypointGate, AutoCloseable {

  /**
   * Returns a new handle to the same gate.
   *
   * @throws WaypointStateException if this handle is already closed
   */
  @MustBeClosed
  GateHandle share();

  /**
   * @return the number of open handles to the underlying gate
   */
  int references();

  boolean isClosed();

  /** Releases this handle's reference to the gate. */
  @Override
  void close();
}
