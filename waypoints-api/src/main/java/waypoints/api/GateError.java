package waypoints.api;

/** The reasons a pass can fail. Both are recoverable; the gate stays usable after either. */
public enum GateError {

  /** The caller's wait exceeded its timeout before its waypoint was reached. */
  TIMED_OUT,

  /**
   * The requested waypoint is below the gate's cursor. Either another caller already passed it, or
   * the waypoints were requested out of order. Reported without blocking.
   */
  ALREADY_PASSED
}
