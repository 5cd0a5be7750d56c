package waypoints.api;

/**
 * Raised by {@link PassResult#orThrow()} for a {@link GateError#TIMED_OUT} result.
 *
 * @see GateError#TIMED_OUT
 */
public class WaypointTimeoutException extends WaypointException {
  private final long waypoint;
  private final long cursor;

  public WaypointTimeoutException(long waypoint, long cursor) {
    super(
        String.format(
            "Timed out waiting for waypoint %d (cursor was at %d)", waypoint, cursor));
    this.waypoint = waypoint;
    this.cursor = cursor;
  }

  public long getWaypoint() {
    return waypoint;
  }

  public long getCursor() {
    return cursor;
  }
}
