package waypoints.api;

/**
 * Raised by {@link PassResult#orThrow()} for a {@link GateError#ALREADY_PASSED} result.
 *
 * @see GateError#ALREADY_PASSED
 */
public class WaypointAlreadyPassedException extends WaypointException {
  private final long waypoint;
  private final long cursor;

  public WaypointAlreadyPassedException(long waypoint, long cursor) {
    super(String.format("Waypoint %d was already passed (cursor is at %d)", waypoint, cursor));
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
