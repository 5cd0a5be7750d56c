package waypoints.api;

/** Thrown when a gate can no longer be used, e.g. after its last handle has been closed. */
public class WaypointStateException extends WaypointException {

  public WaypointStateException(Throwable cause) {
    super(cause);
  }

  public WaypointStateException(String message) {
    super(message);
  }
}
