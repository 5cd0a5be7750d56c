package waypoints.api;

public class WaypointException extends RuntimeException {

  public WaypointException(Throwable cause) {
    super(cause);
  }

  public WaypointException(String message) {
    super(message);
  }
}
