package waypoints.core.internal;

public class ThreadUtils {

  public static String getCurrentThreadId() {
    return String.format("%s-%d", Thread.currentThread().getName(), Thread.currentThread().getId());
  }
}
