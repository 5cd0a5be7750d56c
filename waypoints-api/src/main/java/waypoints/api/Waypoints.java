package waypoints.api;

import java.util.Iterator;
import java.util.ServiceLoader;

/** Entry point for creating gates. */
public final class Waypoints {

  private static volatile WaypointGateProvider provider;

  private Waypoints() {}

  /** Creates a gate with the cursor at 0. */
  public static WaypointGate newGate() {
    return newGate(GateOptions.defaults());
  }

  public static WaypointGate newGate(GateOptions options) {
    return provider().newGate(options);
  }

  /** Creates a gate with the cursor at 0, wrapped in a handle that can be shared across threads. */
  public static GateHandle newShared() {
    return newShared(GateOptions.defaults());
  }

  public static GateHandle newShared(GateOptions options) {
    return provider().newShared(options);
  }

  static WaypointGateProvider discoverProvider() {
    Iterator<WaypointGateProvider> providers =
        ServiceLoader.load(WaypointGateProvider.class).iterator();
    if (!providers.hasNext()) {
      throw new WaypointStateException(
          "No " + WaypointGateProvider.class.getName() + " found on the class path");
    }
    return providers.next();
  }

  private static WaypointGateProvider provider() {
    WaypointGateProvider p = provider;
    if (p == null) {
      synchronized (Waypoints.class) {
        p = provider;
        if (p == null) {
          p = provider = discoverProvider();
        }
      }
    }
    return p;
  }
}
