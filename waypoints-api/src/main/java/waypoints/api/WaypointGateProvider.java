package waypoints.api;

/**
 * Service provider interface for gate implementations, discovered with {@link
 * java.util.ServiceLoader}.
 */
public interface WaypointGateProvider {

  WaypointGate newGate(GateOptions options);

  GateHandle newShared(GateOptions options);
}
