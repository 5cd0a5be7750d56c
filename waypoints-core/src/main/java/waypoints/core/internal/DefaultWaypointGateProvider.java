package waypoints.core.internal;

import com.google.auto.service.AutoService;
import waypoints.api.GateHandle;
import waypoints.api.GateOptions;
import waypoints.api.WaypointGate;
import waypoints.api.WaypointGateProvider;

/** Provides the in-process gate implementation to {@link waypoints.api.Waypoints}. */
@AutoService(WaypointGateProvider.class)
public class DefaultWaypointGateProvider implements WaypointGateProvider {

  @Override
  public WaypointGate newGate(GateOptions options) {
    return new DefaultWaypointGate(options);
  }

  @Override
  public GateHandle newShared(GateOptions options) {
    return RefCountedGateHandle.wrap(new DefaultWaypointGate(options));
  }
}
