package waypoints.api;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.errorprone.annotations.Immutable;

import java.time.Duration;
import java.util.Optional;

/**
 * Configuration of a {@link WaypointGate}.
 *
 * @param name label used in {@code toString()} and log lines
 * @param defaultTimeout how long {@link WaypointGate#pass(long)} and the other overloads without an
 *     explicit timeout wait; {@code null} waits indefinitely
 */
@Immutable
public record GateOptions(String name, Duration defaultTimeout) {

  public static final String DEFAULT_NAME = "waypoints";

  private static final GateOptions DEFAULTS = new GateOptions(DEFAULT_NAME, null);

  public GateOptions {
    checkNotNull(name, "name");
    checkArgument(!name.isBlank(), "name must not be blank");
  }

  public static GateOptions defaults() {
    return DEFAULTS;
  }

  public GateOptions withName(String name) {
    return new GateOptions(name, defaultTimeout);
  }

  public GateOptions withDefaultTimeout(Duration defaultTimeout) {
    return new GateOptions(name, defaultTimeout);
  }

  public Optional<Duration> getDefaultTimeout() {
    return Optional.ofNullable(defaultTimeout);
  }
}
