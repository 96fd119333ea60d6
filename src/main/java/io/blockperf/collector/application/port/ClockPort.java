package io.blockperf.collector.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the correlation engine and peer tracker.
 * <p><strong>Why:</strong> Staleness sweeps and reconciliation timestamps need a clock that tests can control.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe; reads happen on dispatcher and scheduler
 * threads.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see io.blockperf.collector.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns the current time as an {@link Instant}.
   *
   * @return current instant with millisecond precision
   */
  default Instant now() {
    return Instant.ofEpochMilli(nowMillis());
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
