package io.blockperf.collector.application.pipeline;

import java.time.Duration;
import java.util.Objects;

/**
 * Timer periods for {@link CollectorUseCase}.
 *
 * @param reconcileInterval period of OS-connection reconciliation
 * @param sweepInterval period of the stale block-record sweep
 * @param reportInterval period of the peer statistics report
 * @since 0.1.0
 */
public record CollectorSettings(Duration reconcileInterval, Duration sweepInterval, Duration reportInterval) {
  public static final Duration DEFAULT_RECONCILE_INTERVAL = Duration.ofSeconds(30);
  public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(10);
  public static final Duration DEFAULT_REPORT_INTERVAL = Duration.ofSeconds(60);

  public CollectorSettings {
    requirePositive(reconcileInterval, "reconcileInterval");
    requirePositive(sweepInterval, "sweepInterval");
    requirePositive(reportInterval, "reportInterval");
  }

  public static CollectorSettings defaults() {
    return new CollectorSettings(DEFAULT_RECONCILE_INTERVAL, DEFAULT_SWEEP_INTERVAL, DEFAULT_REPORT_INTERVAL);
  }

  private static void requirePositive(Duration value, String name) {
    Objects.requireNonNull(value, name);
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }
}
