package io.blockperf.collector.application.block;

import java.time.Duration;
import java.util.Objects;

/**
 * Tuning for {@link BlockCorrelationEngine}.
 *
 * @param staleAfter age after which an unadopted record is swept without emission
 * @param retiredHashCapacity number of finalized or swept hashes remembered to suppress late events
 * @since 0.1.0
 */
public record BlockCorrelationSettings(Duration staleAfter, int retiredHashCapacity) {
  public static final Duration DEFAULT_STALE_AFTER = Duration.ofMinutes(10);
  public static final int DEFAULT_RETIRED_HASH_CAPACITY = 8_192;

  public BlockCorrelationSettings {
    Objects.requireNonNull(staleAfter, "staleAfter");
    if (staleAfter.isNegative() || staleAfter.isZero()) {
      throw new IllegalArgumentException("staleAfter must be positive");
    }
    if (retiredHashCapacity <= 0) {
      throw new IllegalArgumentException("retiredHashCapacity must be positive");
    }
  }

  public static BlockCorrelationSettings defaults() {
    return new BlockCorrelationSettings(DEFAULT_STALE_AFTER, DEFAULT_RETIRED_HASH_CAPACITY);
  }
}
