package io.blockperf.collector.application.port;

import java.time.Instant;

/**
 * Chain time model of the tracked network: genesis start and slot length.
 *
 * @since 0.1.0
 */
public interface NetworkConfig {
  /** Network name, e.g. {@code mainnet}. */
  String name();

  /** Network magic reported in every block sample. */
  long magic();

  /**
   * Returns the wall-clock start of a slot.
   *
   * @param slotNo slot number
   * @return slot start instant
   */
  Instant slotTime(long slotNo);
}
