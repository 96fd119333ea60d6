package io.blockperf.collector.config;

import java.util.Locale;

/**
 * Where the node's trace events are read from.
 *
 * @since 0.1.0
 */
public enum SourceType {
  /** JSON-lines trace file written by the node. */
  FILE,
  /** systemd journal of the node's unit, read through {@code journalctl}. */
  JOURNALD;

  /**
   * Parses a source name case-insensitively.
   *
   * @param raw source name; blank selects {@code fallback}
   * @param fallback value used when {@code raw} is blank
   * @return parsed source type
   * @throws IllegalArgumentException when the name is unknown
   */
  public static SourceType from(String raw, SourceType fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return SourceType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("source must be one of file|journald (was " + raw.trim() + ")", ex);
    }
  }
}
