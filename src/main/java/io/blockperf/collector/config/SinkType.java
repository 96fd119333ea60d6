package io.blockperf.collector.config;

import java.util.Locale;

/**
 * Destination of finalized block samples.
 *
 * @since 0.1.0
 */
public enum SinkType {
  /** JSON line at INFO on the samples logger. */
  LOG,
  /** POST to the block sample API. */
  HTTP,
  /** Append JSON lines to a file. */
  FILE;

  /**
   * Parses a sink name case-insensitively.
   *
   * @param raw sink name; blank selects {@code fallback}
   * @param fallback value used when {@code raw} is blank
   * @return parsed sink type
   * @throws IllegalArgumentException when the name is unknown
   */
  public static SinkType from(String raw, SinkType fallback) {
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return SinkType.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("sink must be one of log|http|file (was " + raw.trim() + ")", ex);
    }
  }
}
