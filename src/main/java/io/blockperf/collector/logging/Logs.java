package io.blockperf.collector.logging;

import java.nio.charset.StandardCharsets;

/**
 * <strong>What:</strong> Shapes untrusted or secret values before they are logged.
 * <p><strong>Why:</strong> Malformed trace lines can be arbitrarily long, and the API key must never reach a log.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";
  private static final String UNSET_PLACEHOLDER = "<none>";

  private Logs() {}

  /**
   * Cuts a value to at most {@code maxBytes} UTF-8 bytes without splitting a character, noting the original size.
   *
   * @param value text to shorten; {@code null} gives {@code "<null>"}
   * @param maxBytes byte budget; must be positive
   * @return {@code value} when it fits, otherwise the kept prefix followed by {@code "... (truncated, N of M bytes)"}
   * @throws IllegalArgumentException if {@code maxBytes} is not positive
   */
  public static String truncate(String value, int maxBytes) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be positive");
    }
    byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
    if (utf8.length <= maxBytes) {
      return value;
    }
    int end = maxBytes;
    // Back off continuation bytes (10xxxxxx) so the cut lands on a character start.
    while (end > 0 && (utf8[end] & 0xC0) == 0x80) {
      end--;
    }
    return new String(utf8, 0, end, StandardCharsets.UTF_8)
        + "... (truncated, " + maxBytes + " of " + utf8.length + " bytes)";
  }

  /**
   * Masks a secret for display.
   *
   * @param value secret or {@code null}
   * @return {@code [REDACTED]} when a value is present, {@code <none>} when it is unset or empty
   */
  public static String redact(String value) {
    return value == null || value.isEmpty() ? UNSET_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }
}
