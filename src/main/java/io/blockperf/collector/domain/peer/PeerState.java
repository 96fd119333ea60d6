package io.blockperf.collector.domain.peer;

import java.util.Locale;
import java.util.Optional;

/**
 * Connection state of a peer as seen by the node's peer governors.
 *
 * <p>{@link #UNKNOWN} is only ever assigned by reconciliation against the OS socket table; log events always carry a
 * concrete state.</p>
 *
 * @since 0.1.0
 */
public enum PeerState {
  UNKNOWN("Unknown"),
  COLD("Cold"),
  WARM("Warm"),
  HOT("Hot");

  private final String label;

  PeerState(String label) {
    this.label = label;
  }

  /**
   * Returns the label used in node log messages ({@code Cold}, {@code Warm}, ...).
   *
   * @return log label
   */
  public String label() {
    return label;
  }

  /**
   * Resolves a governor state token as printed by the node. {@code Unknown} is not a valid token.
   *
   * @param token state token such as {@code Warm}
   * @return matching state, or empty when the token is not Cold, Warm, or Hot
   */
  public static Optional<PeerState> fromLogToken(String token) {
    if (token == null) {
      return Optional.empty();
    }
    return switch (token.trim().toLowerCase(Locale.ROOT)) {
      case "cold" -> Optional.of(COLD);
      case "warm" -> Optional.of(WARM);
      case "hot" -> Optional.of(HOT);
      default -> Optional.empty();
    };
  }
}
