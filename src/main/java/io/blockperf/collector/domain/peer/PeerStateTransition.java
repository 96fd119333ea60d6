package io.blockperf.collector.domain.peer;

import java.util.Objects;
import java.util.Optional;

/**
 * Explicit table of the governor transitions the collector accepts.
 *
 * <p>Status-change events name their transition directly ({@code ColdToWarm}); inbound governor events map onto the
 * same rows (PromotedToWarm is Cold to Warm, DemotedToCold is Warm to Cold, and so on). Any other (from, to) pair is
 * rejected at classification time.</p>
 *
 * @since 0.1.0
 */
public enum PeerStateTransition {
  COLD_TO_WARM(PeerState.COLD, PeerState.WARM),
  WARM_TO_HOT(PeerState.WARM, PeerState.HOT),
  HOT_TO_WARM(PeerState.HOT, PeerState.WARM),
  WARM_TO_COLD(PeerState.WARM, PeerState.COLD);

  private final PeerState from;
  private final PeerState to;

  PeerStateTransition(PeerState from, PeerState to) {
    this.from = from;
    this.to = to;
  }

  public PeerState from() {
    return from;
  }

  public PeerState to() {
    return to;
  }

  /** Returns the label used by the node, e.g. {@code ColdToWarm}. */
  public String label() {
    return from.label() + "To" + to.label();
  }

  /**
   * Looks up the row for a (from, to) pair.
   *
   * @param from state before the transition
   * @param to state after the transition
   * @return matching transition, or empty when the pair is not in the table
   */
  public static Optional<PeerStateTransition> between(PeerState from, PeerState to) {
    Objects.requireNonNull(from, "from");
    Objects.requireNonNull(to, "to");
    for (PeerStateTransition transition : values()) {
      if (transition.from == from && transition.to == to) {
        return Optional.of(transition);
      }
    }
    return Optional.empty();
  }

  /**
   * Indicates whether the tracker's current state agrees with this transition's from-state.
   * {@link PeerState#UNKNOWN} agrees with every row.
   *
   * @param current state currently tracked for the peer
   * @return {@code true} when no mismatch should be reported
   */
  public boolean agreesWith(PeerState current) {
    return current == PeerState.UNKNOWN || current == from;
  }
}
