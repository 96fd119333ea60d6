package io.blockperf.collector.domain.event;

import java.util.Locale;

/**
 * Discriminator of classified node events.
 *
 * @since 0.1.0
 */
public enum EventKind {
  INBOUND_GOVERNOR_COUNTERS,
  NODE_RESTART,
  PEER_PROMOTED_WARM,
  PEER_PROMOTED_HOT,
  PEER_DEMOTED_WARM,
  PEER_DEMOTED_COLD,
  PEER_STATUS_CHANGED,
  BLOCK_HEADER_SEEN,
  BLOCK_FETCH_REQUESTED,
  BLOCK_DOWNLOADED,
  BLOCK_ADOPTED,
  IGNORED;

  /** Returns the lower-case dotted name used in metric keys, e.g. {@code block.header.seen}. */
  public String metricName() {
    return name().toLowerCase(Locale.ROOT).replace('_', '.');
  }

  /** Indicates whether events of this kind change the peer map. */
  public boolean isPeerTransition() {
    return switch (this) {
      case PEER_PROMOTED_WARM, PEER_PROMOTED_HOT, PEER_DEMOTED_WARM, PEER_DEMOTED_COLD, PEER_STATUS_CHANGED -> true;
      default -> false;
    };
  }
}
