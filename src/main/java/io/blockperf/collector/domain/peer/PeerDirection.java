package io.blockperf.collector.domain.peer;

/**
 * Which side opened the connection to a peer.
 *
 * @since 0.1.0
 */
public enum PeerDirection {
  /** The remote peer connected to the tracked node. */
  INBOUND("Inbound"),
  /** The tracked node connected to the remote peer. */
  OUTBOUND("Outbound");

  private final String label;

  PeerDirection(String label) {
    this.label = label;
  }

  public String label() {
    return label;
  }
}
