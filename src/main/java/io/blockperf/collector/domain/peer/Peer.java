package io.blockperf.collector.domain.peer;

import io.blockperf.collector.domain.net.Endpoint;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable view of one tracked peer.
 *
 * <p>The tracker replaces a peer with a modified copy on every transition, so snapshots handed to reporting code
 * never observe later mutations.</p>
 *
 * @param key identity (remote address and port)
 * @param direction connection direction
 * @param state current governor state
 * @param localEndpoint local side of the connection when known; may be {@code null}
 * @param lastUpdated instant of the event or reconciliation pass that last touched the peer
 * @since 0.1.0
 */
public record Peer(
    PeerKey key,
    PeerDirection direction,
    PeerState state,
    Endpoint localEndpoint,
    Instant lastUpdated) {

  public Peer {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(state, "state");
    Objects.requireNonNull(lastUpdated, "lastUpdated");
  }

  public String remoteAddress() {
    return key.remoteAddress();
  }

  public int remotePort() {
    return key.remotePort();
  }

  public Optional<Endpoint> local() {
    return Optional.ofNullable(localEndpoint);
  }

  /**
   * Returns a copy moved to {@code newState}; a known local endpoint is kept when {@code local} is {@code null}.
   *
   * @param newState state to apply
   * @param local local endpoint reported by the event, or {@code null}
   * @param at event instant
   * @return updated copy
   */
  public Peer transitionTo(PeerState newState, Endpoint local, Instant at) {
    return new Peer(key, direction, newState, local != null ? local : localEndpoint, at);
  }
}
