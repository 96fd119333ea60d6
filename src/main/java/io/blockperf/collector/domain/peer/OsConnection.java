package io.blockperf.collector.domain.peer;

import io.blockperf.collector.domain.net.Endpoint;
import java.util.Objects;

/**
 * One established TCP connection reported by the operating system.
 *
 * @param local local endpoint
 * @param remote remote endpoint
 * @param direction inferred direction of the connection
 * @since 0.1.0
 */
public record OsConnection(Endpoint local, Endpoint remote, PeerDirection direction) {

  public OsConnection {
    Objects.requireNonNull(local, "local");
    Objects.requireNonNull(remote, "remote");
    Objects.requireNonNull(direction, "direction");
  }

  public PeerKey peerKey() {
    return PeerKey.of(remote);
  }
}
