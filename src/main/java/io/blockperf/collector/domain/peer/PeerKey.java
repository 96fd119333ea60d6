package io.blockperf.collector.domain.peer;

import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.net.IpAddresses;
import java.util.Objects;

/**
 * Unique identity of a peer: its remote address and port.
 *
 * @param remoteAddress remote IP address, in canonical form
 * @param remotePort remote TCP port
 * @since 0.1.0
 */
public record PeerKey(String remoteAddress, int remotePort) {

  public PeerKey {
    remoteAddress = IpAddresses.canonical(Objects.requireNonNull(remoteAddress, "remoteAddress"));
  }

  /**
   * Builds the key for a remote endpoint.
   *
   * @param remote remote endpoint
   * @return peer key
   */
  public static PeerKey of(Endpoint remote) {
    Objects.requireNonNull(remote, "remote");
    return new PeerKey(remote.address(), remote.port());
  }

  public Endpoint endpoint() {
    return new Endpoint(remoteAddress, remotePort);
  }

  @Override
  public String toString() {
    return endpoint().toString();
  }
}
