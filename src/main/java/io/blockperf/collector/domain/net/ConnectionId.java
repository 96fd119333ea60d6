package io.blockperf.collector.domain.net;

import java.util.Objects;

/**
 * Local/remote endpoint pair carried by node trace events as {@code "<local> <remote>"}.
 *
 * @param local endpoint owned by the tracked node
 * @param remote endpoint of the peer
 * @since 0.1.0
 */
public record ConnectionId(Endpoint local, Endpoint remote) {

  public ConnectionId {
    Objects.requireNonNull(local, "local");
    Objects.requireNonNull(remote, "remote");
  }

  /**
   * Parses the space separated form used by chain-sync and block-fetch events, e.g.
   * {@code "172.0.118.125:30002 [2001:db8::1]:3001"}.
   *
   * @param text connection id text
   * @return parsed connection id
   * @throws IllegalArgumentException when the text does not contain exactly two endpoints
   */
  public static ConnectionId parse(String text) {
    Objects.requireNonNull(text, "text");
    String[] parts = text.trim().split("\\s+");
    if (parts.length != 2) {
      throw new IllegalArgumentException("connectionId must contain local and remote endpoints (was '" + text + "')");
    }
    return new ConnectionId(Endpoint.parse(parts[0]), Endpoint.parse(parts[1]));
  }
}
