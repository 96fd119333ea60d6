package io.blockperf.collector.domain.block;

import io.blockperf.collector.domain.net.Endpoint;
import java.time.Instant;
import java.util.Objects;

/**
 * Timestamped milestone attributed to a remote peer.
 *
 * @param at instant of the milestone
 * @param remote peer the milestone came from
 * @since 0.1.0
 */
public record Sighting(Instant at, Endpoint remote) {

  public Sighting {
    Objects.requireNonNull(at, "at");
    Objects.requireNonNull(remote, "remote");
  }
}
