package io.blockperf.collector.domain.peer;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Peer counts grouped by state and by direction.
 *
 * @param byState number of peers per state (every state present, possibly zero)
 * @param byDirection number of peers per direction (every direction present, possibly zero)
 * @param total number of peers
 * @since 0.1.0
 */
public record PeerStatistics(Map<PeerState, Integer> byState, Map<PeerDirection, Integer> byDirection, int total) {

  public PeerStatistics {
    byState = Map.copyOf(Objects.requireNonNull(byState, "byState"));
    byDirection = Map.copyOf(Objects.requireNonNull(byDirection, "byDirection"));
  }

  /**
   * Counts the supplied peers.
   *
   * @param peers peers to count
   * @return statistics
   */
  public static PeerStatistics of(Collection<Peer> peers) {
    Map<PeerState, Integer> states = new EnumMap<>(PeerState.class);
    for (PeerState state : PeerState.values()) {
      states.put(state, 0);
    }
    Map<PeerDirection, Integer> directions = new EnumMap<>(PeerDirection.class);
    for (PeerDirection direction : PeerDirection.values()) {
      directions.put(direction, 0);
    }
    for (Peer peer : peers) {
      states.merge(peer.state(), 1, Integer::sum);
      directions.merge(peer.direction(), 1, Integer::sum);
    }
    return new PeerStatistics(states, directions, peers.size());
  }

  public int count(PeerState state) {
    return byState.getOrDefault(state, 0);
  }

  public int count(PeerDirection direction) {
    return byDirection.getOrDefault(direction, 0);
  }
}
