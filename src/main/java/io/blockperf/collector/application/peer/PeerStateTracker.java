package io.blockperf.collector.application.peer;

import io.blockperf.collector.application.port.ClockPort;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.application.port.PeerSnapshotQuery;
import io.blockperf.collector.domain.event.ClassifiedEvent.PeerTransition;
import io.blockperf.collector.domain.event.EventKind;
import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.peer.OsConnection;
import io.blockperf.collector.domain.peer.Peer;
import io.blockperf.collector.domain.peer.PeerDirection;
import io.blockperf.collector.domain.peer.PeerKey;
import io.blockperf.collector.domain.peer.PeerState;
import io.blockperf.collector.domain.peer.PeerStateTransition;
import io.blockperf.collector.domain.peer.PeerStatistics;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the map of peers the tracked node is connected to.
 * <p><strong>Why:</strong> Peer state comes from two partial sources: governor log events know the state, the OS
 * socket table knows which connections exist. The tracker merges both into one consistent view.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Apply promotion, demotion, and status-change events; the event's target state always wins and a from-state
 *   mismatch is only logged and counted.</li>
 *   <li>Reconcile existence against established OS connections: unknown connections are inserted as
 *   {@link PeerState#UNKNOWN}, peers without a connection are removed.</li>
 *   <li>Serve immutable snapshots and statistics for reporting.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Every operation holds an internal {@link ReentrantLock} for its whole duration;
 * the dispatcher and the reconciliation timer may call concurrently.</p>
 * <p><strong>Observability:</strong> Emits {@code peers.transition.*}, {@code peers.reconcile.*}, and
 * {@code peers.restart.cleared} metrics.</p>
 *
 * @since 0.1.0
 */
public final class PeerStateTracker implements PeerSnapshotQuery {
  private static final Logger log = LoggerFactory.getLogger(PeerStateTracker.class);

  private final ReentrantLock lock = new ReentrantLock();
  private final Map<PeerKey, Peer> peers = new LinkedHashMap<>();
  private final MetricsPort metrics;
  private final ClockPort clock;

  /**
   * Creates a tracker using the system clock and no metrics.
   */
  public PeerStateTracker() {
    this(MetricsPort.NO_OP, ClockPort.SYSTEM);
  }

  /**
   * Creates a tracker.
   *
   * @param metrics metrics sink
   * @param clock clock used to stamp peers inserted by reconciliation
   */
  public PeerStateTracker(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Applies a classified peer transition event.
   *
   * @param event transition event
   * @return peer state after the transition
   */
  public Peer applyTransitionEvent(PeerTransition event) {
    Objects.requireNonNull(event, "event");
    return applyTransitionEvent(
        event.kind(), event.direction(), event.remote(), event.local(), event.transition(), event.at());
  }

  /**
   * Moves a peer to {@code transition.to()}, creating it when absent.
   *
   * @param kind event kind that produced the transition (for logging)
   * @param direction direction used when the peer is created
   * @param remote remote endpoint identifying the peer
   * @param local local endpoint when known; {@code null} keeps a previously known value
   * @param transition validated transition
   * @param at event timestamp
   * @return peer state after the transition
   */
  public Peer applyTransitionEvent(
      EventKind kind,
      PeerDirection direction,
      Endpoint remote,
      Endpoint local,
      PeerStateTransition transition,
      Instant at) {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(direction, "direction");
    Objects.requireNonNull(remote, "remote");
    Objects.requireNonNull(transition, "transition");
    Objects.requireNonNull(at, "at");

    PeerKey key = PeerKey.of(remote);
    lock.lock();
    try {
      Peer current = peers.get(key);
      if (current == null) {
        current = new Peer(key, direction, PeerState.UNKNOWN, local, at);
        metrics.increment("peers.created");
        log.debug("Tracking new {} peer {} from {}", direction.label(), key, kind);
      } else {
        if (!transition.agreesWith(current.state())) {
          metrics.increment("peers.transition.mismatch");
          log.debug(
              "Peer {} reported {} while tracked as {}; applying {}",
              key, transition.label(), current.state().label(), transition.to().label());
        }
        if (at.isBefore(current.lastUpdated())) {
          metrics.increment("peers.event.outOfOrder");
          log.debug("Peer {} event at {} is older than last update {}", key, at, current.lastUpdated());
        }
      }
      Peer updated = current.transitionTo(transition.to(), local, at);
      peers.put(key, updated);
      metrics.increment("peers.transition.applied");
      return updated;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Aligns peer existence with the established OS connections, stamping new peers with the tracker clock.
   *
   * @param osConnections current established connections
   * @return counts of inserted and removed peers
   */
  public ReconcileResult reconcile(Set<OsConnection> osConnections) {
    return reconcile(osConnections, clock.now());
  }

  /**
   * Aligns peer existence with the established OS connections. Idempotent for an unchanged snapshot.
   *
   * @param osConnections current established connections
   * @param now timestamp given to inserted peers
   * @return counts of inserted and removed peers
   */
  public ReconcileResult reconcile(Set<OsConnection> osConnections, Instant now) {
    Objects.requireNonNull(osConnections, "osConnections");
    Objects.requireNonNull(now, "now");

    Map<PeerKey, OsConnection> live = new LinkedHashMap<>();
    for (OsConnection connection : osConnections) {
      live.putIfAbsent(connection.peerKey(), connection);
    }

    lock.lock();
    try {
      int removed = 0;
      Iterator<Map.Entry<PeerKey, Peer>> it = peers.entrySet().iterator();
      while (it.hasNext()) {
        Map.Entry<PeerKey, Peer> entry = it.next();
        if (!live.containsKey(entry.getKey())) {
          it.remove();
          removed++;
          log.debug("Peer {} no longer has an established connection; removed", entry.getKey());
        }
      }

      int added = 0;
      for (Map.Entry<PeerKey, OsConnection> entry : live.entrySet()) {
        if (!peers.containsKey(entry.getKey())) {
          OsConnection connection = entry.getValue();
          peers.put(
              entry.getKey(),
              new Peer(entry.getKey(), connection.direction(), PeerState.UNKNOWN, connection.local(), now));
          added++;
        }
      }

      if (added > 0) {
        metrics.observe("peers.reconcile.added", added);
      }
      if (removed > 0) {
        metrics.observe("peers.reconcile.removed", removed);
      }
      return new ReconcileResult(added, removed, peers.size());
    } finally {
      lock.unlock();
    }
  }

  /**
   * Forgets every peer, used when the node restarts.
   *
   * @return number of peers removed
   */
  public int clear() {
    lock.lock();
    try {
      int count = peers.size();
      peers.clear();
      metrics.increment("peers.restart.cleared");
      return count;
    } finally {
      lock.unlock();
    }
  }

  /**
   * Looks up one peer.
   *
   * @param key peer identity
   * @return peer when tracked
   */
  public Optional<Peer> find(PeerKey key) {
    lock.lock();
    try {
      return Optional.ofNullable(peers.get(key));
    } finally {
      lock.unlock();
    }
  }

  @Override
  public List<Peer> snapshot() {
    lock.lock();
    try {
      return List.copyOf(peers.values());
    } finally {
      lock.unlock();
    }
  }

  @Override
  public PeerStatistics statistics() {
    return PeerStatistics.of(snapshot());
  }

  public int size() {
    lock.lock();
    try {
      return peers.size();
    } finally {
      lock.unlock();
    }
  }
}
