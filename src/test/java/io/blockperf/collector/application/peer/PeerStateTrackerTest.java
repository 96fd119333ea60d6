package io.blockperf.collector.application.peer;

import static org.junit.jupiter.api.Assertions.*;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
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
import io.blockperf.collector.testing.MutableClock;
import io.blockperf.collector.testing.RecordingMetricsPort;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

class PeerStateTrackerTest {
  private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");
  private static final Endpoint LOCAL = new Endpoint("10.0.0.5", 3001);
  private static final Endpoint REMOTE_A = new Endpoint("3.228.174.253", 6000);
  private static final Endpoint REMOTE_B = new Endpoint("2001:db8::1", 3001);

  private RecordingMetricsPort metrics;
  private MutableClock clock;
  private PeerStateTracker tracker;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    clock = new MutableClock(T0);
    tracker = new PeerStateTracker(metrics, clock);
  }

  @Test
  void firstTransitionCreatesPeerInTargetState() {
    Peer peer = tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.INBOUND, REMOTE_A, T0));

    assertEquals(PeerState.WARM, peer.state());
    assertEquals(PeerDirection.INBOUND, peer.direction());
    assertEquals(LOCAL, peer.local().orElseThrow());
    assertEquals(T0, peer.lastUpdated());
    assertEquals(1, metrics.count("peers.created"));
    assertEquals(1, metrics.count("peers.transition.applied"));
    assertEquals(0, metrics.count("peers.transition.mismatch"));
  }

  @Test
  void consecutiveTransitionsFollowTheLifecycle() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.OUTBOUND, REMOTE_A, T0));
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_HOT,
        PeerStateTransition.WARM_TO_HOT, PeerDirection.OUTBOUND, REMOTE_A, T0.plusSeconds(1)));
    Peer peer = tracker.applyTransitionEvent(transition(EventKind.PEER_DEMOTED_WARM,
        PeerStateTransition.HOT_TO_WARM, PeerDirection.OUTBOUND, REMOTE_A, T0.plusSeconds(2)));

    assertEquals(PeerState.WARM, peer.state());
    assertEquals(1, tracker.size());
    assertEquals(3, metrics.count("peers.transition.applied"));
    assertEquals(0, metrics.count("peers.transition.mismatch"));
  }

  @Test
  void mismatchedTransitionIsAppliedAndLogged() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.INBOUND, REMOTE_A, T0));

    Logger logger = (Logger) LoggerFactory.getLogger(PeerStateTracker.class);
    ListAppender<ILoggingEvent> appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    Peer peer;
    try {
      peer = tracker.applyTransitionEvent(transition(EventKind.PEER_DEMOTED_WARM,
          PeerStateTransition.HOT_TO_WARM, PeerDirection.INBOUND, REMOTE_A, T0.plusSeconds(1)));
    } finally {
      logger.detachAppender(appender);
      appender.stop();
    }

    assertEquals(PeerState.WARM, peer.state());
    assertEquals(1, metrics.count("peers.transition.mismatch"));
    assertTrue(appender.list.stream()
        .map(ILoggingEvent::getFormattedMessage)
        .anyMatch(message -> message.equals(
            "Peer 3.228.174.253:6000 reported HotToWarm while tracked as Warm; applying Warm")));
  }

  @Test
  void olderEventIsCountedButStillApplied() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.INBOUND, REMOTE_A, T0));
    Peer peer = tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_HOT,
        PeerStateTransition.WARM_TO_HOT, PeerDirection.INBOUND, REMOTE_A, T0.minusSeconds(5)));

    assertEquals(PeerState.HOT, peer.state());
    assertEquals(1, metrics.count("peers.event.outOfOrder"));
  }

  @Test
  void transitionWithoutLocalKeepsKnownLocal() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.OUTBOUND, REMOTE_A, T0));
    Peer peer = tracker.applyTransitionEvent(new PeerTransition(T0.plusSeconds(1), EventKind.PEER_STATUS_CHANGED,
        PeerStateTransition.WARM_TO_HOT, PeerDirection.OUTBOUND, REMOTE_A, null));

    assertEquals(LOCAL, peer.local().orElseThrow());
  }

  @Test
  void reconcileAddsUnknownPeersAndRemovesClosedOnes() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.INBOUND, REMOTE_A, T0));
    clock.advance(Duration.ofSeconds(30));

    ReconcileResult result = tracker.reconcile(Set.of(new OsConnection(LOCAL, REMOTE_B, PeerDirection.INBOUND)));

    assertEquals(new ReconcileResult(1, 1, 1), result);
    assertTrue(result.changed());
    Peer added = tracker.find(PeerKey.of(REMOTE_B)).orElseThrow();
    assertEquals(PeerState.UNKNOWN, added.state());
    assertEquals(T0.plusSeconds(30), added.lastUpdated());
    assertTrue(tracker.find(PeerKey.of(REMOTE_A)).isEmpty());
    assertEquals(List.of(1L), metrics.observed("peers.reconcile.added"));
    assertEquals(List.of(1L), metrics.observed("peers.reconcile.removed"));
  }

  @Test
  void reconcileTwiceWithSameSnapshotChangesNothingTheSecondTime() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.OUTBOUND, REMOTE_A, T0));
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_HOT,
        PeerStateTransition.WARM_TO_HOT, PeerDirection.OUTBOUND, REMOTE_A, T0.plusSeconds(1)));
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.INBOUND, new Endpoint("52.1.2.3", 3001), T0));
    Set<OsConnection> connections = Set.of(
        new OsConnection(LOCAL, REMOTE_A, PeerDirection.OUTBOUND),
        new OsConnection(LOCAL, REMOTE_B, PeerDirection.INBOUND));

    ReconcileResult first = tracker.reconcile(connections);
    assertEquals(new ReconcileResult(1, 1, 2), first);
    List<Peer> before = tracker.snapshot();

    clock.advance(Duration.ofSeconds(30));
    ReconcileResult second = tracker.reconcile(connections);

    assertEquals(new ReconcileResult(0, 0, 2), second);
    assertFalse(second.changed());
    assertEquals(before, tracker.snapshot());
    assertEquals(List.of(1L), metrics.observed("peers.reconcile.added"));
    assertEquals(List.of(1L), metrics.observed("peers.reconcile.removed"));
  }

  @Test
  void reconcileKeepsStateOfLivePeers() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.INBOUND, REMOTE_A, T0));

    ReconcileResult result = tracker.reconcile(Set.of(new OsConnection(LOCAL, REMOTE_A, PeerDirection.INBOUND)));

    assertFalse(result.changed());
    assertEquals(PeerState.WARM, tracker.find(PeerKey.of(REMOTE_A)).orElseThrow().state());
    assertTrue(metrics.observed("peers.reconcile.added").isEmpty());
  }

  @Test
  void unknownPeerAcceptsAnyTransitionWithoutMismatch() {
    tracker.reconcile(Set.of(new OsConnection(LOCAL, REMOTE_A, PeerDirection.INBOUND)));

    Peer peer = tracker.applyTransitionEvent(transition(EventKind.PEER_DEMOTED_COLD,
        PeerStateTransition.WARM_TO_COLD, PeerDirection.INBOUND, REMOTE_A, T0));

    assertEquals(PeerState.COLD, peer.state());
    assertEquals(0, metrics.count("peers.transition.mismatch"));
    assertEquals(0, metrics.count("peers.created"));
  }

  @Test
  void clearDropsEverything() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.INBOUND, REMOTE_A, T0));
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.OUTBOUND, REMOTE_B, T0));

    assertEquals(2, tracker.clear());
    assertEquals(0, tracker.size());
    assertEquals(1, metrics.count("peers.restart.cleared"));
  }

  @Test
  void snapshotIsDetachedAndStatisticsCountStatesAndDirections() {
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_WARM,
        PeerStateTransition.COLD_TO_WARM, PeerDirection.INBOUND, REMOTE_A, T0));
    tracker.applyTransitionEvent(transition(EventKind.PEER_PROMOTED_HOT,
        PeerStateTransition.WARM_TO_HOT, PeerDirection.OUTBOUND, REMOTE_B, T0));

    List<Peer> snapshot = tracker.snapshot();
    tracker.clear();
    assertEquals(2, snapshot.size());
    assertThrows(UnsupportedOperationException.class, () -> snapshot.remove(0));

    PeerStatistics stats = PeerStatistics.of(snapshot);
    assertEquals(2, stats.total());
    assertEquals(1, stats.count(PeerState.WARM));
    assertEquals(1, stats.count(PeerState.HOT));
    assertEquals(0, stats.count(PeerState.COLD));
    assertEquals(1, stats.count(PeerDirection.INBOUND));
    assertEquals(1, stats.count(PeerDirection.OUTBOUND));
  }

  private static PeerTransition transition(
      EventKind kind, PeerStateTransition transition, PeerDirection direction, Endpoint remote, Instant at) {
    return new PeerTransition(at, kind, transition, direction, remote, LOCAL);
  }
}
