package io.blockperf.collector.application.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import io.blockperf.collector.application.block.BlockCorrelationEngine;
import io.blockperf.collector.application.block.SampleMetadata;
import io.blockperf.collector.application.classify.EventClassifier;
import io.blockperf.collector.application.peer.PeerStateTracker;
import io.blockperf.collector.config.NetworkProfile;
import io.blockperf.collector.domain.block.BlockSample;
import io.blockperf.collector.domain.event.ClassifiedEvent;
import io.blockperf.collector.domain.event.NormalizedEvent;
import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.peer.PeerKey;
import io.blockperf.collector.domain.peer.PeerState;
import io.blockperf.collector.testing.MutableClock;
import io.blockperf.collector.testing.NodeEvents;
import io.blockperf.collector.testing.RecordingBlockSampleSink;
import io.blockperf.collector.testing.RecordingMetricsPort;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventDispatcherTest {
  private static final Instant SLOT_TIME = Instant.EPOCH.plusSeconds(1_000);
  private static final String CONNECTION = "10.0.0.5:3001 3.228.174.253:6000";

  private RecordingMetricsPort metrics;
  private RecordingBlockSampleSink sink;
  private PeerStateTracker peers;
  private BlockCorrelationEngine blocks;
  private EventDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    sink = new RecordingBlockSampleSink();
    MutableClock clock = new MutableClock(SLOT_TIME);
    peers = new PeerStateTracker(metrics, clock);
    blocks = new BlockCorrelationEngine(
        new NetworkProfile("test", 42L, Instant.EPOCH, Duration.ofSeconds(1)),
        new SampleMetadata("test", new Endpoint("10.0.0.5", 3001)),
        sink,
        clock,
        metrics);
    dispatcher = new EventDispatcher(new EventClassifier(metrics), peers, blocks, metrics);
  }

  @Test
  void routesBlockEventsIntoOneSample() {
    dispatcher.dispatch(NodeEvents.header(SLOT_TIME.plusMillis(300), "abc", 7L, 1_000L, CONNECTION));
    dispatcher.dispatch(NodeEvents.fetchRequest(SLOT_TIME.plusMillis(500), "abc", CONNECTION));
    dispatcher.dispatch(NodeEvents.downloaded(SLOT_TIME.plusMillis(1_000), "abc", 2_000L, CONNECTION));
    ClassifiedEvent last = dispatcher.dispatch(NodeEvents.adopted(SLOT_TIME.plusMillis(1_200), "abc", 7L));

    assertInstanceOf(ClassifiedEvent.BlockAdopted.class, last);
    List<BlockSample> samples = sink.samples();
    assertEquals(1, samples.size());
    assertEquals(Duration.ofMillis(300), samples.get(0).headerDelta());
    assertEquals(2_000L, samples.get(0).blockSize());
  }

  @Test
  void headerWithUnusableSlotNeverReachesTheEngine() {
    for (long slot : new long[] {-1L, Long.MAX_VALUE}) {
      String hash = "slot" + slot;
      dispatcher.dispatch(NodeEvents.header(SLOT_TIME.plusMillis(300), hash, 7L, slot, CONNECTION));
      dispatcher.dispatch(NodeEvents.fetchRequest(SLOT_TIME.plusMillis(500), hash, CONNECTION));
      dispatcher.dispatch(NodeEvents.downloaded(SLOT_TIME.plusMillis(1_000), hash, 2_000L, CONNECTION));
      dispatcher.dispatch(NodeEvents.adopted(SLOT_TIME.plusMillis(1_200), hash, 7L));
    }

    assertTrue(sink.samples().isEmpty());
    assertEquals(2, metrics.count("classifier.discarded"));
    assertEquals(0, blocks.openRecords());
  }

  @Test
  void routesPeerTransitionsToTracker() {
    dispatcher.dispatch(NodeEvents.inboundGovernor(
        SLOT_TIME, "Net.InboundGovernor.Remote.PromotedToWarmRemote", CONNECTION));
    dispatcher.dispatch(NodeEvents.inboundGovernor(
        SLOT_TIME.plusSeconds(1), "Net.InboundGovernor.Remote.PromotedToHotRemote", CONNECTION));

    assertEquals(PeerState.HOT, peers.find(new PeerKey("3.228.174.253", 6000)).orElseThrow().state());
  }

  @Test
  void nodeRestartClearsPeersButKeepsBlocks() {
    dispatcher.dispatch(NodeEvents.statusChanged(SLOT_TIME, "ColdToWarm 3.228.174.253:6000"));
    dispatcher.dispatch(NodeEvents.header(SLOT_TIME.plusMillis(300), "abc", 7L, 1_000L, CONNECTION));

    dispatcher.dispatch(NodeEvents.serverStarted(SLOT_TIME.plusSeconds(2)));

    assertEquals(0, peers.size());
    assertTrue(blocks.isOpen("abc"));
    assertEquals(1, metrics.count("peers.restart.cleared"));
  }

  @Test
  void governorCountersAreObserved() {
    dispatcher.dispatch(NodeEvents.counters(SLOT_TIME, 5, 4, 3, 2));

    assertEquals(List.of(5L), metrics.observed("peers.governor.idle"));
    assertEquals(List.of(4L), metrics.observed("peers.governor.cold"));
    assertEquals(List.of(3L), metrics.observed("peers.governor.warm"));
    assertEquals(List.of(2L), metrics.observed("peers.governor.hot"));
  }

  @Test
  void ignoredEventsChangeNothing() {
    ClassifiedEvent result = dispatcher.dispatch(NormalizedEvent.of(SLOT_TIME, "Mempool.AddedTx", Map.of()));

    assertInstanceOf(ClassifiedEvent.Ignored.class, result);
    assertEquals(0, peers.size());
    assertEquals(0, blocks.openRecords());
  }
}
