package io.blockperf.collector.application.classify;

import static org.junit.jupiter.api.Assertions.*;

import io.blockperf.collector.domain.event.ClassifiedEvent;
import io.blockperf.collector.domain.event.ClassifiedEvent.BlockAdopted;
import io.blockperf.collector.domain.event.ClassifiedEvent.BlockDownloaded;
import io.blockperf.collector.domain.event.ClassifiedEvent.BlockFetchRequested;
import io.blockperf.collector.domain.event.ClassifiedEvent.BlockHeaderSeen;
import io.blockperf.collector.domain.event.ClassifiedEvent.Ignored;
import io.blockperf.collector.domain.event.ClassifiedEvent.InboundGovernorCounters;
import io.blockperf.collector.domain.event.ClassifiedEvent.NodeRestart;
import io.blockperf.collector.domain.event.ClassifiedEvent.PeerTransition;
import io.blockperf.collector.domain.event.EventKind;
import io.blockperf.collector.domain.event.NormalizedEvent;
import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.peer.PeerDirection;
import io.blockperf.collector.domain.peer.PeerStateTransition;
import io.blockperf.collector.testing.NodeEvents;
import io.blockperf.collector.testing.RecordingMetricsPort;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class EventClassifierTest {
  private static final Instant AT = Instant.parse("2024-05-01T10:00:00Z");
  private static final String CONNECTION = "10.0.0.5:3001 3.228.174.253:6000";

  private RecordingMetricsPort metrics;
  private EventClassifier classifier;

  @BeforeEach
  void setUp() {
    metrics = new RecordingMetricsPort();
    classifier = new EventClassifier(metrics);
  }

  @Test
  void classifiesDownloadedHeader() {
    ClassifiedEvent result = classifier.classify(NodeEvents.header(AT, "\"abc123\"", 42L, 1_000L, CONNECTION));

    BlockHeaderSeen header = assertInstanceOf(BlockHeaderSeen.class, result);
    assertEquals("abc123", header.blockHash());
    assertEquals(42L, header.blockNo());
    assertEquals(1_000L, header.slotNo());
    assertEquals(0L, header.blockSize());
    assertEquals(new Endpoint("3.228.174.253", 6000), header.remote());
    assertEquals(AT, header.at());
    assertEquals(1, metrics.count("classifier.kind.block.header.seen"));
  }

  @Test
  void classifiesFetchRequestWithAndWithoutPeer() {
    BlockFetchRequested withPeer = assertInstanceOf(
        BlockFetchRequested.class, classifier.classify(NodeEvents.fetchRequest(AT, "abc", CONNECTION)));
    assertEquals(new Endpoint("3.228.174.253", 6000), withPeer.remote());

    NormalizedEvent bare = NormalizedEvent.of(AT, NodeEvents.SEND_FETCH_REQUEST, Map.of("head", "abc"));
    BlockFetchRequested withoutPeer = assertInstanceOf(BlockFetchRequested.class, classifier.classify(bare));
    assertEquals("abc", withoutPeer.blockHash());
    assertNull(withoutPeer.remote());
    assertEquals(2, metrics.count("classifier.kind.block.fetch.requested"));
  }

  @Test
  void classifiesCompletedFetchWithStructuredConnectionId() {
    NormalizedEvent event = NormalizedEvent.of(AT, NodeEvents.COMPLETED_BLOCK_FETCH, Map.of(
        "block", "abc",
        "size", 2_048,
        "peer", Map.of("connectionId", Map.of(
            "localAddress", Map.of("address", "10.0.0.5", "port", 3001),
            "remoteAddress", Map.of("address", "2001:db8::1", "port", "3001")))));

    BlockDownloaded downloaded = assertInstanceOf(BlockDownloaded.class, classifier.classify(event));

    assertEquals(2_048L, downloaded.blockSize());
    assertEquals(new Endpoint("2001:db8::1", 3001), downloaded.remote());
  }

  @Test
  void classifiesAdoptionFromHeadersOrNewTip() {
    BlockAdopted fromHeaders =
        assertInstanceOf(BlockAdopted.class, classifier.classify(NodeEvents.adopted(AT, "abc", 42L)));
    assertEquals("abc", fromHeaders.blockHash());
    assertFalse(fromHeaders.forkSwitch());

    NormalizedEvent fork = NormalizedEvent.of(AT, NodeEvents.SWITCHED_TO_A_FORK, Map.of("newtip", "def@1234"));
    BlockAdopted fromTip = assertInstanceOf(BlockAdopted.class, classifier.classify(fork));
    assertEquals("def", fromTip.blockHash());
    assertTrue(fromTip.forkSwitch());
  }

  @Test
  void classifiesPeerSelectionStatusChangeAsOutbound() {
    ClassifiedEvent result = classifier.classify(
        NodeEvents.statusChanged(AT, "ColdToWarm (Just 10.0.0.5:3001) 3.228.174.253:6000"));

    PeerTransition transition = assertInstanceOf(PeerTransition.class, result);
    assertEquals(EventKind.PEER_STATUS_CHANGED, transition.kind());
    assertEquals(PeerStateTransition.COLD_TO_WARM, transition.transition());
    assertEquals(PeerDirection.OUTBOUND, transition.direction());
    assertEquals(new Endpoint("10.0.0.5", 3001), transition.local());
    assertEquals(new Endpoint("3.228.174.253", 6000), transition.remote());
  }

  @Test
  void unparseableStatusChangeIsDiscarded() {
    Ignored ignored = assertInstanceOf(
        Ignored.class, classifier.classify(NodeEvents.statusChanged(AT, "ColdToHot 1.2.3.4:1")));

    assertTrue(ignored.malformed());
    assertEquals(1, metrics.count("classifier.discarded"));
  }

  @Test
  void classifiesInboundGovernorTransitionsByDirection() {
    PeerTransition remote = assertInstanceOf(PeerTransition.class, classifier.classify(
        NodeEvents.inboundGovernor(AT, "Net.InboundGovernor.Remote.PromotedToWarmRemote", CONNECTION)));
    assertEquals(EventKind.PEER_PROMOTED_WARM, remote.kind());
    assertEquals(PeerStateTransition.COLD_TO_WARM, remote.transition());
    assertEquals(PeerDirection.INBOUND, remote.direction());

    PeerTransition local = assertInstanceOf(PeerTransition.class, classifier.classify(
        NodeEvents.inboundGovernor(AT, "Net.InboundGovernor.Local.DemotedToCold", CONNECTION)));
    assertEquals(EventKind.PEER_DEMOTED_COLD, local.kind());
    assertEquals(PeerStateTransition.WARM_TO_COLD, local.transition());
    assertEquals(PeerDirection.OUTBOUND, local.direction());
  }

  @Test
  void classifiesGovernorCountersAndRestart() {
    InboundGovernorCounters counters = assertInstanceOf(
        InboundGovernorCounters.class, classifier.classify(NodeEvents.counters(AT, 1, 2, 3, 4)));
    assertEquals(1, counters.idlePeers());
    assertEquals(2, counters.coldPeers());
    assertEquals(3, counters.warmPeers());
    assertEquals(4, counters.hotPeers());

    assertInstanceOf(NodeRestart.class, classifier.classify(NodeEvents.serverStarted(AT)));
    assertEquals(1, metrics.count("classifier.kind.node.restart"));
  }

  @Test
  void unknownNamespacesAreIgnoredWithoutDiscardMetric() {
    Ignored ignored = assertInstanceOf(Ignored.class, classifier.classify(
        NormalizedEvent.of(AT, "Mempool.AddedTx", Map.of("txids", List.of("a")))));
    Ignored governor = assertInstanceOf(Ignored.class, classifier.classify(
        NodeEvents.inboundGovernor(AT, "Net.InboundGovernor.Remote.MuxCleanExit", CONNECTION)));

    assertFalse(ignored.malformed());
    assertFalse(governor.malformed());
    assertEquals(2, metrics.count("classifier.ignored"));
    assertEquals(0, metrics.count("classifier.discarded"));
  }

  @Test
  void malformedPayloadsAreDiscarded() {
    NormalizedEvent missingSlot = NormalizedEvent.of(AT, NodeEvents.DOWNLOADED_HEADER, Map.of(
        "block", "abc", "blockNo", 1, "peer", Map.of("connectionId", CONNECTION)));
    NormalizedEvent badConnection = NormalizedEvent.of(AT, NodeEvents.COMPLETED_BLOCK_FETCH, Map.of(
        "block", "abc", "size", 10, "peer", Map.of("connectionId", "not-a-connection")));
    NormalizedEvent blankHash = NormalizedEvent.of(AT, NodeEvents.ADDED_TO_CURRENT_CHAIN, Map.of(
        "headers", List.of(Map.of("hash", "\"\""))));

    for (NormalizedEvent event : List.of(missingSlot, badConnection, blankHash)) {
      Ignored ignored = assertInstanceOf(Ignored.class, classifier.classify(event));
      assertTrue(ignored.malformed(), event.namespace());
    }
    assertEquals(3, metrics.count("classifier.discarded"));
  }

  @Test
  void headerWithSlotOrBlockNumberOutOfRangeIsDiscarded() {
    List<NormalizedEvent> events = List.of(
        NodeEvents.header(AT, "abc", 1L, -1L, CONNECTION),
        NodeEvents.header(AT, "abc", 1L, Long.MAX_VALUE, CONNECTION),
        NodeEvents.header(AT, "abc", -5L, 10L, CONNECTION));

    for (NormalizedEvent event : events) {
      Ignored ignored = assertInstanceOf(Ignored.class, classifier.classify(event));
      assertTrue(ignored.malformed());
    }
    assertEquals(3, metrics.count("classifier.discarded"));
    assertEquals(0, metrics.count("classifier.kind.block.header.seen"));

    assertInstanceOf(BlockHeaderSeen.class,
        classifier.classify(NodeEvents.header(AT, "abc", 1L, EventClassifier.MAX_CHAIN_INDEX, CONNECTION)));
  }

  @Test
  void fractionalNumbersAreRejected() {
    NormalizedEvent event = NormalizedEvent.of(AT, NodeEvents.DOWNLOADED_HEADER, Map.of(
        "block", "abc", "blockNo", 1.5, "slot", 10, "peer", Map.of("connectionId", CONNECTION)));

    assertTrue(assertInstanceOf(Ignored.class, classifier.classify(event)).malformed());
  }
}
