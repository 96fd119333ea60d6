package io.blockperf.collector.application.pipeline;

import io.blockperf.collector.application.block.BlockCorrelationEngine;
import io.blockperf.collector.application.classify.EventClassifier;
import io.blockperf.collector.application.peer.PeerStateTracker;
import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.domain.event.ClassifiedEvent;
import io.blockperf.collector.domain.event.NormalizedEvent;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies one event at a time and hands it to the peer tracker or the block correlation engine.
 *
 * <p>Callers must invoke {@link #dispatch(NormalizedEvent)} from a single thread in arrival order; first-writer-wins
 * and from-state checks depend on it.</p>
 *
 * @since 0.1.0
 */
public final class EventDispatcher {
  private static final Logger log = LoggerFactory.getLogger(EventDispatcher.class);

  private final EventClassifier classifier;
  private final PeerStateTracker peers;
  private final BlockCorrelationEngine blocks;
  private final MetricsPort metrics;

  public EventDispatcher(
      EventClassifier classifier, PeerStateTracker peers, BlockCorrelationEngine blocks, MetricsPort metrics) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.peers = Objects.requireNonNull(peers, "peers");
    this.blocks = Objects.requireNonNull(blocks, "blocks");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Classifies and routes a single event.
   *
   * @param event normalized trace event
   * @return the classification that was acted on
   */
  public ClassifiedEvent dispatch(NormalizedEvent event) {
    Objects.requireNonNull(event, "event");
    ClassifiedEvent classified = classifier.classify(event);
    route(classified);
    return classified;
  }

  private void route(ClassifiedEvent classified) {
    if (classified instanceof ClassifiedEvent.PeerTransition transition) {
      peers.applyTransitionEvent(transition);
    } else if (classified instanceof ClassifiedEvent.BlockHeaderSeen header) {
      blocks.onHeaderSeen(
          header.blockHash(), header.blockNo(), header.slotNo(), header.blockSize(), header.remote(), header.at());
    } else if (classified instanceof ClassifiedEvent.BlockFetchRequested request) {
      blocks.onFetchRequested(request.blockHash(), request.at());
    } else if (classified instanceof ClassifiedEvent.BlockDownloaded download) {
      blocks.onDownloaded(download.blockHash(), download.remote(), download.at(), download.blockSize());
    } else if (classified instanceof ClassifiedEvent.BlockAdopted adopted) {
      blocks.onAdopted(adopted.blockHash(), adopted.at());
    } else if (classified instanceof ClassifiedEvent.InboundGovernorCounters counters) {
      metrics.observe("peers.governor.idle", counters.idlePeers());
      metrics.observe("peers.governor.cold", counters.coldPeers());
      metrics.observe("peers.governor.warm", counters.warmPeers());
      metrics.observe("peers.governor.hot", counters.hotPeers());
      log.debug(
          "Inbound governor counters idle={} cold={} warm={} hot={}",
          counters.idlePeers(),
          counters.coldPeers(),
          counters.warmPeers(),
          counters.hotPeers());
    } else if (classified instanceof ClassifiedEvent.NodeRestart restart) {
      int cleared = peers.clear();
      log.info("Node restart at {}; cleared {} tracked peers", restart.at(), cleared);
    }
    // Ignored events were already counted by the classifier.
  }
}
