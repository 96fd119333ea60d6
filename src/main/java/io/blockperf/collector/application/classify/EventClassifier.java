package io.blockperf.collector.application.classify;

import io.blockperf.collector.application.port.MetricsPort;
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
import io.blockperf.collector.domain.net.ConnectionId;
import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.peer.PeerDirection;
import io.blockperf.collector.domain.peer.PeerStateTransition;
import io.blockperf.collector.logging.Logs;
import io.blockperf.collector.validation.Numbers;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Maps a {@link NormalizedEvent} onto one typed {@link ClassifiedEvent} variant.
 * <p><strong>Why:</strong> Downstream components consume fixed field sets instead of untyped payload maps; the
 * decision is made purely from the namespace, then the payload is decoded for that variant.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Recognise block propagation, peer governor, and node lifecycle namespaces.</li>
 *   <li>Decode payload fields, turning any missing or malformed field into {@link Ignored}.</li>
 *   <li>Count outcomes: {@code classifier.kind.*}, {@code classifier.ignored}, {@code classifier.discarded}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from the metrics port; safe for concurrent use.</p>
 *
 * @since 0.1.0
 */
public final class EventClassifier {
  private static final Logger log = LoggerFactory.getLogger(EventClassifier.class);

  static final String DOWNLOADED_HEADER = "ChainSync.Client.DownloadedHeader";
  static final String SEND_FETCH_REQUEST = "BlockFetch.Client.SendFetchRequest";
  static final String COMPLETED_BLOCK_FETCH = "BlockFetch.Client.CompletedBlockFetch";
  static final String ADDED_TO_CURRENT_CHAIN = "ChainDB.AddBlockEvent.AddedToCurrentChain";
  static final String SWITCHED_TO_A_FORK = "ChainDB.AddBlockEvent.SwitchedToAFork";
  static final String PEER_STATUS_CHANGED = "Net.PeerSelection.Actions.StatusChanged";
  static final String SERVER_STARTED = "Net.Server.Local.Started";
  static final String INBOUND_GOVERNOR_PREFIX = "Net.InboundGovernor.";

  private static final int MAX_REASON_BYTES = 256;
  // 2^40 slots of the longest configurable slot length still land inside Instant's range.
  static final long MAX_CHAIN_INDEX = 1L << 40;

  private final MetricsPort metrics;
  private final PeerStatusChangeParser statusChangeParser;

  /**
   * Creates a classifier that records no metrics.
   */
  public EventClassifier() {
    this(MetricsPort.NO_OP);
  }

  /**
   * Creates a classifier.
   *
   * @param metrics metrics sink for classification outcomes
   */
  public EventClassifier(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.statusChangeParser = new PeerStatusChangeParser();
  }

  /**
   * Classifies one event. Never throws for payload problems.
   *
   * @param event event to classify
   * @return decoded variant, or {@link Ignored}
   */
  public ClassifiedEvent classify(NormalizedEvent event) {
    Objects.requireNonNull(event, "event");
    String namespace = event.namespace();
    ClassifiedEvent result;
    try {
      result = decode(event, namespace);
    } catch (IllegalArgumentException ex) {
      result = new Ignored(event.at(), namespace, ex.getMessage(), true);
    }

    if (result instanceof Ignored ignored) {
      if (ignored.malformed()) {
        metrics.increment("classifier.discarded");
        log.debug("Discarded {} event: {}", namespace, Logs.truncate(ignored.reason(), MAX_REASON_BYTES));
      } else {
        metrics.increment("classifier.ignored");
      }
    } else {
      metrics.increment("classifier.kind." + result.kind().metricName());
    }
    return result;
  }

  private ClassifiedEvent decode(NormalizedEvent event, String namespace) {
    return switch (namespace) {
      case DOWNLOADED_HEADER -> headerSeen(event);
      case SEND_FETCH_REQUEST -> fetchRequested(event);
      case COMPLETED_BLOCK_FETCH -> downloaded(event);
      case ADDED_TO_CURRENT_CHAIN -> adopted(event, false);
      case SWITCHED_TO_A_FORK -> adopted(event, true);
      case PEER_STATUS_CHANGED -> statusChanged(event);
      case SERVER_STARTED -> new NodeRestart(event.at());
      default -> namespace.startsWith(INBOUND_GOVERNOR_PREFIX)
          ? inboundGovernor(event, namespace)
          : new Ignored(event.at(), namespace, "unrecognized namespace", false);
    };
  }

  private static BlockHeaderSeen headerSeen(NormalizedEvent event) {
    Map<String, Object> data = event.data();
    String hash = PayloadFields.cleanHash(PayloadFields.requireString(data, "block"));
    long blockNo = Numbers.requireRange("blockNo", PayloadFields.requireLong(data, "blockNo"), 0L, MAX_CHAIN_INDEX);
    long slotNo = Numbers.requireRange("slot", PayloadFields.requireLong(data, "slot"), 0L, MAX_CHAIN_INDEX);
    long size = PayloadFields.optionalLong(data, "size").orElse(0L);
    ConnectionId connection = PayloadFields.requireConnectionId(data, "peer.connectionId");
    return new BlockHeaderSeen(event.at(), hash, blockNo, slotNo, size, connection.remote());
  }

  private static BlockFetchRequested fetchRequested(NormalizedEvent event) {
    Map<String, Object> data = event.data();
    String hash = PayloadFields.cleanHash(PayloadFields.requireString(data, "head"));
    Endpoint remote = null;
    if (PayloadFields.find(data, "peer.connectionId") != null) {
      remote = PayloadFields.requireConnectionId(data, "peer.connectionId").remote();
    }
    return new BlockFetchRequested(event.at(), hash, remote);
  }

  private static BlockDownloaded downloaded(NormalizedEvent event) {
    Map<String, Object> data = event.data();
    String hash = PayloadFields.cleanHash(PayloadFields.requireString(data, "block"));
    long size = PayloadFields.optionalLong(data, "size").orElse(0L);
    ConnectionId connection = PayloadFields.requireConnectionId(data, "peer.connectionId");
    return new BlockDownloaded(event.at(), hash, Math.max(0L, size), connection.remote());
  }

  private static BlockAdopted adopted(NormalizedEvent event, boolean forkSwitch) {
    Map<String, Object> data = event.data();
    String hash;
    if (PayloadFields.find(data, "headers") != null) {
      List<?> headers = PayloadFields.requireList(data, "headers");
      Map<String, Object> first = PayloadFields.requireMap(headers.get(0), "headers[0]");
      hash = PayloadFields.requireString(first, "hash");
    } else {
      String newTip = PayloadFields.requireString(data, "newtip");
      int at = newTip.indexOf('@');
      hash = at >= 0 ? newTip.substring(0, at) : newTip;
    }
    return new BlockAdopted(event.at(), PayloadFields.cleanHash(hash), forkSwitch);
  }

  private ClassifiedEvent statusChanged(NormalizedEvent event) {
    String text = PayloadFields.requireString(event.data(), "peerStatusChangeType");
    Optional<PeerStatusChangeParser.StatusChange> change = statusChangeParser.parse(text);
    if (change.isEmpty()) {
      throw new IllegalArgumentException("unrecognized peerStatusChangeType '" + text + "'");
    }
    PeerStatusChangeParser.StatusChange parsed = change.get();
    return new PeerTransition(
        event.at(),
        EventKind.PEER_STATUS_CHANGED,
        parsed.transition(),
        PeerDirection.OUTBOUND,
        parsed.remote(),
        parsed.local());
  }

  private static ClassifiedEvent inboundGovernor(NormalizedEvent event, String namespace) {
    String leaf = namespace.substring(namespace.lastIndexOf('.') + 1);
    if (leaf.equals("InboundGovernorCounters")) {
      Map<String, Object> data = event.data();
      return new InboundGovernorCounters(
          event.at(),
          PayloadFields.requireInt(data, "idlePeers"),
          PayloadFields.requireInt(data, "coldPeers"),
          PayloadFields.requireInt(data, "warmPeers"),
          PayloadFields.requireInt(data, "hotPeers"));
    }

    String action = leaf.endsWith("Remote") ? leaf.substring(0, leaf.length() - "Remote".length()) : leaf;
    EventKind kind = switch (action) {
      case "PromotedToWarm" -> EventKind.PEER_PROMOTED_WARM;
      case "PromotedToHot" -> EventKind.PEER_PROMOTED_HOT;
      case "DemotedToWarm" -> EventKind.PEER_DEMOTED_WARM;
      case "DemotedToCold" -> EventKind.PEER_DEMOTED_COLD;
      default -> null;
    };
    if (kind == null) {
      return new Ignored(event.at(), namespace, "unhandled inbound governor event", false);
    }

    ConnectionId connection = PayloadFields.requireConnectionId(event.data(), "connectionId");
    PeerDirection direction = namespace.contains(".Local.") ? PeerDirection.OUTBOUND : PeerDirection.INBOUND;
    return new PeerTransition(
        event.at(), kind, transitionFor(kind), direction, connection.remote(), connection.local());
  }

  private static PeerStateTransition transitionFor(EventKind kind) {
    return switch (kind) {
      case PEER_PROMOTED_WARM -> PeerStateTransition.COLD_TO_WARM;
      case PEER_PROMOTED_HOT -> PeerStateTransition.WARM_TO_HOT;
      case PEER_DEMOTED_WARM -> PeerStateTransition.HOT_TO_WARM;
      case PEER_DEMOTED_COLD -> PeerStateTransition.WARM_TO_COLD;
      default -> throw new IllegalArgumentException("not an inbound governor transition: " + kind);
    };
  }
}
