package io.blockperf.collector.domain.event;

import io.blockperf.collector.domain.net.Endpoint;
import io.blockperf.collector.domain.peer.PeerDirection;
import io.blockperf.collector.domain.peer.PeerStateTransition;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed set of decoded event payloads produced by the classifier.
 *
 * <p>Each variant carries only the fields its consumer needs. Anything the classifier cannot decode becomes
 * {@link Ignored}.</p>
 *
 * @since 0.1.0
 */
public sealed interface ClassifiedEvent
    permits ClassifiedEvent.InboundGovernorCounters,
        ClassifiedEvent.NodeRestart,
        ClassifiedEvent.PeerTransition,
        ClassifiedEvent.BlockHeaderSeen,
        ClassifiedEvent.BlockFetchRequested,
        ClassifiedEvent.BlockDownloaded,
        ClassifiedEvent.BlockAdopted,
        ClassifiedEvent.Ignored {

  /** Event discriminator. */
  EventKind kind();

  /** Timestamp of the underlying trace record. */
  Instant at();

  /** Inbound governor peer counters. */
  record InboundGovernorCounters(Instant at, int idlePeers, int coldPeers, int warmPeers, int hotPeers)
      implements ClassifiedEvent {
    public InboundGovernorCounters {
      Objects.requireNonNull(at, "at");
    }

    @Override
    public EventKind kind() {
      return EventKind.INBOUND_GOVERNOR_COUNTERS;
    }
  }

  /** The node's server started; all previously tracked connections are gone. */
  record NodeRestart(Instant at) implements ClassifiedEvent {
    public NodeRestart {
      Objects.requireNonNull(at, "at");
    }

    @Override
    public EventKind kind() {
      return EventKind.NODE_RESTART;
    }
  }

  /**
   * Promotion, demotion, or status change of one peer.
   *
   * @param at event timestamp
   * @param kind one of the peer transition kinds
   * @param transition validated row of the transition table
   * @param direction direction inferred from the event source
   * @param remote remote endpoint (peer identity)
   * @param local local endpoint, or {@code null} when the event does not carry one
   */
  record PeerTransition(
      Instant at,
      EventKind kind,
      PeerStateTransition transition,
      PeerDirection direction,
      Endpoint remote,
      Endpoint local) implements ClassifiedEvent {
    public PeerTransition {
      Objects.requireNonNull(at, "at");
      Objects.requireNonNull(kind, "kind");
      Objects.requireNonNull(transition, "transition");
      Objects.requireNonNull(direction, "direction");
      Objects.requireNonNull(remote, "remote");
      if (!kind.isPeerTransition()) {
        throw new IllegalArgumentException("kind must be a peer transition kind (was " + kind + ")");
      }
    }
  }

  /** First sighting of a block header announced by a peer. */
  record BlockHeaderSeen(Instant at, String blockHash, long blockNo, long slotNo, long blockSize, Endpoint remote)
      implements ClassifiedEvent {
    public BlockHeaderSeen {
      Objects.requireNonNull(at, "at");
      Objects.requireNonNull(blockHash, "blockHash");
      Objects.requireNonNull(remote, "remote");
    }

    @Override
    public EventKind kind() {
      return EventKind.BLOCK_HEADER_SEEN;
    }
  }

  /** The node asked a peer for a block body; {@code remote} may be {@code null}. */
  record BlockFetchRequested(Instant at, String blockHash, Endpoint remote) implements ClassifiedEvent {
    public BlockFetchRequested {
      Objects.requireNonNull(at, "at");
      Objects.requireNonNull(blockHash, "blockHash");
    }

    @Override
    public EventKind kind() {
      return EventKind.BLOCK_FETCH_REQUESTED;
    }
  }

  /** A block body finished downloading; {@code blockSize} is zero when the event carries no size. */
  record BlockDownloaded(Instant at, String blockHash, long blockSize, Endpoint remote) implements ClassifiedEvent {
    public BlockDownloaded {
      Objects.requireNonNull(at, "at");
      Objects.requireNonNull(blockHash, "blockHash");
      Objects.requireNonNull(remote, "remote");
    }

    @Override
    public EventKind kind() {
      return EventKind.BLOCK_DOWNLOADED;
    }
  }

  /** The block became part of the node's selected chain, either directly or through a fork switch. */
  record BlockAdopted(Instant at, String blockHash, boolean forkSwitch) implements ClassifiedEvent {
    public BlockAdopted {
      Objects.requireNonNull(at, "at");
      Objects.requireNonNull(blockHash, "blockHash");
    }

    @Override
    public EventKind kind() {
      return EventKind.BLOCK_ADOPTED;
    }
  }

  /**
   * Event the collector does not act on.
   *
   * @param at event timestamp
   * @param namespace namespace of the original record
   * @param reason short description used in DEBUG logs
   * @param malformed {@code true} when the namespace was recognised but the payload could not be decoded
   */
  record Ignored(Instant at, String namespace, String reason, boolean malformed) implements ClassifiedEvent {
    public Ignored {
      Objects.requireNonNull(at, "at");
      namespace = namespace == null ? "" : namespace;
      reason = reason == null ? "" : reason;
    }

    @Override
    public EventKind kind() {
      return EventKind.IGNORED;
    }
  }
}
