package io.blockperf.collector.testing;

import io.blockperf.collector.domain.event.NormalizedEvent;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Builders for node trace events in the shapes the node's JSON tracer produces.
 */
public final class NodeEvents {
  public static final String DOWNLOADED_HEADER = "ChainSync.Client.DownloadedHeader";
  public static final String SEND_FETCH_REQUEST = "BlockFetch.Client.SendFetchRequest";
  public static final String COMPLETED_BLOCK_FETCH = "BlockFetch.Client.CompletedBlockFetch";
  public static final String ADDED_TO_CURRENT_CHAIN = "ChainDB.AddBlockEvent.AddedToCurrentChain";
  public static final String SWITCHED_TO_A_FORK = "ChainDB.AddBlockEvent.SwitchedToAFork";
  public static final String STATUS_CHANGED = "Net.PeerSelection.Actions.StatusChanged";
  public static final String SERVER_STARTED = "Net.Server.Local.Started";
  public static final String GOVERNOR_COUNTERS = "Net.InboundGovernor.Remote.InboundGovernorCounters";

  private NodeEvents() {}

  public static NormalizedEvent header(Instant at, String hash, long blockNo, long slot, String connectionId) {
    return NormalizedEvent.of(at, DOWNLOADED_HEADER, Map.of(
        "block", hash,
        "blockNo", blockNo,
        "slot", slot,
        "peer", Map.of("connectionId", connectionId)));
  }

  public static NormalizedEvent fetchRequest(Instant at, String hash, String connectionId) {
    return NormalizedEvent.of(at, SEND_FETCH_REQUEST, Map.of(
        "head", hash,
        "length", 1,
        "peer", Map.of("connectionId", connectionId)));
  }

  public static NormalizedEvent downloaded(Instant at, String hash, long size, String connectionId) {
    return NormalizedEvent.of(at, COMPLETED_BLOCK_FETCH, Map.of(
        "block", hash,
        "size", size,
        "delay", 0.1,
        "peer", Map.of("connectionId", connectionId)));
  }

  public static NormalizedEvent adopted(Instant at, String hash, long blockNo) {
    return NormalizedEvent.of(at, ADDED_TO_CURRENT_CHAIN, Map.of(
        "headers", List.of(Map.of("hash", hash, "blockNo", blockNo, "kind", "ShelleyBlock"))));
  }

  public static NormalizedEvent statusChanged(Instant at, String text) {
    return NormalizedEvent.of(at, STATUS_CHANGED, Map.of("peerStatusChangeType", text));
  }

  public static NormalizedEvent inboundGovernor(Instant at, String leafNamespace, String connectionId) {
    return NormalizedEvent.of(at, leafNamespace, Map.of("connectionId", connectionId));
  }

  public static NormalizedEvent counters(Instant at, int idle, int cold, int warm, int hot) {
    return NormalizedEvent.of(at, GOVERNOR_COUNTERS, Map.of(
        "idlePeers", idle, "coldPeers", cold, "warmPeers", warm, "hotPeers", hot));
  }

  public static NormalizedEvent serverStarted(Instant at) {
    return NormalizedEvent.of(at, SERVER_STARTED, Map.of());
  }
}
