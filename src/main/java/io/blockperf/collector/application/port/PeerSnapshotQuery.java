package io.blockperf.collector.application.port;

import io.blockperf.collector.domain.peer.Peer;
import io.blockperf.collector.domain.peer.PeerStatistics;
import java.util.List;

/**
 * Read-only query over the tracked peer set, exposed for reporting.
 *
 * @since 0.1.0
 */
public interface PeerSnapshotQuery {
  /**
   * Returns a copy of the current peers; later changes to the tracker are not reflected.
   *
   * @return immutable list of peers
   */
  List<Peer> snapshot();

  /**
   * Returns counts per state and per direction.
   *
   * @return peer statistics
   */
  PeerStatistics statistics();
}
