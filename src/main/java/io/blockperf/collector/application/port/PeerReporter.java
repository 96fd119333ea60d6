package io.blockperf.collector.application.port;

import io.blockperf.collector.domain.peer.PeerStatistics;

/**
 * Port publishing the periodic peer summary.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface PeerReporter {
  /**
   * Publishes one summary.
   *
   * @param statistics peer counts at the time of the report
   * @param openBlockRecords number of in-flight block records
   */
  void report(PeerStatistics statistics, int openBlockRecords);
}
