package io.blockperf.collector.infrastructure.report;

import io.blockperf.collector.application.port.MetricsPort;
import io.blockperf.collector.application.port.PeerReporter;
import io.blockperf.collector.domain.peer.PeerDirection;
import io.blockperf.collector.domain.peer.PeerState;
import io.blockperf.collector.domain.peer.PeerStatistics;
import java.util.Locale;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs the periodic peer summary at INFO and records the counts as {@code peers.report.*} observations.
 *
 * @since 0.1.0
 */
public final class LoggingPeerReporter implements PeerReporter {
  private static final Logger log = LoggerFactory.getLogger(LoggingPeerReporter.class);

  private final MetricsPort metrics;

  public LoggingPeerReporter(MetricsPort metrics) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void report(PeerStatistics statistics, int openBlockRecords) {
    Objects.requireNonNull(statistics, "statistics");
    log.info(
        "Peers: {} total (inbound {}, outbound {}); hot {}, warm {}, cold {}, unknown {}; {} blocks in flight",
        statistics.total(),
        statistics.count(PeerDirection.INBOUND),
        statistics.count(PeerDirection.OUTBOUND),
        statistics.count(PeerState.HOT),
        statistics.count(PeerState.WARM),
        statistics.count(PeerState.COLD),
        statistics.count(PeerState.UNKNOWN),
        openBlockRecords);
    metrics.observe("peers.report.total", statistics.total());
    for (PeerState state : PeerState.values()) {
      metrics.observe("peers.report." + state.name().toLowerCase(Locale.ROOT), statistics.count(state));
    }
    metrics.observe("block.record.open", openBlockRecords);
  }
}
