package io.blockperf.collector.application.port;

import io.blockperf.collector.domain.peer.OsConnection;
import java.io.IOException;
import java.util.Set;

/**
 * Port enumerating the established TCP connections of the monitored node process.
 *
 * <p>Used as ground truth for peer existence during reconciliation. A failure is transient: the caller skips the
 * pass and tries again on the next tick.</p>
 *
 * @since 0.1.0
 */
public interface OsConnectionSnapshot {
  /**
   * Reads the current set of established connections.
   *
   * @return established connections of the node
   * @throws IOException when the operating system tables cannot be read
   */
  Set<OsConnection> establishedConnections() throws IOException;
}
