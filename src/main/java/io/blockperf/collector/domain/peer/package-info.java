/**
 * Peer connectivity model: identity, direction, governor state, and the explicit state transition table.
 * <p><strong>Concurrency:</strong> All types are immutable; the peer map itself is owned by
 * {@code PeerStateTracker}.</p>
 */
package io.blockperf.collector.domain.peer;
