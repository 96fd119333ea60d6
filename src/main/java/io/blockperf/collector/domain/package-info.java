/**
 * Core domain model for the block propagation collector.
 * <p><strong>Role:</strong> Domain layer types describing node log events, peers, and in-flight blocks without
 * infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; {@link io.blockperf.collector.domain.block.BlockRecord}
 * is mutable and owned by a single correlation engine.</p>
 * <p><strong>Metrics:</strong> Domain attributes feed tagging on {@code classifier.*}, {@code peers.*}, and
 * {@code block.*} metrics.</p>
 */
package io.blockperf.collector.domain;
