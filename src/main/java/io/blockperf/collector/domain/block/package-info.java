/**
 * In-flight block records and the finalized propagation samples derived from them.
 * <p><strong>Concurrency:</strong> {@link io.blockperf.collector.domain.block.BlockRecord} is mutable and must only be
 * touched under the owning engine's lock; {@link io.blockperf.collector.domain.block.BlockSample} is immutable.</p>
 */
package io.blockperf.collector.domain.block;
