/**
 * Application layer: use cases coordinating classification, peer tracking, and block correlation through ports.
 * <p><strong>Role:</strong> Hosts the stateful components and the dispatcher; adapters live in
 * {@code io.blockperf.collector.infrastructure}.</p>
 * <p><strong>Concurrency:</strong> Events are processed on a single dispatcher thread; periodic reconciliation and
 * sweeping run on scheduler threads and take the owning component's lock.</p>
 */
package io.blockperf.collector.application;
