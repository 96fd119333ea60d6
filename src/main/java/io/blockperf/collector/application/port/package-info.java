/**
 * Ports (interfaces) that decouple collector use cases from log transports, operating-system access, sample sinks,
 * clocks, and metrics.
 * <p><strong>Role:</strong> Hexagonal boundary consumed by the application layer and implemented by adapters.</p>
 * <p><strong>Concurrency:</strong> Each port documents its threading expectations; sinks and metrics must tolerate
 * calls from the dispatcher thread while scheduler threads are active.</p>
 */
package io.blockperf.collector.application.port;
