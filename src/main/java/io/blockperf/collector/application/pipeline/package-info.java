/**
 * Use cases that drive the collector: ordered event dispatch plus the periodic reconcile, sweep, and report timers.
 */
package io.blockperf.collector.application.pipeline;
