/**
 * Peer summary reporters.
 */
package io.blockperf.collector.infrastructure.report;
