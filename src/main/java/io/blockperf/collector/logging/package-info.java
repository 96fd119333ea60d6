/**
 * Logging utilities that tune verbosity and bound payloads before they reach the log.
 *
 * @since 0.1.0
 */
package io.blockperf.collector.logging;
