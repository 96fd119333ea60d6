/**
 * Authoritative peer map: log-driven state transitions and OS-driven existence reconciliation.
 */
package io.blockperf.collector.application.peer;
