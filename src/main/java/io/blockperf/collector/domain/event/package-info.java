/**
 * Node trace events: the normalized input record and the closed set of classified payload variants.
 */
package io.blockperf.collector.domain.event;
