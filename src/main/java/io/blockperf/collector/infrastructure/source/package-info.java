/**
 * Event source adapters reading the node's JSON trace log.
 */
package io.blockperf.collector.infrastructure.source;
