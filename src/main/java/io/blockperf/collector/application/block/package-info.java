/**
 * Correlation of block header, fetch, download, and adoption events into finalized propagation samples.
 */
package io.blockperf.collector.application.block;
