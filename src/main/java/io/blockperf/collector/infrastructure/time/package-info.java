/**
 * Clock adapters.
 */
package io.blockperf.collector.infrastructure.time;
