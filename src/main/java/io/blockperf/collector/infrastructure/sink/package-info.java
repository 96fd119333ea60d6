/**
 * Block sample sinks: structured log, JSON-lines file, and HTTP submission to the sample API.
 */
package io.blockperf.collector.infrastructure.sink;
