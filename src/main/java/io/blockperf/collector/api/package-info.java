/**
 * Command-line entry points: the {@code blockperf} dispatcher, the {@code run} command, and their argument and
 * output helpers.
 */
package io.blockperf.collector.api;
