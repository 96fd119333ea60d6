/**
 * Stateless classification of node trace events into typed payload variants.
 */
package io.blockperf.collector.application.classify;
