/**
 * Executor construction for timer and sink threads.
 */
package io.blockperf.collector.infrastructure.exec;
