/**
 * Input validation helpers for configuration and CLI values. Violations raise {@link IllegalArgumentException}.
 *
 * @since 0.1.0
 */
package io.blockperf.collector.validation;
