/**
 * Configuration loading and wiring: embedded defaults, YAML, CLI overrides, and the composition root.
 *
 * <p>Precedence is CLI {@code key=value} over YAML over embedded defaults. Invalid values raise
 * {@link IllegalArgumentException}.</p>
 *
 * @since 0.1.0
 */
package io.blockperf.collector.config;
