/**
 * Network addressing value objects shared by peer and block models.
 */
package io.blockperf.collector.domain.net;
