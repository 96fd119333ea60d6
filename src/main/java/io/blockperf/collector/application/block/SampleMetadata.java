package io.blockperf.collector.application.block;

import io.blockperf.collector.domain.net.Endpoint;
import java.util.Objects;

/**
 * Configuration-supplied fields stamped onto every block sample.
 *
 * @param bpVersion collector version
 * @param localEndpoint local address and port of the tracked node
 * @since 0.1.0
 */
public record SampleMetadata(String bpVersion, Endpoint localEndpoint) {

  public SampleMetadata {
    Objects.requireNonNull(bpVersion, "bpVersion");
    Objects.requireNonNull(localEndpoint, "localEndpoint");
  }
}
