package io.blockperf.collector.config;

import io.blockperf.collector.application.port.NetworkConfig;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Chain parameters used to turn slot numbers into wall-clock time.
 *
 * <p>{@code slotTime(slot) = systemStart + slot * slotLength}. The built-in profiles use a one-second slot length,
 * which holds for every slot the collector can observe on these networks.</p>
 *
 * @param name network name
 * @param magic network magic
 * @param systemStart genesis system start
 * @param slotLength length of one slot
 * @since 0.1.0
 */
public record NetworkProfile(String name, long magic, Instant systemStart, Duration slotLength)
    implements NetworkConfig {

  public static final NetworkProfile MAINNET =
      new NetworkProfile("mainnet", 764_824_073L, Instant.ofEpochSecond(1_591_566_291L), Duration.ofSeconds(1));
  public static final NetworkProfile PREPROD =
      new NetworkProfile("preprod", 1L, Instant.ofEpochSecond(1_654_041_600L), Duration.ofSeconds(1));
  public static final NetworkProfile PREVIEW =
      new NetworkProfile("preview", 2L, Instant.ofEpochSecond(1_666_656_000L), Duration.ofSeconds(1));

  public NetworkProfile {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(systemStart, "systemStart");
    Objects.requireNonNull(slotLength, "slotLength");
    if (magic < 0) {
      throw new IllegalArgumentException("magic must not be negative");
    }
    if (slotLength.isZero() || slotLength.isNegative()) {
      throw new IllegalArgumentException("slotLength must be positive");
    }
  }

  /**
   * Returns a built-in profile.
   *
   * @param name {@code mainnet}, {@code preprod}, or {@code preview}
   * @return matching profile
   * @throws IllegalArgumentException when the name is not a built-in network
   */
  public static NetworkProfile named(String name) {
    String normalized = Objects.requireNonNull(name, "name").trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "mainnet" -> MAINNET;
      case "preprod" -> PREPROD;
      case "preview" -> PREVIEW;
      default -> throw new IllegalArgumentException(
          "network must be one of mainnet|preprod|preview|custom (was " + name.trim() + ")");
    };
  }

  /**
   * Returns the sample API base URL operated for a built-in network.
   *
   * @return API base URL, empty for custom networks
   */
  public Optional<String> defaultApiUrl() {
    if (equals(MAINNET)) {
      return Optional.of("https://api.openblockperf.cardano.org");
    }
    if (equals(PREPROD)) {
      return Optional.of("https://preprod.api.openblockperf.cardano.org");
    }
    if (equals(PREVIEW)) {
      return Optional.of("https://preview.api.openblockperf.cardano.org");
    }
    return Optional.empty();
  }

  @Override
  public Instant slotTime(long slotNo) {
    if (slotNo < 0) {
      throw new IllegalArgumentException("slotNo must not be negative");
    }
    return systemStart.plus(slotLength.multipliedBy(slotNo));
  }
}
