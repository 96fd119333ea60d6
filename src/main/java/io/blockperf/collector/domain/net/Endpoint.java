package io.blockperf.collector.domain.net;

import java.util.Objects;

/**
 * <strong>What:</strong> Immutable address/port pair identifying one side of a TCP connection.
 * <p><strong>Why:</strong> Node log events, OS socket tables, and block samples all describe peers by address and port;
 * a single value type keeps their comparison rules identical.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent sharing.</p>
 * <p><strong>Observability:</strong> {@link #toString()} renders {@code ip:port} or {@code [ipv6]:port} for logs.</p>
 *
 * @param address textual IPv4 or IPv6 address without brackets, canonicalized by {@link IpAddresses}; never blank
 * @param port TCP port (0-65535)
 * @since 0.1.0
 */
public record Endpoint(String address, int port) {

  /**
   * Validates the port and canonicalizes the address.
   *
   * @throws IllegalArgumentException when the address is blank or the port is out of range
   */
  public Endpoint {
    Objects.requireNonNull(address, "address");
    address = address.trim();
    if (address.isEmpty()) {
      throw new IllegalArgumentException("address must not be blank");
    }
    address = IpAddresses.canonical(address);
    if (port < 0 || port > 65_535) {
      throw new IllegalArgumentException("port must be between 0 and 65535 (was " + port + ")");
    }
  }

  /**
   * Parses {@code ip:port} or {@code [ipv6]:port} text as printed by the node.
   *
   * @param text endpoint text; must not be {@code null}
   * @return parsed endpoint
   * @throws IllegalArgumentException when the text is not a valid endpoint
   */
  public static Endpoint parse(String text) {
    Objects.requireNonNull(text, "text");
    String trimmed = text.trim();
    String host;
    String portPart;
    if (trimmed.startsWith("[")) {
      int close = trimmed.indexOf(']');
      if (close < 0 || close + 2 > trimmed.length() || trimmed.charAt(close + 1) != ':') {
        throw new IllegalArgumentException("endpoint must use [ipv6]:port format (was '" + text + "')");
      }
      host = trimmed.substring(1, close);
      portPart = trimmed.substring(close + 2);
    } else {
      int colon = trimmed.lastIndexOf(':');
      if (colon <= 0 || colon == trimmed.length() - 1) {
        throw new IllegalArgumentException("endpoint must use ip:port format (was '" + text + "')");
      }
      host = trimmed.substring(0, colon);
      portPart = trimmed.substring(colon + 1);
      if (host.indexOf(':') >= 0) {
        throw new IllegalArgumentException("IPv6 endpoint must be wrapped in [ ] (was '" + text + "')");
      }
    }
    return new Endpoint(host, parsePort(portPart));
  }

  /**
   * Parses a decimal port number.
   *
   * @param raw port text
   * @return port value
   * @throws IllegalArgumentException when the text is not numeric or out of range
   */
  public static int parsePort(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("port must not be blank");
    }
    try {
      int port = Integer.parseInt(raw.trim());
      if (port < 0 || port > 65_535) {
        throw new IllegalArgumentException("port must be between 0 and 65535 (was " + port + ")");
      }
      return port;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException("port must be numeric (was '" + raw + "')", ex);
    }
  }

  @Override
  public String toString() {
    return address.indexOf(':') >= 0 ? '[' + address + "]:" + port : address + ':' + port;
  }
}
