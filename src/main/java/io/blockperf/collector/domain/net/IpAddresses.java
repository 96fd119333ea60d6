package io.blockperf.collector.domain.net;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical text for IP addresses so that the node log and the kernel socket tables name a peer identically.
 *
 * <p>IPv6 is rendered per RFC 5952 (lower case, longest zero run of two or more groups compressed) and IPv4-mapped
 * IPv6 addresses ({@code ::ffff:a.b.c.d}) collapse to their dotted IPv4 form. Anything that is not an IPv6 literal,
 * including dotted IPv4, is returned unchanged.</p>
 *
 * @since 0.1.0
 */
public final class IpAddresses {
  // Literal characters only; the brackets added below make InetAddress reject non-literals without a name lookup.
  private static final Pattern IPV6_LITERAL = Pattern.compile("[0-9A-Fa-f:.]+");

  private IpAddresses() {}

  /**
   * Canonicalizes an address as printed in a node log.
   *
   * @param address address text without brackets
   * @return canonical form, or {@code address} itself when it is not a valid IPv6 literal
   */
  public static String canonical(String address) {
    if (address.indexOf(':') < 0 || !IPV6_LITERAL.matcher(address).matches()) {
      return address;
    }
    try {
      return format(InetAddress.getByName('[' + address + ']').getAddress());
    } catch (UnknownHostException ex) {
      // Not a literal after all; Endpoint keeps text it cannot interpret.
      return address;
    }
  }

  /**
   * Formats raw address bytes.
   *
   * @param bytes 4 or 16 bytes in network order
   * @return dotted IPv4 or RFC 5952 IPv6 text
   * @throws IllegalArgumentException for any other length
   */
  public static String format(byte[] bytes) {
    if (bytes.length == 4) {
      return dotted(bytes, 0);
    }
    if (bytes.length != 16) {
      throw new IllegalArgumentException("address must be 4 or 16 bytes (was " + bytes.length + ")");
    }
    if (isIpv4Mapped(bytes)) {
      return dotted(bytes, 12);
    }
    return compressIpv6(bytes);
  }

  private static boolean isIpv4Mapped(byte[] bytes) {
    for (int i = 0; i < 10; i++) {
      if (bytes[i] != 0) {
        return false;
      }
    }
    return (bytes[10] & 0xFF) == 0xFF && (bytes[11] & 0xFF) == 0xFF;
  }

  private static String dotted(byte[] bytes, int offset) {
    return (bytes[offset] & 0xFF) + "." + (bytes[offset + 1] & 0xFF) + "."
        + (bytes[offset + 2] & 0xFF) + "." + (bytes[offset + 3] & 0xFF);
  }

  static String compressIpv6(byte[] bytes) {
    int[] groups = new int[8];
    for (int i = 0; i < 8; i++) {
      groups[i] = ((bytes[i * 2] & 0xFF) << 8) | (bytes[i * 2 + 1] & 0xFF);
    }
    int bestStart = -1;
    int bestLength = 0;
    for (int i = 0; i < 8; ) {
      if (groups[i] != 0) {
        i++;
        continue;
      }
      int start = i;
      while (i < 8 && groups[i] == 0) {
        i++;
      }
      if (i - start > bestLength) {
        bestStart = start;
        bestLength = i - start;
      }
    }
    if (bestLength < 2) {
      bestStart = -1;
    }
    StringBuilder text = new StringBuilder();
    for (int i = 0; i < 8; i++) {
      if (i == bestStart) {
        text.append("::");
        i += bestLength - 1;
        continue;
      }
      if (text.length() > 0 && text.charAt(text.length() - 1) != ':') {
        text.append(':');
      }
      text.append(Integer.toHexString(groups[i]));
    }
    return text.toString().toLowerCase(Locale.ROOT);
  }
}
