package io.blockperf.collector.validation;

import java.net.Inet4Address;
import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.UnknownHostException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Network value validation: IP literals for the node's local address and HTTP(S) base URLs for the sample API.
 *
 * @since 0.1.0
 */
public final class Net {

  private static final int MAX_HOSTNAME_LENGTH = 253;
  private static final int MAX_LABEL_LENGTH = 63;

  // IPv4 dotted-quad shape; octets are range-checked separately.
  private static final Pattern IPV4_PATTERN = Pattern.compile("\\A\\d{1,3}(?:\\.\\d{1,3}){3}\\z");

  private Net() {
    // Utility
  }

  /**
   * Validates an IPv4 or IPv6 literal without resolving names.
   *
   * @param name parameter name for diagnostics
   * @param value candidate literal; IPv6 may be bracketed
   * @return the literal without brackets
   * @throws IllegalArgumentException when the value is not an IP literal
   */
  public static String requireIpLiteral(String name, String value) {
    String sanitized = Strings.requireNonBlank(name, value);
    if (sanitized.startsWith("[") && sanitized.endsWith("]")) {
      sanitized = sanitized.substring(1, sanitized.length() - 1);
    }
    if (IPV4_PATTERN.matcher(sanitized).matches()) {
      validateIpv4Octets(sanitized);
      return sanitized;
    }
    if (sanitized.indexOf(':') >= 0) {
      validateIpv6(name, sanitized);
      return sanitized;
    }
    throw new IllegalArgumentException(name + " must be an IPv4 or IPv6 literal (was " + sanitized + ")");
  }

  /**
   * Validates an absolute {@code http} or {@code https} URL and strips a trailing slash.
   *
   * @param name parameter name for diagnostics
   * @param value candidate URL
   * @return normalized URL without trailing slash
   * @throws IllegalArgumentException when the URL is malformed, relative, or uses another scheme
   */
  public static String validateHttpUrl(String name, String value) {
    String sanitized = Strings.requirePrintableAscii(name, value, 2_048);
    URI uri;
    try {
      uri = new URI(sanitized);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(name + " is not a valid URL: " + ex.getMessage(), ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(name + " must use http or https (was " + sanitized + ")");
    }
    String host = uri.getHost();
    if (host == null || host.isEmpty()) {
      throw new IllegalArgumentException(name + " must include a host (was " + sanitized + ")");
    }
    if (host.startsWith("[")) {
      validateIpv6(name, host.substring(1, host.length() - 1));
    } else if (IPV4_PATTERN.matcher(host).matches()) {
      validateIpv4Octets(host);
    } else {
      validateHostname(host);
    }
    if (uri.getPort() != -1) {
      Numbers.requireRange(name + " port", uri.getPort(), 1, 65_535);
    }
    while (sanitized.endsWith("/")) {
      sanitized = sanitized.substring(0, sanitized.length() - 1);
    }
    return sanitized;
  }

  private static void validateHostname(String host) {
    int len = host.length();
    if (len == 0 || len > MAX_HOSTNAME_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname length: " + len + " (must be 1.." + MAX_HOSTNAME_LENGTH + ')');
    }
    int start = 0;
    while (true) {
      int dot = host.indexOf('.', start);
      int end = (dot == -1) ? len : dot;
      validateLabel(host, start, end);
      if (dot == -1) {
        break;
      }
      start = dot + 1;
      if (start == len) {
        throw new IllegalArgumentException("invalid hostname: empty trailing label");
      }
    }
  }

  private static void validateLabel(String s, int start, int end) {
    int labelLen = end - start;
    if (labelLen <= 0 || labelLen > MAX_LABEL_LENGTH) {
      throw new IllegalArgumentException(
          "invalid hostname: label length " + labelLen + " (must be 1.." + MAX_LABEL_LENGTH + ")");
    }
    if (!isAsciiAlnum(s.charAt(start)) || !isAsciiAlnum(s.charAt(end - 1))) {
      throw new IllegalArgumentException("invalid hostname: labels must start/end with alphanumeric");
    }
    for (int i = start + 1; i < end - 1; i++) {
      char c = s.charAt(i);
      if (!(isAsciiAlnum(c) || c == '-')) {
        throw new IllegalArgumentException("invalid hostname: illegal character '" + c + '\'');
      }
    }
  }

  private static void validateIpv4Octets(String host) {
    int startIndex = 0;
    for (int i = 0; i < 4; i++) {
      int endIndex = (i < 3) ? host.indexOf('.', startIndex) : host.length();
      int octet = Integer.parseInt(host.substring(startIndex, endIndex));
      Numbers.requireRange("IPv4 octet", octet, 0, 255);
      startIndex = endIndex + 1;
    }
  }

  private static void validateIpv6(String name, String host) {
    try {
      InetAddress address = InetAddress.getByName(host);
      if (!(address instanceof Inet6Address) && !(address instanceof Inet4Address)) {
        throw new IllegalArgumentException(name + " is not a valid IPv6 literal: " + host);
      }
    } catch (UnknownHostException ex) {
      throw new IllegalArgumentException(name + " is not a valid IPv6 literal: " + host, ex);
    }
  }

  private static boolean isAsciiAlnum(char c) {
    return (c >= 'a' && c <= 'z')
        || (c >= 'A' && c <= 'Z')
        || (c >= '0' && c <= '9');
  }
}
