package io.blockperf.collector.application.classify;

import io.blockperf.collector.domain.net.ConnectionId;
import io.blockperf.collector.domain.net.Endpoint;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

/**
 * Field accessors over parsed JSON payload graphs (maps, lists, strings, numbers, booleans).
 *
 * <p>Every accessor throws {@link IllegalArgumentException} naming the offending path when a field is missing or
 * has the wrong shape; the classifier turns that into a discarded event.</p>
 */
final class PayloadFields {

  private PayloadFields() {}

  static Object find(Map<String, Object> data, String path) {
    Object current = data;
    for (String segment : path.split("\\.")) {
      if (!(current instanceof Map<?, ?> map)) {
        return null;
      }
      current = map.get(segment);
    }
    return current;
  }

  static String requireString(Map<String, Object> data, String path) {
    Object value = find(data, path);
    if (value instanceof String text && !text.isBlank()) {
      return text.trim();
    }
    throw new IllegalArgumentException(describe(path, value, "a non-blank string"));
  }

  static long requireLong(Map<String, Object> data, String path) {
    Object value = find(data, path);
    if (value == null) {
      throw new IllegalArgumentException("missing field " + path);
    }
    return toLong(path, value);
  }

  static OptionalLong optionalLong(Map<String, Object> data, String path) {
    Object value = find(data, path);
    if (value == null) {
      return OptionalLong.empty();
    }
    return OptionalLong.of(toLong(path, value));
  }

  static int requireInt(Map<String, Object> data, String path) {
    long value = requireLong(data, path);
    if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
      throw new IllegalArgumentException(path + " is out of int range (was " + value + ")");
    }
    return (int) value;
  }

  @SuppressWarnings("unchecked")
  static Map<String, Object> requireMap(Object value, String path) {
    if (value instanceof Map<?, ?> map) {
      return (Map<String, Object>) map;
    }
    throw new IllegalArgumentException(describe(path, value, "an object"));
  }

  static List<?> requireList(Map<String, Object> data, String path) {
    Object value = find(data, path);
    if (value instanceof List<?> list && !list.isEmpty()) {
      return list;
    }
    throw new IllegalArgumentException(describe(path, value, "a non-empty array"));
  }

  /**
   * Decodes a connection id in either the {@code "<local> <remote>"} string form or the
   * {@code {localAddress: {address, port}, remoteAddress: {address, port}}} object form.
   */
  static ConnectionId requireConnectionId(Map<String, Object> data, String path) {
    Object value = find(data, path);
    if (value instanceof String text) {
      return ConnectionId.parse(text);
    }
    Map<String, Object> map = requireMap(value, path);
    return new ConnectionId(
        endpoint(map, path + ".localAddress"),
        endpoint(map, path + ".remoteAddress"));
  }

  /**
   * Strips the literal double quotes some tracers wrap around hashes, e.g. {@code "\"ab12\""}.
   */
  static String cleanHash(String raw) {
    String hash = raw.trim();
    while (hash.length() >= 2 && hash.startsWith("\"") && hash.endsWith("\"")) {
      hash = hash.substring(1, hash.length() - 1).trim();
    }
    if (hash.isEmpty()) {
      throw new IllegalArgumentException("block hash must not be blank");
    }
    return hash;
  }

  private static Endpoint endpoint(Map<String, Object> connection, String path) {
    String leaf = path.substring(path.lastIndexOf('.') + 1);
    Map<String, Object> side = requireMap(connection.get(leaf), path);
    Object address = side.get("address");
    if (!(address instanceof String text) || text.isBlank()) {
      throw new IllegalArgumentException(describe(path + ".address", address, "a non-blank string"));
    }
    Object port = side.get("port");
    if (port == null) {
      throw new IllegalArgumentException("missing field " + path + ".port");
    }
    String portText = port instanceof Number number ? Long.toString(toLong(path + ".port", number)) : port.toString();
    return new Endpoint(text, Endpoint.parsePort(portText));
  }

  private static long toLong(String path, Object value) {
    if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof Number number) {
      try {
        return new BigDecimal(number.toString()).longValueExact();
      } catch (ArithmeticException | NumberFormatException ex) {
        throw new IllegalArgumentException(path + " must be an integer (was " + value + ")", ex);
      }
    }
    if (value instanceof String text) {
      try {
        return Long.parseLong(text.trim());
      } catch (NumberFormatException ex) {
        throw new IllegalArgumentException(path + " must be an integer (was '" + text + "')", ex);
      }
    }
    throw new IllegalArgumentException(describe(path, value, "an integer"));
  }

  private static String describe(String path, Object value, String expected) {
    if (value == null) {
      return "missing field " + path;
    }
    return path + " must be " + expected + " (was " + value.getClass().getSimpleName() + ")";
  }
}
