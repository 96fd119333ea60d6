package io.blockperf.collector.infrastructure.source;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.blockperf.collector.domain.event.NormalizedEvent;
import java.io.IOException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Parses one line of the node's JSON trace output into a {@link NormalizedEvent}.
 *
 * <p>Expected shape: {@code {"at":"2025-09-12T16:51:39.269022269Z","ns":"ChainSync.Client.DownloadedHeader",
 * "data":{...},"sev":"Info","thread":"96913","host":"relay1"}}. {@code ns} may also be a list of segments, which is
 * joined with dots. Unknown top-level fields are ignored.</p>
 *
 * <p>Instances are thread-safe; the underlying {@link JsonFactory} is shared.</p>
 *
 * @since 0.1.0
 */
public final class NodeLogLineParser {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a single trace line.
   *
   * @param line JSON object text; never {@code null}
   * @return normalized event
   * @throws IllegalArgumentException when the line is not a JSON object or lacks {@code at}/{@code ns}
   */
  public NormalizedEvent parse(String line) {
    Objects.requireNonNull(line, "line");
    try (JsonParser parser = factory.createParser(line)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw new IllegalArgumentException("Trace line is not a JSON object");
      }
      Map<String, Object> root = readObject(parser);
      JsonToken trailing = parser.nextToken();
      if (trailing != null && trailing != JsonToken.NOT_AVAILABLE) {
        throw new IllegalArgumentException("Trace line contains trailing content");
      }
      return toEvent(root);
    } catch (IOException ex) {
      throw new IllegalArgumentException("Invalid JSON trace line", ex);
    }
  }

  private NormalizedEvent toEvent(Map<String, Object> root) {
    Instant at = parseTimestamp(root.get("at"));
    String namespace = namespace(root.get("ns"));
    Object data = root.get("data");
    Map<String, Object> payload;
    if (data == null) {
      payload = Map.of();
    } else if (data instanceof Map<?, ?> map) {
      payload = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        payload.put(String.valueOf(entry.getKey()), entry.getValue());
      }
    } else {
      throw new IllegalArgumentException("data must be a JSON object");
    }
    return new NormalizedEvent(
        at, namespace, text(root.get("sev")), text(root.get("thread")), text(root.get("host")), payload);
  }

  static Instant parseTimestamp(Object value) {
    if (!(value instanceof String text) || text.isBlank()) {
      throw new IllegalArgumentException("at must be an ISO-8601 timestamp string");
    }
    try {
      return Instant.parse(text);
    } catch (DateTimeParseException strict) {
      try {
        return OffsetDateTime.parse(text).toInstant();
      } catch (DateTimeParseException lenient) {
        throw new IllegalArgumentException("Unparseable timestamp '" + text + "'", lenient);
      }
    }
  }

  private static String namespace(Object value) {
    if (value instanceof String text && !text.isBlank()) {
      return text.trim();
    }
    if (value instanceof List<?> segments && !segments.isEmpty()) {
      StringBuilder joined = new StringBuilder();
      for (Object segment : segments) {
        if (!(segment instanceof String part) || part.isBlank()) {
          throw new IllegalArgumentException("ns segments must be non-blank strings");
        }
        if (joined.length() > 0) {
          joined.append('.');
        }
        joined.append(part.trim());
      }
      return joined.toString();
    }
    throw new IllegalArgumentException("ns must be a string or a list of strings");
  }

  private static String text(Object value) {
    return value == null ? "" : value.toString();
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of trace line");
    }
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_OBJECT) {
        break;
      }
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String fieldName = parser.getCurrentName();
      map.put(fieldName, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    while (true) {
      JsonToken token = parser.nextToken();
      if (token == JsonToken.END_ARRAY) {
        break;
      }
      list.add(readValue(parser, token));
    }
    return list;
  }
}
