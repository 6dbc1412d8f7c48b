package ca.gc.cra.logrelay.application.translate;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Streaming parser for push delivery bodies. Unknown fields are skipped.
 *
 * <p>Thread-safe; the underlying {@link JsonFactory} is shared.</p>
 *
 * @since 0.1.0
 */
public final class PushMessageParser {
  private final JsonFactory factory = new JsonFactory();

  /**
   * Parses a push body.
   *
   * @param body raw request body
   * @return parsed message
   * @throws TranslationException with reason {@code MALFORMED} when the body is not a valid push document
   */
  public PushMessage parse(byte[] body) throws TranslationException {
    Objects.requireNonNull(body, "body");
    try (JsonParser parser = factory.createParser(body)) {
      JsonToken token = parser.nextToken();
      if (token != JsonToken.START_OBJECT) {
        throw TranslationException.malformed("push body must be a JSON object");
      }
      PushMessage.Message message = null;
      String subscription = null;
      while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
        String field = fieldName(parser, token);
        JsonToken value = parser.nextToken();
        switch (field) {
          case "message" -> message = readMessage(parser, value);
          case "subscription" -> subscription = readString(parser, value, field);
          default -> parser.skipChildren();
        }
      }
      JsonToken trailing = parser.nextToken();
      if (trailing != null) {
        throw TranslationException.malformed("push body contains trailing content");
      }
      return new PushMessage(message, subscription);
    } catch (IOException ex) {
      throw TranslationException.malformed("invalid JSON: " + ex.getMessage(), ex);
    }
  }

  private PushMessage.Message readMessage(JsonParser parser, JsonToken token)
      throws IOException, TranslationException {
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    expect(token, JsonToken.START_OBJECT, "message");
    String data = null;
    Map<String, String> attributes = Map.of();
    String messageId = null;
    Instant publishTime = null;
    JsonToken next;
    while ((next = parser.nextToken()) != JsonToken.END_OBJECT) {
      String field = fieldName(parser, next);
      JsonToken value = parser.nextToken();
      switch (field) {
        case "data" -> data = readString(parser, value, field);
        case "attributes" -> attributes = readAttributes(parser, value);
        case "messageId", "message_id" -> messageId = readString(parser, value, field);
        case "publishTime", "publish_time" -> publishTime = readInstant(parser, value, field);
        default -> parser.skipChildren();
      }
    }
    return new PushMessage.Message(data, attributes, messageId, publishTime);
  }

  private Map<String, String> readAttributes(JsonParser parser, JsonToken token)
      throws IOException, TranslationException {
    if (token == JsonToken.VALUE_NULL) {
      return Map.of();
    }
    expect(token, JsonToken.START_OBJECT, "attributes");
    Map<String, String> attributes = new LinkedHashMap<>();
    JsonToken next;
    while ((next = parser.nextToken()) != JsonToken.END_OBJECT) {
      String key = fieldName(parser, next);
      String value = readString(parser, parser.nextToken(), "attributes." + key);
      if (value != null) {
        attributes.put(key, value);
      }
    }
    return attributes;
  }

  private static Instant readInstant(JsonParser parser, JsonToken token, String field)
      throws IOException, TranslationException {
    String raw = readString(parser, token, field);
    if (raw == null || raw.isEmpty()) {
      return null;
    }
    try {
      return OffsetDateTime.parse(raw).toInstant();
    } catch (DateTimeException ex) {
      throw TranslationException.malformed("invalid " + field + ": " + raw, ex);
    }
  }

  private static String readString(JsonParser parser, JsonToken token, String field)
      throws IOException, TranslationException {
    if (token == JsonToken.VALUE_NULL) {
      return null;
    }
    expect(token, JsonToken.VALUE_STRING, field);
    return parser.getText();
  }

  private static String fieldName(JsonParser parser, JsonToken token) throws IOException, TranslationException {
    expect(token, JsonToken.FIELD_NAME, "object");
    return parser.getCurrentName();
  }

  private static void expect(JsonToken actual, JsonToken expected, String field) throws TranslationException {
    if (actual != expected) {
      throw TranslationException.malformed("expected " + expected + " for " + field + " but found " + actual);
    }
  }
}
