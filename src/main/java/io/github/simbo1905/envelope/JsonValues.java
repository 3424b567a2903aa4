// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;

/// JSON glue shared by the opaque fallback, the schema block and the streaming reader
final class JsonValues {

  static final ObjectMapper MAPPER = new ObjectMapper()
      .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

  private JsonValues() {
  }

  /// JSON rendering of an arbitrary Java object. Never fails: an object Jackson cannot describe is rendered as
  /// the JSON string of its `toString()`.
  static String render(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      LOGGER.fine(() -> "JSON rendering of " + value.getClass().getName() + " failed, falling back to toString: " + e.getOriginalMessage());
      try {
        return MAPPER.writeValueAsString(String.valueOf(value));
      } catch (JsonProcessingException impossible) {
        throw new IllegalStateException("Cannot render a plain string as JSON", impossible);
      }
    }
  }

  /// Parse a complete JSON document into a value tree
  static Value parse(String text) {
    try (JsonParser parser = MAPPER.getFactory().createParser(text)) {
      final JsonToken first = parser.nextToken();
      if (first == null) {
        throw new IllegalArgumentException("Empty JSON text");
      }
      final Value value = read(parser);
      if (parser.nextToken() != null) {
        throw new IllegalArgumentException("Trailing content after JSON value at " + parser.currentLocation());
      }
      return value;
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Invalid JSON: " + e.getOriginalMessage(), e);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  /// Bind JSON text to a Java type, used when projecting an opaque value back onto a typed member
  static <T> Optional<T> bind(String text, Class<T> type) {
    try {
      return Optional.ofNullable(MAPPER.readValue(text, type));
    } catch (JsonProcessingException e) {
      LOGGER.finer(() -> "Cannot bind JSON to " + type.getName() + ": " + e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /// Read the value starting at the parser's current token, leaving the parser on that value's last token
  static Value read(JsonParser parser) throws IOException {
    final JsonToken token = parser.currentToken();
    if (token == null) {
      throw new IllegalArgumentException("Unexpected end of JSON input");
    }
    return switch (token) {
      case VALUE_NULL -> Value.NULL;
      case VALUE_TRUE -> new Value.Bool(true);
      case VALUE_FALSE -> new Value.Bool(false);
      case VALUE_STRING -> new Value.StringValue(parser.getText());
      case VALUE_NUMBER_INT -> switch (parser.getNumberType()) {
        case INT -> new Value.Int32(parser.getIntValue());
        case LONG -> new Value.Int64(parser.getLongValue());
        default -> new Value.Float64(parser.getDoubleValue());
      };
      case VALUE_NUMBER_FLOAT -> new Value.Float64(parser.getDoubleValue());
      case START_ARRAY -> {
        final List<Value> elements = new ArrayList<>();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
          elements.add(read(parser));
        }
        yield new Value.ArrayValue(elements);
      }
      case START_OBJECT -> readObject(parser);
      case VALUE_EMBEDDED_OBJECT -> new Value.StringValue(parser.getText());
      default -> throw new IllegalArgumentException("Unexpected JSON token " + token + " at " + parser.currentLocation());
    };
  }

  /// Read an object whose START_OBJECT is the current token
  static Value.ObjectValue readObject(JsonParser parser) throws IOException {
    final Map<String, Value> fields = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      final String name = parser.currentName();
      parser.nextToken();
      fields.put(name, read(parser));
    }
    if (parser.currentToken() != JsonToken.END_OBJECT) {
      throw new IllegalArgumentException("Unterminated JSON object at " + parser.currentLocation());
    }
    return new Value.ObjectValue(fields);
  }
}
