// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.*;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;

/// Streaming decode of a JSON array of objects into field maps, one element at a time. This is a separate and much
/// simpler path than the envelope: JSON text in, the same Value model out. Numbers become Int32 when they fit,
/// then Int64, otherwise Float64.
///
/// The caller owns the input stream; the reader never closes it.
public final class JsonValueReader {

  private JsonValueReader() {
  }

  /// Lazily parse the elements of a top level JSON array. Close the returned stream to release the parser.
  public static Stream<Value.ObjectValue> stream(InputStream input) {
    final JsonParser parser = open(input);
    final Spliterator<Value.ObjectValue> elements = new Spliterators.AbstractSpliterator<>(Long.MAX_VALUE,
        Spliterator.ORDERED | Spliterator.NONNULL) {
      private boolean finished;

      @Override
      public boolean tryAdvance(Consumer<? super Value.ObjectValue> action) {
        if (finished) {
          return false;
        }
        try {
          final Optional<Value.ObjectValue> next = nextElement(parser);
          next.ifPresentOrElse(action, () -> finished = true);
          return next.isPresent();
        } catch (IOException e) {
          throw new UncheckedIOException("Failed to parse streaming JSON", e);
        }
      }
    };
    return StreamSupport.stream(elements, false).onClose(() -> close(parser));
  }

  /// Number of elements in the top level array, skipping their contents without building values
  public static long countItems(InputStream input) {
    final JsonParser parser = open(input);
    try {
      long count = 0;
      JsonToken token;
      while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
        if (token == null) {
          throw new IllegalArgumentException("JSON array is not terminated");
        }
        parser.skipChildren();
        count++;
      }
      final long counted = count;
      LOGGER.fine(() -> "Counted " + counted + " items in JSON stream");
      return count;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to count items in JSON stream", e);
    } finally {
      close(parser);
    }
  }

  /// At most `maxItems` elements as `{"items": [...], "count": n, "hasMore": bool}` where `hasMore` reports whether
  /// the array holds further elements
  public static Value.ObjectValue readPartial(InputStream input, int maxItems) {
    if (maxItems < 0) {
      throw new IllegalArgumentException("maxItems must not be negative: " + maxItems);
    }
    final JsonParser parser = open(input);
    try {
      final List<Value> items = new ArrayList<>();
      while (items.size() < maxItems) {
        final Optional<Value.ObjectValue> next = nextElement(parser);
        if (next.isEmpty()) {
          break;
        }
        items.add(next.get());
      }
      final boolean hasMore = items.size() == maxItems && hasAnotherElement(parser);
      final Map<String, Value> result = new LinkedHashMap<>();
      result.put("items", new Value.ArrayValue(items));
      result.put("count", new Value.Int32(items.size()));
      result.put("hasMore", new Value.Bool(hasMore));
      return new Value.ObjectValue(result);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to parse partial JSON stream", e);
    } finally {
      close(parser);
    }
  }

  private static boolean hasAnotherElement(JsonParser parser) throws IOException {
    final JsonToken token = parser.nextToken();
    return token != null && token != JsonToken.END_ARRAY;
  }

  private static JsonParser open(InputStream input) {
    Objects.requireNonNull(input, "input must not be null");
    final JsonParser parser;
    try {
      parser = JsonValues.MAPPER.getFactory().createParser(input);
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to open JSON stream", e);
    }
    parser.disable(JsonParser.Feature.AUTO_CLOSE_SOURCE);
    try {
      if (parser.nextToken() != JsonToken.START_ARRAY) {
        throw new IllegalArgumentException("Expected a JSON array at the top level");
      }
      return parser;
    } catch (IOException | RuntimeException e) {
      close(parser);
      if (e instanceof IOException io) {
        throw new UncheckedIOException("Failed to open JSON stream", io);
      }
      throw (RuntimeException) e;
    }
  }

  private static Optional<Value.ObjectValue> nextElement(JsonParser parser) throws IOException {
    final JsonToken token = parser.nextToken();
    if (token == JsonToken.END_ARRAY) {
      return Optional.empty();
    }
    if (token == null) {
      throw new IllegalArgumentException("JSON array is not terminated");
    }
    if (token != JsonToken.START_OBJECT) {
      throw new IllegalArgumentException("Expected a JSON object element but found " + token + " at " + parser.currentLocation());
    }
    return Optional.of(JsonValues.readObject(parser));
  }

  private static void close(JsonParser parser) {
    try {
      parser.close();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
