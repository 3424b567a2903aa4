// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.jetbrains.annotations.NotNull;

import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/// Entry point for serializing Java objects. The object is projected onto a field map, encoded into an envelope and
/// passed through the transform pipeline; deserialization runs the same steps backwards.
///
/// ```java
/// final var serializer = TaggedSerializer.create();
/// final var options = SerializationOptions.defaults().withEncryption("secret");
/// final byte[] bytes = serializer.serialize(new Person("Ann", 30), options);
/// final Person person = serializer.deserialize(bytes, Person.class, options);
/// ```
public final class TaggedSerializer {

  private final EnvelopeCodec codec;
  private final Map<Class<?>, FieldMapper<?>> mappers = new ConcurrentHashMap<>();

  TaggedSerializer(EnvelopeCodec codec) {
    this.codec = Objects.requireNonNull(codec);
  }

  public static TaggedSerializer create() {
    return new TaggedSerializer(EnvelopeCodec.create());
  }

  /// Use an explicit mapper for a type instead of reflective projection
  public <T> TaggedSerializer register(@NotNull Class<T> type, @NotNull FieldMapper<T> mapper) {
    mappers.put(Objects.requireNonNull(type), Objects.requireNonNull(mapper));
    return this;
  }

  public byte[] serialize(Object object, @NotNull SerializationOptions options) {
    return codec.encode(toFieldMap(object), options);
  }

  /// Decode and project into the target type. `Map.class` yields plain Java values and `Value.ObjectValue.class`
  /// yields the decoded field map itself.
  public <T> T deserialize(@NotNull byte[] bytes, @NotNull Class<T> type, @NotNull SerializationOptions options) {
    Objects.requireNonNull(type, "type must not be null");
    final Value.ObjectValue fields = codec.decode(bytes, options);
    if (type == Value.ObjectValue.class || type == Value.class || type == Object.class) {
      return type.cast(fields);
    }
    if (type == Map.class) {
      return type.cast(Values.toJavaMap(fields));
    }
    return mapperFor(type).fromFieldMap(fields);
  }

  /// A field map is returned unchanged, a map with string keys is converted entry by entry and anything else is
  /// projected one level deep through its mapper. Collections, arrays and maps with other keys have no field names
  /// and are refused.
  @SuppressWarnings("unchecked")
  public Value.ObjectValue toFieldMap(Object object) {
    if (object == null) {
      return Value.ObjectValue.EMPTY;
    }
    if (object instanceof Value.ObjectValue fields) {
      return fields;
    }
    if (object instanceof Map<?, ?> map) {
      if (!map.keySet().stream().allMatch(String.class::isInstance)) {
        throw new IllegalArgumentException("Map keys must all be strings to serialize as fields: " + object.getClass().getName());
      }
      return Values.objectOf(map);
    }
    if (object instanceof Collection<?> || object.getClass().isArray()) {
      throw new IllegalArgumentException("Cannot serialize " + object.getClass().getName() + " as a field map, wrap it in a record or a map");
    }
    return ((FieldMapper<Object>) mapperFor(object.getClass())).toFieldMap(object);
  }

  @SuppressWarnings("unchecked")
  <T> FieldMapper<T> mapperFor(Class<T> type) {
    return (FieldMapper<T>) mappers.computeIfAbsent(type, ObjectProjection::new);
  }
}
