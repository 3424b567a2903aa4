// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.time.Instant;
import java.util.*;

/// Conversion between plain Java objects and the Value model.
///
/// Exactly `String`, `Integer`, `Long`, `Double`, `Boolean`, `Instant`, `UUID`, `byte[]`, `List` and `Map` with
/// string keys are recognized. Everything else, including near matches such as `Short`, `Float` or `Set`, becomes an
/// `Opaque` carrying the class name and a JSON rendering.
public final class Values {

  private Values() {
  }

  public static Value of(Object object) {
    if (object == null) {
      return Value.NULL;
    }
    if (object instanceof Value value) {
      return value;
    }
    final Optional<Tag> tag = Tag.forJavaClass(object.getClass());
    if (tag.isPresent()) {
      return switch (tag.get()) {
        case STRING -> new Value.StringValue((String) object);
        case INT32 -> new Value.Int32((Integer) object);
        case INT64 -> new Value.Int64((Long) object);
        case DOUBLE -> new Value.Float64((Double) object);
        case BOOL -> new Value.Bool((Boolean) object);
        case TIMESTAMP -> Value.Timestamp.of((Instant) object);
        case GUID -> new Value.Guid((UUID) object);
        case BYTES -> new Value.Bytes((byte[]) object);
        default -> throw new IllegalStateException("No Java conversion for " + tag.get());
      };
    }
    if (object instanceof List<?> list) {
      final List<Value> elements = new ArrayList<>(list.size());
      list.forEach(element -> elements.add(of(element)));
      return new Value.ArrayValue(elements);
    }
    if (object instanceof Map<?, ?> map && map.keySet().stream().allMatch(String.class::isInstance)) {
      return objectOf(map);
    }
    return opaque(object);
  }

  /// Field map from a map with string keys
  public static Value.ObjectValue objectOf(Map<?, ?> map) {
    final Map<String, Value> fields = new LinkedHashMap<>(map.size() * 2);
    map.forEach((key, value) -> fields.put((String) key, of(value)));
    return new Value.ObjectValue(fields);
  }

  public static Value.Opaque opaque(Object object) {
    return new Value.Opaque(object.getClass().getName(), JsonValues.render(object));
  }

  /// Plain Java form of a value. Opaque values are returned as the Java form of their parsed fallback text.
  public static Object toJava(Value value) {
    return switch (value.tag()) {
      case NULL -> null;
      case STRING -> ((Value.StringValue) value).value();
      case INT32 -> ((Value.Int32) value).value();
      case INT64 -> ((Value.Int64) value).value();
      case DOUBLE -> ((Value.Float64) value).value();
      case BOOL -> ((Value.Bool) value).value();
      case TIMESTAMP -> ((Value.Timestamp) value).toInstant();
      case GUID -> ((Value.Guid) value).value();
      case BYTES -> ((Value.Bytes) value).value();
      case ARRAY -> {
        final List<Object> list = new ArrayList<>();
        ((Value.ArrayValue) value).elements().forEach(element -> list.add(toJava(element)));
        yield list;
      }
      case OBJECT -> toJavaMap((Value.ObjectValue) value);
      case OPAQUE -> toJava(((Value.Opaque) value).parse());
    };
  }

  public static Map<String, Object> toJavaMap(Value.ObjectValue fields) {
    final Map<String, Object> map = new LinkedHashMap<>(fields.size() * 2);
    fields.fields().forEach((name, value) -> map.put(name, toJava(value)));
    return map;
  }
}
