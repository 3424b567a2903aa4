// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.util.LinkedHashMap;
import java.util.Map;

/// Infers a TypeDescriptor from a value tree. Arrays are assumed homogeneous: only the first element is inspected.
public final class SchemaGenerator {

  private SchemaGenerator() {
  }

  public static TypeDescriptor.ObjectOf infer(Value.ObjectValue fields) {
    final Map<String, TypeDescriptor> properties = new LinkedHashMap<>(fields.size() * 2);
    fields.fields().forEach((name, value) -> properties.put(name, infer(value)));
    return new TypeDescriptor.ObjectOf(properties);
  }

  public static TypeDescriptor infer(Value value) {
    return switch (value.tag()) {
      case NULL, STRING, INT32, INT64, DOUBLE, BOOL, TIMESTAMP, GUID, BYTES -> TypeDescriptor.Scalar.of(value.tag());
      case ARRAY -> {
        final var elements = ((Value.ArrayValue) value).elements();
        yield new TypeDescriptor.ArrayOf(elements.isEmpty() ? TypeDescriptor.OBJECT : infer(elements.get(0)));
      }
      case OBJECT -> infer((Value.ObjectValue) value);
      case OPAQUE -> TypeDescriptor.OBJECT;
    };
  }
}
