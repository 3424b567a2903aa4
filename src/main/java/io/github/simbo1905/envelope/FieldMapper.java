// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

/// Explicit mapping between a Java type and the field map the envelope carries. Register a hand written mapper with
/// `TaggedSerializer.register` to avoid reflection; `ObjectProjection` is the reflective default.
public interface FieldMapper<T> {

  Value.ObjectValue toFieldMap(T record);

  T fromFieldMap(Value.ObjectValue fields);

  static <T> FieldMapper<T> reflective(Class<T> type) {
    return new ObjectProjection<>(type);
  }
}
