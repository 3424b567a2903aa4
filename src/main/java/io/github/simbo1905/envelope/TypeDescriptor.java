// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.jetbrains.annotations.NotNull;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// Structural type tree inferred from a value and embedded as the optional schema block.
/// All nodes are nested within this interface to provide a clean API.
public sealed interface TypeDescriptor permits TypeDescriptor.Scalar, TypeDescriptor.ArrayOf, TypeDescriptor.ObjectOf {

  Scalar OBJECT = new Scalar(Tag.OBJECT.schemaName());

  /// A canonical type name such as `int` or `string`, or the catch-all `object`
  record Scalar(@NotNull String name) implements TypeDescriptor {
    public Scalar {
      Objects.requireNonNull(name, "name must not be null");
    }

    static Scalar of(Tag tag) {
      return new Scalar(tag.schemaName());
    }
  }

  /// Homogeneous array, the element descriptor is taken from the first element
  record ArrayOf(@NotNull TypeDescriptor element) implements TypeDescriptor {
    public ArrayOf {
      Objects.requireNonNull(element, "element must not be null");
    }
  }

  /// Named properties in insertion order
  record ObjectOf(@NotNull Map<String, TypeDescriptor> properties) implements TypeDescriptor {
    public ObjectOf {
      Objects.requireNonNull(properties, "properties must not be null");
      properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }
  }
}
