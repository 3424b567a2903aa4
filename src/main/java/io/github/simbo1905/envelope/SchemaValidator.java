// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;

/// Checks decoded data against the schema embedded beside it.
///
/// Every property of the schema must be present. A property with a scalar descriptor must hold a value of exactly
/// that kind, and `null` only matches the name `null`. A property with an array or object descriptor is accepted
/// whatever it holds: container descriptors are not checked recursively.
public final class SchemaValidator {

  private SchemaValidator() {
  }

  public static void validate(Value.ObjectValue data, TypeDescriptor.ObjectOf schema) {
    schema.properties().forEach((name, descriptor) -> {
      final Value actual = data.fields().get(name);
      if (actual == null) {
        throw new SchemaValidationException(name, "Schema validation failed: missing required field '" + name + "'");
      }
      if (descriptor instanceof TypeDescriptor.Scalar scalar && !matches(actual, scalar.name())) {
        throw new SchemaValidationException(name, "Schema validation failed: field '" + name + "' has kind " +
            actual.tag().schemaName() + " but schema expects " + scalar.name());
      }
    });
    LOGGER.finer(() -> "Validated " + data.size() + " fields against " + schema.properties().size() + " schema properties");
  }

  /// Leaf check. `object` and names this codec does not know accept anything.
  static boolean matches(Value value, String expected) {
    if (value.tag() == Tag.NULL) {
      return Tag.NULL.schemaName().equals(expected);
    }
    return Tag.forSchemaName(expected)
        .map(tag -> tag == value.tag())
        .orElse(true);
  }
}
