// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.time.Instant;
import java.util.*;

/// Meta categorization of tags for cleaner switch expressions
enum MetaTag {
  VALUE,      // Scalars written directly
  CONTAINER,  // Recurse into nested tagged values
  FALLBACK    // Anything outside the registry
}

/// Type tag enum for identifying the kind of value that follows in the wire format.
/// The byte codes and schema names are fixed by the format and must never be renumbered.
public enum Tag {
  NULL(0x00, "null", MetaTag.VALUE),
  STRING(0x01, "string", MetaTag.VALUE, String.class),
  INT32(0x02, "int", MetaTag.VALUE, Integer.class),
  INT64(0x03, "long", MetaTag.VALUE, Long.class),
  DOUBLE(0x04, "double", MetaTag.VALUE, Double.class),
  BOOL(0x05, "bool", MetaTag.VALUE, Boolean.class),
  TIMESTAMP(0x06, "datetime", MetaTag.VALUE, Instant.class),
  GUID(0x07, "guid", MetaTag.VALUE, UUID.class),
  BYTES(0x08, "bytes", MetaTag.VALUE, byte[].class),
  ARRAY(0x09, "array", MetaTag.CONTAINER),
  OBJECT(0x0A, "object", MetaTag.CONTAINER),
  OPAQUE(0xFF, "object", MetaTag.FALLBACK);

  private static final Tag[] BY_CODE = new Tag[256];

  static {
    for (Tag tag : values()) {
      BY_CODE[tag.code & 0xFF] = tag;
    }
  }

  final byte code;
  final String schemaName;
  final MetaTag metaTag;
  final Class<?>[] javaClasses;

  Tag(int code, String schemaName, MetaTag metaTag, Class<?>... javaClasses) {
    Objects.requireNonNull(schemaName);
    Objects.requireNonNull(metaTag);
    this.code = (byte) code;
    this.schemaName = schemaName;
    this.metaTag = metaTag;
    this.javaClasses = javaClasses;
  }

  public byte code() {
    return code;
  }

  /// The canonical type name used in schema descriptors
  public String schemaName() {
    return schemaName;
  }

  /// Scalars that carry a canonical schema name of their own (the containers and the fallback do not)
  public boolean isScalar() {
    return metaTag == MetaTag.VALUE;
  }

  /// Registered tag of the value, or OPAQUE for the fallback variant
  public static Tag of(Value value) {
    Objects.requireNonNull(value, "value must not be null, use Value.NULL");
    return value.tag();
  }

  /// Exact-kind lookup of a plain Java class. Subtypes and near matches such as `Short` or `Float` are not coerced.
  static Optional<Tag> forJavaClass(Class<?> clazz) {
    return Arrays.stream(values())
        .filter(tag -> Arrays.stream(tag.javaClasses).anyMatch(supported -> supported.equals(clazz)))
        .findFirst();
  }

  static Tag fromByte(byte code) {
    final Tag tag = BY_CODE[code & 0xFF];
    if (tag == null) {
      throw new FramingException("Unknown value tag 0x" + Integer.toHexString(code & 0xFF));
    }
    return tag;
  }

  /// Scalar tag owning the canonical schema name, if any
  static Optional<Tag> forSchemaName(String name) {
    return Arrays.stream(values())
        .filter(Tag::isScalar)
        .filter(tag -> tag.schemaName.equals(name))
        .findFirst();
  }
}
