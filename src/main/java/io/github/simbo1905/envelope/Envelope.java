// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.jetbrains.annotations.NotNull;

import java.util.Objects;
import java.util.Optional;

/// A fully parsed envelope: header fields, the optional embedded schema and the data block.
/// The `hasSchema` flag is true exactly when a schema is present.
public record Envelope(byte version,
                       @NotNull Flags flags,
                       @NotNull Value.Timestamp timestamp,
                       @NotNull Optional<TypeDescriptor.ObjectOf> schema,
                       @NotNull Value.ObjectValue data) {

  public Envelope {
    Objects.requireNonNull(flags, "flags must not be null");
    Objects.requireNonNull(timestamp, "timestamp must not be null");
    Objects.requireNonNull(schema, "schema must not be null");
    Objects.requireNonNull(data, "data must not be null");
    if (flags.hasSchema() != schema.isPresent()) {
      throw new IllegalArgumentException("hasSchema flag is " + flags.hasSchema() + " but schema present is " + schema.isPresent());
    }
  }

  /// The fixed marker bytes, identical for every envelope
  public byte[] magic() {
    return Constants.MAGIC_BYTES.clone();
  }
}
