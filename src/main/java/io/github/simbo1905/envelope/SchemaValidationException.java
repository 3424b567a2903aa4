// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.util.Objects;

/// A required field is missing or a leaf value does not have the kind named by the embedded schema
public final class SchemaValidationException extends EnvelopeException {

  private final String fieldName;

  public SchemaValidationException(String fieldName, String message) {
    super(message);
    this.fieldName = Objects.requireNonNull(fieldName);
  }

  /// The offending field
  public String fieldName() {
    return fieldName;
  }
}
