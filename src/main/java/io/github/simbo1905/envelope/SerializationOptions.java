// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/// Per call configuration. Decode must be given the same compression and encryption settings, including the same
/// key, that were used to encode: the header flags are never consulted to pick the decode pipeline.
public record SerializationOptions(boolean includeSchema,
                                   boolean validateSchema,
                                   @NotNull CompressionLevel compressionLevel,
                                   boolean encrypt,
                                   @Nullable String encryptionKey) {

  public SerializationOptions {
    Objects.requireNonNull(compressionLevel, "compressionLevel must not be null");
    if (encrypt && (encryptionKey == null || encryptionKey.isEmpty())) {
      throw new IllegalArgumentException("encrypt is set but no encryptionKey was given");
    }
  }

  /// Schema embedded and validated, optimal compression, no encryption
  public static SerializationOptions defaults() {
    return new SerializationOptions(true, true, CompressionLevel.OPTIMAL, false, null);
  }

  /// Every optional stage off
  public static SerializationOptions plain() {
    return new SerializationOptions(false, false, CompressionLevel.NONE, false, null);
  }

  public SerializationOptions withIncludeSchema(boolean includeSchema) {
    return new SerializationOptions(includeSchema, validateSchema, compressionLevel, encrypt, encryptionKey);
  }

  public SerializationOptions withValidateSchema(boolean validateSchema) {
    return new SerializationOptions(includeSchema, validateSchema, compressionLevel, encrypt, encryptionKey);
  }

  public SerializationOptions withCompression(CompressionLevel compressionLevel) {
    return new SerializationOptions(includeSchema, validateSchema, compressionLevel, encrypt, encryptionKey);
  }

  public SerializationOptions withEncryption(String encryptionKey) {
    return new SerializationOptions(includeSchema, validateSchema, compressionLevel, true, encryptionKey);
  }

  public SerializationOptions withoutEncryption() {
    return new SerializationOptions(includeSchema, validateSchema, compressionLevel, false, null);
  }

  @Override
  public String toString() {
    return "SerializationOptions[includeSchema=" + includeSchema +
        ", validateSchema=" + validateSchema +
        ", compressionLevel=" + compressionLevel +
        ", encrypt=" + encrypt +
        ", encryptionKey=" + (encryptionKey == null ? "null" : "***") + ']';
  }
}
