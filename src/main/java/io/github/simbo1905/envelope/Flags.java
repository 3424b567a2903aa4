// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

/// The header flag byte. The bits record what the encoder did and are informational only:
/// decode never uses them to choose whether to decrypt or decompress.
public record Flags(boolean hasSchema, boolean wasCompressed, boolean wasEncrypted) {

  static final int HAS_SCHEMA = 0x01;
  static final int WAS_COMPRESSED = 0x02;
  static final int WAS_ENCRYPTED = 0x04;
  static final int KNOWN_BITS = HAS_SCHEMA | WAS_COMPRESSED | WAS_ENCRYPTED;

  static Flags from(SerializationOptions options) {
    return new Flags(options.includeSchema(), options.compressionLevel().enabled(), options.encrypt());
  }

  static Flags fromByte(byte bits) {
    return new Flags((bits & HAS_SCHEMA) != 0, (bits & WAS_COMPRESSED) != 0, (bits & WAS_ENCRYPTED) != 0);
  }

  static boolean onlyKnownBits(byte bits) {
    return (bits & ~KNOWN_BITS) == 0;
  }

  byte toByte() {
    int bits = 0;
    if (hasSchema) bits |= HAS_SCHEMA;
    if (wasCompressed) bits |= WAS_COMPRESSED;
    if (wasEncrypted) bits |= WAS_ENCRYPTED;
    return (byte) bits;
  }
}
