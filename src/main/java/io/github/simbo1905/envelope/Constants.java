// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.nio.charset.StandardCharsets;

/// Enum containing the fixed header fields of the envelope and their sizes
enum Constants {
  MAGIC(4),
  VERSION(Byte.BYTES),
  FLAGS(Byte.BYTES),
  TIMESTAMP(Long.BYTES),
  LENGTH(Integer.BYTES);

  /// ASCII "TUSK"
  static final byte[] MAGIC_BYTES = "TUSK".getBytes(StandardCharsets.US_ASCII);
  static final byte CURRENT_VERSION = 1;
  static final int HEADER_SIZE = MAGIC.sizeInBytes + VERSION.sizeInBytes + FLAGS.sizeInBytes + TIMESTAMP.sizeInBytes;

  final int sizeInBytes;

  Constants(int sizeInBytes) {
    this.sizeInBytes = sizeInBytes;
  }
}
