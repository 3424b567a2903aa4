// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.util.zip.Deflater;

/// Speed and size trade-off of the single GZIP compressor. NONE disables the compression stage.
public enum CompressionLevel {
  NONE(Deflater.NO_COMPRESSION),
  FASTEST(Deflater.BEST_SPEED),
  OPTIMAL(6),
  SMALLEST_SIZE(Deflater.BEST_COMPRESSION);

  final int deflaterLevel;

  CompressionLevel(int deflaterLevel) {
    this.deflaterLevel = deflaterLevel;
  }

  public boolean enabled() {
    return this != NONE;
  }
}
