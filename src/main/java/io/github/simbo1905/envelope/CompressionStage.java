// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;

/// GZIP over the entire buffer. There is one algorithm and the level only trades speed for size.
final class CompressionStage implements TransformStage {

  /// First two bytes of every GZIP member
  static final byte[] GZIP_MAGIC = {(byte) 0x1f, (byte) 0x8b};

  private final CompressionLevel level;

  CompressionStage(CompressionLevel level) {
    this.level = Objects.requireNonNull(level);
    if (!level.enabled()) {
      throw new IllegalArgumentException("Compression stage needs a level other than " + level);
    }
  }

  @Override
  public String name() {
    return "gzip(" + level + ")";
  }

  @Override
  public byte[] apply(byte[] input) {
    final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
    try (GZIPOutputStream gzip = new GZIPOutputStream(out) {
      {
        def.setLevel(level.deflaterLevel);
      }
    }) {
      gzip.write(input);
    } catch (IOException e) {
      throw new TransformException("Compression failed: " + e.getMessage(), e);
    }
    final byte[] result = out.toByteArray();
    LOGGER.fine(() -> "Compressed " + input.length + " bytes to " + result.length + " bytes at " + level);
    return result;
  }

  @Override
  public byte[] invert(byte[] input) {
    final byte[] scratch = ScratchPool.COPY_BUFFERS.borrow();
    try (GZIPInputStream gzip = new GZIPInputStream(new ByteArrayInputStream(input))) {
      final ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length * 2));
      int read;
      while ((read = gzip.read(scratch)) != -1) {
        out.write(scratch, 0, read);
      }
      final byte[] result = out.toByteArray();
      LOGGER.fine(() -> "Decompressed " + input.length + " bytes to " + result.length + " bytes");
      return result;
    } catch (IOException e) {
      throw new TransformException("Decompression failed, the buffer is not GZIP data or is corrupt: " + e.getMessage(), e);
    } finally {
      ScratchPool.COPY_BUFFERS.release(scratch);
    }
  }

  static boolean looksCompressed(byte[] bytes) {
    return bytes.length >= GZIP_MAGIC.length && bytes[0] == GZIP_MAGIC[0] && bytes[1] == GZIP_MAGIC[1];
  }
}
