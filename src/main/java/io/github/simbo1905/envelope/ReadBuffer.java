// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/// Bounds checked little-endian reader. Every read that would pass the end of the buffer raises a
/// TruncationException naming what was being read, never a BufferUnderflowException.
final class ReadBuffer {

  private final ByteBuffer buffer;

  ReadBuffer(byte[] bytes) {
    this.buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
  }

  private void require(int needed, String what) {
    if (buffer.remaining() < needed) {
      throw new TruncationException("Truncated reading " + what + " at position " + buffer.position() +
          ": need " + needed + " bytes but only " + buffer.remaining() + " remain");
    }
  }

  byte get(String what) {
    require(Byte.BYTES, what);
    return buffer.get();
  }

  int getInt(String what) {
    require(Integer.BYTES, what);
    return buffer.getInt();
  }

  long getLong(String what) {
    require(Long.BYTES, what);
    return buffer.getLong();
  }

  double getDouble(String what) {
    require(Double.BYTES, what);
    return buffer.getDouble();
  }

  byte[] getBytes(int length, String what) {
    require(length, what);
    final byte[] bytes = new byte[length];
    buffer.get(bytes);
    return bytes;
  }

  /// An int32 length or count. Negative values can never be satisfied so they are reported as truncation.
  int getLength(String what) {
    final int length = getInt(what + " length");
    if (length < 0) {
      throw new TruncationException("Negative " + what + " length " + length + " at position " + (buffer.position() - Integer.BYTES));
    }
    return length;
  }

  /// An int32 element count. Each element occupies at least `minElementSize` bytes so a count the remaining
  /// bytes cannot hold is rejected before anything is allocated for it.
  int getCount(String what, int minElementSize) {
    final int count = getInt(what + " count");
    if (count < 0) {
      throw new TruncationException("Negative " + what + " count " + count + " at position " + (buffer.position() - Integer.BYTES));
    }
    if ((long) count * minElementSize > buffer.remaining()) {
      throw new TruncationException("Truncated reading " + what + ": count " + count + " cannot fit in the " +
          buffer.remaining() + " bytes that remain");
    }
    return count;
  }

  byte[] getLengthPrefixed(String what) {
    return getBytes(getLength(what), what);
  }

  /// UTF-8 text. Malformed bytes are a framing error rather than being replaced.
  String getString(String what) {
    final int at = buffer.position();
    final byte[] bytes = getLengthPrefixed(what);
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException e) {
      throw new FramingException("Invalid UTF-8 in " + what + " at position " + at + ": " + e.getMessage(), e);
    }
  }

  int position() {
    return buffer.position();
  }

  int remaining() {
    return buffer.remaining();
  }
}
