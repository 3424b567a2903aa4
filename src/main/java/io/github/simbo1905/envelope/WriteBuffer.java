// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/// Growable little-endian write buffer. Instances are pooled and not thread safe; one encode owns one buffer.
final class WriteBuffer {

  private ByteBuffer buffer;

  WriteBuffer(int initialCapacity) {
    this.buffer = ByteBuffer.allocate(Math.max(initialCapacity, 64)).order(ByteOrder.LITTLE_ENDIAN);
  }

  private void ensureRemaining(int needed) {
    if (buffer.remaining() >= needed) {
      return;
    }
    final int required = Math.addExact(buffer.position(), needed);
    int capacity = buffer.capacity();
    while (capacity < required) {
      capacity = capacity > Integer.MAX_VALUE / 2 ? required : capacity * 2;
    }
    final ByteBuffer grown = ByteBuffer.allocate(capacity).order(ByteOrder.LITTLE_ENDIAN);
    buffer.flip();
    grown.put(buffer);
    buffer = grown;
  }

  WriteBuffer put(byte value) {
    ensureRemaining(Byte.BYTES);
    buffer.put(value);
    return this;
  }

  WriteBuffer putInt(int value) {
    ensureRemaining(Integer.BYTES);
    buffer.putInt(value);
    return this;
  }

  WriteBuffer putLong(long value) {
    ensureRemaining(Long.BYTES);
    buffer.putLong(value);
    return this;
  }

  WriteBuffer putDouble(double value) {
    ensureRemaining(Double.BYTES);
    buffer.putDouble(value);
    return this;
  }

  WriteBuffer putBytes(byte[] bytes) {
    ensureRemaining(bytes.length);
    buffer.put(bytes);
    return this;
  }

  /// int32 length followed by the raw bytes
  WriteBuffer putLengthPrefixed(byte[] bytes) {
    return putInt(bytes.length).putBytes(bytes);
  }

  /// int32 length followed by the UTF-8 encoding
  WriteBuffer putString(String s) {
    Objects.requireNonNull(s);
    return putLengthPrefixed(s.getBytes(StandardCharsets.UTF_8));
  }

  int position() {
    return buffer.position();
  }

  byte[] toByteArray() {
    return Arrays.copyOf(buffer.array(), buffer.position());
  }

  /// Clear for reuse. Answers false when the buffer has grown too large to be worth pooling.
  boolean reset(int maxRetainedCapacity) {
    buffer.clear();
    return buffer.capacity() <= maxRetainedCapacity;
  }

  @Override
  public String toString() {
    return "WriteBuffer{position=" + buffer.position() + ", capacity=" + buffer.capacity() + '}';
  }
}
