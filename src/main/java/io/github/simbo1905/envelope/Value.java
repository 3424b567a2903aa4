// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.jetbrains.annotations.NotNull;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.time.Instant;
import java.util.*;

/// The universal unit the codec operates on. There is one record per registered kind plus the
/// `Opaque` fallback which carries a runtime type name and a textual rendering of a value of any other kind.
/// `null` is never a legal `Value`, use `Value.NULL`.
public sealed interface Value permits
    Value.NullValue, Value.StringValue, Value.Int32, Value.Int64, Value.Float64, Value.Bool,
    Value.Timestamp, Value.Guid, Value.Bytes, Value.ArrayValue, Value.ObjectValue, Value.Opaque {

  NullValue NULL = new NullValue();

  /// The wire tag of this kind
  Tag tag();

  record NullValue() implements Value {
    @Override
    public Tag tag() {
      return Tag.NULL;
    }
  }

  record StringValue(@NotNull String value) implements Value {
    public StringValue {
      Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public Tag tag() {
      return Tag.STRING;
    }
  }

  record Int32(int value) implements Value {
    @Override
    public Tag tag() {
      return Tag.INT32;
    }
  }

  record Int64(long value) implements Value {
    @Override
    public Tag tag() {
      return Tag.INT64;
    }
  }

  record Float64(double value) implements Value {
    @Override
    public Tag tag() {
      return Tag.DOUBLE;
    }
  }

  record Bool(boolean value) implements Value {
    @Override
    public Tag tag() {
      return Tag.BOOL;
    }
  }

  /// 100 nanosecond ticks since 0001-01-01T00:00:00Z
  record Timestamp(long ticks) implements Value {
    static final long TICKS_PER_SECOND = 10_000_000L;
    static final long NANOS_PER_TICK = 100L;
    /// Seconds between 0001-01-01 and the unix epoch
    static final long EPOCH_OFFSET_SECONDS = 62_135_596_800L;

    public static Timestamp of(Instant instant) {
      Objects.requireNonNull(instant, "instant must not be null");
      final long seconds = Math.addExact(instant.getEpochSecond(), EPOCH_OFFSET_SECONDS);
      return new Timestamp(Math.addExact(Math.multiplyExact(seconds, TICKS_PER_SECOND), instant.getNano() / NANOS_PER_TICK));
    }

    public static Timestamp now() {
      return of(Instant.now());
    }

    public Instant toInstant() {
      final long seconds = Math.floorDiv(ticks, TICKS_PER_SECOND) - EPOCH_OFFSET_SECONDS;
      final long nanos = Math.floorMod(ticks, TICKS_PER_SECOND) * NANOS_PER_TICK;
      return Instant.ofEpochSecond(seconds, nanos);
    }

    @Override
    public Tag tag() {
      return Tag.TIMESTAMP;
    }
  }

  /// 128-bit identifier. On the wire the first three groups are little-endian and the last eight bytes are in order.
  record Guid(@NotNull UUID value) implements Value {
    static final int BYTES = 16;

    public Guid {
      Objects.requireNonNull(value, "value must not be null");
    }

    byte[] toWireBytes() {
      final ByteBuffer buffer = ByteBuffer.allocate(BYTES);
      final long msb = value.getMostSignificantBits();
      buffer.order(ByteOrder.LITTLE_ENDIAN);
      buffer.putInt((int) (msb >>> 32));
      buffer.putShort((short) (msb >>> 16));
      buffer.putShort((short) msb);
      buffer.order(ByteOrder.BIG_ENDIAN);
      buffer.putLong(value.getLeastSignificantBits());
      return buffer.array();
    }

    static Guid fromWireBytes(byte[] bytes) {
      if (bytes.length != BYTES) {
        throw new IllegalArgumentException("Guid needs " + BYTES + " bytes but got " + bytes.length);
      }
      final ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
      final long a = buffer.getInt() & 0xFFFFFFFFL;
      final long b = buffer.getShort() & 0xFFFFL;
      final long c = buffer.getShort() & 0xFFFFL;
      buffer.order(ByteOrder.BIG_ENDIAN);
      final long lsb = buffer.getLong();
      return new Guid(new UUID((a << 32) | (b << 16) | c, lsb));
    }

    @Override
    public Tag tag() {
      return Tag.GUID;
    }
  }

  /// Opaque byte sequence. The array is copied on the way in and on the way out.
  record Bytes(byte[] value) implements Value {
    public Bytes {
      Objects.requireNonNull(value, "value must not be null");
      value = value.clone();
    }

    @Override
    public byte[] value() {
      return value.clone();
    }

    byte[] unsafeArray() {
      return value;
    }

    @Override
    public Tag tag() {
      return Tag.BYTES;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Bytes other && Arrays.equals(value, other.value);
    }

    @Override
    public int hashCode() {
      return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
      return "Bytes[length=" + value.length + "]";
    }
  }

  record ArrayValue(@NotNull List<Value> elements) implements Value {
    public ArrayValue {
      elements = List.copyOf(elements);
    }

    public static ArrayValue of(Value... elements) {
      return new ArrayValue(List.of(elements));
    }

    @Override
    public Tag tag() {
      return Tag.ARRAY;
    }
  }

  /// Field name to value mapping that keeps insertion order
  record ObjectValue(@NotNull Map<String, Value> fields) implements Value {
    public static final ObjectValue EMPTY = new ObjectValue(Map.of());

    public ObjectValue {
      Objects.requireNonNull(fields, "fields must not be null");
      final Map<String, Value> copy = new LinkedHashMap<>(fields.size() * 2);
      fields.forEach((name, value) -> copy.put(
          Objects.requireNonNull(name, "field name must not be null"),
          Objects.requireNonNull(value, () -> "field " + name + " is null, use Value.NULL")));
      fields = Collections.unmodifiableMap(copy);
    }

    public Optional<Value> get(String name) {
      return Optional.ofNullable(fields.get(name));
    }

    public int size() {
      return fields.size();
    }

    @Override
    public Tag tag() {
      return Tag.OBJECT;
    }
  }

  /// A value of a kind outside the registry, carried as its runtime type name and a JSON rendering
  record Opaque(@NotNull String typeName, @NotNull String text) implements Value {
    public Opaque {
      Objects.requireNonNull(typeName, "typeName must not be null");
      Objects.requireNonNull(text, "text must not be null");
    }

    /// Parse the fallback text into a generic value tree
    public Value parse() {
      return JsonValues.parse(text);
    }

    @Override
    public Tag tag() {
      return Tag.OPAQUE;
    }
  }
}
