// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.TestOnly;

import java.util.*;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static io.github.simbo1905.envelope.Constants.*;

/// Writes and reads the envelope: fixed header, optional schema block and the tagged value tree, and wraps the
/// result in the transform pipeline selected by the caller's options.
///
/// ```
/// magic[4] version[1] flags[1] timestamp[8] (schemaLen[4] schemaJson)? fieldCount[4] (keyLen[4] key value)*
/// ```
///
/// All integers are little-endian. Instances hold no state about any buffer and are safe to share between threads.
public final class EnvelopeCodec {

  static final Logger LOGGER = Logger.getLogger(EnvelopeCodec.class.getName());

  /// Deeper nesting than this is treated as a corrupt or hostile buffer on decode and refused on encode
  static final int MAX_DEPTH = 512;

  /// Smallest encoding of a tagged value is the tag byte alone
  static final int MIN_VALUE_SIZE = 1;
  /// Smallest encoding of a field is an empty key plus a tag byte
  static final int MIN_FIELD_SIZE = LENGTH.sizeInBytes + MIN_VALUE_SIZE;

  private final Supplier<Value.Timestamp> clock;

  EnvelopeCodec(Supplier<Value.Timestamp> clock) {
    this.clock = Objects.requireNonNull(clock);
  }

  public static EnvelopeCodec create() {
    return new EnvelopeCodec(Value.Timestamp::now);
  }

  @TestOnly
  static EnvelopeCodec withClock(Supplier<Value.Timestamp> clock) {
    return new EnvelopeCodec(clock);
  }

  /// Encode a field map into an envelope and apply the optional compression and encryption stages.
  /// Values nested deeper than `MAX_DEPTH` are refused with an `IllegalArgumentException`.
  public byte[] encode(@NotNull Value.ObjectValue fields, @NotNull SerializationOptions options) {
    Objects.requireNonNull(fields, "fields must not be null");
    Objects.requireNonNull(options, "options must not be null");
    final byte[] envelope = writeEnvelope(fields, options);
    final byte[] result = TransformPipeline.of(options).encode(envelope);
    LOGGER.fine(() -> "Encoded " + fields.size() + " fields to " + result.length + " bytes (envelope " + envelope.length + " bytes)");
    return result;
  }

  /// Decode the data block of a buffer produced by `encode` with the same options
  public Value.ObjectValue decode(@NotNull byte[] bytes, @NotNull SerializationOptions options) {
    return decodeEnvelope(bytes, options).data();
  }

  /// Undo the transforms chosen by the options, parse the envelope and validate it when asked to
  public Envelope decodeEnvelope(@NotNull byte[] bytes, @NotNull SerializationOptions options) {
    Objects.requireNonNull(bytes, "bytes must not be null");
    Objects.requireNonNull(options, "options must not be null");
    final byte[] plain = TransformPipeline.of(options).decode(bytes);
    final Envelope envelope = readEnvelope(plain);
    final Flags flags = envelope.flags();
    if (flags.wasCompressed() != options.compressionLevel().enabled() || flags.wasEncrypted() != options.encrypt()) {
      LOGGER.warning(() -> "Header flags " + flags + " disagree with decode options " + options);
    }
    envelope.schema().ifPresent(schema -> {
      if (options.validateSchema()) {
        SchemaValidator.validate(envelope.data(), schema);
      }
    });
    LOGGER.fine(() -> "Decoded " + bytes.length + " bytes to " + envelope.data().size() + " fields");
    return envelope;
  }

  byte[] writeEnvelope(Value.ObjectValue fields, SerializationOptions options) {
    final WriteBuffer buffer = ScratchPool.WRITE_BUFFERS.borrow();
    try {
      buffer.putBytes(MAGIC_BYTES);
      buffer.put(CURRENT_VERSION);
      buffer.put(Flags.from(options).toByte());
      buffer.putLong(clock.get().ticks());
      if (options.includeSchema()) {
        final String schema = SchemaText.write(SchemaGenerator.infer(fields));
        LOGGER.finer(() -> "Writing schema " + schema);
        buffer.putString(schema);
      }
      writeFields(buffer, fields, 0);
      return buffer.toByteArray();
    } finally {
      ScratchPool.WRITE_BUFFERS.release(buffer);
    }
  }

  static Envelope readEnvelope(byte[] bytes) {
    final ReadBuffer buffer = new ReadBuffer(bytes);
    final byte[] magic = buffer.getBytes(MAGIC.sizeInBytes, "magic");
    if (!Arrays.equals(magic, MAGIC_BYTES)) {
      throw new FramingException("Invalid binary format: magic number mismatch, found " + HexFormat.of().formatHex(magic));
    }
    final byte version = buffer.get("version");
    if (version != CURRENT_VERSION) {
      throw new FramingException("Unsupported format version " + version + ", expected " + CURRENT_VERSION);
    }
    final Flags flags = Flags.fromByte(buffer.get("flags"));
    final Value.Timestamp timestamp = new Value.Timestamp(buffer.getLong("timestamp"));
    final Optional<TypeDescriptor.ObjectOf> schema = flags.hasSchema()
        ? Optional.of(SchemaText.parseTopLevel(buffer.getString("schema")))
        : Optional.empty();
    final Value.ObjectValue data = readFields(buffer, 0);
    if (buffer.remaining() > 0) {
      throw new FramingException(buffer.remaining() + " unexpected trailing bytes after the data block at position " + buffer.position());
    }
    return new Envelope(version, flags, timestamp, schema, data);
  }

  static void writeFields(WriteBuffer buffer, Value.ObjectValue fields, int depth) {
    buffer.putInt(fields.size());
    for (Map.Entry<String, Value> entry : fields.fields().entrySet()) {
      buffer.putString(entry.getKey());
      writeValue(buffer, entry.getValue(), depth);
    }
  }

  static void writeValue(WriteBuffer buffer, Value value, int depth) {
    if (depth > MAX_DEPTH) {
      throw new IllegalArgumentException("Cannot encode values nested deeper than " + MAX_DEPTH + " levels");
    }
    final Tag tag = value.tag();
    LOGGER.finer(() -> "writeValue " + tag + " at position " + buffer.position());
    buffer.put(tag.code());
    switch (tag) {
      case NULL -> {
      }
      case STRING -> buffer.putString(((Value.StringValue) value).value());
      case INT32 -> buffer.putInt(((Value.Int32) value).value());
      case INT64 -> buffer.putLong(((Value.Int64) value).value());
      case DOUBLE -> buffer.putDouble(((Value.Float64) value).value());
      case BOOL -> buffer.put(((Value.Bool) value).value() ? (byte) 1 : (byte) 0);
      case TIMESTAMP -> buffer.putLong(((Value.Timestamp) value).ticks());
      case GUID -> buffer.putBytes(((Value.Guid) value).toWireBytes());
      case BYTES -> buffer.putLengthPrefixed(((Value.Bytes) value).unsafeArray());
      case ARRAY -> {
        final List<Value> elements = ((Value.ArrayValue) value).elements();
        buffer.putInt(elements.size());
        for (Value element : elements) {
          writeValue(buffer, element, depth + 1);
        }
      }
      case OBJECT -> writeFields(buffer, (Value.ObjectValue) value, depth + 1);
      case OPAQUE -> {
        final Value.Opaque opaque = (Value.Opaque) value;
        buffer.putString(opaque.typeName());
        buffer.putString(opaque.text());
      }
    }
  }

  static Value.ObjectValue readFields(ReadBuffer buffer, int depth) {
    final int count = buffer.getCount("field", MIN_FIELD_SIZE);
    final Map<String, Value> fields = new LinkedHashMap<>(count * 2);
    for (int i = 0; i < count; i++) {
      final String key = buffer.getString("field name");
      if (fields.put(key, readValue(buffer, depth)) != null) {
        throw new FramingException("Duplicate field name '" + key + "' at position " + buffer.position());
      }
    }
    return new Value.ObjectValue(fields);
  }

  static Value readValue(ReadBuffer buffer, int depth) {
    checkDepth(depth);
    final int at = buffer.position();
    final Tag tag = Tag.fromByte(buffer.get("value tag"));
    LOGGER.finer(() -> "readValue " + tag + " at position " + at);
    return switch (tag) {
      case NULL -> Value.NULL;
      case STRING -> new Value.StringValue(buffer.getString("string"));
      case INT32 -> new Value.Int32(buffer.getInt("int32"));
      case INT64 -> new Value.Int64(buffer.getLong("int64"));
      case DOUBLE -> new Value.Float64(buffer.getDouble("double"));
      case BOOL -> new Value.Bool(buffer.get("bool") != 0);
      case TIMESTAMP -> new Value.Timestamp(buffer.getLong("timestamp"));
      case GUID -> Value.Guid.fromWireBytes(buffer.getBytes(Value.Guid.BYTES, "guid"));
      case BYTES -> new Value.Bytes(buffer.getLengthPrefixed("bytes"));
      case ARRAY -> {
        final int count = buffer.getCount("array element", MIN_VALUE_SIZE);
        final List<Value> elements = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
          elements.add(readValue(buffer, depth + 1));
        }
        yield new Value.ArrayValue(elements);
      }
      case OBJECT -> readFields(buffer, depth + 1);
      case OPAQUE -> new Value.Opaque(buffer.getString("opaque type name"), buffer.getString("opaque text"));
    };
  }

  private static void checkDepth(int depth) {
    if (depth > MAX_DEPTH) {
      throw new FramingException("Values nested deeper than " + MAX_DEPTH + " levels");
    }
  }
}
