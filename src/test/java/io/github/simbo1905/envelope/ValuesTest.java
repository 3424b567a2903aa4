// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

/// Tags, the value model and conversion from plain Java objects
class ValuesTest {

  public record Point(int x, int y) {}

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void tagCodesAreFixed() {
    assertEquals(0x00, Tag.NULL.code());
    assertEquals(0x01, Tag.STRING.code());
    assertEquals(0x02, Tag.INT32.code());
    assertEquals(0x03, Tag.INT64.code());
    assertEquals(0x04, Tag.DOUBLE.code());
    assertEquals(0x05, Tag.BOOL.code());
    assertEquals(0x06, Tag.TIMESTAMP.code());
    assertEquals(0x07, Tag.GUID.code());
    assertEquals(0x08, Tag.BYTES.code());
    assertEquals(0x09, Tag.ARRAY.code());
    assertEquals(0x0A, Tag.OBJECT.code());
    assertEquals((byte) 0xFF, Tag.OPAQUE.code());
  }

  @Test
  void everyTagDecodesFromItsOwnCode() {
    for (Tag tag : Tag.values()) {
      assertSame(tag, Tag.fromByte(tag.code()));
    }
    assertThrows(FramingException.class, () -> Tag.fromByte((byte) 0x0B));
    assertThrows(FramingException.class, () -> Tag.fromByte((byte) 0x80));
  }

  @Test
  void javaClassLookupIsExact() {
    assertEquals(Optional.of(Tag.INT32), Tag.forJavaClass(Integer.class));
    assertEquals(Optional.of(Tag.BYTES), Tag.forJavaClass(byte[].class));
    assertTrue(Tag.forJavaClass(Short.class).isEmpty());
    assertTrue(Tag.forJavaClass(Float.class).isEmpty());
    assertTrue(Tag.forJavaClass(int.class).isEmpty());
    assertTrue(Tag.forJavaClass(Object.class).isEmpty());
  }

  @Test
  void schemaNamesResolveOnlyScalars() {
    assertEquals(Optional.of(Tag.TIMESTAMP), Tag.forSchemaName("datetime"));
    assertTrue(Tag.forSchemaName("object").isEmpty());
    assertTrue(Tag.forSchemaName("array").isEmpty());
    assertTrue(Tag.OPAQUE.schemaName().equals("object"));
    assertFalse(Tag.OPAQUE.isScalar());
  }

  @Test
  void exactKindsMapToTheirTags() {
    assertEquals(Value.NULL, Values.of(null));
    assertEquals(new Value.StringValue("s"), Values.of("s"));
    assertEquals(new Value.Int32(7), Values.of(7));
    assertEquals(new Value.Int64(7L), Values.of(7L));
    assertEquals(new Value.Float64(0.5), Values.of(0.5));
    assertEquals(new Value.Bool(true), Values.of(true));
    final UUID id = UUID.randomUUID();
    assertEquals(new Value.Guid(id), Values.of(id));
    assertEquals(new Value.Bytes(new byte[]{1, 2}), Values.of(new byte[]{1, 2}));
    final Instant now = Instant.parse("2024-02-29T12:00:00Z");
    assertEquals(Value.Timestamp.of(now), Values.of(now));
  }

  @Test
  void nearMatchesFallBackToOpaque() {
    final Value shortValue = Values.of((short) 7);
    assertEquals(Tag.OPAQUE, Tag.of(shortValue));
    final Value.Opaque opaque = (Value.Opaque) shortValue;
    assertEquals("java.lang.Short", opaque.typeName());
    assertEquals("7", opaque.text());
    assertEquals(new Value.Int32(7), opaque.parse());

    final Value.Opaque floatValue = (Value.Opaque) Values.of(1.5f);
    assertEquals("java.lang.Float", floatValue.typeName());
    assertEquals(new Value.Float64(1.5), floatValue.parse());

    assertEquals(Tag.OPAQUE, Values.of(Set.of("a")).tag());
    assertEquals(Tag.OPAQUE, Values.of(Map.of(1, "one")).tag());
  }

  @Test
  void customRecordIsOpaqueJson() {
    final Value.Opaque opaque = (Value.Opaque) Values.of(new Point(1, 2));
    assertEquals(Point.class.getName(), opaque.typeName());
    assertEquals("{\"x\":1,\"y\":2}", opaque.text());
    assertEquals(Map.of("x", 1, "y", 2), Values.toJava(opaque));
  }

  @Test
  void customRecordSurvivesTheWireAsOpaque() {
    final Value.ObjectValue fields = Values.objectOf(Map.of("where", new Point(3, 4), "level", (short) 9));
    final EnvelopeCodec codec = EnvelopeCodec.create();
    final SerializationOptions options = SerializationOptions.defaults();
    final Value.ObjectValue decoded = codec.decode(codec.encode(fields, options), options);

    assertEquals(fields, decoded);
    final Value.Opaque where = (Value.Opaque) decoded.get("where").orElseThrow();
    assertEquals(Point.class.getName(), where.typeName());
    assertEquals(Map.of("where", Map.of("x", 3, "y", 4), "level", 9), Values.toJavaMap(decoded));
  }

  @Test
  void listsAndStringKeyedMapsNest() {
    final Map<String, Object> java = new LinkedHashMap<>();
    java.put("list", new LinkedList<>(List.of(1, "two")));
    java.put("map", Map.of("k", 2L));
    java.put("nothing", null);

    final Value.ObjectValue fields = Values.objectOf(java);
    assertEquals(Value.ArrayValue.of(new Value.Int32(1), new Value.StringValue("two")), fields.get("list").orElseThrow());
    assertEquals(new Value.ObjectValue(Map.of("k", new Value.Int64(2L))), fields.get("map").orElseThrow());
    assertEquals(Value.NULL, fields.get("nothing").orElseThrow());
    assertEquals(java, Values.toJavaMap(fields));
  }

  @Test
  void objectValueRejectsJavaNull() {
    final Map<String, Value> fields = new HashMap<>();
    fields.put("x", null);
    assertThrows(NullPointerException.class, () -> new Value.ObjectValue(fields));
  }

  @Test
  void objectValueIsImmutable() {
    final Value.ObjectValue fields = EnvelopeCodecTest.person();
    assertThrows(UnsupportedOperationException.class, () -> fields.fields().put("x", Value.NULL));
  }

  @Test
  void bytesAreCopied() {
    final byte[] raw = {1, 2, 3};
    final Value.Bytes bytes = new Value.Bytes(raw);
    raw[0] = 9;
    assertEquals(1, bytes.value()[0]);
    bytes.value()[1] = 9;
    assertEquals(2, bytes.value()[1]);
  }

  @Test
  void timestampTicksCountFromYearOne() {
    assertEquals(621_355_968_000_000_000L, Value.Timestamp.of(Instant.EPOCH).ticks());
    assertEquals(Instant.parse("0001-01-01T00:00:00Z"), new Value.Timestamp(0L).toInstant());
    final Instant instant = Instant.parse("2025-06-30T10:15:30.1234567Z");
    assertEquals(instant, Value.Timestamp.of(instant).toInstant());
  }

  @Test
  void timestampDropsSubTickPrecision() {
    final Instant instant = Instant.parse("2025-06-30T10:15:30.123456789Z");
    assertEquals(Instant.parse("2025-06-30T10:15:30.123456700Z"), Value.Timestamp.of(instant).toInstant());
  }

  @Test
  void guidWireBytesUseMixedEndianLayout() {
    final Value.Guid guid = new Value.Guid(UUID.fromString("00112233-4455-6677-8899-aabbccddeeff"));
    final byte[] expected = {
        0x33, 0x22, 0x11, 0x00, 0x55, 0x44, 0x77, 0x66,
        (byte) 0x88, (byte) 0x99, (byte) 0xAA, (byte) 0xBB, (byte) 0xCC, (byte) 0xDD, (byte) 0xEE, (byte) 0xFF};
    assertArrayEquals(expected, guid.toWireBytes());
    assertEquals(guid, Value.Guid.fromWireBytes(expected));
  }

  @Test
  void guidRoundTripsForRandomIds() {
    for (int i = 0; i < 100; i++) {
      final Value.Guid guid = new Value.Guid(UUID.randomUUID());
      assertEquals(guid, Value.Guid.fromWireBytes(guid.toWireBytes()));
    }
  }

  @Test
  void opaqueWithInvalidJsonCannotBeParsed() {
    assertThrows(IllegalArgumentException.class, () -> new Value.Opaque("x.Y", "not json").parse());
  }
}
