// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;
import static org.junit.jupiter.api.Assertions.*;

/// Reflective projection of records and beans onto field maps and back
public class ObjectProjectionTest {

  public record Person(String name, int age, List<String> tags) {}

  public record Point(int x, int y) {}

  public record Segment(Point from, Point to, short weight) {}

  public enum Color {RED, GREEN}

  public record Swatch(Color color, UUID id, boolean active) {}

  /// JavaBean with private state
  public static class Account {
    private String owner;
    private long balance;

    public Account() {
    }

    public String getOwner() {
      return owner;
    }

    public void setOwner(String owner) {
      this.owner = owner;
    }

    public long getBalance() {
      return balance;
    }

    public void setBalance(long balance) {
      this.balance = balance;
    }
  }

  public static class Counter {
    public int count;
    public String label;
  }

  public static class Fixed {
    public final String id;

    public Fixed(String id) {
      this.id = id;
    }
  }

  @BeforeAll
  static void setupLogging() {
    LoggingControl.setupCleanLogging();
  }

  @Test
  void recordComponentsBecomeFields() {
    final FieldMapper<Person> mapper = FieldMapper.reflective(Person.class);
    final Value.ObjectValue fields = mapper.toFieldMap(new Person("Ann", 30, List.of("x", "y")));

    assertEquals(List.of("name", "age", "tags"), List.copyOf(fields.fields().keySet()));
    assertEquals(new Value.Int32(30), fields.get("age").orElseThrow());
    assertEquals(Value.ArrayValue.of(new Value.StringValue("x"), new Value.StringValue("y")), fields.get("tags").orElseThrow());
    assertEquals(new Person("Ann", 30, List.of("x", "y")), mapper.fromFieldMap(fields));
  }

  @Test
  void customMembersTravelAsOpaqueAndBindBack() {
    final FieldMapper<Segment> mapper = FieldMapper.reflective(Segment.class);
    final Segment segment = new Segment(new Point(0, 1), new Point(2, 3), (short) 4);
    final Value.ObjectValue fields = mapper.toFieldMap(segment);

    assertEquals(Tag.OPAQUE, fields.get("from").orElseThrow().tag());
    assertEquals(new Value.Opaque("java.lang.Short", "4"), fields.get("weight").orElseThrow());
    assertEquals(segment, mapper.fromFieldMap(fields));
  }

  @Test
  void unconvertibleAndMissingMembersTakeDefaults() {
    final FieldMapper<Person> mapper = FieldMapper.reflective(Person.class);
    final Value.ObjectValue fields = new Value.ObjectValue(Map.of(
        "name", new Value.StringValue("Ann"),
        "age", new Value.StringValue("abc")));
    assertEquals(new Person("Ann", 0, null), mapper.fromFieldMap(fields));
  }

  @Test
  void textAndNumbersConvertToMemberTypes() {
    assertEquals(42, ObjectProjection.convert(new Value.StringValue("42"), int.class));
    assertEquals(30, ObjectProjection.convert(new Value.Float64(30.0), int.class));
    assertEquals(5L, ObjectProjection.convert(new Value.Int32(5), long.class));
    assertEquals(2.0, ObjectProjection.convert(new Value.Int32(2), double.class));
    assertEquals("5", ObjectProjection.convert(new Value.Int32(5), String.class));
    assertEquals(Color.GREEN, ObjectProjection.convert(new Value.StringValue("GREEN"), Color.class));
    assertEquals(true, ObjectProjection.convert(new Value.StringValue("TRUE"), boolean.class));
  }

  @Test
  void lossyConversionsAreRefused() {
    assertSame(ObjectProjection.UNCONVERTIBLE, ObjectProjection.convert(new Value.Float64(30.5), int.class));
    assertSame(ObjectProjection.UNCONVERTIBLE, ObjectProjection.convert(new Value.Int64(1L << 40), int.class));
    assertSame(ObjectProjection.UNCONVERTIBLE, ObjectProjection.convert(new Value.Int32(300), byte.class));
    assertSame(ObjectProjection.UNCONVERTIBLE, ObjectProjection.convert(Value.NULL, int.class));
    assertSame(ObjectProjection.UNCONVERTIBLE, ObjectProjection.convert(new Value.StringValue("BLUE"), Color.class));
    assertNull(ObjectProjection.convert(Value.NULL, String.class));
  }

  @Test
  void containersConvertThroughJackson() {
    final Value.ObjectValue point = new Value.ObjectValue(Map.of("x", new Value.Int32(1), "y", new Value.Int32(2)));
    assertEquals(new Point(1, 2), ObjectProjection.convert(point, Point.class));
  }

  @Test
  void valueTypedMembersPassThrough() {
    final Value value = new Value.StringValue("kept");
    assertSame(value, ObjectProjection.convert(value, Value.class));
    assertSame(ObjectProjection.UNCONVERTIBLE, ObjectProjection.convert(value, Value.Int32.class));
  }

  @Test
  void enumAndGuidMembersRoundTrip() {
    final FieldMapper<Swatch> mapper = FieldMapper.reflective(Swatch.class);
    final Swatch swatch = new Swatch(Color.RED, UUID.randomUUID(), true);
    final Value.ObjectValue fields = mapper.toFieldMap(swatch);
    assertEquals(new Value.Guid(swatch.id()), fields.get("id").orElseThrow());
    assertEquals(swatch, mapper.fromFieldMap(fields));
  }

  @Test
  void beanPropertiesRoundTrip() {
    final Account account = new Account();
    account.setOwner("Bob");
    account.setBalance(1_000_000_000_000L);

    final FieldMapper<Account> mapper = FieldMapper.reflective(Account.class);
    final Value.ObjectValue fields = mapper.toFieldMap(account);
    LOGGER.info(() -> "Account fields " + fields);
    assertEquals(new Value.StringValue("Bob"), fields.get("owner").orElseThrow());
    assertEquals(new Value.Int64(1_000_000_000_000L), fields.get("balance").orElseThrow());

    final Account copy = mapper.fromFieldMap(fields);
    assertEquals("Bob", copy.getOwner());
    assertEquals(1_000_000_000_000L, copy.getBalance());
  }

  @Test
  void publicFieldsRoundTrip() {
    final Counter counter = new Counter();
    counter.count = 3;
    counter.label = "hits";

    final FieldMapper<Counter> mapper = FieldMapper.reflective(Counter.class);
    final Counter copy = mapper.fromFieldMap(mapper.toFieldMap(counter));
    assertEquals(3, copy.count);
    assertEquals("hits", copy.label);
  }

  @Test
  void typeWithoutNoArgConstructorIsWriteOnly() {
    final FieldMapper<Fixed> mapper = FieldMapper.reflective(Fixed.class);
    final Value.ObjectValue fields = mapper.toFieldMap(new Fixed("abc"));
    assertEquals(new Value.ObjectValue(Map.of("id", new Value.StringValue("abc"))), fields);
    assertThrows(IllegalArgumentException.class, () -> mapper.fromFieldMap(fields));
  }

  @Test
  void interfacesCannotBeProjected() {
    assertThrows(IllegalArgumentException.class, () -> FieldMapper.reflective(Runnable.class));
  }
}
