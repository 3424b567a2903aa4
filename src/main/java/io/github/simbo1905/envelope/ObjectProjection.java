// SPDX-FileCopyrightText: 2025 Simon Massey
// SPDX-License-Identifier: MIT

package io.github.simbo1905.envelope;

import org.jetbrains.annotations.NotNull;

import java.lang.invoke.MethodHandle;
import java.lang.invoke.MethodHandles;
import java.lang.reflect.*;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.*;
import java.util.stream.Collectors;

import static io.github.simbo1905.envelope.EnvelopeCodec.LOGGER;

/// Reflective field mapper that looks one level deep at the public members of a type.
///
/// For a record the members are its components and the canonical constructor rebuilds it. For any other class the
/// members are public instance fields and JavaBean getters, and a public no-argument constructor plus public
/// fields and setters rebuild it. Member values are not projected further: a member of a custom type travels as an
/// opaque value. On the way back each member gets a best effort conversion and a member that cannot be converted
/// is left at its default.
final class ObjectProjection<T> implements FieldMapper<T> {

  /// Marks a value that cannot be converted to the member type
  static final Object UNCONVERTIBLE = new Object();

  record Member(String name, Class<?> type, MethodHandle getter, MethodHandle setter) {
  }

  final Class<T> type;
  final List<Member> members;
  final MethodHandle constructor;

  ObjectProjection(@NotNull Class<T> type) {
    this.type = Objects.requireNonNull(type, "type must not be null");
    if (type.isPrimitive() || type.isArray() || type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
      throw new IllegalArgumentException("Cannot project " + type.getName() + ": needs a concrete record or class");
    }
    final MethodHandles.Lookup lookup = MethodHandles.lookup();
    try {
      if (type.isRecord()) {
        final RecordComponent[] components = type.getRecordComponents();
        final List<Member> recordMembers = new ArrayList<>(components.length);
        for (RecordComponent component : components) {
          recordMembers.add(new Member(component.getName(), component.getType(), unreflect(lookup, component.getAccessor()), null));
        }
        this.members = List.copyOf(recordMembers);
        final Class<?>[] parameterTypes = Arrays.stream(components).map(RecordComponent::getType).toArray(Class<?>[]::new);
        final Constructor<T> canonical = type.getDeclaredConstructor(parameterTypes);
        canonical.trySetAccessible();
        this.constructor = lookup.unreflectConstructor(canonical);
      } else {
        this.members = beanMembers(lookup, type);
        this.constructor = noArgConstructor(lookup, type);
      }
    } catch (NoSuchMethodException | IllegalAccessException e) {
      throw new IllegalArgumentException("Cannot project " + type.getName() + ": " + e.getMessage(), e);
    }
    LOGGER.fine(() -> "ObjectProjection for " + type.getSimpleName() + " members " +
        members.stream().map(Member::name).collect(Collectors.joining(",")));
  }

  private static MethodHandle unreflect(MethodHandles.Lookup lookup, Method method) throws IllegalAccessException {
    method.trySetAccessible();
    return lookup.unreflect(method);
  }

  private static MethodHandle noArgConstructor(MethodHandles.Lookup lookup, Class<?> type) throws IllegalAccessException {
    try {
      final Constructor<?> noArg = type.getConstructor();
      return lookup.unreflectConstructor(noArg);
    } catch (NoSuchMethodException e) {
      LOGGER.fine(() -> type.getName() + " has no public no-argument constructor, it can only be written");
      return null;
    }
  }

  private static List<Member> beanMembers(MethodHandles.Lookup lookup, Class<?> type) throws IllegalAccessException {
    final Map<String, Member> byName = new LinkedHashMap<>();
    for (Field field : type.getFields()) {
      final int modifiers = field.getModifiers();
      if (Modifier.isStatic(modifiers)) {
        continue;
      }
      field.trySetAccessible();
      final MethodHandle setter = Modifier.isFinal(modifiers) ? null : lookup.unreflectSetter(field);
      byName.put(field.getName(), new Member(field.getName(), field.getType(), lookup.unreflectGetter(field), setter));
    }
    final Map<String, Method> setters = new HashMap<>();
    for (Method method : type.getMethods()) {
      if (!Modifier.isStatic(method.getModifiers()) && method.getParameterCount() == 1 && method.getName().startsWith("set")
          && method.getName().length() > 3) {
        setters.put(decapitalize(method.getName().substring(3)), method);
      }
    }
    for (Method method : type.getMethods()) {
      final String property = propertyName(method);
      if (property == null || byName.containsKey(property)) {
        continue;
      }
      final Method setter = setters.get(property);
      final MethodHandle setterHandle = setter != null && setter.getParameterTypes()[0].equals(method.getReturnType())
          ? unreflect(lookup, setter)
          : null;
      byName.put(property, new Member(property, method.getReturnType(), unreflect(lookup, method), setterHandle));
    }
    return List.copyOf(byName.values());
  }

  /// JavaBean property name of a public getter, or null
  static String propertyName(Method method) {
    if (Modifier.isStatic(method.getModifiers()) || method.getParameterCount() != 0
        || method.getReturnType() == void.class || method.getDeclaringClass() == Object.class) {
      return null;
    }
    final String name = method.getName();
    if (name.startsWith("get") && name.length() > 3) {
      return decapitalize(name.substring(3));
    }
    if (name.startsWith("is") && name.length() > 2 && (method.getReturnType() == boolean.class || method.getReturnType() == Boolean.class)) {
      return decapitalize(name.substring(2));
    }
    return null;
  }

  static String decapitalize(String name) {
    return Character.toLowerCase(name.charAt(0)) + name.substring(1);
  }

  @Override
  public Value.ObjectValue toFieldMap(T record) {
    if (record == null) {
      return Value.ObjectValue.EMPTY;
    }
    final Map<String, Value> fields = new LinkedHashMap<>(members.size() * 2);
    for (Member member : members) {
      final Object value;
      try {
        value = member.getter().invoke(record);
      } catch (Throwable e) {
        throw new RuntimeException("Failed to read member " + member.name() + " of " + type.getName(), e);
      }
      fields.put(member.name(), Values.of(value));
    }
    return new Value.ObjectValue(fields);
  }

  @Override
  public T fromFieldMap(Value.ObjectValue fields) {
    if (constructor == null) {
      throw new IllegalArgumentException(type.getName() + " has no public no-argument constructor to project into");
    }
    return type.isRecord() ? construct(fields) : populate(fields);
  }

  private T construct(Value.ObjectValue fields) {
    final Object[] arguments = new Object[members.size()];
    for (int i = 0; i < arguments.length; i++) {
      final Member member = members.get(i);
      final Object converted = fields.get(member.name())
          .map(value -> convert(value, member.type()))
          .orElse(UNCONVERTIBLE);
      arguments[i] = converted == UNCONVERTIBLE ? defaultValue(member.type()) : converted;
    }
    try {
      return type.cast(constructor.invokeWithArguments(arguments));
    } catch (RuntimeException e) {
      throw new IllegalArgumentException("Constructor of " + type.getName() + " rejected the projected members: " + e.getMessage(), e);
    } catch (Throwable e) {
      throw new RuntimeException("Failed to construct " + type.getName(), e);
    }
  }

  private T populate(Value.ObjectValue fields) {
    final T instance;
    try {
      instance = type.cast(constructor.invoke());
    } catch (Throwable e) {
      throw new RuntimeException("Failed to construct " + type.getName(), e);
    }
    for (Member member : members) {
      if (member.setter() == null) {
        continue;
      }
      final Optional<Value> value = fields.get(member.name());
      if (value.isEmpty()) {
        continue;
      }
      final Object converted = convert(value.get(), member.type());
      if (converted == UNCONVERTIBLE) {
        continue;
      }
      try {
        member.setter().invoke(instance, converted);
      } catch (Throwable e) {
        throw new RuntimeException("Failed to set member " + member.name() + " of " + type.getName(), e);
      }
    }
    return instance;
  }

  static Object defaultValue(Class<?> type) {
    return type.isPrimitive() ? Array.get(Array.newInstance(type, 1), 0) : null;
  }

  /// Best effort conversion of a value to a member type, or UNCONVERTIBLE
  static Object convert(Value value, Class<?> target) {
    if (value.tag() == Tag.NULL) {
      return target.isPrimitive() ? UNCONVERTIBLE : null;
    }
    final Class<?> boxed = box(target);
    if (Value.class.isAssignableFrom(boxed)) {
      return boxed.isInstance(value) ? value : UNCONVERTIBLE;
    }
    if (value instanceof Value.Opaque opaque) {
      final Optional<?> bound = JsonValues.bind(opaque.text(), boxed);
      return bound.isPresent() ? bound.get() : UNCONVERTIBLE;
    }
    final Object java = Values.toJava(value);
    if (boxed.isInstance(java)) {
      return java;
    }
    final Object converted = java instanceof String text ? fromText(text, boxed) : fromScalar(java, boxed);
    if (converted != UNCONVERTIBLE || !(value instanceof Value.ObjectValue || value instanceof Value.ArrayValue)) {
      if (converted == UNCONVERTIBLE) {
        LOGGER.finer(() -> "Cannot convert " + value.tag() + " to " + target.getName());
      }
      return converted;
    }
    try {
      return JsonValues.MAPPER.convertValue(java, boxed);
    } catch (IllegalArgumentException e) {
      LOGGER.finer(() -> "Cannot convert " + value.tag() + " to " + target.getName() + ": " + e.getMessage());
      return UNCONVERTIBLE;
    }
  }

  private static Object fromScalar(Object java, Class<?> boxed) {
    if (boxed == String.class && !(java instanceof Map || java instanceof List || java instanceof byte[])) {
      return String.valueOf(java);
    }
    if (java instanceof Number number) {
      return fromNumber(number, boxed);
    }
    return UNCONVERTIBLE;
  }

  private static Object fromNumber(Number number, Class<?> boxed) {
    final boolean integral = number instanceof Integer || number instanceof Long;
    final double asDouble = number.doubleValue();
    if (boxed == Double.class) return asDouble;
    if (boxed == Float.class) return number.floatValue();
    if (!integral && (asDouble != Math.rint(asDouble) || Double.isInfinite(asDouble))) {
      return UNCONVERTIBLE;
    }
    final long asLong = number.longValue();
    if (!integral && (asDouble < Long.MIN_VALUE || asDouble > Long.MAX_VALUE)) {
      return UNCONVERTIBLE;
    }
    if (boxed == Long.class) return asLong;
    if (boxed == Integer.class) return inRange(asLong, Integer.MIN_VALUE, Integer.MAX_VALUE) ? (Object) (int) asLong : UNCONVERTIBLE;
    if (boxed == Short.class) return inRange(asLong, Short.MIN_VALUE, Short.MAX_VALUE) ? (Object) (short) asLong : UNCONVERTIBLE;
    if (boxed == Byte.class) return inRange(asLong, Byte.MIN_VALUE, Byte.MAX_VALUE) ? (Object) (byte) asLong : UNCONVERTIBLE;
    return UNCONVERTIBLE;
  }

  private static boolean inRange(long value, long min, long max) {
    return value >= min && value <= max;
  }

  @SuppressWarnings({"unchecked", "rawtypes"})
  private static Object fromText(String text, Class<?> boxed) {
    try {
      if (boxed == Integer.class) return Integer.valueOf(text.trim());
      if (boxed == Long.class) return Long.valueOf(text.trim());
      if (boxed == Short.class) return Short.valueOf(text.trim());
      if (boxed == Byte.class) return Byte.valueOf(text.trim());
      if (boxed == Double.class) return Double.valueOf(text.trim());
      if (boxed == Float.class) return Float.valueOf(text.trim());
      if (boxed == Boolean.class) {
        return "true".equalsIgnoreCase(text.trim()) ? Boolean.TRUE
            : "false".equalsIgnoreCase(text.trim()) ? Boolean.FALSE : UNCONVERTIBLE;
      }
      if (boxed == Character.class) return text.length() == 1 ? (Object) text.charAt(0) : UNCONVERTIBLE;
      if (boxed == UUID.class) return UUID.fromString(text.trim());
      if (boxed == Instant.class) return Instant.parse(text.trim());
      if (boxed.isEnum()) return Enum.valueOf((Class<? extends Enum>) boxed, text);
    } catch (IllegalArgumentException | DateTimeParseException e) {
      LOGGER.finer(() -> "Cannot parse '" + text + "' as " + boxed.getName() + ": " + e.getMessage());
    }
    return UNCONVERTIBLE;
  }

  static Class<?> box(Class<?> type) {
    if (!type.isPrimitive()) return type;
    if (type == int.class) return Integer.class;
    if (type == long.class) return Long.class;
    if (type == double.class) return Double.class;
    if (type == boolean.class) return Boolean.class;
    if (type == float.class) return Float.class;
    if (type == short.class) return Short.class;
    if (type == byte.class) return Byte.class;
    if (type == char.class) return Character.class;
    throw new IllegalArgumentException("No box for " + type);
  }
}
