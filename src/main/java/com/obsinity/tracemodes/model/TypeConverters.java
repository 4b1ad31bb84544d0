package com.obsinity.tracemodes.model;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Function;

/** Minimal string -> type converters for option values declared as strings (annotation defaults). */
public final class TypeConverters {
	private TypeConverters() {}

	public static Function<String, Object> forType(Class<?> target) {
		if (target == String.class || target == Object.class) return s -> s;
		if (target == Long.class || target == long.class) return Long::parseLong;
		if (target == Integer.class || target == int.class) return Integer::parseInt;
		if (target == Double.class || target == double.class) return Double::parseDouble;
		if (target == Boolean.class || target == boolean.class)
			return s -> {
				if ("1".equals(s)) return Boolean.TRUE;
				if ("0".equals(s)) return Boolean.FALSE;
				return Boolean.parseBoolean(s);
			};
		if (target == UUID.class) return UUID::fromString;
		if (target == Instant.class) return Instant::parse;
		if (target == Duration.class) return Duration::parse;
		if (target.isEnum()) return s -> enumValue(target, s);
		return null;
	}

	/**
	 * Returns {@code value} as {@code target}: as-is when already assignable, converted when it is a string and a
	 * converter exists.
	 *
	 * @throws IllegalArgumentException when no conversion applies
	 */
	@SuppressWarnings("unchecked")
	public static <T> T convert(Object value, Class<T> target) {
		if (value == null) return null;
		Class<?> boxed = box(target);
		if (boxed.isInstance(value)) return (T) value;
		if (value instanceof String s) {
			Function<String, Object> fn = forType(target);
			if (fn != null) return (T) fn.apply(s.strip());
		}
		throw new IllegalArgumentException(
				"Cannot convert " + value.getClass().getName() + " to " + target.getName() + ": " + value);
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	private static Object enumValue(Class<?> type, String s) {
		return Enum.valueOf((Class) type, s);
	}

	private static Class<?> box(Class<?> type) {
		if (!type.isPrimitive()) return type;
		if (type == long.class) return Long.class;
		if (type == int.class) return Integer.class;
		if (type == double.class) return Double.class;
		if (type == boolean.class) return Boolean.class;
		if (type == float.class) return Float.class;
		if (type == short.class) return Short.class;
		if (type == byte.class) return Byte.class;
		if (type == char.class) return Character.class;
		return type;
	}
}
