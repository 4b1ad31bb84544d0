package com.obsinity.tracemodes.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable option values handed to every layer and to the base type when a pipeline is instantiated. Null values are
 * kept (a caller may deliberately supply {@code null}).
 */
public final class TraceOptions {

	private static final TraceOptions EMPTY = new TraceOptions(Map.of());

	private final Map<String, Object> values;

	private TraceOptions(Map<String, Object> values) {
		this.values = values;
	}

	public static TraceOptions empty() {
		return EMPTY;
	}

	public static TraceOptions of(Map<String, ?> values) {
		if (values == null || values.isEmpty()) return EMPTY;
		return new TraceOptions(Collections.unmodifiableMap(new LinkedHashMap<>(values)));
	}

	public boolean contains(String name) {
		return values.containsKey(name);
	}

	public Object get(String name) {
		return values.get(name);
	}

	/** Typed access; string values are converted with {@link TypeConverters}. */
	public <T> T get(String name, Class<T> type) {
		return TypeConverters.convert(values.get(name), type);
	}

	public <T> T getOrDefault(String name, Class<T> type, T fallback) {
		T value = get(name, type);
		return (value == null) ? fallback : value;
	}

	public Set<String> names() {
		return values.keySet();
	}

	public Map<String, Object> asMap() {
		return values;
	}

	@Override
	public String toString() {
		return "TraceOptions" + values;
	}
}
