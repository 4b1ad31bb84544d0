package com.obsinity.tracemodes.utils;

import java.util.Map;

import com.obsinity.tracemodes.trace.TraceQuery;

/**
 * Reads the mode hint carried by an execution context. Strings are used as-is, enums by {@code name()}, anything else
 * by {@code toString()}. Returns null when there is no usable hint, meaning "use the default mode".
 */
public final class TraceModeSelector {

	public static final String DEFAULT_CONTEXT_KEY = "trace_mode";

	private final String contextKey;

	public TraceModeSelector() {
		this(DEFAULT_CONTEXT_KEY);
	}

	public TraceModeSelector(String contextKey) {
		this.contextKey = (contextKey == null || contextKey.isBlank()) ? DEFAULT_CONTEXT_KEY : contextKey;
	}

	public String contextKey() {
		return contextKey;
	}

	public String select(Map<String, ?> context) {
		if (context == null) return null;
		Object hint = context.get(contextKey);
		if (hint == null) return null;
		String mode = (hint instanceof Enum<?> e) ? e.name() : hint.toString();
		return mode.isBlank() ? null : mode.strip();
	}

	public String select(TraceQuery query) {
		return (query == null) ? null : select(query.context());
	}
}
