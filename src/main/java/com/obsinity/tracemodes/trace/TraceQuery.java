package com.obsinity.tracemodes.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The query being traced: its source text, optional operation name and a mutable per-execution context that layers
 * may read and write. The context accepts null values.
 */
public final class TraceQuery {

	private final String queryString;
	private final String operationName;
	private final Map<String, Object> context = Collections.synchronizedMap(new LinkedHashMap<>());

	public TraceQuery(String queryString) {
		this(queryString, null, Map.of());
	}

	public TraceQuery(String queryString, String operationName, Map<String, ?> context) {
		this.queryString = Objects.requireNonNull(queryString, "queryString must not be null");
		this.operationName = operationName;
		if (context != null) {
			context.forEach((k, v) -> {
				if (k != null) this.context.put(k, v);
			});
		}
	}

	public String queryString() {
		return queryString;
	}

	public String operationName() {
		return operationName;
	}

	/** Live, synchronized execution context. Iterate it inside {@code synchronized (context())}. */
	public Map<String, Object> context() {
		return context;
	}

	@Override
	public String toString() {
		return "TraceQuery{operationName=" + operationName + ", queryString=" + queryString + "}";
	}
}
