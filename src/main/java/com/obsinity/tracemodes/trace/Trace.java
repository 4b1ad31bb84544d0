package com.obsinity.tracemodes.trace;

import java.util.List;
import java.util.function.Supplier;

/**
 * Instrumentation hooks invoked by the query engine around each phase of an execution.
 *
 * <p>Every operation receives the subject of the phase plus a {@code next} supplier that continues the chain. An
 * implementation must call {@code next.get()} exactly once (unless it deliberately short-circuits) and return the
 * value it produced, possibly after recording something about the call.
 *
 * <p>A composed trace is a chain of {@link TraceLayer}s around a base instance. Use {@link #unwrap(Class)} to reach
 * a specific layer or the base instance from the outermost object.
 *
 * <pre>{@code
 * Trace trace = engine.newInstance(MySchema.class, "special", Map.of());
 * Object result = trace.executeQuery(query, () -> runQuery(query));
 * }</pre>
 */
public interface Trace {

	<T> T lex(String queryString, Supplier<T> next);

	<T> T parse(String queryString, Supplier<T> next);

	<T> T validate(TraceQuery query, Supplier<T> next);

	<T> T analyzeQuery(TraceQuery query, Supplier<T> next);

	<T> T executeMultiplex(List<TraceQuery> queries, Supplier<T> next);

	<T> T executeQuery(TraceQuery query, Supplier<T> next);

	<T> T executeField(TraceField field, TraceQuery query, Supplier<T> next);

	<T> T authorized(String typeName, Object object, TraceQuery query, Supplier<T> next);

	<T> T resolveType(String abstractTypeName, Object object, TraceQuery query, Supplier<T> next);

	/** The next trace inward, or {@code null} for a base instance. */
	default Trace inner() {
		return null;
	}

	/** True if this trace, or any trace it wraps, is an instance of {@code type}. */
	default boolean isWrapperFor(Class<?> type) {
		return unwrapOrNull(type) != null;
	}

	/**
	 * Returns the outermost trace in this chain that is an instance of {@code type}.
	 *
	 * @throws IllegalArgumentException if no trace in the chain matches
	 */
	default <W> W unwrap(Class<W> type) {
		W found = unwrapOrNull(type);
		if (found == null) {
			throw new IllegalArgumentException("No " + type.getName() + " in trace chain of " + getClass().getName());
		}
		return found;
	}

	private <W> W unwrapOrNull(Class<W> type) {
		Trace current = this;
		while (current != null) {
			if (type.isInstance(current)) return type.cast(current);
			current = current.inner();
		}
		return null;
	}
}
