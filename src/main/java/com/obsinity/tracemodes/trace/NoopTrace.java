package com.obsinity.tracemodes.trace;

import java.util.List;
import java.util.function.Supplier;

import com.obsinity.tracemodes.model.TraceOptions;

/**
 * Built-in base type: every operation simply runs {@code next}. Custom base types usually extend this class and
 * override the operations they care about.
 */
public class NoopTrace implements Trace {

	private final TraceOptions options;

	public NoopTrace() {
		this(TraceOptions.empty());
	}

	public NoopTrace(TraceOptions options) {
		this.options = (options == null ? TraceOptions.empty() : options);
	}

	/** Options this instance was constructed with. */
	public TraceOptions options() {
		return options;
	}

	@Override
	public <T> T lex(String queryString, Supplier<T> next) {
		return next.get();
	}

	@Override
	public <T> T parse(String queryString, Supplier<T> next) {
		return next.get();
	}

	@Override
	public <T> T validate(TraceQuery query, Supplier<T> next) {
		return next.get();
	}

	@Override
	public <T> T analyzeQuery(TraceQuery query, Supplier<T> next) {
		return next.get();
	}

	@Override
	public <T> T executeMultiplex(List<TraceQuery> queries, Supplier<T> next) {
		return next.get();
	}

	@Override
	public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
		return next.get();
	}

	@Override
	public <T> T executeField(TraceField field, TraceQuery query, Supplier<T> next) {
		return next.get();
	}

	@Override
	public <T> T authorized(String typeName, Object object, TraceQuery query, Supplier<T> next) {
		return next.get();
	}

	@Override
	public <T> T resolveType(String abstractTypeName, Object object, TraceQuery query, Supplier<T> next) {
		return next.get();
	}
}
