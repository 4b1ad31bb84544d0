package com.obsinity.tracemodes.trace;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Base class for instrumentation layers. Every operation delegates to the inner trace; subclasses override the
 * operations they instrument and call {@code super} to continue the chain.
 *
 * <p>Layer classes registered through {@code TraceCapability.of(Class)} must declare either a
 * {@code (Trace, TraceOptions)} or a {@code (Trace)} constructor.
 *
 * <pre>{@code
 * public class TimingTrace extends TraceLayer {
 *   public TimingTrace(Trace inner) { super(inner); }
 *
 *   @Override
 *   public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
 *     long start = System.nanoTime();
 *     try {
 *       return super.executeQuery(query, next);
 *     } finally {
 *       query.context().put("elapsed", System.nanoTime() - start);
 *     }
 *   }
 * }
 * }</pre>
 */
public abstract class TraceLayer implements Trace {

	private final Trace inner;

	protected TraceLayer(Trace inner) {
		this.inner = Objects.requireNonNull(inner, "inner trace must not be null");
	}

	@Override
	public final Trace inner() {
		return inner;
	}

	@Override
	public <T> T lex(String queryString, Supplier<T> next) {
		return inner.lex(queryString, next);
	}

	@Override
	public <T> T parse(String queryString, Supplier<T> next) {
		return inner.parse(queryString, next);
	}

	@Override
	public <T> T validate(TraceQuery query, Supplier<T> next) {
		return inner.validate(query, next);
	}

	@Override
	public <T> T analyzeQuery(TraceQuery query, Supplier<T> next) {
		return inner.analyzeQuery(query, next);
	}

	@Override
	public <T> T executeMultiplex(List<TraceQuery> queries, Supplier<T> next) {
		return inner.executeMultiplex(queries, next);
	}

	@Override
	public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
		return inner.executeQuery(query, next);
	}

	@Override
	public <T> T executeField(TraceField field, TraceQuery query, Supplier<T> next) {
		return inner.executeField(field, query, next);
	}

	@Override
	public <T> T authorized(String typeName, Object object, TraceQuery query, Supplier<T> next) {
		return inner.authorized(typeName, object, query, next);
	}

	@Override
	public <T> T resolveType(String abstractTypeName, Object object, TraceQuery query, Supplier<T> next) {
		return inner.resolveType(abstractTypeName, object, query, next);
	}
}
