package com.obsinity.tracemodes.legacy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import com.obsinity.tracemodes.capability.TraceCapability;
import com.obsinity.tracemodes.model.TraceConfigurationException;
import com.obsinity.tracemodes.model.TraceOptions;
import com.obsinity.tracemodes.trace.Trace;
import com.obsinity.tracemodes.trace.TraceField;
import com.obsinity.tracemodes.trace.TraceLayer;
import com.obsinity.tracemodes.trace.TraceQuery;

/**
 * Bridges {@link LegacyTracer}s into a pipeline. Applied directly over the base type when the owning class or any
 * ancestor enabled legacy tracing. Tracers are read from the {@value #TRACERS_OPTION} option; the first tracer is the
 * outermost.
 */
public final class LegacyTracerShim extends TraceLayer {

	public static final String TRACERS_OPTION = "legacy_tracers";

	/** The capability inserted by the pipeline builder. */
	public static final TraceCapability CAPABILITY = TraceCapability.of("LegacyTracerShim", LegacyTracerShim::new);

	private final List<LegacyTracer> tracers;

	public LegacyTracerShim(Trace inner, TraceOptions options) {
		super(inner);
		this.tracers = readTracers(options);
	}

	/** Tracers this shim calls, outermost first. */
	public List<LegacyTracer> tracers() {
		return tracers;
	}

	@Override
	public <T> T lex(String queryString, Supplier<T> next) {
		return call("lex", data("query_string", queryString), () -> super.lex(queryString, next));
	}

	@Override
	public <T> T parse(String queryString, Supplier<T> next) {
		return call("parse", data("query_string", queryString), () -> super.parse(queryString, next));
	}

	@Override
	public <T> T validate(TraceQuery query, Supplier<T> next) {
		return call("validate", queryData(query), () -> super.validate(query, next));
	}

	@Override
	public <T> T analyzeQuery(TraceQuery query, Supplier<T> next) {
		return call("analyze_query", queryData(query), () -> super.analyzeQuery(query, next));
	}

	@Override
	public <T> T executeMultiplex(List<TraceQuery> queries, Supplier<T> next) {
		return call("execute_multiplex", data("queries", queries), () -> super.executeMultiplex(queries, next));
	}

	@Override
	public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
		return call("execute_query", queryData(query), () -> super.executeQuery(query, next));
	}

	@Override
	public <T> T executeField(TraceField field, TraceQuery query, Supplier<T> next) {
		Map<String, Object> data = queryData(query);
		data.put("field", field);
		if (field != null) data.put("path", field.path());
		return call("execute_field", data, () -> super.executeField(field, query, next));
	}

	@Override
	public <T> T authorized(String typeName, Object object, TraceQuery query, Supplier<T> next) {
		Map<String, Object> data = queryData(query);
		data.put("type", typeName);
		if (object != null) data.put("object", object);
		return call("authorized", data, () -> super.authorized(typeName, object, query, next));
	}

	@Override
	public <T> T resolveType(String abstractTypeName, Object object, TraceQuery query, Supplier<T> next) {
		Map<String, Object> data = queryData(query);
		data.put("type", abstractTypeName);
		if (object != null) data.put("object", object);
		return call("resolve_type", data, () -> super.resolveType(abstractTypeName, object, query, next));
	}

	@SuppressWarnings("unchecked")
	private <T> T call(String key, Map<String, Object> data, Supplier<T> continuation) {
		if (tracers.isEmpty()) return continuation.get();
		Map<String, Object> view = Collections.unmodifiableMap(data);
		Supplier<Object> chain = continuation::get;
		for (int i = tracers.size() - 1; i >= 0; i--) {
			LegacyTracer tracer = tracers.get(i);
			Supplier<Object> inward = chain;
			chain = () -> tracer.trace(key, view, inward);
		}
		return (T) chain.get();
	}

	private static Map<String, Object> queryData(TraceQuery query) {
		return data("query", query);
	}

	private static Map<String, Object> data(String key, Object value) {
		Map<String, Object> data = new LinkedHashMap<>();
		data.put(key, value);
		return data;
	}

	private static List<LegacyTracer> readTracers(TraceOptions options) {
		Object raw = (options == null) ? null : options.get(TRACERS_OPTION);
		if (raw == null) return List.of();
		if (!(raw instanceof Iterable<?> items)) {
			throw new TraceConfigurationException(
					"Option " + TRACERS_OPTION + " must be a list of LegacyTracer, got " + raw.getClass().getName());
		}
		List<LegacyTracer> out = new ArrayList<>();
		for (Object item : items) {
			if (!(item instanceof LegacyTracer tracer)) {
				throw new TraceConfigurationException("Not a LegacyTracer: " + item);
			}
			out.add(tracer);
		}
		return List.copyOf(out);
	}
}
