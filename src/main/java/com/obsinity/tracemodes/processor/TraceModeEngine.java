package com.obsinity.tracemodes.processor;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import lombok.RequiredArgsConstructor;

import com.obsinity.tracemodes.model.LayerDeclaration;
import com.obsinity.tracemodes.model.Modes;
import com.obsinity.tracemodes.model.OptionDeclaration;
import com.obsinity.tracemodes.model.TracePipeline;
import com.obsinity.tracemodes.registry.TraceModeConfig;
import com.obsinity.tracemodes.registry.TraceModeRegistry;
import com.obsinity.tracemodes.trace.Trace;
import com.obsinity.tracemodes.trace.TraceQuery;
import com.obsinity.tracemodes.utils.TraceModeSelector;

/**
 * # TraceModeEngine
 *
 * <p>Execution-time entry point used by the query engine. Looks up the class's {@link TraceModeConfig} in the
 * {@link TraceModeRegistry} and delegates to {@link PipelineBuilder}, {@link OptionAggregator} and
 * {@link TraceFactory}.
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * TraceQuery query = new TraceQuery("{ greeting }", null, Map.of("trace_mode", "special"));
 * Trace trace = engine.newInstanceFor(MySchema.class, query, Map.of());
 * Object result = trace.executeQuery(query, () -> execute(query));
 * }</pre>
 *
 * <p>All operations are synchronous and safe to call concurrently.
 */
@RequiredArgsConstructor
public class TraceModeEngine {

	private static final Logger log = LoggerFactory.getLogger(TraceModeEngine.class);

	private final TraceModeRegistry registry;
	private final PipelineBuilder builder;
	private final OptionAggregator aggregator;
	private final TraceFactory factory;
	private final TraceModeSelector selector;
	private final PipelineDiagnostics diagnostics;

	/** Engine with default components and no Spring context. */
	public static TraceModeEngine standalone(TraceModeRegistry registry) {
		ModeResolver resolver = new ModeResolver();
		PipelineBuilder builder = new PipelineBuilder(resolver);
		OptionAggregator aggregator = new OptionAggregator(resolver);
		return new TraceModeEngine(
				registry,
				builder,
				aggregator,
				new TraceFactory(builder, aggregator),
				new TraceModeSelector(),
				new PipelineDiagnostics());
	}

	public TraceModeRegistry registry() {
		return registry;
	}

	/** Registration store of {@code type}. */
	public TraceModeConfig configFor(Class<?> type) {
		return registry.configFor(type);
	}

	/* ===================== introspection ===================== */

	public TracePipeline pipelineFor(Class<?> type, String mode) {
		return builder.build(registry.configFor(type), mode);
	}

	public Map<String, OptionDeclaration> optionsFor(Class<?> type, String mode) {
		return aggregator.optionsFor(registry.configFor(type), Modes.requireValid(mode));
	}

	public String defaultModeOf(Class<?> type) {
		return factory.defaultModeOf(registry.configFor(type));
	}

	/**
	 * Mode names known for {@code type}: {@value Modes#DEFAULT}, the effective default mode, modes declared explicitly
	 * anywhere in the ancestry and every mode named by a layer scope in the ancestry.
	 */
	public Set<String> knownModes(Class<?> type) {
		TraceModeConfig config = registry.configFor(type);
		Set<String> modes = new LinkedHashSet<>();
		modes.add(Modes.DEFAULT);
		modes.add(factory.defaultModeOf(config));
		for (TraceModeConfig level : config.ancestry()) {
			modes.addAll(level.ownDeclaredModes());
			for (LayerDeclaration layer : level.ownLayers()) {
				modes.addAll(layer.scope().modes());
			}
		}
		return Set.copyOf(modes);
	}

	/** JSON description of the (class, mode) pipeline with its merged options. */
	public String describe(Class<?> type, String mode) {
		TraceModeConfig config = registry.configFor(type);
		String m = Modes.requireValid(mode);
		return diagnostics.toJson(builder.build(config, m), aggregator.optionsFor(config, m));
	}

	/* ===================== instantiation ===================== */

	public Trace newInstance(Class<?> type) {
		return newInstance(type, null, Map.of());
	}

	public Trace newInstance(Class<?> type, Map<String, ?> params) {
		return newInstance(type, null, params);
	}

	/** @param mode requested mode; null selects the class's default mode */
	public Trace newInstance(Class<?> type, String mode, Map<String, ?> params) {
		return factory.newInstance(registry.configFor(type), mode, params);
	}

	/** Uses the mode hint carried by {@code context}, if any. */
	public Trace newInstanceFor(Class<?> type, Map<String, ?> context, Map<String, ?> params) {
		String hint = selector.select(context);
		if (log.isDebugEnabled()) {
			log.debug("Selected trace mode {} for {}", hint != null ? hint : "<default>", type.getName());
		}
		return newInstance(type, hint, params);
	}

	public Trace newInstanceFor(Class<?> type, TraceQuery query, Map<String, ?> params) {
		return newInstanceFor(type, query == null ? null : query.context(), params);
	}

	/* ===================== administration ===================== */

	/** Builds the pipelines for {@code modes} ahead of the first request. */
	public void preload(Class<?> type, Collection<String> modes) {
		TraceModeConfig config = registry.configFor(type);
		for (String mode : modes) {
			builder.build(config, mode);
		}
	}

	/** Clears one cached pipeline of {@code type}; a null mode clears all of them. */
	public void resetCache(Class<?> type, String mode) {
		TraceModeConfig config = registry.configFor(type);
		if (mode == null) {
			config.resetCache();
		} else {
			config.resetCache(mode);
		}
	}

	public void resetCache(Class<?> type) {
		resetCache(type, null);
	}
}
