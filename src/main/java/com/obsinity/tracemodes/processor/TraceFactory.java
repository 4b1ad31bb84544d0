package com.obsinity.tracemodes.processor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.obsinity.tracemodes.legacy.LegacyTracer;
import com.obsinity.tracemodes.legacy.LegacyTracerShim;
import com.obsinity.tracemodes.model.Modes;
import com.obsinity.tracemodes.model.OptionDeclaration;
import com.obsinity.tracemodes.model.TraceOptions;
import com.obsinity.tracemodes.model.TracePipeline;
import com.obsinity.tracemodes.registry.TraceModeConfig;
import com.obsinity.tracemodes.trace.Trace;

/**
 * Instantiates pipelines. Every call returns a fresh trace chain; only the {@link TracePipeline} is shared.
 *
 * <p>Option values: declared defaults first, then caller-supplied values override them. Each required option (no
 * default after merging declarations) must be supplied, else {@link MissingParameterException}. Supplied names that
 * no layer declared are passed through unchanged.
 */
public class TraceFactory {

	private final PipelineBuilder builder;
	private final OptionAggregator aggregator;

	public TraceFactory(PipelineBuilder builder, OptionAggregator aggregator) {
		this.builder = Objects.requireNonNull(builder, "builder must not be null");
		this.aggregator = Objects.requireNonNull(aggregator, "aggregator must not be null");
	}

	/** Nearest default-mode override in the ancestry, else {@value Modes#DEFAULT}. */
	public String defaultModeOf(TraceModeConfig config) {
		for (TraceModeConfig c = config; c != null; c = c.parent()) {
			String mode = c.ownDefaultMode();
			if (mode != null) return mode;
		}
		return Modes.DEFAULT;
	}

	public Trace newInstance(TraceModeConfig config) {
		return newInstance(config, null, Map.of());
	}

	/**
	 * @param mode requested mode; null or blank selects {@link #defaultModeOf(TraceModeConfig)}
	 * @param supplied caller-supplied option values
	 * @throws MissingParameterException if a required option has no value
	 */
	public Trace newInstance(TraceModeConfig config, String mode, Map<String, ?> supplied) {
		String m = (mode == null || mode.isBlank()) ? defaultModeOf(config) : mode.strip();
		TracePipeline pipeline = builder.build(config, m);
		Map<String, OptionDeclaration> declared = aggregator.optionsFor(config, m);

		Map<String, Object> values = new LinkedHashMap<>();
		declared.forEach((name, decl) -> {
			if (decl.hasDefault()) values.put(name, decl.defaultValue());
		});
		if (supplied != null) values.putAll(supplied);

		for (OptionDeclaration decl : declared.values()) {
			if (decl.isRequired() && !values.containsKey(decl.name())) {
				throw new MissingParameterException(decl.name(), decl.declaredBy(), config.name(), m);
			}
		}

		if (pipeline.legacyShim() && !values.containsKey(LegacyTracerShim.TRACERS_OPTION)) {
			values.put(LegacyTracerShim.TRACERS_OPTION, legacyTracers(config));
		}
		return pipeline.instantiate(TraceOptions.of(values));
	}

	/** Legacy tracers registered across the ancestry, root first. */
	public List<LegacyTracer> legacyTracers(TraceModeConfig config) {
		List<LegacyTracer> tracers = new ArrayList<>();
		for (TraceModeConfig level : config.ancestry()) {
			tracers.addAll(level.ownLegacyTracers());
		}
		return List.copyOf(tracers);
	}
}
