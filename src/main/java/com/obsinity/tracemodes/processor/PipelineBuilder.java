package com.obsinity.tracemodes.processor;

import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.tracemodes.model.LayerDeclaration;
import com.obsinity.tracemodes.model.Modes;
import com.obsinity.tracemodes.model.TracePipeline;
import com.obsinity.tracemodes.registry.TraceModeConfig;
import com.obsinity.tracemodes.trace.NoopTrace;
import com.obsinity.tracemodes.trace.Trace;

/**
 * Builds and caches the {@link TracePipeline} for a (class, mode) pair. Each class keeps its own cache; a subclass
 * never reuses its superclass's entry.
 *
 * <p>Base type: walking from the class up to the root, the first level that declared a base type for this mode, or a
 * global base type, wins (a mode base type beats a global one on the same level). Without any, {@link NoopTrace}.
 * The legacy shim is included when the class or an ancestor declared it.
 */
public class PipelineBuilder {

	private static final Logger log = LoggerFactory.getLogger(PipelineBuilder.class);

	private final ModeResolver resolver;
	private final PipelineDiagnostics diagnostics;
	private final boolean logPipelines;

	public PipelineBuilder(ModeResolver resolver) {
		this(resolver, null, false);
	}

	public PipelineBuilder(ModeResolver resolver, PipelineDiagnostics diagnostics, boolean logPipelines) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
		this.diagnostics = diagnostics;
		this.logPipelines = logPipelines && diagnostics != null;
	}

	public TracePipeline build(TraceModeConfig config, String mode) {
		String m = Modes.requireValid(mode);
		return config.pipeline(m, key -> compose(config, key));
	}

	/** Builds without consulting or filling the cache. */
	public TracePipeline compose(TraceModeConfig config, String mode) {
		Class<? extends Trace> baseType = effectiveBaseType(config, mode);
		boolean legacyShim = hasLegacyShim(config);
		List<LayerDeclaration> layers = resolver.resolve(config, mode);
		TracePipeline pipeline = new TracePipeline(config.name(), mode, baseType, legacyShim, layers);

		if (log.isDebugEnabled()) {
			log.debug("Built trace pipeline class={} mode={} ancestry={}", config.name(), mode, pipeline.ancestry());
			if (logPipelines) {
				log.debug("trace pipeline payload:\n{}", diagnostics.toJson(pipeline));
			}
		}
		return pipeline;
	}

	static Class<? extends Trace> effectiveBaseType(TraceModeConfig config, String mode) {
		for (TraceModeConfig c = config; c != null; c = c.parent()) {
			Class<? extends Trace> modeBase = c.ownModeBaseType(mode);
			if (modeBase != null) return modeBase;
			Class<? extends Trace> base = c.ownBaseType();
			if (base != null) return base;
		}
		return NoopTrace.class;
	}

	static boolean hasLegacyShim(TraceModeConfig config) {
		for (TraceModeConfig c = config; c != null; c = c.parent()) {
			if (c.ownLegacyShim()) return true;
		}
		return false;
	}
}
