package com.obsinity.tracemodes.registry;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.MergedAnnotation;
import org.springframework.core.annotation.MergedAnnotations;
import org.springframework.core.annotation.MergedAnnotations.SearchStrategy;

import com.obsinity.tracemodes.annotations.DefaultTraceMode;
import com.obsinity.tracemodes.annotations.LegacyTracing;
import com.obsinity.tracemodes.annotations.TraceBase;
import com.obsinity.tracemodes.annotations.TraceMode;
import com.obsinity.tracemodes.annotations.TraceOption;
import com.obsinity.tracemodes.annotations.TraceWith;
import com.obsinity.tracemodes.model.LayerScope;
import com.obsinity.tracemodes.model.TraceConfigurationException;
import com.obsinity.tracemodes.trace.Trace;
import com.obsinity.tracemodes.trace.TraceLayer;

/**
 * Applies the registration annotations found directly on a class (meta-annotations included) to that class's
 * {@link TraceModeConfig}.
 *
 * <p>Annotations on superclasses are not consulted: their registrations live on the superclass config and reach this
 * class through the parent pointer.
 *
 * <p>Order applied: {@code @TraceBase}, {@code @TraceMode}s, {@code @DefaultTraceMode}, {@code @LegacyTracing}, then
 * {@code @TraceWith}s in declaration order.
 */
public class TraceAnnotationScanner {

	private static final Logger log = LoggerFactory.getLogger(TraceAnnotationScanner.class);

	public void apply(Class<?> type, TraceModeConfig config) {
		MergedAnnotations annotations = MergedAnnotations.from(type, SearchStrategy.DIRECT);

		MergedAnnotation<TraceBase> base = annotations.get(TraceBase.class);
		if (base.isPresent()) {
			config.setBaseType(traceType(type, base.getClass("value")));
		}

		annotations.stream(TraceMode.class).forEach(mode -> {
			Class<?> modeBase = mode.getClass("base");
			config.declareMode(mode.getString("name"), modeBase == Trace.class ? null : traceType(type, modeBase));
		});

		MergedAnnotation<DefaultTraceMode> defaultMode = annotations.get(DefaultTraceMode.class);
		if (defaultMode.isPresent()) {
			config.setDefaultMode(defaultMode.getString("value"));
		}

		if (annotations.isPresent(LegacyTracing.class)) {
			config.declareLegacyShim();
		}

		annotations.stream(TraceWith.class).forEach(with -> {
			Class<? extends TraceLayer> layerType = layerType(type, with.getClass("value"));
			String[] modes = with.getStringArray("modes");
			LayerScope scope = (modes.length == 0) ? LayerScope.all() : LayerScope.of(modes);
			config.declareLayer(layerType, scope, readOptions(with.synthesize()));
		});

		if (log.isDebugEnabled() && !config.ownLayers().isEmpty()) {
			log.debug("Scanned {}: layers={}", type.getName(), config.ownLayers());
		}
	}

	private static Map<String, Object> readOptions(TraceWith with) {
		Map<String, Object> options = new LinkedHashMap<>();
		Arrays.stream(with.options()).forEach((TraceOption opt) -> options.put(opt.name(), opt.value()));
		return options;
	}

	@SuppressWarnings("unchecked")
	private static Class<? extends Trace> traceType(Class<?> owner, Class<?> type) {
		if (!Trace.class.isAssignableFrom(type)) {
			throw new TraceConfigurationException(type.getName() + " on " + owner.getName() + " is not a Trace");
		}
		return (Class<? extends Trace>) type;
	}

	@SuppressWarnings("unchecked")
	private static Class<? extends TraceLayer> layerType(Class<?> owner, Class<?> type) {
		if (!TraceLayer.class.isAssignableFrom(type)) {
			throw new TraceConfigurationException(
					type.getName() + " registered on " + owner.getName() + " is not a TraceLayer");
		}
		return (Class<? extends TraceLayer>) type;
	}
}
