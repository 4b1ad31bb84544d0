package com.obsinity.tracemodes.configuration;

import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.util.ClassUtils;

import lombok.RequiredArgsConstructor;

import com.obsinity.tracemodes.processor.TraceModeEngine;

/**
 * Builds the pipelines listed under {@code obsinity.trace-modes.preload} once all singletons exist, so registration
 * mistakes (bad layer constructors, unknown classes) fail at startup instead of on the first request.
 */
@RequiredArgsConstructor
public class TracePipelinePreloader implements SmartInitializingSingleton {

	private static final Logger log = LoggerFactory.getLogger(TracePipelinePreloader.class);

	private final TraceModeEngine engine;
	private final TraceModeProperties properties;

	@Override
	public void afterSingletonsInstantiated() {
		for (Map.Entry<String, List<String>> e : properties.preload().entrySet()) {
			Class<?> type;
			try {
				type = ClassUtils.forName(e.getKey(), ClassUtils.getDefaultClassLoader());
			} catch (ClassNotFoundException | LinkageError ex) {
				throw new BeanCreationException(
						"tracePipelinePreloader", "Cannot load class listed in obsinity.trace-modes.preload: " + e.getKey(), ex);
			}
			List<String> modes = e.getValue() == null || e.getValue().isEmpty()
					? List.of(engine.defaultModeOf(type))
					: e.getValue();
			engine.preload(type, modes);
			log.info("Preloaded trace pipelines class={} modes={}", type.getName(), modes);
		}
	}
}
