package com.obsinity.tracemodes.configuration;

import java.util.List;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import com.obsinity.tracemodes.utils.TraceModeSelector;

/**
 * {@code obsinity.trace-modes.*} settings.
 *
 * @param contextKey execution-context key carrying the mode hint
 * @param logPipelines log each built pipeline as JSON at DEBUG
 * @param preload fully-qualified class name to the modes whose pipelines are built at startup
 */
@ConfigurationProperties(prefix = "obsinity.trace-modes")
public record TraceModeProperties(
		@DefaultValue(TraceModeSelector.DEFAULT_CONTEXT_KEY) String contextKey,
		@DefaultValue("false") boolean logPipelines,
		Map<String, List<String>> preload) {

	public TraceModeProperties {
		preload = (preload == null) ? Map.of() : Map.copyOf(preload);
	}
}
