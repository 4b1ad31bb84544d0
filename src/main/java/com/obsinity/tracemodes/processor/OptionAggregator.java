package com.obsinity.tracemodes.processor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.obsinity.tracemodes.model.LayerDeclaration;
import com.obsinity.tracemodes.model.OptionDeclaration;
import com.obsinity.tracemodes.registry.TraceModeConfig;

/**
 * Merges the option declarations of every layer in a (class, mode) pipeline. Layers are visited in resolution order.
 * On a duplicate name the later-resolved default wins. A later declaration without a default never drops a default
 * declared earlier, so a name is required only when no included layer gives it a default.
 */
public class OptionAggregator {

	private final ModeResolver resolver;

	public OptionAggregator(ModeResolver resolver) {
		this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
	}

	public Map<String, OptionDeclaration> optionsFor(TraceModeConfig config, String mode) {
		Map<String, OptionDeclaration> merged = new LinkedHashMap<>();
		for (LayerDeclaration layer : resolver.resolve(config, mode)) {
			layer.options().forEach((name, decl) -> merged.merge(name, decl, OptionAggregator::combine));
		}
		return Collections.unmodifiableMap(merged);
	}

	private static OptionDeclaration combine(OptionDeclaration earlier, OptionDeclaration later) {
		return (later.isRequired() && earlier.hasDefault()) ? earlier : later;
	}
}
