package com.obsinity.tracemodes.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.obsinity.tracemodes.capability.TraceCapability;

/**
 * One registered instrumentation layer.
 *
 * @param capability behavior applied over the inner trace
 * @param scope modes the layer applies to
 * @param options construction parameters the layer needs, by name
 * @param declaringClass name of the config that issued the registration (ordering and diagnostics only)
 */
public record LayerDeclaration(
		TraceCapability capability, LayerScope scope, Map<String, OptionDeclaration> options, String declaringClass) {

	public LayerDeclaration {
		Objects.requireNonNull(capability, "capability must not be null");
		scope = (scope == null) ? LayerScope.all() : scope;
		options = (options == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(options));
	}

	/**
	 * Builds a declaration from the values given at registration: every required option of the capability is
	 * declared (required unless {@code defaults} supplies a value), and every entry of {@code defaults} becomes an
	 * option with that default.
	 */
	public static LayerDeclaration of(
			TraceCapability capability, LayerScope scope, Map<String, ?> defaults, String declaringClass) {
		if (capability == null) {
			throw new TraceConfigurationException("Cannot declare a null capability on " + declaringClass);
		}
		Map<String, OptionDeclaration> options = new LinkedHashMap<>();
		for (String name : capability.requiredOptions()) {
			options.put(name, OptionDeclaration.required(name, capability.name()));
		}
		if (defaults != null) {
			defaults.forEach((name, value) -> {
				if (name == null || name.isBlank()) {
					throw new TraceConfigurationException(
							"Blank option name for " + capability.name() + " on " + declaringClass);
				}
				options.put(name, OptionDeclaration.withDefault(name, value, capability.name()));
			});
		}
		return new LayerDeclaration(capability, scope, options, declaringClass);
	}

	@Override
	public String toString() {
		return capability.name() + "@" + declaringClass + scope;
	}
}
