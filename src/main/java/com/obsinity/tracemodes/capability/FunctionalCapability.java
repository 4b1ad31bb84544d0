package com.obsinity.tracemodes.capability;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.function.BiFunction;

import com.obsinity.tracemodes.model.TraceConfigurationException;
import com.obsinity.tracemodes.model.TraceOptions;
import com.obsinity.tracemodes.trace.Trace;

/** {@link TraceCapability} backed by a factory function. Identity-based equality. */
final class FunctionalCapability implements TraceCapability {

	private final String name;
	private final Set<String> requiredOptions;
	private final BiFunction<Trace, TraceOptions, ? extends Trace> factory;

	FunctionalCapability(
			String name, Set<String> requiredOptions, BiFunction<Trace, TraceOptions, ? extends Trace> factory) {
		if (name == null || name.isBlank()) {
			throw new TraceConfigurationException("Capability name must not be blank");
		}
		this.name = name;
		this.requiredOptions = (requiredOptions == null)
				? Set.of()
				: Collections.unmodifiableSet(new LinkedHashSet<>(requiredOptions));
		this.factory = Objects.requireNonNull(factory, "factory must not be null");
	}

	@Override
	public String name() {
		return name;
	}

	@Override
	public Set<String> requiredOptions() {
		return requiredOptions;
	}

	@Override
	public Trace wrap(Trace inner, TraceOptions options) {
		Trace layer = factory.apply(inner, options);
		if (layer == null) {
			throw new TraceConfigurationException("Capability " + name + " returned a null trace");
		}
		return layer;
	}

	@Override
	public String toString() {
		return "TraceCapability[" + name + "]";
	}
}
