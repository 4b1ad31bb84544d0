package com.obsinity.tracemodes.capability;

import java.util.Set;
import java.util.function.BiFunction;

import com.obsinity.tracemodes.model.TraceOptions;
import com.obsinity.tracemodes.trace.Trace;
import com.obsinity.tracemodes.trace.TraceLayer;

/**
 * A unit of instrumentation behavior that can be layered over another trace. Applying a capability produces a new
 * outer trace that runs its behavior first and delegates to {@code inner} to continue the chain.
 *
 * <p>Capabilities are stateless descriptors: one capability may be registered on many classes and applied to many
 * pipelines; {@link #wrap(Trace, TraceOptions)} is called once per instantiated trace.
 */
public interface TraceCapability {

	/** Human-friendly name used in diagnostics and error messages. */
	String name();

	/** Option names that must have a value (declared default or caller-supplied) at construction time. */
	Set<String> requiredOptions();

	/** Creates the layer instance wrapping {@code inner}. */
	Trace wrap(Trace inner, TraceOptions options);

	/**
	 * Capability backed by a {@link TraceLayer} subclass. Required options are read from
	 * {@link com.obsinity.tracemodes.annotations.RequiresOptions} on the class.
	 */
	static TraceCapability of(Class<? extends TraceLayer> layerType) {
		return ClassCapability.forType(layerType);
	}

	/** Capability backed by a factory function. */
	static TraceCapability of(
			String name, Set<String> requiredOptions, BiFunction<Trace, TraceOptions, ? extends Trace> factory) {
		return new FunctionalCapability(name, requiredOptions, factory);
	}

	/** Capability backed by a factory function with no required options. */
	static TraceCapability of(String name, BiFunction<Trace, TraceOptions, ? extends Trace> factory) {
		return new FunctionalCapability(name, Set.of(), factory);
	}
}
