package com.obsinity.tracemodes.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import com.obsinity.tracemodes.capability.TraceCapability;
import com.obsinity.tracemodes.legacy.LegacyTracerShim;
import com.obsinity.tracemodes.trace.Trace;

/**
 * The composed trace type for one (class, mode) pair: a base type plus an ordered list of layers. Immutable; rebuilt
 * pipelines for identical registrations are {@link #equals(Object) equal}.
 *
 * <p>Layers are kept innermost first. When the pipeline is instantiated the base instance is created, the legacy shim
 * (if any) wraps it, then each layer wraps the result in list order, so the last layer runs first.
 */
public final class TracePipeline {

	private final String owner;
	private final String mode;
	private final Class<? extends Trace> baseType;
	private final boolean legacyShim;
	private final List<LayerDeclaration> layers;

	public TracePipeline(
			String owner,
			String mode,
			Class<? extends Trace> baseType,
			boolean legacyShim,
			List<LayerDeclaration> layers) {
		this.owner = Objects.requireNonNull(owner, "owner must not be null");
		this.mode = Objects.requireNonNull(mode, "mode must not be null");
		this.baseType = Objects.requireNonNull(baseType, "baseType must not be null");
		this.legacyShim = legacyShim;
		this.layers = (layers == null) ? List.of() : List.copyOf(layers);
	}

	public String owner() {
		return owner;
	}

	public String mode() {
		return mode;
	}

	public Class<? extends Trace> baseType() {
		return baseType;
	}

	public boolean legacyShim() {
		return legacyShim;
	}

	/** Resolved layer declarations, innermost first (the legacy shim is not listed). */
	public List<LayerDeclaration> layers() {
		return layers;
	}

	/** Capabilities in application order, innermost first, including the legacy shim when present. */
	public List<TraceCapability> capabilities() {
		List<TraceCapability> out = new ArrayList<>(layers.size() + 1);
		if (legacyShim) out.add(LegacyTracerShim.CAPABILITY);
		for (LayerDeclaration layer : layers) out.add(layer.capability());
		return Collections.unmodifiableList(out);
	}

	public boolean includes(TraceCapability capability) {
		return capabilities().contains(capability);
	}

	/** True if the base type is {@code type} or one of its subtypes. */
	public boolean isBasedOn(Class<?> type) {
		return type.isAssignableFrom(baseType);
	}

	/** Names from the outermost layer down to the base type, the order in which operations run. */
	public List<String> ancestry() {
		List<TraceCapability> caps = capabilities();
		List<String> out = new ArrayList<>(caps.size() + 1);
		for (int i = caps.size() - 1; i >= 0; i--) out.add(caps.get(i).name());
		out.add(baseType.getName());
		return Collections.unmodifiableList(out);
	}

	/** Creates a fresh trace chain. Instances share nothing with each other. */
	public Trace instantiate(TraceOptions options) {
		TraceOptions opts = (options == null) ? TraceOptions.empty() : options;
		Trace current = BaseTypes.instantiate(baseType, opts);
		for (TraceCapability capability : capabilities()) {
			current = capability.wrap(current, opts);
		}
		return current;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof TracePipeline other)) return false;
		return legacyShim == other.legacyShim
				&& owner.equals(other.owner)
				&& mode.equals(other.mode)
				&& baseType.equals(other.baseType)
				&& layers.equals(other.layers);
	}

	@Override
	public int hashCode() {
		return Objects.hash(owner, mode, baseType, legacyShim, layers);
	}

	@Override
	public String toString() {
		return "TracePipeline{owner=" + owner + ", mode=" + mode + ", ancestry=" + ancestry() + "}";
	}
}
