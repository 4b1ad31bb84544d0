package com.obsinity.tracemodes.registry;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CopyOnWriteArraySet;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.obsinity.tracemodes.capability.TraceCapability;
import com.obsinity.tracemodes.legacy.LegacyTracer;
import com.obsinity.tracemodes.model.BaseTypes;
import com.obsinity.tracemodes.model.LayerDeclaration;
import com.obsinity.tracemodes.model.LayerScope;
import com.obsinity.tracemodes.model.Modes;
import com.obsinity.tracemodes.model.TraceConfigurationException;
import com.obsinity.tracemodes.model.TracePipeline;
import com.obsinity.tracemodes.trace.Trace;
import com.obsinity.tracemodes.trace.TraceLayer;

/**
 * Per-class trace mode configuration: this class's own layer declarations and mode settings, a pointer to the parent
 * class's config, and this class's own cache of built pipelines.
 *
 * <p>Declarations are append-only. A pipeline already cached for a mode is not affected by later declarations here or
 * on an ancestor; call {@link #resetCache()} or {@link #resetCache(String)} to rebuild it.
 *
 * <p>Own settings are exposed as-is (no inheritance applied). Effective values that walk the ancestry are computed by
 * the processor classes.
 */
public final class TraceModeConfig {

	private static final Logger log = LoggerFactory.getLogger(TraceModeConfig.class);

	private final String name;
	private final TraceModeConfig parent;

	private final List<LayerDeclaration> layers = new CopyOnWriteArrayList<>();
	private final Set<String> declaredModes = new CopyOnWriteArraySet<>();
	private final ConcurrentMap<String, Class<? extends Trace>> modeBaseTypes = new ConcurrentHashMap<>();
	private final List<LegacyTracer> legacyTracers = new CopyOnWriteArrayList<>();
	private final ConcurrentMap<String, TracePipeline> cache = new ConcurrentHashMap<>();

	private volatile Class<? extends Trace> baseType;
	private volatile String defaultMode;
	private volatile boolean legacyShim;

	public TraceModeConfig(String name, TraceModeConfig parent) {
		if (name == null || name.isBlank()) {
			throw new TraceConfigurationException("Config name must not be blank");
		}
		this.name = name;
		this.parent = parent;
	}

	/** Config with no parent. */
	public static TraceModeConfig root(String name) {
		return new TraceModeConfig(name, null);
	}

	/** New config whose parent is this one. */
	public TraceModeConfig child(String childName) {
		return new TraceModeConfig(childName, this);
	}

	/* ===================== registration ===================== */

	/** Registers {@code capability} for every mode with no option defaults. */
	public TraceModeConfig declareLayer(TraceCapability capability) {
		return declareLayer(capability, LayerScope.all(), Map.of());
	}

	/** Registers {@code capability} for every mode. */
	public TraceModeConfig declareLayer(TraceCapability capability, Map<String, ?> options) {
		return declareLayer(capability, LayerScope.all(), options);
	}

	/** Registers {@code capability} for the given modes only (no modes means every mode). */
	public TraceModeConfig declareLayer(TraceCapability capability, String... modes) {
		LayerScope scope = (modes == null || modes.length == 0) ? LayerScope.all() : LayerScope.of(modes);
		return declareLayer(capability, scope, Map.of());
	}

	public TraceModeConfig declareLayer(Class<? extends TraceLayer> layerType, LayerScope scope, Map<String, ?> options) {
		return declareLayer(TraceCapability.of(layerType), scope, options);
	}

	/**
	 * Appends a layer declaration to this class's own sequence.
	 *
	 * @param options option defaults, keyed by name; capability-required options without an entry stay required
	 */
	public TraceModeConfig declareLayer(TraceCapability capability, LayerScope scope, Map<String, ?> options) {
		LayerDeclaration declaration = LayerDeclaration.of(capability, scope, options, name);
		layers.add(declaration);
		noteLateRegistration("layer " + declaration);
		return this;
	}

	/** Overrides the base type for this class and descendants that do not override it. */
	public TraceModeConfig setBaseType(Class<? extends Trace> type) {
		this.baseType = BaseTypes.requireInstantiable(type);
		noteLateRegistration("base type " + type.getName());
		return this;
	}

	/** Names a mode explicitly. */
	public TraceModeConfig declareMode(String mode) {
		declaredModes.add(Modes.requireValid(mode));
		return this;
	}

	/** Names a mode and sets the base type used for that mode only. */
	public TraceModeConfig declareMode(String mode, Class<? extends Trace> modeBaseType) {
		String m = Modes.requireValid(mode);
		declaredModes.add(m);
		if (modeBaseType != null) {
			modeBaseTypes.put(m, BaseTypes.requireInstantiable(modeBaseType));
			noteLateRegistration("base type " + modeBaseType.getName() + " for mode " + m);
		}
		return this;
	}

	public TraceModeConfig setDefaultMode(String mode) {
		this.defaultMode = Modes.requireValid(mode);
		return this;
	}

	/** Inserts the legacy tracer shim over the base type in pipelines built here and in descendants. */
	public TraceModeConfig declareLegacyShim() {
		this.legacyShim = true;
		noteLateRegistration("legacy shim");
		return this;
	}

	/** Registers a legacy tracer; implies {@link #declareLegacyShim()}. */
	public TraceModeConfig addLegacyTracer(LegacyTracer tracer) {
		legacyTracers.add(Objects.requireNonNull(tracer, "tracer must not be null"));
		return declareLegacyShim();
	}

	/** Removes a legacy tracer registered here. The shim stays declared. */
	public boolean removeLegacyTracer(LegacyTracer tracer) {
		return legacyTracers.remove(tracer);
	}

	/* ===================== own state ===================== */

	public String name() {
		return name;
	}

	public TraceModeConfig parent() {
		return parent;
	}

	/** Configs from the root-most ancestor down to this one. */
	public List<TraceModeConfig> ancestry() {
		Deque<TraceModeConfig> chain = new ArrayDeque<>();
		for (TraceModeConfig c = this; c != null; c = c.parent) {
			chain.addFirst(c);
		}
		return List.copyOf(chain);
	}

	/** This class's own declarations in insertion order. */
	public List<LayerDeclaration> ownLayers() {
		return Collections.unmodifiableList(layers);
	}

	public Class<? extends Trace> ownBaseType() {
		return baseType;
	}

	public Class<? extends Trace> ownModeBaseType(String mode) {
		return modeBaseTypes.get(mode);
	}

	public String ownDefaultMode() {
		return defaultMode;
	}

	public boolean ownLegacyShim() {
		return legacyShim;
	}

	public List<LegacyTracer> ownLegacyTracers() {
		return Collections.unmodifiableList(legacyTracers);
	}

	public Set<String> ownDeclaredModes() {
		return Collections.unmodifiableSet(declaredModes);
	}

	/* ===================== cache ===================== */

	/** Cached pipeline for {@code mode}, or null if none was built since the last reset. */
	public TracePipeline cachedPipeline(String mode) {
		return cache.get(mode);
	}

	/** Modes with a cached pipeline. */
	public Set<String> cachedModes() {
		return Collections.unmodifiableSet(cache.keySet());
	}

	/**
	 * Returns the cached pipeline for {@code mode}, building it with {@code builder} on first use. The build runs at
	 * most once per mode between resets; concurrent callers for the same mode wait for it.
	 */
	public TracePipeline pipeline(String mode, Function<String, TracePipeline> builder) {
		TracePipeline cached = cache.get(mode);
		if (cached != null) return cached;
		return cache.computeIfAbsent(mode, builder);
	}

	public void resetCache() {
		if (!cache.isEmpty()) {
			log.debug("Resetting all cached trace pipelines of {} (modes={})", name, cache.keySet());
		}
		cache.clear();
	}

	public void resetCache(String mode) {
		if (cache.remove(mode) != null) {
			log.debug("Reset cached trace pipeline of {} for mode {}", name, mode);
		}
	}

	private void noteLateRegistration(String what) {
		if (!cache.isEmpty() && log.isDebugEnabled()) {
			log.debug(
					"Registered {} on {} after pipelines were built for {}; they are unchanged until resetCache",
					what,
					name,
					cache.keySet());
		}
	}

	@Override
	public String toString() {
		return "TraceModeConfig{" + name + (parent == null ? "" : " < " + parent.name) + "}";
	}
}
