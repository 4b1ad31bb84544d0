package com.obsinity.tracemodes.registry;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps Java classes to their {@link TraceModeConfig}. A class's parent config is its superclass's config; top-level
 * classes hang under one shared {@link #root()} config, so registrations on the root apply to every class.
 *
 * <p>A class's config is created on first request, at which point its registration annotations are applied.
 */
public class TraceModeRegistry {

	private static final Logger log = LoggerFactory.getLogger(TraceModeRegistry.class);

	public static final String ROOT_NAME = "<root>";

	private final TraceModeConfig root = TraceModeConfig.root(ROOT_NAME);
	private final ConcurrentMap<Class<?>, TraceModeConfig> configs = new ConcurrentHashMap<>();
	private final TraceAnnotationScanner scanner;

	public TraceModeRegistry() {
		this(new TraceAnnotationScanner());
	}

	public TraceModeRegistry(TraceAnnotationScanner scanner) {
		this.scanner = Objects.requireNonNull(scanner, "scanner must not be null");
	}

	/** The config every top-level class inherits from. */
	public TraceModeConfig root() {
		return root;
	}

	/** Config for {@code type}, creating it (and its ancestors' configs) on first use. */
	public TraceModeConfig configFor(Class<?> type) {
		Objects.requireNonNull(type, "type must not be null");
		if (type == Object.class) return root;

		TraceModeConfig existing = configs.get(type);
		if (existing != null) return existing;

		Class<?> superclass = type.getSuperclass();
		TraceModeConfig parent = (superclass == null || superclass == Object.class) ? root : configFor(superclass);
		TraceModeConfig created = new TraceModeConfig(type.getName(), parent);
		scanner.apply(type, created);

		TraceModeConfig raced = configs.putIfAbsent(type, created);
		if (raced != null) return raced;
		log.debug("Registered trace mode config for {} (parent={})", type.getName(), parent.name());
		return created;
	}

	/** Config for {@code type} if one was already created. */
	public Optional<TraceModeConfig> find(Class<?> type) {
		if (type == Object.class) return Optional.of(root);
		return Optional.ofNullable(configs.get(type));
	}

	public Set<Class<?>> registeredTypes() {
		return Set.copyOf(configs.keySet());
	}

	/** Clears every cached pipeline of every config. */
	public void resetAllCaches() {
		root.resetCache();
		for (Map.Entry<Class<?>, TraceModeConfig> e : configs.entrySet()) {
			e.getValue().resetCache();
		}
	}
}
