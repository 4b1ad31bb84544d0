package com.obsinity.tracemodes.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Which modes a layer declaration applies to: {@link #all()} (every mode, including names never declared anywhere) or
 * an explicit, non-empty set of mode names.
 */
public final class LayerScope {

	private static final LayerScope ALL = new LayerScope(null);

	private final Set<String> modes; // null = all

	private LayerScope(Set<String> modes) {
		this.modes = modes;
	}

	public static LayerScope all() {
		return ALL;
	}

	public static LayerScope of(String... modes) {
		return of(modes == null ? null : Arrays.asList(modes));
	}

	/**
	 * Scope for the given mode names. A null collection means {@link #all()}; an empty one is rejected.
	 *
	 * @throws TraceConfigurationException if the collection is empty or holds a blank name
	 */
	public static LayerScope of(Collection<String> modes) {
		if (modes == null) return ALL;
		if (modes.isEmpty()) {
			throw new TraceConfigurationException("A mode-scoped layer needs at least one mode name");
		}
		Set<String> names = new LinkedHashSet<>();
		for (String m : modes) {
			names.add(Modes.requireValid(m));
		}
		return new LayerScope(Collections.unmodifiableSet(names));
	}

	public boolean isAll() {
		return modes == null;
	}

	/** True if a layer with this scope is visible when resolving {@code mode}. */
	public boolean includes(String mode) {
		return modes == null || modes.contains(mode);
	}

	/** True only for mode-scoped declarations naming {@code mode}; always false for {@link #all()}. */
	public boolean namesMode(String mode) {
		return modes != null && modes.contains(mode);
	}

	/** Explicit mode names, empty for {@link #all()}. */
	public Set<String> modes() {
		return modes == null ? Set.of() : modes;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) return true;
		if (!(o instanceof LayerScope other)) return false;
		return (modes == null) ? other.modes == null : modes.equals(other.modes);
	}

	@Override
	public int hashCode() {
		return modes == null ? 0 : modes.hashCode();
	}

	@Override
	public String toString() {
		return isAll() ? "ALL" : modes.toString();
	}
}
