package com.obsinity.tracemodes.model;

/** Mode name constants and validation. */
public final class Modes {

	/** Reserved mode name; always exists even with no declarations for it. */
	public static final String DEFAULT = "default";

	private Modes() {}

	/** Returns {@code name} stripped, or throws if it is null or blank. */
	public static String requireValid(String name) {
		if (name == null || name.isBlank()) {
			throw new TraceConfigurationException("Trace mode name must not be blank");
		}
		return name.strip();
	}
}
