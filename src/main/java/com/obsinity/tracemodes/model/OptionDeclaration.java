package com.obsinity.tracemodes.model;

import java.util.Objects;

/**
 * A named construction parameter declared by a layer.
 *
 * @param name parameter name
 * @param defaultValue default used when the caller supplies nothing (meaningful only when {@code hasDefault})
 * @param hasDefault false for required parameters
 * @param declaredBy name of the capability that declared it, for error messages
 */
public record OptionDeclaration(String name, Object defaultValue, boolean hasDefault, String declaredBy) {

	public OptionDeclaration {
		Objects.requireNonNull(name, "option name must not be null");
		if (!hasDefault) defaultValue = null;
	}

	public static OptionDeclaration required(String name, String declaredBy) {
		return new OptionDeclaration(name, null, false, declaredBy);
	}

	public static OptionDeclaration withDefault(String name, Object defaultValue, String declaredBy) {
		return new OptionDeclaration(name, defaultValue, true, declaredBy);
	}

	public boolean isRequired() {
		return !hasDefault;
	}
}
