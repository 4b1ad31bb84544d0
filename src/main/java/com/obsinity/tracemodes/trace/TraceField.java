package com.obsinity.tracemodes.trace;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** A field resolution being traced: owner type, field name and the resolved arguments. */
public record TraceField(String ownerType, String fieldName, Map<String, Object> arguments) {

	public TraceField {
		arguments = (arguments == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
	}

	public TraceField(String ownerType, String fieldName) {
		this(ownerType, fieldName, Map.of());
	}

	/** {@code Owner.field} form used in logs and legacy tracer metadata. */
	public String path() {
		return ownerType + "." + fieldName;
	}
}
