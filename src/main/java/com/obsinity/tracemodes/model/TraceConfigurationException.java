package com.obsinity.tracemodes.model;

/** Thrown for invalid registrations or when a layer or base type cannot be constructed. */
public class TraceConfigurationException extends RuntimeException {

	public TraceConfigurationException(String message) {
		super(message);
	}

	public TraceConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
