package com.obsinity.tracemodes.processor;

/** Thrown when a required construction option has neither a declared default nor a caller-supplied value. */
public final class MissingParameterException extends RuntimeException {

	private final String parameter;
	private final String capability;

	public MissingParameterException(String parameter, String capability, String owner, String mode) {
		super("Missing required trace option '" + parameter + "' for " + capability + " (class=" + owner + ", mode="
				+ mode + ")");
		this.parameter = parameter;
		this.capability = capability;
	}

	public String parameter() {
		return parameter;
	}

	public String capability() {
		return capability;
	}
}
