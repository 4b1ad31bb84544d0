package com.obsinity.tracemodes.model;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;

import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;
import org.springframework.util.ClassUtils;

import com.obsinity.tracemodes.trace.Trace;

/** Validation and instantiation of base trace types. */
public final class BaseTypes {

	private BaseTypes() {}

	/**
	 * Checks that {@code type} can serve as a base type: concrete, with a public {@code (TraceOptions)} or no-arg
	 * constructor.
	 *
	 * @throws TraceConfigurationException otherwise
	 */
	public static Class<? extends Trace> requireInstantiable(Class<? extends Trace> type) {
		constructorFor(type);
		return type;
	}

	/** Creates a base instance, passing {@code options} when the type accepts them. */
	public static Trace instantiate(Class<? extends Trace> type, TraceOptions options) {
		Constructor<? extends Trace> ctor = constructorFor(type);
		try {
			return (ctor.getParameterCount() == 1)
					? BeanUtils.instantiateClass(ctor, options)
					: BeanUtils.instantiateClass(ctor);
		} catch (BeanInstantiationException e) {
			throw new TraceConfigurationException("Failed to construct base trace " + type.getName(), e);
		}
	}

	private static Constructor<? extends Trace> constructorFor(Class<? extends Trace> type) {
		if (type == null) {
			throw new TraceConfigurationException("Base trace type must not be null");
		}
		if (type.isInterface() || Modifier.isAbstract(type.getModifiers())) {
			throw new TraceConfigurationException("Base trace type is not concrete: " + type.getName());
		}
		Constructor<? extends Trace> ctor = ClassUtils.getConstructorIfAvailable(type, TraceOptions.class);
		if (ctor == null) ctor = ClassUtils.getConstructorIfAvailable(type);
		if (ctor == null) {
			throw new TraceConfigurationException(
					"Base trace type " + type.getName() + " needs a public (TraceOptions) or no-arg constructor");
		}
		return ctor;
	}
}
