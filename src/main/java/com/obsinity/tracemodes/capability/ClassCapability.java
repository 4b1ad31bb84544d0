package com.obsinity.tracemodes.capability;

import java.lang.reflect.Constructor;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

import org.springframework.beans.BeanInstantiationException;
import org.springframework.beans.BeanUtils;
import org.springframework.core.annotation.AnnotatedElementUtils;
import org.springframework.util.ClassUtils;

import com.obsinity.tracemodes.annotations.RequiresOptions;
import com.obsinity.tracemodes.model.TraceConfigurationException;
import com.obsinity.tracemodes.model.TraceOptions;
import com.obsinity.tracemodes.trace.Trace;
import com.obsinity.tracemodes.trace.TraceLayer;

/**
 * {@link TraceCapability} for a {@link TraceLayer} subclass. The constructor is resolved once, preferring
 * {@code (Trace, TraceOptions)} over {@code (Trace)}. Two instances for the same class are equal.
 */
final class ClassCapability implements TraceCapability {

	private final Class<? extends TraceLayer> type;
	private final Constructor<? extends TraceLayer> constructor;
	private final boolean takesOptions;
	private final Set<String> requiredOptions;

	private ClassCapability(
			Class<? extends TraceLayer> type,
			Constructor<? extends TraceLayer> constructor,
			boolean takesOptions,
			Set<String> requiredOptions) {
		this.type = type;
		this.constructor = constructor;
		this.takesOptions = takesOptions;
		this.requiredOptions = requiredOptions;
	}

	static ClassCapability forType(Class<? extends TraceLayer> type) {
		if (type == null) {
			throw new TraceConfigurationException("Layer type must not be null");
		}
		if (Modifier.isAbstract(type.getModifiers())) {
			throw new TraceConfigurationException("Layer type is abstract: " + type.getName());
		}
		Constructor<? extends TraceLayer> ctor =
				ClassUtils.getConstructorIfAvailable(type, Trace.class, TraceOptions.class);
		boolean takesOptions = ctor != null;
		if (ctor == null) {
			ctor = ClassUtils.getConstructorIfAvailable(type, Trace.class);
		}
		if (ctor == null) {
			throw new TraceConfigurationException("Layer type " + type.getName()
					+ " needs a public (Trace, TraceOptions) or (Trace) constructor");
		}
		return new ClassCapability(type, ctor, takesOptions, readRequiredOptions(type));
	}

	private static Set<String> readRequiredOptions(Class<?> type) {
		RequiresOptions ann = AnnotatedElementUtils.findMergedAnnotation(type, RequiresOptions.class);
		if (ann == null) return Set.of();
		Set<String> names = new LinkedHashSet<>();
		Arrays.stream(ann.value()).filter(s -> s != null && !s.isBlank()).map(String::strip).forEach(names::add);
		return Collections.unmodifiableSet(names);
	}

	Class<? extends TraceLayer> type() {
		return type;
	}

	@Override
	public String name() {
		return type.getSimpleName().isEmpty() ? type.getName() : type.getSimpleName();
	}

	@Override
	public Set<String> requiredOptions() {
		return requiredOptions;
	}

	@Override
	public Trace wrap(Trace inner, TraceOptions options) {
		try {
			return takesOptions
					? BeanUtils.instantiateClass(constructor, inner, options)
					: BeanUtils.instantiateClass(constructor, inner);
		} catch (BeanInstantiationException e) {
			throw new TraceConfigurationException("Failed to construct layer " + type.getName(), e);
		}
	}

	@Override
	public boolean equals(Object o) {
		return this == o || (o instanceof ClassCapability other && type.equals(other.type));
	}

	@Override
	public int hashCode() {
		return Objects.hash(type);
	}

	@Override
	public String toString() {
		return "TraceCapability[" + type.getName() + "]";
	}
}
