package com.obsinity.tracemodes.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.obsinity.tracemodes.trace.TraceLayer;

/**
 * Registers a layer on the annotated class. Without {@link #modes()} the layer applies to every mode; with modes it
 * applies only when one of those modes is resolved. Applies to the annotated class and all its subclasses.
 *
 * <pre>{@code
 * @TraceWith(GlobalTrace.class)
 * @TraceWith(value = SpecialTrace.class, modes = "special")
 * @TraceWith(value = OptionsTrace.class, modes = "options",
 *     options = @TraceOption(name = "configured_option", value = "was_configured"))
 * class ParentSchema {}
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(TraceWiths.class)
@Documented
public @interface TraceWith {

	Class<? extends TraceLayer> value();

	/** Mode names; empty means all modes. */
	String[] modes() default {};

	/** Option defaults for this registration. */
	TraceOption[] options() default {};
}
