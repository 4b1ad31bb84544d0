package com.obsinity.tracemodes.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.obsinity.tracemodes.trace.Trace;

/**
 * Names a mode on the annotated class, optionally with a base type used for that mode only. {@link Trace} itself as
 * {@link #base()} means "no mode-specific base type".
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(TraceModes.class)
@Documented
public @interface TraceMode {

	String name();

	Class<? extends Trace> base() default Trace.class;
}
