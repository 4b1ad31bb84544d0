package com.obsinity.tracemodes.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import com.obsinity.tracemodes.trace.Trace;

/** Overrides the base trace type for the annotated class and every subclass that does not override it again. */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TraceBase {
	Class<? extends Trace> value();
}
