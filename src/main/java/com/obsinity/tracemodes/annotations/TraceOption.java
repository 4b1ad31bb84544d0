package com.obsinity.tracemodes.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/** A named option default declared inside {@link TraceWith#options()}. Values are strings; layers convert them. */
@Target({})
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface TraceOption {
	String name();

	String value();
}
