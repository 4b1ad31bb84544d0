package com.obsinity.tracemodes.annotations;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares option names a {@code TraceLayer} subclass needs at construction time. A registration must provide a
 * default for each, or the caller must supply it when instantiating the pipeline.
 *
 * <pre>{@code
 * @RequiresOptions("configured_option")
 * public class OptionsTrace extends TraceLayer { ... }
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Inherited
@Documented
public @interface RequiresOptions {
	String[] value();
}
