package com.obsinity.tracemodes.configuration;

import static java.lang.annotation.RetentionPolicy.RUNTIME;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Inherited;
import java.lang.annotation.Retention;
import java.lang.annotation.Target;

import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.annotation.AliasFor;
import org.springframework.test.annotation.DirtiesContext;

/**
 * Test meta-annotation for suites that need a fresh Spring context (and thus a fresh {@code TraceModeRegistry} with
 * empty pipeline caches) per test class. Imports {@link TraceModeAutoConfiguration}.
 *
 * <pre>{@code
 * @TraceModeBootSuite(classes = MySuite.Config.class, properties = "obsinity.trace-modes.context-key=hint")
 * class MySuite {}
 * }</pre>
 */
@Target(ElementType.TYPE)
@Retention(RUNTIME)
@Documented
@Inherited
@SpringBootTest
@ImportAutoConfiguration(TraceModeAutoConfiguration.class)
@DirtiesContext(classMode = DirtiesContext.ClassMode.AFTER_CLASS)
public @interface TraceModeBootSuite {

	/** Shortcut to {@link SpringBootTest#classes()}. */
	@AliasFor(annotation = SpringBootTest.class, attribute = "classes")
	Class<?>[] classes() default {};

	/** Shortcut to {@link SpringBootTest#properties()}; defaults to no web stack. */
	@AliasFor(annotation = SpringBootTest.class, attribute = "properties")
	String[] properties() default {"spring.main.web-application-type=none"};

	@AliasFor(annotation = SpringBootTest.class, attribute = "webEnvironment")
	SpringBootTest.WebEnvironment webEnvironment() default SpringBootTest.WebEnvironment.NONE;
}
