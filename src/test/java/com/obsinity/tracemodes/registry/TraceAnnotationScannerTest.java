package com.obsinity.tracemodes.registry;

import static org.assertj.core.api.Assertions.assertThat;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import com.obsinity.tracemodes.annotations.DefaultTraceMode;
import com.obsinity.tracemodes.annotations.LegacyTracing;
import com.obsinity.tracemodes.annotations.TraceBase;
import com.obsinity.tracemodes.annotations.TraceMode;
import com.obsinity.tracemodes.annotations.TraceOption;
import com.obsinity.tracemodes.annotations.TraceWith;
import com.obsinity.tracemodes.model.LayerDeclaration;
import com.obsinity.tracemodes.model.LayerScope;
import com.obsinity.tracemodes.model.TraceOptions;
import com.obsinity.tracemodes.trace.NoopTrace;
import com.obsinity.tracemodes.trace.Trace;
import com.obsinity.tracemodes.trace.TraceLayer;

class TraceAnnotationScannerTest {

	public static class First extends TraceLayer {
		public First(Trace inner) {
			super(inner);
		}
	}

	public static class Second extends TraceLayer {
		public Second(Trace inner) {
			super(inner);
		}
	}

	public static class Base extends NoopTrace {
		public Base(TraceOptions options) {
			super(options);
		}
	}

	public static class ModeBase extends NoopTrace {}

	@TraceBase(Base.class)
	@TraceMode(name = "custom", base = ModeBase.class)
	@TraceMode(name = "named_only")
	@DefaultTraceMode("custom")
	@LegacyTracing
	@TraceWith(First.class)
	@TraceWith(value = Second.class, modes = {"special", "extra"}, options = @TraceOption(name = "level", value = "3"))
	static class FullyAnnotated {}

	static class Unannotated extends FullyAnnotated {}

	/** Composed annotation carrying a registration. */
	@Target(ElementType.TYPE)
	@Retention(RetentionPolicy.RUNTIME)
	@TraceWith(value = First.class, modes = "audited")
	@interface Audited {}

	@Audited
	static class MetaAnnotated {}

	private final TraceAnnotationScanner scanner = new TraceAnnotationScanner();

	private TraceModeConfig scan(Class<?> type) {
		TraceModeConfig config = TraceModeConfig.root(type.getName());
		scanner.apply(type, config);
		return config;
	}

	@Test
	@DisplayName("Every registration annotation lands on the class's own config")
	void applies_all_annotations() {
		TraceModeConfig config = scan(FullyAnnotated.class);

		assertThat(config.ownBaseType()).isEqualTo(Base.class);
		assertThat(config.ownModeBaseType("custom")).isEqualTo(ModeBase.class);
		assertThat(config.ownModeBaseType("named_only")).isNull();
		assertThat(config.ownDeclaredModes()).containsExactlyInAnyOrder("custom", "named_only");
		assertThat(config.ownDefaultMode()).isEqualTo("custom");
		assertThat(config.ownLegacyShim()).isTrue();
	}

	@Test
	@DisplayName("Layers keep declaration order, scope and string option defaults")
	void layers_in_declaration_order() {
		TraceModeConfig config = scan(FullyAnnotated.class);

		assertThat(config.ownLayers()).extracting(l -> l.capability().name()).containsExactly("First", "Second");
		LayerDeclaration second = config.ownLayers().get(1);
		assertThat(second.scope()).isEqualTo(LayerScope.of("special", "extra"));
		assertThat(second.options().get("level").defaultValue()).isEqualTo("3");
		assertThat(second.declaringClass()).isEqualTo(FullyAnnotated.class.getName());
		assertThat(config.ownLayers().get(0).scope().isAll()).isTrue();
	}

	@Test
	@DisplayName("Superclass annotations are not copied onto subclasses")
	void direct_only() {
		TraceModeConfig config = scan(Unannotated.class);

		assertThat(config.ownLayers()).isEmpty();
		assertThat(config.ownBaseType()).isNull();
		assertThat(config.ownDefaultMode()).isNull();
		assertThat(config.ownLegacyShim()).isFalse();
	}

	@Test
	void meta_annotations_register_layers() {
		TraceModeConfig config = scan(MetaAnnotated.class);

		assertThat(config.ownLayers()).singleElement().satisfies(l -> {
			assertThat(l.capability().name()).isEqualTo("First");
			assertThat(l.scope().modes()).containsExactly("audited");
		});
	}
}
