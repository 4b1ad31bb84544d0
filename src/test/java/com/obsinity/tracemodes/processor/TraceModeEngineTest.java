package com.obsinity.tracemodes.processor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import com.obsinity.tracemodes.annotations.DefaultTraceMode;
import com.obsinity.tracemodes.annotations.RequiresOptions;
import com.obsinity.tracemodes.annotations.TraceBase;
import com.obsinity.tracemodes.annotations.TraceMode;
import com.obsinity.tracemodes.annotations.TraceOption;
import com.obsinity.tracemodes.annotations.TraceWith;
import com.obsinity.tracemodes.capability.TraceCapability;
import com.obsinity.tracemodes.model.TraceOptions;
import com.obsinity.tracemodes.registry.TraceModeRegistry;
import com.obsinity.tracemodes.trace.NoopTrace;
import com.obsinity.tracemodes.trace.Trace;
import com.obsinity.tracemodes.trace.TraceLayer;
import com.obsinity.tracemodes.trace.TraceQuery;

/**
 * End-to-end behavior of annotation-registered schemas: inherited default modes, inherited special modes, per-mode
 * options, custom base types and custom default modes.
 */
class TraceModeEngineTest {

	private TraceModeEngine engine;

	@BeforeEach
	void setUp() {
		engine = TraceModeEngine.standalone(new TraceModeRegistry());
	}

	private TraceQuery execute(Class<?> schema, String mode) {
		TraceQuery query = new TraceQuery("{ greeting }", null, mode == null ? Map.of() : Map.of("trace_mode", mode));
		Trace trace = engine.newInstanceFor(schema, query, Map.of());
		trace.executeQuery(query, () -> "Howdy!");
		return query;
	}

	/* ===================== schemas ===================== */

	public static class GlobalTrace extends TraceLayer {
		public GlobalTrace(Trace inner) {
			super(inner);
		}

		@Override
		public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
			query.context().put("global_trace", true);
			return super.executeQuery(query, next);
		}
	}

	public static class SpecialTrace extends TraceLayer {
		public SpecialTrace(Trace inner) {
			super(inner);
		}

		@Override
		public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
			query.context().put("special_trace", true);
			return super.executeQuery(query, next);
		}
	}

	@RequiresOptions("configured_option")
	public static class OptionsTrace extends TraceLayer {
		private final String configuredOption;

		public OptionsTrace(Trace inner, TraceOptions options) {
			super(inner);
			this.configuredOption = options.get("configured_option", String.class);
		}

		@Override
		public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
			query.context().put("configured_option", configuredOption);
			return super.executeQuery(query, next);
		}
	}

	public static class ChildSpecialTrace extends TraceLayer {
		public ChildSpecialTrace(Trace inner) {
			super(inner);
		}

		@Override
		public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
			query.context().put("child_special_trace", true);
			return super.executeQuery(query, next);
		}
	}

	public static class GrandchildDefaultTrace extends TraceLayer {
		public GrandchildDefaultTrace(Trace inner) {
			super(inner);
		}

		@Override
		public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
			query.context().put("grandchild_default", true);
			return super.executeQuery(query, next);
		}
	}

	@TraceWith(GlobalTrace.class)
	@TraceWith(value = SpecialTrace.class, modes = "special")
	@TraceWith(
			value = OptionsTrace.class,
			modes = "options",
			options = @TraceOption(name = "configured_option", value = "was_configured"))
	static class ParentSchema {}

	@TraceWith(value = ChildSpecialTrace.class, modes = {"special", "extra_special"})
	static class ChildSchema extends ParentSchema {}

	@TraceWith(GrandchildDefaultTrace.class)
	static class GrandchildSchema extends ChildSchema {}

	/* ===================== scenarios ===================== */

	@Test
	@DisplayName("Traces are inherited from default modes")
	void inherited_from_default_modes() {
		TraceQuery parent = execute(ParentSchema.class, null);
		assertThat(parent.context()).containsEntry("global_trace", true).doesNotContainKey("grandchild_default");

		TraceQuery child = execute(ChildSchema.class, null);
		assertThat(child.context()).containsEntry("global_trace", true).doesNotContainKey("grandchild_default");

		TraceQuery grandchild = execute(GrandchildSchema.class, null);
		assertThat(grandchild.context())
				.containsEntry("global_trace", true)
				.containsEntry("grandchild_default", true);
	}

	@Test
	@DisplayName("Special modes are inherited, but only by exact mode name")
	void inherits_special_modes() {
		assertThat(execute(ParentSchema.class, "special").context())
				.containsEntry("global_trace", true)
				.containsEntry("special_trace", true)
				.doesNotContainKeys("child_special_trace", "grandchild_default");

		assertThat(execute(ChildSchema.class, "special").context())
				.containsEntry("global_trace", true)
				.containsEntry("special_trace", true)
				.containsEntry("child_special_trace", true)
				.doesNotContainKey("grandchild_default");

		assertThat(execute(ChildSchema.class, "extra_special").context())
				.containsEntry("global_trace", true)
				.containsEntry("child_special_trace", true)
				.doesNotContainKeys("special_trace", "grandchild_default");

		assertThat(execute(GrandchildSchema.class, "special").context())
				.containsEntry("global_trace", true)
				.containsEntry("special_trace", true)
				.containsEntry("child_special_trace", true)
				.containsEntry("grandchild_default", true);
	}

	@Test
	@DisplayName("Options are required and passed only for the modes that declare them")
	void options_only_for_their_mode() {
		assertThat(engine.optionsFor(ParentSchema.class, "default")).isEmpty();
		assertThat(engine.optionsFor(ParentSchema.class, "options")).containsOnlyKeys("configured_option");
		assertThat(execute(ParentSchema.class, "options").context())
				.containsEntry("configured_option", "was_configured");
	}

	@Test
	@DisplayName("A null option value reaches the layer and is written to the context")
	void null_option_value() {
		Map<String, Object> params = new HashMap<>();
		params.put("configured_option", null);
		TraceQuery query = new TraceQuery("{ greeting }");

		Trace trace = engine.newInstance(ParentSchema.class, "options", params);

		assertThat(trace.executeQuery(query, () -> "Howdy!")).isEqualTo("Howdy!");
		assertThat(query.context()).containsEntry("configured_option", null).containsEntry("global_trace", true);
	}

	@Test
	@DisplayName("Unknown modes never raise and carry only the ALL-scoped layers")
	void unknown_mode() {
		assertThatCode(() -> execute(GrandchildSchema.class, "nope")).doesNotThrowAnyException();
		assertThat(RecordingLayers.layerNames(engine.pipelineFor(GrandchildSchema.class, "nope")))
				.containsExactly("GlobalTrace", "GrandchildDefaultTrace");
	}

	@Test
	@DisplayName("pipelineFor is memoized per class until resetCache")
	void memoized_per_class() {
		var first = engine.pipelineFor(ChildSchema.class, "special");
		assertThat(engine.pipelineFor(ChildSchema.class, "special")).isSameAs(first);
		assertThat(engine.pipelineFor(ParentSchema.class, "special")).isNotSameAs(first);

		engine.resetCache(ChildSchema.class, "special");
		assertThat(engine.pipelineFor(ChildSchema.class, "special")).isNotSameAs(first).isEqualTo(first);
	}

	@Test
	void known_modes_cover_ancestry() {
		assertThat(engine.knownModes(GrandchildSchema.class))
				.containsExactlyInAnyOrder("default", "special", "options", "extra_special");
	}

	@Test
	void describe_renders_json() throws Exception {
		JsonNode json = new ObjectMapper().readTree(engine.describe(ParentSchema.class, "options"));
		assertThat(json.get("owner").asText()).isEqualTo(ParentSchema.class.getName());
		assertThat(json.get("layers")).hasSize(2);
		assertThat(json.get("options").get("configured_option").get("default").asText()).isEqualTo("was_configured");
	}

	@Test
	void programmatic_registration_on_the_root_applies_everywhere() {
		engine.registry().root().declareLayer(TraceCapability.of("RootLayer", (inner, opts) -> inner));
		assertThat(engine.pipelineFor(GrandchildSchema.class, "default").layers().get(0).capability().name())
				.isEqualTo("RootLayer");
	}

	@Nested
	class CustomBaseType {

		public static class CustomTrace extends NoopTrace {
			public CustomTrace(TraceOptions options) {
				super(options);
			}
		}

		@TraceBase(CustomTrace.class)
		static class CustomBaseTraceParentSchema {}

		@TraceWith(value = SpecialTrace.class, modes = "special_with_base_class")
		static class CustomBaseTraceSubclassSchema extends CustomBaseTraceParentSchema {}

		@Test
		@DisplayName("The custom base type is used for the default mode")
		void default_mode() {
			assertThat(engine.pipelineFor(CustomBaseTraceParentSchema.class, "default").baseType())
					.isEqualTo(CustomTrace.class);
			assertThat(engine.pipelineFor(CustomBaseTraceSubclassSchema.class, "default").baseType())
					.isEqualTo(CustomTrace.class);

			assertThat(engine.newInstance(CustomBaseTraceParentSchema.class)).isInstanceOf(CustomTrace.class);
			assertThat(engine.newInstance(CustomBaseTraceSubclassSchema.class).isWrapperFor(CustomTrace.class))
					.isTrue();
		}

		@Test
		@DisplayName("The custom base type is used for special modes")
		void special_modes() {
			assertThat(engine.pipelineFor(CustomBaseTraceSubclassSchema.class, "special_with_base_class")
							.isBasedOn(CustomTrace.class))
					.isTrue();
			Trace trace = engine.newInstance(CustomBaseTraceSubclassSchema.class, "special_with_base_class", Map.of());
			assertThat(trace).isInstanceOf(SpecialTrace.class);
			assertThat(trace.unwrap(CustomTrace.class)).isNotNull();
		}
	}

	@Nested
	class CustomDefaultMode {

		public static class CustomDefaultTrace extends NoopTrace {
			public CustomDefaultTrace(TraceOptions options) {
				super(options);
			}

			@Override
			public <T> T executeQuery(TraceQuery query, Supplier<T> next) {
				query.context().put("custom_default_used", true);
				return next.get();
			}
		}

		@TraceMode(name = "custom_default", base = CustomDefaultTrace.class)
		@DefaultTraceMode("custom_default")
		static class CustomDefaultSchema extends ParentSchema {}

		static class ChildCustomDefaultSchema extends CustomDefaultSchema {}

		@Test
		@DisplayName("The default mode is inherited")
		void inherits_configuration() {
			assertThat(engine.defaultModeOf(ParentSchema.class)).isEqualTo("default");
			assertThat(engine.defaultModeOf(CustomDefaultSchema.class)).isEqualTo("custom_default");
			assertThat(engine.defaultModeOf(ChildCustomDefaultSchema.class)).isEqualTo("custom_default");
		}

		@Test
		@DisplayName("The configured default is used when no mode is given")
		void uses_specified_default() {
			assertThat(execute(CustomDefaultSchema.class, null).context()).containsEntry("custom_default_used", true);
			assertThat(execute(ChildCustomDefaultSchema.class, null).context())
					.containsEntry("custom_default_used", true);
			// a mode base type replaces only the base; ALL-scoped layers still apply
			assertThat(execute(CustomDefaultSchema.class, null).context()).containsEntry("global_trace", true);
			assertThat(engine.pipelineFor(ChildCustomDefaultSchema.class, "default").baseType())
					.isEqualTo(NoopTrace.class);
		}
	}

	@Nested
	class ModeOptions {

		@RequiresOptions("arg1")
		public static class PluginTrace extends TraceLayer {
			public PluginTrace(Trace inner) {
				super(inner);
			}
		}

		@RequiresOptions("arg3")
		public static class BaseTracer extends TraceLayer {
			public BaseTracer(Trace inner) {
				super(inner);
			}
		}

		@RequiresOptions("arg2")
		public static class ExtraTracer extends TraceLayer {
			public ExtraTracer(Trace inner, TraceOptions options) {
				super(inner);
				if (options.get("arg2", Boolean.class) == null) throw new IllegalStateException("arg2 missing");
			}
		}

		@TraceWith(value = PluginTrace.class, options = @TraceOption(name = "arg1", value = "1"))
		@TraceWith(value = ExtraTracer.class, modes = "extra", options = @TraceOption(name = "arg2", value = "true"))
		@TraceWith(value = BaseTracer.class, options = @TraceOption(name = "arg3", value = "true"))
		static class ModeOptionsSchema {}

		@Test
		@DisplayName("Default options are merged into custom mode options")
		void merges_default_options() {
			assertThat(engine.optionsFor(ModeOptionsSchema.class, "default")).containsOnlyKeys("arg1", "arg3");
			assertThat(engine.optionsFor(ModeOptionsSchema.class, "extra")).containsOnlyKeys("arg1", "arg2", "arg3");

			assertThat(engine.newInstance(ModeOptionsSchema.class, "default", Map.of())).isNotNull();
			assertThat(engine.newInstance(ModeOptionsSchema.class, "extra", Map.of())).isNotNull();
		}
	}
}
