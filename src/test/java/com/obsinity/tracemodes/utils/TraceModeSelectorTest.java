package com.obsinity.tracemodes.utils;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.HashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.obsinity.tracemodes.trace.TraceQuery;

class TraceModeSelectorTest {

	enum Hint {
		special
	}

	private final TraceModeSelector selector = new TraceModeSelector();

	@Test
	void reads_default_key() {
		assertThat(selector.contextKey()).isEqualTo("trace_mode");
		assertThat(selector.select(Map.of("trace_mode", " special "))).isEqualTo("special");
		assertThat(selector.select(Map.of("trace_mode", Hint.special))).isEqualTo("special");
		assertThat(selector.select(new TraceQuery("{ a }", null, Map.of("trace_mode", "options"))))
				.isEqualTo("options");
	}

	@Test
	void no_usable_hint_means_default() {
		Map<String, Object> withNull = new HashMap<>();
		withNull.put("trace_mode", null);

		assertThat(selector.select((Map<String, ?>) null)).isNull();
		assertThat(selector.select((TraceQuery) null)).isNull();
		assertThat(selector.select(withNull)).isNull();
		assertThat(selector.select(Map.of("trace_mode", "  "))).isNull();
		assertThat(selector.select(Map.of("other", "special"))).isNull();
	}

	@Test
	void custom_key() {
		TraceModeSelector custom = new TraceModeSelector("mode_hint");
		assertThat(custom.select(Map.of("mode_hint", "special", "trace_mode", "other"))).isEqualTo("special");
		assertThat(new TraceModeSelector(" ").contextKey()).isEqualTo(TraceModeSelector.DEFAULT_CONTEXT_KEY);
	}
}
