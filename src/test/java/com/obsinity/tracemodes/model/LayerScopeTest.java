package com.obsinity.tracemodes.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

class LayerScopeTest {

	@Test
	void all_includes_every_mode_but_names_none() {
		LayerScope all = LayerScope.all();
		assertThat(all.isAll()).isTrue();
		assertThat(all.includes("default")).isTrue();
		assertThat(all.includes("never_declared")).isTrue();
		assertThat(all.namesMode("default")).isFalse();
		assertThat(all.modes()).isEmpty();
	}

	@Test
	void explicit_modes() {
		LayerScope scope = LayerScope.of(" special ", "extra_special");
		assertThat(scope.isAll()).isFalse();
		assertThat(scope.modes()).containsExactly("special", "extra_special");
		assertThat(scope.includes("special")).isTrue();
		assertThat(scope.includes("default")).isFalse();
		assertThat(scope.namesMode("extra_special")).isTrue();
		assertThat(scope).isEqualTo(LayerScope.of(List.of("special", "extra_special")));
	}

	@Test
	void null_collection_means_all() {
		assertThat(LayerScope.of((List<String>) null)).isSameAs(LayerScope.all());
	}

	@Test
	void rejects_empty_and_blank() {
		assertThatThrownBy(() -> LayerScope.of(List.of())).isInstanceOf(TraceConfigurationException.class);
		assertThatThrownBy(() -> LayerScope.of("special", " ")).isInstanceOf(TraceConfigurationException.class);
	}
}
