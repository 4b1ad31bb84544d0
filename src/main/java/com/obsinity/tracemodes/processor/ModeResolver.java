package com.obsinity.tracemodes.processor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.obsinity.tracemodes.model.LayerDeclaration;
import com.obsinity.tracemodes.registry.TraceModeConfig;

/**
 * Produces the ordered layer declarations that apply to a (class, mode) pair.
 *
 * <p>Walks the ancestry root first. At each level it takes that level's ALL-scoped declarations in declaration order,
 * then the declarations whose mode set contains {@code mode}, in declaration order. Mode membership is exact: a
 * declaration for another mode name never applies, and an unknown mode yields only the ALL-scoped layers.
 */
public class ModeResolver {

	public List<LayerDeclaration> resolve(TraceModeConfig config, String mode) {
		List<LayerDeclaration> resolved = new ArrayList<>();
		for (TraceModeConfig level : config.ancestry()) {
			List<LayerDeclaration> own = level.ownLayers();
			for (LayerDeclaration d : own) {
				if (d.scope().isAll()) resolved.add(d);
			}
			for (LayerDeclaration d : own) {
				if (d.scope().namesMode(mode)) resolved.add(d);
			}
		}
		return Collections.unmodifiableList(resolved);
	}
}
