package com.obsinity.tracemodes.legacy;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Older single-pipeline tracer contract: one callback for every phase, keyed by a string. Implementations must call
 * {@code block.get()} and return its value.
 */
@FunctionalInterface
public interface LegacyTracer {

	Object trace(String key, Map<String, Object> data, Supplier<Object> block);
}
