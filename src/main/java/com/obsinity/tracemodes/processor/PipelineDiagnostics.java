package com.obsinity.tracemodes.processor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import com.obsinity.tracemodes.model.LayerDeclaration;
import com.obsinity.tracemodes.model.OptionDeclaration;
import com.obsinity.tracemodes.model.TracePipeline;

/**
 * Renders pipelines as plain maps / JSON for diagnostics. Option defaults are rendered with {@code String.valueOf} so
 * arbitrary values never break serialization.
 */
public class PipelineDiagnostics {

	private final ObjectMapper mapper;

	public PipelineDiagnostics() {
		this(null);
	}

	public PipelineDiagnostics(ObjectMapper mapper) {
		// Use the application's mapper if provided; otherwise create a default.
		this.mapper = (mapper != null ? mapper.copy() : new ObjectMapper()).enable(SerializationFeature.INDENT_OUTPUT);
	}

	public Map<String, Object> describe(TracePipeline pipeline) {
		return describe(pipeline, null);
	}

	/** Structure of {@code pipeline}, plus the merged options when given. */
	public Map<String, Object> describe(TracePipeline pipeline, Map<String, OptionDeclaration> mergedOptions) {
		Map<String, Object> out = new LinkedHashMap<>();
		out.put("owner", pipeline.owner());
		out.put("mode", pipeline.mode());
		out.put("baseType", pipeline.baseType().getName());
		out.put("legacyShim", pipeline.legacyShim());
		out.put("ancestry", pipeline.ancestry());

		List<Map<String, Object>> layers = new ArrayList<>();
		for (LayerDeclaration layer : pipeline.layers()) {
			Map<String, Object> l = new LinkedHashMap<>();
			l.put("capability", layer.capability().name());
			l.put("declaredBy", layer.declaringClass());
			l.put("scope", layer.scope().isAll() ? "ALL" : List.copyOf(layer.scope().modes()));
			l.put("options", options(layer.options()));
			layers.add(l);
		}
		out.put("layers", layers);

		if (mergedOptions != null) {
			out.put("options", options(mergedOptions));
		}
		return out;
	}

	public String toJson(TracePipeline pipeline) {
		return toJson(pipeline, null);
	}

	public String toJson(TracePipeline pipeline, Map<String, OptionDeclaration> mergedOptions) {
		Map<String, Object> description = describe(pipeline, mergedOptions);
		try {
			return mapper.writeValueAsString(description);
		} catch (JsonProcessingException e) {
			// Fallback to toString() if serialization fails
			return String.valueOf(description);
		}
	}

	private static Map<String, Object> options(Map<String, OptionDeclaration> options) {
		Map<String, Object> out = new LinkedHashMap<>();
		options.forEach((name, decl) -> {
			Map<String, Object> o = new LinkedHashMap<>();
			o.put("required", decl.isRequired());
			if (decl.hasDefault()) o.put("default", String.valueOf(decl.defaultValue()));
			o.put("declaredBy", decl.declaredBy());
			out.put(name, o);
		});
		return out;
	}
}
