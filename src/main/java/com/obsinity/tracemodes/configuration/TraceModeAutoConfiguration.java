package com.obsinity.tracemodes.configuration;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import com.fasterxml.jackson.databind.ObjectMapper;

import com.obsinity.tracemodes.processor.ModeResolver;
import com.obsinity.tracemodes.processor.OptionAggregator;
import com.obsinity.tracemodes.processor.PipelineBuilder;
import com.obsinity.tracemodes.processor.PipelineDiagnostics;
import com.obsinity.tracemodes.processor.TraceFactory;
import com.obsinity.tracemodes.processor.TraceModeEngine;
import com.obsinity.tracemodes.registry.TraceAnnotationScanner;
import com.obsinity.tracemodes.registry.TraceModeRegistry;
import com.obsinity.tracemodes.utils.TraceModeSelector;

/** Wires the trace mode engine. Every bean backs off when the application defines its own. */
@AutoConfiguration
@EnableConfigurationProperties(TraceModeProperties.class)
public class TraceModeAutoConfiguration {

	@Bean
	@ConditionalOnMissingBean
	public TraceAnnotationScanner traceAnnotationScanner() {
		return new TraceAnnotationScanner();
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceModeRegistry traceModeRegistry(TraceAnnotationScanner scanner) {
		return new TraceModeRegistry(scanner);
	}

	@Bean
	@ConditionalOnMissingBean
	public ModeResolver modeResolver() {
		return new ModeResolver();
	}

	@Bean
	@ConditionalOnMissingBean
	public PipelineDiagnostics pipelineDiagnostics(ObjectProvider<ObjectMapper> mapper) {
		return new PipelineDiagnostics(mapper.getIfAvailable());
	}

	@Bean
	@ConditionalOnMissingBean
	public PipelineBuilder pipelineBuilder(
			ModeResolver resolver, PipelineDiagnostics diagnostics, TraceModeProperties properties) {
		return new PipelineBuilder(resolver, diagnostics, properties.logPipelines());
	}

	@Bean
	@ConditionalOnMissingBean
	public OptionAggregator optionAggregator(ModeResolver resolver) {
		return new OptionAggregator(resolver);
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceFactory traceFactory(PipelineBuilder builder, OptionAggregator aggregator) {
		return new TraceFactory(builder, aggregator);
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceModeSelector traceModeSelector(TraceModeProperties properties) {
		return new TraceModeSelector(properties.contextKey());
	}

	@Bean
	@ConditionalOnMissingBean
	public TraceModeEngine traceModeEngine(
			TraceModeRegistry registry,
			PipelineBuilder builder,
			OptionAggregator aggregator,
			TraceFactory factory,
			TraceModeSelector selector,
			PipelineDiagnostics diagnostics) {
		return new TraceModeEngine(registry, builder, aggregator, factory, selector, diagnostics);
	}

	@Bean
	public TracePipelinePreloader tracePipelinePreloader(TraceModeEngine engine, TraceModeProperties properties) {
		return new TracePipelinePreloader(engine, properties);
	}
}
