package com.platform.relay.observability;

import com.platform.relay.config.RelayProperties;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenTelemetry wiring for HTTP requests and agent commands.
 *
 * Spans always carry trace ids into the logs. They leave the process only
 * when relay.tracing.export-enabled is set.
 */
@Slf4j
@Configuration
public class TracingConfig {

    static final String INSTRUMENTATION_NAME = "com.platform.relay";

    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    @Bean(destroyMethod = "close")
    public SdkTracerProvider relayTracerProvider(
            RelayProperties properties,
            @Value("${spring.application.name:tools-relay}") String serviceName) {
        RelayProperties.Tracing tracing = properties.getTracing();

        SdkTracerProviderBuilder builder = SdkTracerProvider.builder()
            .setResource(Resource.getDefault().merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName))))
            .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(tracing.getSampleRatio())));

        if (tracing.isExportEnabled()) {
            builder.addSpanProcessor(BatchSpanProcessor.builder(OtlpGrpcSpanExporter.builder()
                    .setEndpoint(tracing.getOtlpEndpoint())
                    .setTimeout(tracing.getExportTimeout())
                    .build())
                .build());
            log.info("Exporting spans to {} (sample ratio {})", tracing.getOtlpEndpoint(), tracing.getSampleRatio());
        } else {
            log.info("Span export disabled, trace ids are kept for log correlation only");
        }
        return builder.build();
    }

    @Bean(destroyMethod = "")
    public OpenTelemetry openTelemetry(SdkTracerProvider relayTracerProvider) {
        return OpenTelemetrySdk.builder()
            .setTracerProvider(relayTracerProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_NAME);
    }
}
