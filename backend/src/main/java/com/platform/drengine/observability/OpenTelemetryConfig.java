package com.platform.drengine.observability;

import com.platform.drengine.config.DrEngineProperties;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import io.opentelemetry.sdk.trace.samplers.Sampler;
import io.opentelemetry.semconv.ResourceAttributes;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Tracing for failover runs, backup executions and recovery tests.
 * Spans are exported over OTLP gRPC; with tracing disabled the tracer is a no-op.
 */
@Slf4j
@Configuration
public class OpenTelemetryConfig {

    static final String INSTRUMENTATION_SCOPE = "com.platform.drengine";

    private final DrEngineProperties.Tracing tracing;

    private SdkTracerProvider tracerProvider;

    public OpenTelemetryConfig(DrEngineProperties properties) {
        this.tracing = properties.getTracing();
    }

    @Bean
    public OpenTelemetry openTelemetry() {
        if (!tracing.isEnabled()) {
            log.info("Tracing disabled, failover and backup spans are not exported");
            return OpenTelemetry.noop();
        }

        Resource resource = Resource.getDefault().merge(Resource.create(Attributes.builder()
            .put(ResourceAttributes.SERVICE_NAME, tracing.getServiceName())
            .put(ResourceAttributes.DEPLOYMENT_ENVIRONMENT, tracing.getDeployment())
            .build()));

        OtlpGrpcSpanExporter exporter = OtlpGrpcSpanExporter.builder()
            .setEndpoint(tracing.getOtlpEndpoint())
            .setTimeout(Duration.ofSeconds(10))
            .build();

        tracerProvider = SdkTracerProvider.builder()
            .setResource(resource)
            .setSampler(Sampler.parentBased(Sampler.traceIdRatioBased(tracing.getSamplingRatio())))
            .addSpanProcessor(BatchSpanProcessor.builder(exporter)
                .setScheduleDelay(Duration.ofSeconds(5))
                .build())
            .build();

        log.info("Tracing enabled: service={}, deployment={}, endpoint={}, sampling={}",
            tracing.getServiceName(), tracing.getDeployment(), tracing.getOtlpEndpoint(),
            tracing.getSamplingRatio());

        return OpenTelemetrySdk.builder()
            .setTracerProvider(tracerProvider)
            .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
            .build();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    }

    @PreDestroy
    public void shutdown() {
        if (tracerProvider != null) {
            tracerProvider.shutdown();
        }
    }
}
