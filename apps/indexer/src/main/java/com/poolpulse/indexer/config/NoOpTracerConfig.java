package com.poolpulse.indexer.config;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * No-operation tracer used unless OTLP export is enabled.
 */
@Configuration
@ConditionalOnProperty(prefix = "poolpulse.otel", name = "enabled", havingValue = "false", matchIfMissing = true)
public class NoOpTracerConfig {

    @Bean
    public OpenTelemetry openTelemetry() {
        return OpenTelemetry.noop();
    }

    @Bean
    public Tracer tracer(OpenTelemetry openTelemetry) {
        return openTelemetry.getTracer("poolpulse-noop");
    }
}
