package com.example.LusLaboris.config;

import com.example.LusLaboris.monitoring.MonitoringSink;
import com.example.LusLaboris.monitoring.OpenTelemetryMonitoringSink;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MonitoringConfig {

    /**
     * Falls back to the global instance, which is a no-op unless an SDK or the
     * Java agent registered one (e.g. exporting OTLP to a Phoenix collector).
     */
    @Bean
    @ConditionalOnMissingBean(OpenTelemetry.class)
    public OpenTelemetry openTelemetry() {
        return GlobalOpenTelemetry.get();
    }

    @Bean
    @ConditionalOnMissingBean(MonitoringSink.class)
    public MonitoringSink monitoringSink(OpenTelemetry openTelemetry, RagProperties properties) {
        return new OpenTelemetryMonitoringSink(openTelemetry, properties.getMonitoring().getProjectName());
    }
}
