package com.example.LusLaboris.monitoring;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * Emits each event as a single, immediately ended OpenTelemetry span.
 * Exporting (OTLP to Phoenix or any collector) is configured on the
 * {@link OpenTelemetry} instance, not here.
 */
public class OpenTelemetryMonitoringSink implements MonitoringSink {

    private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMonitoringSink.class);

    private final Tracer tracer;

    public OpenTelemetryMonitoringSink(OpenTelemetry openTelemetry, String instrumentationName) {
        this.tracer = openTelemetry.getTracer(instrumentationName);
    }

    @Override
    public void emit(String name, SpanKind kind, Map<String, Object> attributes) {
        try {
            Span span = tracer.spanBuilder(name)
                    .setSpanKind(kind)
                    .setAllAttributes(toAttributes(attributes))
                    .startSpan();
            span.setStatus(StatusCode.OK);
            span.end();
        } catch (RuntimeException e) {
            log.warn("Failed to emit trace span '{}'", name, e);
        }
    }

    static Attributes toAttributes(Map<String, Object> attributes) {
        AttributesBuilder builder = Attributes.builder();
        if (attributes == null) {
            return builder.build();
        }
        attributes.forEach((key, value) -> {
            if (value instanceof String s) {
                builder.put(key, s);
            } else if (value instanceof Boolean b) {
                builder.put(key, b);
            } else if (value instanceof Long l) {
                builder.put(key, l);
            } else if (value instanceof Double d) {
                builder.put(key, d);
            } else if (value instanceof List<?> list) {
                putList(builder, key, list);
            } else if (value != null) {
                builder.put(key, value.toString());
            }
        });
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static void putList(AttributesBuilder builder, String key, List<?> list) {
        Object first = list.isEmpty() ? null : list.get(0);
        if (first == null || first instanceof String) {
            builder.put(AttributeKey.stringArrayKey(key), (List<String>) list);
        } else if (first instanceof Long) {
            builder.put(AttributeKey.longArrayKey(key), (List<Long>) list);
        } else if (first instanceof Double) {
            builder.put(AttributeKey.doubleArrayKey(key), (List<Double>) list);
        } else if (first instanceof Boolean) {
            builder.put(AttributeKey.booleanArrayKey(key), (List<Boolean>) list);
        } else {
            builder.put(key, list.toString());
        }
    }
}
