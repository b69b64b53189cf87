package com.example.LusLaboris.monitoring;

import io.opentelemetry.api.trace.SpanKind;

import java.util.Map;

/**
 * Destination for structured trace events.
 * Attribute values must already be primitive (String, Long, Double, Boolean)
 * or lists of one primitive type; see {@link com.example.LusLaboris.util.TraceAttributes}.
 * Implementations must not throw.
 */
public interface MonitoringSink {

    void emit(String name, SpanKind kind, Map<String, Object> attributes);
}
