package com.example.LusLaboris.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flattens arbitrary metadata into trace-safe attribute values.
 *
 * Trace attributes only accept String, Long, Double, Boolean or homogeneous
 * lists of those. Maps and lists holding anything else become JSON strings,
 * null becomes the string "null", other objects use toString().
 */
public final class TraceAttributes {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .findAndAddModules()
            .build();

    private TraceAttributes() {
    }

    public static Map<String, Object> toPrimitive(Map<String, ?> metadata) {
        Map<String, Object> serialized = new LinkedHashMap<>();
        if (metadata == null) {
            return serialized;
        }
        metadata.forEach((key, value) -> serialized.put(key, toPrimitiveValue(value)));
        return serialized;
    }

    public static Object toPrimitiveValue(Object value) {
        if (value == null) {
            return "null";
        }
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof Collection<?> collection) {
            return primitiveList(collection);
        }
        if (value instanceof Object[] array) {
            return primitiveList(Arrays.asList(array));
        }
        if (value instanceof Map<?, ?> map) {
            return toJson(map);
        }
        return value.toString();
    }

    private static Object primitiveList(Collection<?> collection) {
        List<Object> converted = new ArrayList<>(collection.size());
        Class<?> elementType = null;
        for (Object item : collection) {
            Object primitive = isPrimitive(item) ? toPrimitiveValue(item) : null;
            if (primitive == null) {
                return toJson(collection);
            }
            if (elementType == null) {
                elementType = primitive.getClass();
            } else if (!elementType.equals(primitive.getClass())) {
                return toJson(collection);
            }
            converted.add(primitive);
        }
        return converted;
    }

    private static boolean isPrimitive(Object value) {
        return value instanceof String || value instanceof Boolean || value instanceof Number;
    }

    private static String toJson(Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return Objects.toString(value);
        }
    }
}
