package com.qqsuccubus.core.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper and unchecked read/write helpers.
 * <p>
 * Java time types are written through {@link JavaTimeModule}. Failures are rethrown as
 * {@link IllegalArgumentException} carrying the Jackson cause.
 * </p>
 */
public final class JsonUtils {
    private JsonUtils() {
    }

    private static final ObjectMapper MAPPER = new ObjectMapper().registerModule(new JavaTimeModule());

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static String writeValueAsString(Object object) {
        try {
            return mapper().writeValueAsString(object);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to write JSON: " + e.getMessage(), e);
        }
    }

    public static <T> T readValue(String json, Class<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to read JSON: " + e.getMessage(), e);
        }
    }

    public static <T> T readValue(String json, TypeReference<T> clazz) {
        try {
            return mapper().readValue(json, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to read JSON: " + e.getMessage(), e);
        }
    }

    public static JsonNode readTree(String json) {
        try {
            return mapper().readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to read JSON: " + e.getMessage(), e);
        }
    }

    public static <T> T treeToValue(JsonNode node, Class<T> clazz) {
        try {
            return mapper().treeToValue(node, clazz);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to map JSON: " + e.getMessage(), e);
        }
    }

}
