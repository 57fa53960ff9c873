package com.yieldvault.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static JSON conversion used by MapStruct mappers for columns that hold a details map.
 *
 * <p>Big integers are written as plain JSON numbers and read back as {@code BigInteger} when they
 * do not fit a {@code long}.
 */
public final class JsonHelper {

    private static final Logger log = LoggerFactory.getLogger(JsonHelper.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    static {
        OBJECT_MAPPER.findAndRegisterModules();
    }

    private JsonHelper() {}

    /** Returns null for a null value. */
    public static String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return OBJECT_MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize to JSON: {}", value.getClass().getSimpleName(), e);
            throw new IllegalStateException("JSON serialization failed", e);
        }
    }

    /** Returns null for null or blank input. */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return OBJECT_MAPPER.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Failed to deserialize JSON map: {}", json, e);
            throw new IllegalStateException("JSON deserialization failed", e);
        }
    }
}
