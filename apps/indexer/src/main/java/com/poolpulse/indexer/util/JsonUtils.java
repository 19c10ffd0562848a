package com.poolpulse.indexer.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON utility functions
 */
@Slf4j
public class JsonUtils {

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Convert object to JSON string
     */
    public static String toJson(Object obj) throws JsonProcessingException {
        return mapper.writeValueAsString(obj);
    }

    /**
     * Convert object to JSON string, falling back to "{}" when it cannot be serialized
     */
    public static String toJsonOrEmpty(Object obj) {
        try {
            return toJson(obj);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize {}: {}", obj != null ? obj.getClass().getSimpleName() : "null", e.getMessage());
            return "{}";
        }
    }
}
