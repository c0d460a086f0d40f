package io.clusterengine.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.List;

/**
 * Shared Jackson setup for persisted entities and action payloads.
 */
public final class JsonUtils {

    private static final ObjectMapper MAPPER = newObjectMapper();
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<List<String>>() { };

    private JsonUtils() {
        // Utility class
    }

    public static ObjectMapper newObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE);
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Reads a free-form payload value as a list of strings; anything but a list reads as empty.
     */
    public static List<String> toStringList(Object value) {
        if (!(value instanceof List)) {
            return new ArrayList<>();
        }
        return new ArrayList<>(MAPPER.convertValue(value, STRING_LIST));
    }
}
