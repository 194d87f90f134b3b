package com.conveyal.catchment.common;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * A library containing static methods for working with JSON.
 */
public abstract class JsonUtilities {

    /**
     * If we receive a JSON object containing a field that we don't recognize, fail. This should catch misspellings
     * in hand-written requests and scenario overlays.
     */
    public static final ObjectMapper objectMapper = createBaseObjectMapper();

    private static ObjectMapper createBaseObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(JsonParser.Feature.ALLOW_COMMENTS, true);
        objectMapper.configure(JsonParser.Feature.ALLOW_UNQUOTED_FIELD_NAMES, true);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, true);
        return objectMapper;
    }

    /** Represent the supplied object as a JSON string, for logging and debugging. */
    public static String objectToJsonString (Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException(e);
        }
    }

    /** Read an object of the given type, failing on unrecognized fields. */
    public static <T> T objectFromJson (String json, Class<T> type) {
        try {
            return objectMapper.readValue(json, type);
        } catch (IOException e) {
            throw new IllegalArgumentException("Could not parse " + type.getSimpleName() + " from JSON.", e);
        }
    }

}
