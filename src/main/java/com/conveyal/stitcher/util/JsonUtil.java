package com.conveyal.stitcher.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import spark.ResponseTransformer;

public abstract class JsonUtil {

    public static final ObjectMapper objectMapper = getObjectMapper();
    public static final ResponseTransformer toJson = objectMapper::writeValueAsString;

    public static ObjectMapper getObjectMapper () {
        ObjectMapper objectMapper = new ObjectMapper();
        // Workers report back with extra fields we don't model (output URIs, timings), so tolerate unknown properties.
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return objectMapper;
    }

    public static ObjectNode objectNode () {
        return objectMapper.createObjectNode();
    }

    public static String toJsonString (Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to write JSON.", e);
        }
    }

}
