package com.agentflow.engine.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson configuration for execution records and workflow definitions.
 * Timestamps are ISO-8601 strings, null fields are omitted and unknown fields ignored.
 */
public final class ObjectMappers {

    private ObjectMappers() {
    }

    /**
     * Create a JSON mapper.
     */
    public static ObjectMapper json() {
        return configure(new ObjectMapper());
    }

    /**
     * Create a YAML mapper for workflow definitions.
     */
    public static ObjectMapper yaml() {
        return configure(new ObjectMapper(new YAMLFactory()));
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
