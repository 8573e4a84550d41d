package com.regressionsentinel.core.store;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Jackson configuration shared by snapshot stores, webhook payloads and
 * exports: ISO-8601 dates, unknown properties ignored.
 */
public final class ObjectMappers {

    private static final ObjectMapper STANDARD = create();

    private ObjectMappers() {
    }

    /**
     * @return the shared, fully configured mapper (thread-safe once configured)
     */
    public static ObjectMapper standard() {
        return STANDARD;
    }

    /**
     * @return a new mapper with the standard configuration, for callers that
     *         need to customise it further
     */
    public static ObjectMapper create() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
