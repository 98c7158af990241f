package com.example.crosstab.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Shared JSON encoding for store implementations that keep values as strings.
 */
abstract class JsonCoordinationStore implements CoordinationStore {

    protected final ObjectMapper objectMapper;

    protected JsonCoordinationStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    protected String write(String key, Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize value for key " + key, e);
        }
    }

    protected <T> T read(String key, String json, Class<T> type) {
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to deserialize value for key " + key, e);
        }
    }
}
