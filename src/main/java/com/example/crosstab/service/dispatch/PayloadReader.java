package com.example.crosstab.service.dispatch;

import com.example.crosstab.exception.ProtocolException;
import com.example.crosstab.model.VectorClock;
import com.example.crosstab.util.Constants.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Typed reads from an inbound payload. Anything of the wrong shape is a {@code MALFORMED_PAYLOAD}.
 */
final class PayloadReader {

    private final JsonNode payload;
    private final ObjectMapper objectMapper;

    PayloadReader(JsonNode payload, ObjectMapper objectMapper) {
        this.payload = payload == null ? NullNode.getInstance() : payload;
        this.objectMapper = objectMapper;
        if (!this.payload.isNull() && !this.payload.isObject()) {
            throw malformed("payload must be a JSON object");
        }
    }

    String requiredText(String field) {
        String value = optionalText(field);
        if (value == null || value.isBlank()) {
            throw malformed(field + " is required");
        }
        return value;
    }

    String optionalText(String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isTextual()) {
            throw malformed(field + " must be a string");
        }
        return node.asText();
    }

    boolean flag(String field, boolean fallback) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return fallback;
        }
        if (!node.isBoolean()) {
            throw malformed(field + " must be a boolean");
        }
        return node.booleanValue();
    }

    Long optionalLong(String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.canConvertToLong() || !node.isIntegralNumber()) {
            throw malformed(field + " must be an integer");
        }
        return node.longValue();
    }

    JsonNode optionalObject(String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (!node.isObject()) {
            throw malformed(field + " must be a JSON object");
        }
        return node;
    }

    VectorClock optionalClock(String field) {
        JsonNode node = optionalObject(field);
        if (node == null) {
            return null;
        }
        try {
            return objectMapper.treeToValue(node, VectorClock.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw malformed(field + " is not a valid vector clock");
        }
    }

    private static ProtocolException malformed(String message) {
        return new ProtocolException(ErrorCode.MALFORMED_PAYLOAD, message);
    }
}
