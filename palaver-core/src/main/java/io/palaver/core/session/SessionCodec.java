package io.palaver.core.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Serializes session values to JSON trees and back. Every value written to a session goes through
 * here, so a value that cannot survive a store round trip is rejected at {@code set} time.
 */
public final class SessionCodec {
    private final ObjectMapper mapper;

    public SessionCodec() {
        this(defaultMapper());
    }

    public SessionCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public JsonNode encode(Object value) {
        try {
            return mapper.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new SessionStoreException("Value of type " + value.getClass().getName() + " is not JSON-serializable", e);
        }
    }

    public Object decode(JsonNode node) {
        return decode(node, Object.class);
    }

    public <T> T decode(JsonNode node, Class<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new SessionStoreException("Failed to decode session value as " + type.getSimpleName(), e);
        }
    }

    public <T> T decode(JsonNode node, TypeReference<T> type) {
        if (node == null || node.isNull()) {
            return null;
        }
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new SessionStoreException("Failed to decode session value as " + type.getType(), e);
        }
    }

    public String write(ObjectNode document) {
        try {
            return mapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to serialize session document", e);
        }
    }

    public ObjectNode read(String document) {
        if (document == null || document.isBlank()) {
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(document);
            if (node instanceof ObjectNode objectNode) {
                return objectNode;
            }
            throw new SessionStoreException("Session document is not a JSON object");
        } catch (JsonProcessingException e) {
            throw new SessionStoreException("Failed to parse session document", e);
        }
    }

    public ObjectNode emptyDocument() {
        return mapper.createObjectNode();
    }
}
