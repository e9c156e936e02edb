package com.solusoft.ai.claimmatch.persistence;

import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import lombok.extern.slf4j.Slf4j;

/**
 * Serializes stored entities into the {@code payload} TEXT column every table carries.
 * Indexed columns next to it are copies used for lookups only.
 */
@Component
@Slf4j
public class JsonPayloadCodec {

    private final ObjectMapper objectMapper;

    public JsonPayloadCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(Object entity) {
        try {
            return objectMapper.writeValueAsString(entity);
        } catch (JsonProcessingException e) {
            log.error("JSON Serialization Error for {}", entity.getClass().getSimpleName(), e);
            throw new IllegalStateException("Could not serialize " + entity.getClass().getSimpleName(), e);
        }
    }

    public <T> T read(String payload, Class<T> type) {
        try {
            return objectMapper.readValue(payload, type);
        } catch (JsonProcessingException e) {
            log.error("JSON Deserialization Error for {}", type.getSimpleName(), e);
            throw new IllegalStateException("Stored " + type.getSimpleName() + " payload is not readable", e);
        }
    }
}
