package com.finpal.assistant.controller;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Parses JSON request bodies regardless of Content-Type. A missing, blank or unparsable body
 * yields the caller's empty value instead of an error, so the endpoints can answer with their
 * own validation messages.
 */
@Component
public class LenientRequestBodyReader {
    private static final Logger log = LoggerFactory.getLogger(LenientRequestBodyReader.class);

    private static final TypeReference<LinkedHashMap<String, Object>> OBJECT = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    public LenientRequestBodyReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public <T> T read(String body, Class<T> type, Supplier<T> whenMissing) {
        if (body == null || body.isBlank()) {
            return whenMissing.get();
        }
        try {
            T value = objectMapper.readValue(body, type);
            return value != null ? value : whenMissing.get();
        } catch (JsonProcessingException ex) {
            log.debug("Unparsable {} body treated as empty: {}", type.getSimpleName(), ex.getOriginalMessage());
            return whenMissing.get();
        }
    }

    public Map<String, Object> readObject(String body) {
        if (body == null || body.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, Object> value = objectMapper.readValue(body, OBJECT);
            return value != null ? value : new LinkedHashMap<>();
        } catch (JsonProcessingException ex) {
            log.debug("Unparsable object body treated as empty: {}", ex.getOriginalMessage());
            return new LinkedHashMap<>();
        }
    }
}
