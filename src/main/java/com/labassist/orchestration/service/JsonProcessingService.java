package com.labassist.orchestration.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class JsonProcessingService {

    private static final int LOG_SNIPPET = 240;

    private final ObjectMapper objectMapper;

    public Optional<JsonNode> readTree(String label, @Nullable String raw) {
        if (!StringUtils.hasText(raw)) {
            log.warn("Empty {} payload. Unable to parse JSON.", label);
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readTree(raw.trim()));
        } catch (JsonProcessingException ex) {
            log.warn("Failed to parse {} as JSON. Snippet: {}", label, truncate(raw, LOG_SNIPPET));
            return Optional.empty();
        }
    }

    public <T> T fromJson(String raw, TypeReference<T> type) {
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored JSON could not be read: " + truncate(raw, LOG_SNIPPET), ex);
        }
    }

    public <T> T fromJson(String raw, Class<T> type) {
        try {
            return objectMapper.readValue(raw, type);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Stored JSON could not be read: " + truncate(raw, LOG_SNIPPET), ex);
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Value could not be serialized: " + value.getClass().getSimpleName(), ex);
        }
    }

    public String toPrettyJson(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }

    static String truncate(String value, int maxLength) {
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= maxLength) {
            return normalized;
        }
        return normalized.substring(0, maxLength) + "...";
    }
}
