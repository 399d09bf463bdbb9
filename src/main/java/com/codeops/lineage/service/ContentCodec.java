package com.codeops.lineage.service;

import com.codeops.lineage.exception.LineageException;
import com.codeops.lineage.exception.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Converts opaque module content between its API form (a JSON object as a map) and its
 * stored form (canonical JSON text with map keys sorted at every depth). Equal documents
 * always encode to the same text, which is what the content hash is computed over.
 */
@Component
@Slf4j
public class ContentCodec {

    private static final TypeReference<LinkedHashMap<String, Object>> CONTENT_TYPE = new TypeReference<>() {};

    private final ObjectMapper canonicalMapper;

    public ContentCodec(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true)
                .configure(SerializationFeature.INDENT_OUTPUT, false);
    }

    /**
     * Encodes content as canonical JSON.
     *
     * @param content the content document, null is treated as empty
     * @return canonical JSON text
     * @throws ValidationException if the content cannot be represented as JSON
     */
    public String encode(Map<String, Object> content) {
        try {
            return canonicalMapper.writeValueAsString(content != null ? content : Map.of());
        } catch (JsonProcessingException e) {
            throw new ValidationException("Content is not a valid JSON document: " + e.getOriginalMessage());
        }
    }

    /**
     * Decodes stored canonical JSON back into a mutable map.
     *
     * @param json stored content text
     * @return the decoded document
     */
    public Map<String, Object> decode(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return canonicalMapper.readValue(json, CONTENT_TYPE);
        } catch (JsonProcessingException e) {
            log.error("Stored content could not be decoded", e);
            throw new LineageException("Stored content is corrupt", e);
        }
    }

    /**
     * Overlays {@code changes} on {@code base} one top-level key at a time. Keys absent from
     * {@code changes} keep their prior value; nested objects are replaced, not merged.
     *
     * @param base    prior content, may be null
     * @param changes incoming partial content, may be null
     * @return a new map holding the merged document
     */
    public Map<String, Object> overlay(Map<String, Object> base, Map<String, Object> changes) {
        Map<String, Object> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (changes != null) {
            merged.putAll(changes);
        }
        return merged;
    }
}
