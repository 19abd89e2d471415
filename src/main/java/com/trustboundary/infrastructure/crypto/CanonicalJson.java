package com.trustboundary.infrastructure.crypto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic JSON rendering for content that gets sealed or signed.
 *
 * <p>Properties and map keys are sorted, nulls are omitted and timestamps are
 * ISO-8601 strings, so the same object graph always renders to the same bytes.
 * Seals are computed over the compact form; files may use the pretty form.
 */
public class CanonicalJson {

    private static final TypeReference<LinkedHashMap<String, Object>> PROPERTY_MAP = new TypeReference<>() { };

    private final ObjectMapper mapper;

    public CanonicalJson() {
        this.mapper = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
            .serializationInclusion(JsonInclude.Include.NON_NULL)
            .build();
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    /**
     * Compact canonical form.
     *
     * @throws IllegalArgumentException if the value cannot be rendered
     */
    public String write(Object value) {
        try {
            return mapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be rendered as JSON: " + e.getOriginalMessage(), e);
        }
    }

    public String writePretty(Object value) {
        try {
            return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be rendered as JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Deep copy through the JSON representation.
     */
    public <T> T copy(T value, Class<T> type) {
        return value == null ? null : mapper.convertValue(value, type);
    }

    /**
     * Object rendered as a property map, as handed to collaborators that diff state.
     */
    public Map<String, Object> toMap(Object value) {
        return mapper.convertValue(value, PROPERTY_MAP);
    }
}
