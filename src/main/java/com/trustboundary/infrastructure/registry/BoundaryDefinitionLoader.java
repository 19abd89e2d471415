package com.trustboundary.infrastructure.registry;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.exc.MismatchedInputException;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trustboundary.domain.model.Boundary;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and renders raw boundary definitions (snake_case JSON, as exported by the registry).
 *
 * <p>Parsing is lenient about values and strict about shape: enum strings are
 * matched case-insensitively and unknown values become {@code null}, so that
 * compliance checking reports them. Malformed JSON is rejected. The parsed
 * document is kept on the boundary so its signature can be checked against
 * exactly what the registry signed.
 *
 * <p>Signed form: the definition without {@code signature}, keys sorted at
 * every level, no whitespace.
 */
@Slf4j
public class BoundaryDefinitionLoader {

    private static final TypeReference<List<JsonNode>> DEFINITION_LIST = new TypeReference<>() { };
    private static final TypeReference<LinkedHashMap<String, Object>> DEFINITION = new TypeReference<>() { };

    static final String SIGNATURE_FIELD = "signature";

    private final ObjectMapper mapper = JsonMapper.builder()
        .addModule(new JavaTimeModule())
        .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
        .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
        .enable(DeserializationFeature.READ_UNKNOWN_ENUM_VALUES_AS_NULL)
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
        .build();

    public List<Boundary> read(InputStream json) {
        try {
            List<Boundary> boundaries = new ArrayList<>();
            for (JsonNode definition : mapper.readValue(json, DEFINITION_LIST)) {
                boundaries.add(fromDefinition(definition));
            }
            return boundaries;
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid boundary definitions", e);
        }
    }

    public Boundary readOne(String json) {
        try {
            return fromDefinition(mapper.readTree(json));
        } catch (IOException e) {
            throw new UncheckedIOException("Invalid boundary definition", e);
        }
    }

    /**
     * Content a boundary signature covers. Boundaries built in code are rendered
     * in the registry layout first.
     */
    public String signedContent(Boundary boundary) {
        Map<String, Object> definition = new LinkedHashMap<>(boundary.getDefinition() != null
            ? boundary.getDefinition()
            : mapper.convertValue(boundary, DEFINITION));
        definition.remove(SIGNATURE_FIELD);
        try {
            return mapper.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Boundary " + boundary.getBoundaryId()
                + " cannot be rendered: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Load every definition in {@code file} into the registry.
     *
     * @return number of boundaries registered
     */
    public int loadInto(InMemoryBoundaryRegistry registry, Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            List<Boundary> boundaries = read(in);
            boundaries.forEach(registry::register);
            log.info("Loaded {} boundary definition(s) from {}", boundaries.size(), file);
            return boundaries.size();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read boundary definitions from " + file, e);
        }
    }

    private Boundary fromDefinition(JsonNode definition) throws JsonProcessingException {
        if (definition == null || !definition.isObject()) {
            throw MismatchedInputException.from((JsonParser) null, Boundary.class,
                "Boundary definition must be a JSON object");
        }
        Map<String, Object> document = mapper.convertValue(definition, DEFINITION);
        return mapper.treeToValue(definition, Boundary.class).toBuilder()
            .definition(Collections.unmodifiableMap(document))
            .build();
    }
}
