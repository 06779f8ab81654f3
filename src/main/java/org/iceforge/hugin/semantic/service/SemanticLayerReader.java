package org.iceforge.hugin.semantic.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import org.iceforge.hugin.semantic.compiler.MalformedConfigurationException;
import org.iceforge.hugin.semantic.model.SemanticLayer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parses layer and query documents and rejects them when required fields are missing.
 * Documents starting with <code>{</code> are read as JSON, anything else as YAML.
 */
@Component
public class SemanticLayerReader {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Validator validator;

    public SemanticLayerReader(ObjectMapper objectMapper, Validator validator) {
        this.jsonMapper = Objects.requireNonNull(objectMapper);
        this.validator = Objects.requireNonNull(validator);
    }

    public SemanticLayer readLayer(String document) {
        return validate(parse(document, SemanticLayer.class, "semantic layer"), "semantic layer");
    }

    /**
     * Runs bean validation on an already-built layer or query.
     */
    public <T> T validate(T value, String documentName) {
        Set<ConstraintViolation<T>> violations = validator.validate(value);
        if (violations.isEmpty()) {
            return value;
        }
        List<String> messages = violations.stream()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .sorted()
                .toList();
        throw new MalformedConfigurationException(documentName, messages);
    }

    private <T> T parse(String document, Class<T> type, String documentName) {
        if (document == null || document.isBlank()) {
            throw new MalformedConfigurationException(documentName, List.of("document is empty"));
        }
        ObjectMapper mapper = document.stripLeading().startsWith("{") ? jsonMapper : yamlMapper;
        try {
            T value = mapper.readValue(document, type);
            if (value == null) {
                throw new MalformedConfigurationException(documentName, List.of("document is empty"));
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new MalformedConfigurationException(documentName, e);
        }
    }
}
