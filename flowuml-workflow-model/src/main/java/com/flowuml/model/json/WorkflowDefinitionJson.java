package com.flowuml.model.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowuml.model.WorkflowDefinition;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Serialization and deserialization of compiled workflow definitions, for repositories that
 * persist the graph outside the process. JSON excludes null values when serializing.
 * Deserialization goes through the {@link WorkflowDefinition} constructor, so a stored graph with
 * dangling node references is rejected on load.
 */
public final class WorkflowDefinitionJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private WorkflowDefinitionJson() {
    }

    /**
     * Deserializes a definition from a JSON string.
     *
     * @param json the JSON string (e.g. from a repository row)
     * @return the parsed {@link WorkflowDefinition}
     * @throws UncheckedIOException on parse failure
     */
    public static WorkflowDefinition fromJson(String json) {
        try {
            return MAPPER.readValue(json, WorkflowDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Serializes the definition to a compact JSON string (nulls excluded).
     *
     * @throws UncheckedIOException on serialization failure
     */
    public static String toJson(WorkflowDefinition definition) {
        try {
            return MAPPER.writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /** Serializes the definition to a pretty-printed JSON string (nulls excluded). */
    public static String toJsonPretty(WorkflowDefinition definition) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(definition);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
