package com.flowuml.action;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flowuml.model.WorkflowNode;
import com.flowuml.model.json.JsonObjects;

import java.io.UncheckedIOException;
import java.io.IOException;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Action embedded in a node: {@code {"action": "<name>", "params": {...}}}. Parameter values are kept as
 * text: strings as-is, other scalars in their JSON form ({@code 3}, {@code true}), nested objects and
 * arrays as compact JSON. JSON {@code null} becomes the empty string.
 */
public final class ActionDescriptor {

    private final String actionName;
    private final Map<String, String> params;

    public ActionDescriptor(String actionName, Map<String, String> params) {
        this.actionName = Objects.requireNonNull(actionName, "actionName");
        this.params = params != null ? Collections.unmodifiableMap(new LinkedHashMap<>(params)) : Map.of();
    }

    /**
     * Reads the descriptor of a node: its {@code jsonMetadata} when present, otherwise its note when
     * the whole note is a JSON object.
     *
     * @return the descriptor, or empty when the node is not actionable
     */
    public static Optional<ActionDescriptor> fromNode(WorkflowNode node) {
        if (node == null) return Optional.empty();
        if (node.getJsonMetadata() != null && !node.getJsonMetadata().isBlank()) {
            return fromJson(node.getJsonMetadata());
        }
        return fromJson(node.getNoteMarkdown());
    }

    /** Descriptor from JSON object text; empty when the text is not an object or has no textual action. */
    public static Optional<ActionDescriptor> fromJson(String json) {
        Optional<ObjectNode> object = JsonObjects.tryParseObject(json);
        if (object.isEmpty()) return Optional.empty();
        Optional<String> name = JsonObjects.actionName(object.get());
        if (name.isEmpty()) return Optional.empty();
        return Optional.of(new ActionDescriptor(name.get(), paramsOf(object.get().get("params"))));
    }

    private static Map<String, String> paramsOf(JsonNode paramsNode) {
        Map<String, String> params = new LinkedHashMap<>();
        if (paramsNode == null || !paramsNode.isObject()) return params;
        Iterator<Map.Entry<String, JsonNode>> fields = paramsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            params.put(field.getKey(), asText(field.getValue()));
        }
        return params;
    }

    private static String asText(JsonNode value) {
        if (value == null || value.isNull()) return "";
        if (value.isValueNode()) return value.asText();
        try {
            return JsonObjects.mapper().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public String getActionName() {
        return actionName;
    }

    /** Raw parameters in declaration order, before template substitution. */
    public Map<String, String> getParams() {
        return params;
    }

    @Override
    public String toString() {
        return "ActionDescriptor{action='" + actionName + "', params=" + params.keySet() + "}";
    }
}
