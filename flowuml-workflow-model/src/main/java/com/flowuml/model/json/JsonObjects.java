package com.flowuml.model.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * Tagged JSON sniffing for note text and action metadata. Callers branch on the returned
 * {@link Optional}; nothing here throws for malformed input.
 */
public final class JsonObjects {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);

    private JsonObjects() {
    }

    /**
     * Parses the text as a JSON object.
     *
     * @return the object, or empty when the text is null, blank, malformed, or not an object
     */
    public static Optional<ObjectNode> tryParseObject(String text) {
        if (text == null) return Optional.empty();
        String trimmed = text.trim();
        if (!trimmed.startsWith("{")) return Optional.empty();
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            return node != null && node.isObject() ? Optional.of((ObjectNode) node) : Optional.empty();
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    /** Non-blank textual {@code "action"} member of the object, trimmed. */
    public static Optional<String> actionName(ObjectNode object) {
        if (object == null) return Optional.empty();
        JsonNode action = object.get("action");
        if (action == null || !action.isTextual() || action.asText().isBlank()) return Optional.empty();
        return Optional.of(action.asText().trim());
    }

    /** Returns true if the object carries an {@code "action"} key at all (even a non-textual one). */
    public static boolean hasActionKey(ObjectNode object) {
        return object != null && object.has("action");
    }

    /** Shared mapper for callers that need to render nested JSON values back to text. */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
