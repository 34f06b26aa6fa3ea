package com.flowuml.parser;

import com.flowuml.model.json.JsonObjects;

/**
 * Splits note text of the form {@code <json object>|<markdown>} into embedded action metadata and
 * note text. Without a {@code |}, or when the part before it is not a JSON object, the whole text is
 * note text.
 */
final class NoteText {

    private final String jsonMetadata;
    private final String markdown;
    private final boolean invalidMetadata;

    private NoteText(String jsonMetadata, String markdown, boolean invalidMetadata) {
        this.jsonMetadata = jsonMetadata;
        this.markdown = markdown;
        this.invalidMetadata = invalidMetadata;
    }

    static NoteText split(String text) {
        int pipe = text.indexOf('|');
        if (pipe < 0) {
            return new NoteText(null, text, false);
        }
        String left = text.substring(0, pipe).trim();
        String right = text.substring(pipe + 1).trim();
        if (JsonObjects.tryParseObject(left).isPresent()) {
            return new NoteText(left, right, false);
        }
        return new NoteText(null, text, left.startsWith("{"));
    }

    /** Verbatim JSON object text, or null when the note carries no metadata. */
    String jsonMetadata() {
        return jsonMetadata;
    }

    String markdown() {
        return markdown;
    }

    /** True when the text before {@code |} looked like JSON but did not parse as an object. */
    boolean invalidMetadata() {
        return invalidMetadata;
    }
}
