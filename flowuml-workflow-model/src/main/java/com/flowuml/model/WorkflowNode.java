package com.flowuml.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Node in a compiled workflow graph. Created by the parser and immutable afterwards; the parser
 * replaces a node with a copy ({@link #withNote}, {@link #withMetadata}) when a note or embedded
 * action metadata is attached to it.
 * <p>
 * {@code jsonMetadata} holds the verbatim JSON object text of an embedded action descriptor
 * (e.g. {@code {"action":"LoadProfile","params":{"id":"{{userId}}"}}}); {@code noteMarkdown}
 * holds the human-readable note text, including stereotype suffixes such as {@code <<input>>}.
 */
public final class WorkflowNode {

    private final String id;
    private final String label;
    private final String jsonMetadata;
    private final String noteMarkdown;

    @JsonCreator
    public WorkflowNode(
            @JsonProperty("id") String id,
            @JsonProperty("label") String label,
            @JsonProperty("jsonMetadata") String jsonMetadata,
            @JsonProperty("noteMarkdown") String noteMarkdown) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = label != null ? label : "";
        this.jsonMetadata = jsonMetadata;
        this.noteMarkdown = noteMarkdown;
    }

    public WorkflowNode(String id, String label) {
        this(id, label, null, null);
    }

    public String getId() {
        return id;
    }

    /** Display label; never null (empty for unlabeled nodes). */
    public String getLabel() {
        return label;
    }

    /** Embedded action descriptor JSON, or null. */
    public String getJsonMetadata() {
        return jsonMetadata;
    }

    /** Note text attached to this node, or null. */
    public String getNoteMarkdown() {
        return noteMarkdown;
    }

    /** Copy with the given note text; metadata is kept. */
    public WorkflowNode withNote(String note) {
        return new WorkflowNode(id, label, jsonMetadata, note);
    }

    /** Copy with the given metadata and note text. */
    public WorkflowNode withMetadata(String json, String note) {
        return new WorkflowNode(id, label, json, note);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkflowNode that = (WorkflowNode) o;
        return id.equals(that.id) && label.equals(that.label)
                && Objects.equals(jsonMetadata, that.jsonMetadata)
                && Objects.equals(noteMarkdown, that.noteMarkdown);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, label, jsonMetadata, noteMarkdown);
    }

    @Override
    public String toString() {
        return "WorkflowNode{id='" + id + "', label='" + label + "'}";
    }
}
