package com.flowuml.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Presentation settings found in a document: skinparams, pragmas, style blocks and the title.
 * Not part of the workflow graph; kept so callers can re-render or inspect the source diagram.
 */
public final class DiagramProperties {

    /** {@code !pragma name [value]}; value is null when absent. */
    public record Pragma(String name, String value) {
    }

    private final Map<String, String> skinparams;
    private final List<Pragma> pragmas;
    private final List<String> styleBlocks;
    private final String title;

    public DiagramProperties(Map<String, String> skinparams, List<Pragma> pragmas, List<String> styleBlocks, String title) {
        this.skinparams = skinparams != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(skinparams))
                : Map.of();
        this.pragmas = pragmas != null ? List.copyOf(pragmas) : List.of();
        this.styleBlocks = styleBlocks != null ? List.copyOf(styleBlocks) : List.of();
        this.title = title;
    }

    /** Skinparams in declaration order; block entries are keyed {@code group.Name}. */
    public Map<String, String> getSkinparams() {
        return skinparams;
    }

    public Optional<String> skinparam(String name) {
        if (name == null) return Optional.empty();
        for (Map.Entry<String, String> e : skinparams.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return Optional.ofNullable(e.getValue());
        }
        return Optional.empty();
    }

    public List<Pragma> getPragmas() {
        return pragmas;
    }

    /** Raw {@code <style> ... </style>} blocks, lines joined with {@code \n}. */
    public List<String> getStyleBlocks() {
        return styleBlocks;
    }

    public Optional<String> getTitle() {
        return Optional.ofNullable(title);
    }
}
