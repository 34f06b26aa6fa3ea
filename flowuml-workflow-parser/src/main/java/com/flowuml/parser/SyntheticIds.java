package com.flowuml.parser;

import java.util.EnumMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Deterministic id generation for one parse. One monotonically increasing counter per category;
 * a fresh instance is used for every parse so the same text always yields the same ids.
 */
final class SyntheticIds {

    enum Category {
        IF, JOIN, LOOP_ENTRY, AFTER_LOOP, NODE, TRANSITION
    }

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_WORD = Pattern.compile("[^A-Za-z0-9_]+");

    private final Map<Category, Integer> counters = new EnumMap<>(Category.class);

    int next(Category category) {
        int n = counters.getOrDefault(category, 0);
        counters.put(category, n + 1);
        return n;
    }

    String decisionId(String condition) {
        return "if:_" + sanitize(condition) + "_" + next(Category.IF);
    }

    String joinId() {
        return "join_" + next(Category.JOIN);
    }

    String loopEntryId() {
        return "loop_entry_" + next(Category.LOOP_ENTRY);
    }

    String afterLoopId() {
        return "after_loop_" + next(Category.AFTER_LOOP);
    }

    /** Id for a node whose label is already taken as an id (or is unusable as one). */
    String nodeId(String label) {
        String base = sanitize(label);
        int n = next(Category.NODE);
        return base.isEmpty() ? "node_" + n : base + "_" + n;
    }

    String transitionId() {
        return "t_" + next(Category.TRANSITION);
    }

    /** Whitespace runs become {@code _}, then any other run of non-word characters becomes {@code _}. */
    static String sanitize(String text) {
        if (text == null) return "";
        String s = WHITESPACE.matcher(text.trim()).replaceAll("_");
        return NON_WORD.matcher(s).replaceAll("_");
    }
}
