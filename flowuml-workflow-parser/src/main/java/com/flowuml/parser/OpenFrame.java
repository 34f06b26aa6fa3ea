package com.flowuml.parser;

/**
 * Common part of an open nested construct. {@code depth} is the nesting level across branch and
 * loop frames at the time the frame was pushed, so the innermost open construct is the frame with
 * the highest depth.
 */
abstract class OpenFrame {

    private final int depth;
    private final SourceLine openedAt;

    OpenFrame(int depth, SourceLine openedAt) {
        this.depth = depth;
        this.openedAt = openedAt;
    }

    int depth() {
        return depth;
    }

    /** Line holding the {@code if} or {@code repeat} that opened the frame. */
    SourceLine openedAt() {
        return openedAt;
    }
}
