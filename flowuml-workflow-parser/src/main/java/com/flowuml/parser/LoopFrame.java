package com.flowuml.parser;

/** Open {@code repeat}: the loop entry node and the first/last node of the body. */
final class LoopFrame extends OpenFrame {

    private final String loopEntryNodeId;
    private String conditionText;
    private String firstNodeId;
    private String lastNodeId;

    LoopFrame(String loopEntryNodeId, int depth, SourceLine openedAt) {
        super(depth, openedAt);
        this.loopEntryNodeId = loopEntryNodeId;
    }

    String loopEntryNodeId() {
        return loopEntryNodeId;
    }

    String conditionText() {
        return conditionText;
    }

    String firstNodeId() {
        return firstNodeId;
    }

    void setFirstNodeId(String firstNodeId) {
        this.firstNodeId = firstNodeId;
    }

    String lastNodeId() {
        return lastNodeId;
    }

    /** Records the loop condition and the body's last node; an empty body leaves {@code lastNodeId} null. */
    void close(String conditionText, String currentNodeId) {
        this.conditionText = conditionText;
        if (currentNodeId != null && !currentNodeId.equals(loopEntryNodeId)) {
            this.lastNodeId = currentNodeId;
        }
    }

    boolean hasBody() {
        return lastNodeId != null;
    }
}
