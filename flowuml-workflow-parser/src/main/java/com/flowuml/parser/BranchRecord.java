package com.flowuml.parser;

/** One branch of an open {@code if}: its guard, optional label and the first/last node materialized in it. */
final class BranchRecord {

    private final String label;
    private final String conditionText;
    private String entryNodeId;
    private String lastNodeId;

    BranchRecord(String label, String conditionText) {
        this.label = label;
        this.conditionText = conditionText;
    }

    String label() {
        return label;
    }

    String conditionText() {
        return conditionText;
    }

    String entryNodeId() {
        return entryNodeId;
    }

    void setEntryNodeId(String entryNodeId) {
        this.entryNodeId = entryNodeId;
    }

    String lastNodeId() {
        return lastNodeId;
    }

    void setLastNodeId(String lastNodeId) {
        this.lastNodeId = lastNodeId;
    }

    boolean isEmpty() {
        return entryNodeId == null;
    }

    /** Node the branch hands over to the join: the frozen last node, else the entry. */
    String exitNodeId() {
        return lastNodeId != null ? lastNodeId : entryNodeId;
    }
}
