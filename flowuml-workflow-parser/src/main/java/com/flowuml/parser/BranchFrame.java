package com.flowuml.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Open {@code if}: the decision node and its branches in declaration order. The last branch is the active one. */
final class BranchFrame extends OpenFrame {

    private final String decisionNodeId;
    private final String conditionText;
    private final List<BranchRecord> branches = new ArrayList<>();

    BranchFrame(String decisionNodeId, String conditionText, String firstBranchLabel, int depth, SourceLine openedAt) {
        super(depth, openedAt);
        this.decisionNodeId = decisionNodeId;
        this.conditionText = conditionText;
        this.branches.add(new BranchRecord(firstBranchLabel, conditionText));
    }

    String decisionNodeId() {
        return decisionNodeId;
    }

    String conditionText() {
        return conditionText;
    }

    List<BranchRecord> branches() {
        return Collections.unmodifiableList(branches);
    }

    BranchRecord activeBranch() {
        return branches.get(branches.size() - 1);
    }

    /**
     * Freezes the active branch at {@code currentNodeId}; the decision node itself never counts as a
     * branch's last node.
     */
    void freezeActiveBranch(String currentNodeId) {
        BranchRecord active = activeBranch();
        if (currentNodeId != null && !currentNodeId.equals(decisionNodeId) && !active.isEmpty()) {
            active.setLastNodeId(currentNodeId);
        }
    }

    /** Freezes the active branch and opens the next one. */
    BranchRecord openBranch(String label, String conditionText, String currentNodeId) {
        freezeActiveBranch(currentNodeId);
        BranchRecord next = new BranchRecord(label, conditionText);
        branches.add(next);
        return next;
    }
}
