package com.flowuml.parser;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class SyntheticIdsTest {

    @Test
    void countersAreIndependentPerCategory() {
        SyntheticIds ids = new SyntheticIds();
        assertEquals("if:_x_0", ids.decisionId("x"));
        assertEquals("join_0", ids.joinId());
        assertEquals("if:_y_1", ids.decisionId("y"));
        assertEquals("loop_entry_0", ids.loopEntryId());
        assertEquals("after_loop_0", ids.afterLoopId());
        assertEquals("t_0", ids.transitionId());
        assertEquals("t_1", ids.transitionId());
        assertEquals("join_1", ids.joinId());
    }

    @Test
    void sanitizeReplacesWhitespaceAndPunctuation() {
        assertEquals("is_it_ok_", SyntheticIds.sanitize(" is it  ok? "));
        assertEquals("a_b", SyntheticIds.sanitize("a>=b"));
        assertEquals("", SyntheticIds.sanitize(null));
    }

    @Test
    void nodeIdFallsBackWhenLabelHasNoWordCharacters() {
        SyntheticIds ids = new SyntheticIds();
        assertEquals("Ask_user_0", ids.nodeId("Ask user"));
        assertEquals("node_1", ids.nodeId(""));
    }
}
