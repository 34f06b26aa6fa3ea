package com.flowuml.engine.store;

import com.flowuml.model.StartPoint;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryWorkflowDefinitionStoreTest {

    private final InMemoryWorkflowDefinitionStore store = new InMemoryWorkflowDefinitionStore();

    private static WorkflowDefinition definition(String id, String nodeLabel) {
        return new WorkflowDefinition(id, id, List.of(new WorkflowNode("n", nodeLabel)), List.of(),
                List.of(new StartPoint("n")));
    }

    @Test
    void storesAndReplacesById() {
        WorkflowDefinition first = definition("b", "First");
        WorkflowDefinition second = definition("b", "Second");
        store.store(first);
        store.store(definition("a", "Other"));
        store.store(second);

        assertSame(second, store.getById("b").orElseThrow());
        assertEquals(List.of("a", "b"), List.copyOf(store.ids()));
        assertTrue(store.exists("a"));
    }

    @Test
    void unknownIdsAreAbsent() {
        assertEquals(Optional.empty(), store.getById("x"));
        assertEquals(Optional.empty(), store.getById(null));
        assertFalse(store.exists(null));
        assertThrows(NullPointerException.class, () -> store.store(null));
    }
}
