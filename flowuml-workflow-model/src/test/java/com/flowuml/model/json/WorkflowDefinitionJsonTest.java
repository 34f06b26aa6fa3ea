package com.flowuml.model.json;

import com.flowuml.model.StartPoint;
import com.flowuml.model.Transition;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowDefinitionJsonTest {

    private static final String STORED_JSON = """
            {
              "id": "onboarding",
              "name": "Onboarding",
              "nodes": [
                { "id": "Start", "label": "Start" },
                { "id": "Ask", "label": "Ask", "jsonMetadata": "{\\"action\\":\\"Prompt\\"}", "noteMarkdown": "asks" }
              ],
              "transitions": [
                { "id": "t_0", "fromNodeId": "Start", "toNodeId": "Ask" }
              ],
              "startPoints": [ { "nodeId": "Start" } ],
              "storedAt": "2024-01-01"
            }
            """;

    @Test
    void fromJsonBuildsDefinition() {
        WorkflowDefinition def = WorkflowDefinitionJson.fromJson(STORED_JSON);
        assertEquals("onboarding", def.getId());
        assertEquals("Onboarding", def.getName());
        assertEquals(2, def.getNodes().size());
        WorkflowNode ask = def.findNode("Ask").orElseThrow();
        assertEquals("{\"action\":\"Prompt\"}", ask.getJsonMetadata());
        assertEquals("asks", ask.getNoteMarkdown());
        assertNull(def.outgoing("Start").get(0).getCondition());
        assertEquals("Start", def.getStartPoints().get(0).nodeId());
    }

    @Test
    void serializedGraphDecodesToEqualDefinition() {
        WorkflowDefinition def = new WorkflowDefinition("wf", "Loop",
                List.of(new WorkflowNode("A", "A"), new WorkflowNode("B", "B", null, "note")),
                List.of(new Transition("t_0", "A", "B", null), new Transition("t_1", "B", "A", "again")),
                List.of(new StartPoint("A")));

        String json = WorkflowDefinitionJson.toJson(def);
        assertFalse(json.contains("null"));
        assertFalse(json.contains("hasCondition"));
        assertEquals(def, WorkflowDefinitionJson.fromJson(json));
        assertEquals(def, WorkflowDefinitionJson.fromJson(WorkflowDefinitionJson.toJsonPretty(def)));
    }

    @Test
    void danglingReferenceInStoredJsonIsRejected() {
        String json = """
                {"id":"x","nodes":[{"id":"A"}],"transitions":[{"id":"t_0","fromNodeId":"A","toNodeId":"Z"}]}
                """;
        Exception e = assertThrows(Exception.class, () -> WorkflowDefinitionJson.fromJson(json));
        assertTrue(e instanceof UncheckedIOException || e instanceof IllegalArgumentException);
    }

    @Test
    void malformedJsonThrowsUnchecked() {
        assertThrows(UncheckedIOException.class, () -> WorkflowDefinitionJson.fromJson("{not json"));
    }
}
