package com.flowuml.action;

import com.flowuml.model.WorkflowNode;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionDescriptorTest {

    @Test
    void metadataTakesPrecedenceOverNote() {
        WorkflowNode node = new WorkflowNode("A", "A", "{\"action\":\"FromMeta\"}", "{\"action\":\"FromNote\"}");
        assertEquals("FromMeta", ActionDescriptor.fromNode(node).orElseThrow().getActionName());
    }

    @Test
    void wholeJsonNoteIsADescriptor() {
        WorkflowNode node = new WorkflowNode("A", "A", null, "{\"action\":\"Log\",\"params\":{\"level\":\"info\"}}");
        ActionDescriptor descriptor = ActionDescriptor.fromNode(node).orElseThrow();
        assertEquals("Log", descriptor.getActionName());
        assertEquals("info", descriptor.getParams().get("level"));
    }

    @Test
    void paramValuesAreRenderedAsText() {
        ActionDescriptor d = ActionDescriptor.fromJson("""
                {"action":"X","params":{"s":"{{userId}}","n":3,"b":true,"z":null,"o":{"k":[1,2]}}}
                """).orElseThrow();
        assertEquals("{{userId}}", d.getParams().get("s"));
        assertEquals("3", d.getParams().get("n"));
        assertEquals("true", d.getParams().get("b"));
        assertEquals("", d.getParams().get("z"));
        assertEquals("{\"k\":[1,2]}", d.getParams().get("o"));
    }

    @Test
    void nodesWithoutActionAreNotActionable() {
        assertFalse(ActionDescriptor.fromNode(new WorkflowNode("A", "A")).isPresent());
        assertFalse(ActionDescriptor.fromNode(new WorkflowNode("A", "A", "{\"kind\":\"info\"}", null)).isPresent());
        assertFalse(ActionDescriptor.fromNode(new WorkflowNode("A", "A", null, "just text")).isPresent());
        assertFalse(ActionDescriptor.fromNode(null).isPresent());
        assertTrue(ActionDescriptor.fromJson("{\"action\":\"X\"}").orElseThrow().getParams().isEmpty());
    }
}
