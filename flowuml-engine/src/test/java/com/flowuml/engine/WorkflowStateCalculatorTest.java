package com.flowuml.engine;

import com.flowuml.model.ChoiceOption;
import com.flowuml.model.StartPoint;
import com.flowuml.model.Transition;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;
import com.flowuml.model.WorkflowStatePayload;
import com.flowuml.parser.ActivityDiagramParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class WorkflowStateCalculatorTest {

    private final ActivityDiagramParser parser = new ActivityDiagramParser();

    private static WorkflowDefinition definition(List<WorkflowNode> nodes, List<Transition> transitions, String start) {
        return new WorkflowDefinition("wf", "wf", nodes, transitions,
                start != null ? List.of(new StartPoint(start)) : List.of());
    }

    @Test
    void startLabeledStartAdvancesThroughSingleEdge() {
        WorkflowDefinition def = parser.parse("""
                start
                :A;
                """, "wf", null);

        assertEquals(Optional.of("A"), WorkflowStateCalculator.calculateStartNode(def));
        assertEquals(Optional.of("Start"), WorkflowStateCalculator.declaredStartNode(def));
    }

    @Test
    void startWithTwoEdgesIsNotAdvanced() {
        WorkflowDefinition def = definition(
                List.of(new WorkflowNode("s", "Start"), new WorkflowNode("A", "A"), new WorkflowNode("B", "B")),
                List.of(new Transition("t_0", "s", "A", null), new Transition("t_1", "s", "B", null)),
                "s");

        assertEquals(Optional.of("s"), WorkflowStateCalculator.calculateStartNode(def));
    }

    @Test
    void unlabeledStartIsAdvancedButLabeledPromptIsNot() {
        WorkflowDefinition unlabeled = definition(
                List.of(new WorkflowNode("s", ""), new WorkflowNode("A", "A")),
                List.of(new Transition("t_0", "s", "A", null)),
                "s");
        WorkflowDefinition labeled = definition(
                List.of(new WorkflowNode("s", "Welcome"), new WorkflowNode("A", "A")),
                List.of(new Transition("t_0", "s", "A", null)),
                "s");

        assertEquals(Optional.of("A"), WorkflowStateCalculator.calculateStartNode(unlabeled));
        assertEquals(Optional.of("s"), WorkflowStateCalculator.calculateStartNode(labeled));
    }

    @Test
    void startAdvanceTakesOnlyOneHop() {
        WorkflowDefinition def = definition(
                List.of(new WorkflowNode("s", "start"), new WorkflowNode("n", ""), new WorkflowNode("B", "B")),
                List.of(new Transition("t_0", "s", "n", null), new Transition("t_1", "n", "B", null)),
                "s");

        assertEquals(Optional.of("n"), WorkflowStateCalculator.calculateStartNode(def));
    }

    @Test
    void firstNodeIsUsedWithoutStartPointsAndEmptyDefinitionHasNoStart() {
        WorkflowDefinition def = definition(
                List.of(new WorkflowNode("Q", "Question"), new WorkflowNode("A", "A")),
                List.of(new Transition("t_0", "Q", "A", null)),
                null);

        assertEquals(Optional.of("Q"), WorkflowStateCalculator.calculateStartNode(def));
        assertEquals(Optional.empty(),
                WorkflowStateCalculator.calculateStartNode(definition(List.of(), List.of(), null)));
    }

    @Test
    void fanOutIsPresentedAsChoiceInTransitionOrder() {
        WorkflowDefinition def = parser.parse("""
                start
                :A;
                A --> B
                A --> C
                """, "wf", null);

        assertEquals(4, def.getNodes().size());
        assertEquals(2, def.outgoing("A").size());

        WorkflowStatePayload payload = WorkflowStateCalculator.calculateCurrentPayload(def, "A");
        assertTrue(payload.isChoice());
        assertEquals("A", payload.getNodeLabel());
        List<ChoiceOption> choices = payload.getChoices();
        assertEquals(2, choices.size());
        assertEquals(new ChoiceOption(0, "B", "B", null), choices.get(0));
        assertEquals(new ChoiceOption(1, "C", "C", null), choices.get(1));
    }

    @Test
    void singleGuardedTransitionIsOneItemChoice() {
        WorkflowDefinition def = definition(
                List.of(new WorkflowNode("A", "Confirm"), new WorkflowNode("B", "")),
                List.of(new Transition("t_0", "A", "B", "ok")),
                "A");

        WorkflowStatePayload payload = WorkflowStateCalculator.calculateCurrentPayload(def, "A");
        assertTrue(payload.isChoice());
        assertEquals(List.of(new ChoiceOption(0, "B", "B", "ok")), payload.getChoices());
    }

    @Test
    void actionNoteIsSummarized() {
        WorkflowDefinition def = definition(
                List.of(new WorkflowNode("A", "Load", null, "{\"action\":\"LoadProfile\",\"params\":{\"id\":\"1\"}}")),
                List.of(), "A");

        WorkflowStatePayload payload = WorkflowStateCalculator.calculateCurrentPayload(def, "A");
        assertFalse(payload.isChoice());
        assertEquals("Action: LoadProfile", payload.getText());
        assertEquals("Load", payload.getNodeLabel());
    }

    @Test
    void notesThatAreNotActionsAreShownVerbatim() {
        WorkflowDefinition def = definition(
                List.of(
                        new WorkflowNode("json", "J", null, "{\"title\":\"x\"}"),
                        new WorkflowNode("broken", "K", null, "{\"action\": oops"),
                        new WorkflowNode("numeric", "N", null, "{\"action\": 5}"),
                        new WorkflowNode("plain", "P", null, "Please confirm"),
                        new WorkflowNode("bare", "Just a label")),
                List.of(), "plain");

        assertEquals("{\"title\":\"x\"}", WorkflowStateCalculator.calculateCurrentPayload(def, "json").getText());
        assertEquals("{\"action\": oops", WorkflowStateCalculator.calculateCurrentPayload(def, "broken").getText());
        assertEquals("{\"action\": 5}", WorkflowStateCalculator.calculateCurrentPayload(def, "numeric").getText());
        assertEquals("Please confirm", WorkflowStateCalculator.calculateCurrentPayload(def, "plain").getText());
        assertEquals("Just a label", WorkflowStateCalculator.calculateCurrentPayload(def, "bare").getText());
    }

    @Test
    void unknownOrNullNodeGivesEmptyPayload() {
        WorkflowDefinition def = definition(List.of(new WorkflowNode("A", "A")), List.of(), "A");

        assertSame(WorkflowStatePayload.empty(), WorkflowStateCalculator.calculateCurrentPayload(def, null));
        WorkflowStatePayload unknown = WorkflowStateCalculator.calculateCurrentPayload(def, "missing");
        assertFalse(unknown.isChoice());
        assertNull(unknown.getText());
        assertNull(unknown.getNodeLabel());
    }
}
