package com.flowuml.config;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EngineConfigTest {

    @Test
    void emptyEnvironmentGivesDefaults() {
        EngineConfig config = EngineConfig.fromEnvironment(Map.<String, String>of()::get);
        assertEquals("diagrams", config.getDiagramDir());
        assertEquals(List.of("puml", "plantuml"), config.getDiagramExtensions());
        assertEquals(0, config.getHandlerTimeoutSeconds());
        assertTrue(config.isLogHandlerTiming());
        assertTrue(config.isAutoAdvanceAfterAction());
        assertEquals("ImportedWorkflow", config.getDefaultWorkflowName());
    }

    @Test
    void valuesAreReadFromEnvironment() {
        Map<String, String> env = Map.of(
                EngineConfig.ENV_DIAGRAM_DIR, " /srv/flows ",
                EngineConfig.ENV_DIAGRAM_EXTENSIONS, ".PUML, wsd,,",
                EngineConfig.ENV_HANDLER_TIMEOUT_SECONDS, "15",
                EngineConfig.ENV_LOG_HANDLER_TIMING, "false",
                EngineConfig.ENV_AUTO_ADVANCE_AFTER_ACTION, "0",
                EngineConfig.ENV_DEFAULT_WORKFLOW_NAME, "Chat");
        EngineConfig config = EngineConfig.fromEnvironment(env::get);

        assertEquals("/srv/flows", config.getDiagramDir());
        assertEquals(List.of("puml", "wsd"), config.getDiagramExtensions());
        assertEquals(15, config.getHandlerTimeoutSeconds());
        assertFalse(config.isLogHandlerTiming());
        assertFalse(config.isAutoAdvanceAfterAction());
        assertEquals("Chat", config.getDefaultWorkflowName());
    }

    @Test
    void invalidNumbersFallBackAndNegativesClamp() {
        assertEquals(0, EngineConfig.fromEnvironment(Map.of(EngineConfig.ENV_HANDLER_TIMEOUT_SECONDS, "soon")::get)
                .getHandlerTimeoutSeconds());
        assertEquals(0, EngineConfig.fromEnvironment(Map.of(EngineConfig.ENV_HANDLER_TIMEOUT_SECONDS, "-5")::get)
                .getHandlerTimeoutSeconds());
        assertEquals(0, EngineConfig.builder().handlerTimeoutSeconds(-1).build().getHandlerTimeoutSeconds());
    }

    @Test
    void diagramFileMatchingIsCaseInsensitive() {
        EngineConfig config = EngineConfig.defaults();
        assertTrue(config.isDiagramFile("onboarding.PUML"));
        assertTrue(config.isDiagramFile("flow.plantuml"));
        assertFalse(config.isDiagramFile("readme.md"));
        assertFalse(config.isDiagramFile("puml"));
        assertFalse(config.isDiagramFile(null));
    }
}
