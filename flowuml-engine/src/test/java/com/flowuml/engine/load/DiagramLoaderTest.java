package com.flowuml.engine.load;

import com.flowuml.config.EngineConfig;
import com.flowuml.engine.store.InMemoryWorkflowDefinitionStore;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.parser.ActivityDiagramParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DiagramLoaderTest {

    private final InMemoryWorkflowDefinitionStore store = new InMemoryWorkflowDefinitionStore();
    private final DiagramLoader loader = new DiagramLoader(new ActivityDiagramParser(), store, EngineConfig.defaults());

    @Test
    void loadsDiagramFilesAndSkipsOthers(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("approval.puml"), """
                @startuml
                start
                :Submit;
                :Approve;
                stop
                @enduml
                """);
        Files.writeString(dir.resolve("survey.PlantUML"), """
                start
                :Ask;
                """);
        Files.writeString(dir.resolve("readme.txt"), ":Not a diagram;");
        Files.writeString(dir.resolve("empty.puml"), """
                @startuml
                ' nothing here
                @enduml
                """);

        List<String> loaded = loader.loadDirectory(dir);

        assertEquals(List.of("approval", "survey"), loaded);
        assertEquals(Set.of("approval", "survey"), store.ids());
        WorkflowDefinition approval = store.getById("approval").orElseThrow();
        assertTrue(approval.findNode("Approve").isPresent());
        assertEquals(ActivityDiagramParser.DEFAULT_WORKFLOW_NAME, approval.getName());
    }

    @Test
    void missingDirectoryLoadsNothing(@TempDir Path dir) {
        assertEquals(List.of(), loader.loadDirectory(dir.resolve("absent")));
        assertTrue(store.ids().isEmpty());
    }

    @Test
    void configuredDirectoryAndExtensionsAreUsed(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("flow.uml"), ":A;\n:B;\n");
        Files.writeString(dir.resolve("other.puml"), ":C;\n");
        DiagramLoader configured = new DiagramLoader(new ActivityDiagramParser(), store,
                EngineConfig.builder().diagramDir(dir.toString()).diagramExtensions(List.of("uml")).build());

        assertEquals(List.of("flow"), configured.loadConfiguredDirectory());
    }

    @Test
    void loadsClasspathResourceUsingTitleAsName() {
        Optional<String> id = loader.loadResource("diagrams/onboarding.puml");

        assertEquals(Optional.of("onboarding"), id);
        WorkflowDefinition def = store.getById("onboarding").orElseThrow();
        assertEquals("Onboarding", def.getName());
        assertTrue(def.findNode("Welcome").orElseThrow().getJsonMetadata().contains("LoadProfile"));
    }

    @Test
    void missingResourceLoadsNothing() {
        assertEquals(Optional.empty(), loader.loadResource("/diagrams/absent.puml"));
    }

    @Test
    void baseNameDropsOnlyTheLastExtension() {
        assertEquals("order.v2", DiagramLoader.baseName("order.v2.puml"));
        assertEquals("noext", DiagramLoader.baseName("noext"));
    }
}
