package com.flowuml.engine.load;

import com.flowuml.config.EngineConfig;
import com.flowuml.engine.store.WorkflowDefinitionStore;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.parser.ActivityDiagramParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Compiles diagram documents into the definition store. A directory load reads every file whose
 * extension is listed in {@link EngineConfig#getDiagramExtensions()} (not recursive) and uses the
 * file's base name as the definition id. Files that cannot be read or compiled are logged and skipped.
 */
public final class DiagramLoader {

    private static final Logger log = LoggerFactory.getLogger(DiagramLoader.class);

    private final ActivityDiagramParser parser;
    private final WorkflowDefinitionStore store;
    private final EngineConfig config;

    public DiagramLoader(ActivityDiagramParser parser, WorkflowDefinitionStore store, EngineConfig config) {
        this.parser = Objects.requireNonNull(parser, "parser");
        this.store = Objects.requireNonNull(store, "store");
        this.config = config != null ? config : EngineConfig.defaults();
    }

    /** Loads the directory named by {@link EngineConfig#getDiagramDir()}. */
    public List<String> loadConfiguredDirectory() {
        return loadDirectory(Path.of(config.getDiagramDir()));
    }

    /**
     * Loads every diagram file of the directory, in file name order.
     *
     * @return ids of the definitions stored; empty when the directory does not exist
     */
    public List<String> loadDirectory(Path dir) {
        Objects.requireNonNull(dir, "dir");
        if (!Files.isDirectory(dir)) {
            log.warn("Diagram directory not found | dir={}", dir);
            return List.of();
        }
        List<Path> files;
        try (Stream<Path> entries = Files.list(dir)) {
            files = entries
                    .filter(Files::isRegularFile)
                    .filter(p -> config.isDiagramFile(p.getFileName().toString()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list diagram directory " + dir, e);
        }
        List<String> loaded = new ArrayList<>();
        for (Path file : files) {
            String id = baseName(file.getFileName().toString());
            Optional<String> text = readFile(file);
            if (text.isEmpty()) continue;
            compile(text.get(), id, "file:" + file).ifPresent(def -> loaded.add(def.getId()));
        }
        log.info("Diagram directory loaded | dir={} | files={} | loaded={}", dir, files.size(), loaded.size());
        return loaded;
    }

    /**
     * Loads one diagram from the class path; the id is the resource's base name.
     *
     * @return the stored definition id, or empty when the resource is missing or does not compile
     */
    public Optional<String> loadResource(String resourceName) {
        Objects.requireNonNull(resourceName, "resourceName");
        ClassLoader cl = Thread.currentThread().getContextClassLoader();
        if (cl == null) cl = DiagramLoader.class.getClassLoader();
        String path = resourceName.startsWith("/") ? resourceName.substring(1) : resourceName;
        try (InputStream in = cl.getResourceAsStream(path)) {
            if (in == null) {
                log.warn("Diagram resource not found | resource={}", path);
                return Optional.empty();
            }
            String text = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            String fileName = path.substring(path.lastIndexOf('/') + 1);
            return compile(text, baseName(fileName), "classpath:" + path).map(WorkflowDefinition::getId);
        } catch (IOException e) {
            log.warn("Failed to read diagram resource | resource={} | reason={}", path, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<WorkflowDefinition> compile(String text, String id, String source) {
        try {
            WorkflowDefinition definition = parser.parse(text, id, null);
            store.store(definition);
            log.info("Diagram loaded | source={} | definitionId={} | nodes={}",
                    source, id, definition.getNodes().size());
            return Optional.of(definition);
        } catch (RuntimeException e) {
            log.warn("Failed to compile diagram | source={} | reason={}", source, e.getMessage());
            return Optional.empty();
        }
    }

    private static Optional<String> readFile(Path file) {
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("Failed to read diagram file | file={} | reason={}", file, e.getMessage());
            return Optional.empty();
        }
    }

    static String baseName(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
