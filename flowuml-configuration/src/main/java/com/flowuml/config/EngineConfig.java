package com.flowuml.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Configuration loaded from environment variables for the workflow engine.
 * <p>
 * Diagrams: FLOWUML_DIAGRAM_DIR, FLOWUML_DIAGRAM_EXTENSIONS (comma-separated, without dot).
 * Action handlers: FLOWUML_HANDLER_TIMEOUT_SECONDS (0 = wait indefinitely), FLOWUML_LOG_HANDLER_TIMING.
 * Engine: FLOWUML_AUTO_ADVANCE_AFTER_ACTION, FLOWUML_DEFAULT_WORKFLOW_NAME.
 */
public final class EngineConfig {

    static final String ENV_DIAGRAM_DIR = "FLOWUML_DIAGRAM_DIR";
    static final String ENV_DIAGRAM_EXTENSIONS = "FLOWUML_DIAGRAM_EXTENSIONS";
    static final String ENV_HANDLER_TIMEOUT_SECONDS = "FLOWUML_HANDLER_TIMEOUT_SECONDS";
    static final String ENV_LOG_HANDLER_TIMING = "FLOWUML_LOG_HANDLER_TIMING";
    static final String ENV_AUTO_ADVANCE_AFTER_ACTION = "FLOWUML_AUTO_ADVANCE_AFTER_ACTION";
    static final String ENV_DEFAULT_WORKFLOW_NAME = "FLOWUML_DEFAULT_WORKFLOW_NAME";

    private static final String DEFAULT_DIAGRAM_DIR = "diagrams";
    private static final List<String> DEFAULT_DIAGRAM_EXTENSIONS = List.of("puml", "plantuml");
    private static final int DEFAULT_HANDLER_TIMEOUT_SECONDS = 0;
    private static final boolean DEFAULT_LOG_HANDLER_TIMING = true;
    private static final boolean DEFAULT_AUTO_ADVANCE_AFTER_ACTION = true;
    private static final String DEFAULT_WORKFLOW_NAME = "ImportedWorkflow";

    private final String diagramDir;
    private final List<String> diagramExtensions;
    private final int handlerTimeoutSeconds;
    private final boolean logHandlerTiming;
    private final boolean autoAdvanceAfterAction;
    private final String defaultWorkflowName;

    private EngineConfig(Builder b) {
        this.diagramDir = b.diagramDir;
        this.diagramExtensions = Collections.unmodifiableList(new ArrayList<>(b.diagramExtensions));
        this.handlerTimeoutSeconds = Math.max(0, b.handlerTimeoutSeconds);
        this.logHandlerTiming = b.logHandlerTiming;
        this.autoAdvanceAfterAction = b.autoAdvanceAfterAction;
        this.defaultWorkflowName = b.defaultWorkflowName;
    }

    /** Directory scanned for diagram files. Default {@code diagrams}. */
    public String getDiagramDir() {
        return diagramDir;
    }

    /** Lower-case file extensions (without dot) treated as diagrams. Default {@code puml, plantuml}. */
    public List<String> getDiagramExtensions() {
        return diagramExtensions;
    }

    /** Per-dispatch handler timeout in seconds; 0 means no timeout. Never negative. */
    public int getHandlerTimeoutSeconds() {
        return handlerTimeoutSeconds;
    }

    public boolean isLogHandlerTiming() {
        return logHandlerTiming;
    }

    /** Whether an actionable node with a single unguarded exit moves on by itself after its action ran. Default true. */
    public boolean isAutoAdvanceAfterAction() {
        return autoAdvanceAfterAction;
    }

    /** Name given to imported definitions that have neither an explicit name nor a diagram title. */
    public String getDefaultWorkflowName() {
        return defaultWorkflowName;
    }

    /** True when {@code fileName} ends with one of {@link #getDiagramExtensions()} (case-insensitive). */
    public boolean isDiagramFile(String fileName) {
        if (fileName == null) return false;
        String lower = fileName.toLowerCase(Locale.ROOT);
        for (String ext : diagramExtensions) {
            if (lower.endsWith("." + ext)) return true;
        }
        return false;
    }

    public static EngineConfig fromEnvironment() {
        return fromEnvironment(System::getenv);
    }

    /**
     * Loads configuration from the given variable lookup (e.g. a map in tests). Missing, blank or
     * unparsable values fall back to the defaults.
     */
    public static EngineConfig fromEnvironment(Function<String, String> env) {
        Objects.requireNonNull(env, "env");
        List<String> extensions = parseCommaSeparated(env.apply(ENV_DIAGRAM_EXTENSIONS));
        if (extensions.isEmpty()) extensions = DEFAULT_DIAGRAM_EXTENSIONS;

        return builder()
                .diagramDir(getEnv(env, ENV_DIAGRAM_DIR, DEFAULT_DIAGRAM_DIR))
                .diagramExtensions(extensions)
                .handlerTimeoutSeconds(parseInt(env.apply(ENV_HANDLER_TIMEOUT_SECONDS), DEFAULT_HANDLER_TIMEOUT_SECONDS))
                .logHandlerTiming(parseBoolean(env.apply(ENV_LOG_HANDLER_TIMING), DEFAULT_LOG_HANDLER_TIMING))
                .autoAdvanceAfterAction(parseBoolean(env.apply(ENV_AUTO_ADVANCE_AFTER_ACTION), DEFAULT_AUTO_ADVANCE_AFTER_ACTION))
                .defaultWorkflowName(getEnv(env, ENV_DEFAULT_WORKFLOW_NAME, DEFAULT_WORKFLOW_NAME))
                .build();
    }

    /** Configuration with every default applied. */
    public static EngineConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static List<String> parseCommaSeparated(String value) {
        if (value == null || value.isBlank()) {
            return List.of();
        }
        return Stream.of(value.split(","))
                .map(String::trim)
                .map(s -> s.startsWith(".") ? s.substring(1) : s)
                .map(s -> s.toLowerCase(Locale.ROOT))
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String getEnv(Function<String, String> env, String key, String defaultValue) {
        String v = env.apply(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String diagramDir = DEFAULT_DIAGRAM_DIR;
        private List<String> diagramExtensions = DEFAULT_DIAGRAM_EXTENSIONS;
        private int handlerTimeoutSeconds = DEFAULT_HANDLER_TIMEOUT_SECONDS;
        private boolean logHandlerTiming = DEFAULT_LOG_HANDLER_TIMING;
        private boolean autoAdvanceAfterAction = DEFAULT_AUTO_ADVANCE_AFTER_ACTION;
        private String defaultWorkflowName = DEFAULT_WORKFLOW_NAME;

        public Builder diagramDir(String diagramDir) {
            this.diagramDir = diagramDir != null ? diagramDir : DEFAULT_DIAGRAM_DIR;
            return this;
        }

        public Builder diagramExtensions(List<String> diagramExtensions) {
            this.diagramExtensions = Objects.requireNonNull(diagramExtensions, "diagramExtensions");
            return this;
        }

        public Builder handlerTimeoutSeconds(int handlerTimeoutSeconds) {
            this.handlerTimeoutSeconds = handlerTimeoutSeconds;
            return this;
        }

        public Builder logHandlerTiming(boolean logHandlerTiming) {
            this.logHandlerTiming = logHandlerTiming;
            return this;
        }

        public Builder autoAdvanceAfterAction(boolean autoAdvanceAfterAction) {
            this.autoAdvanceAfterAction = autoAdvanceAfterAction;
            return this;
        }

        public Builder defaultWorkflowName(String defaultWorkflowName) {
            this.defaultWorkflowName = defaultWorkflowName != null ? defaultWorkflowName : DEFAULT_WORKFLOW_NAME;
            return this;
        }

        public EngineConfig build() {
            return new EngineConfig(this);
        }
    }
}
