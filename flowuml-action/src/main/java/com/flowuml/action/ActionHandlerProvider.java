package com.flowuml.action;

/**
 * SPI for pluggable action handlers. Implementations are discovered via {@link java.util.ServiceLoader}
 * (META-INF/services/com.flowuml.action.ActionHandlerProvider) by
 * {@link ActionHandlerRegistry#registerDiscovered()}; new actions need no engine code changes.
 */
public interface ActionHandlerProvider {

    /** Action name as written in node metadata (e.g. {@code "LoadProfile"}); matched case-insensitively. */
    String getActionName();

    /** Handler instance. Typically created in the provider constructor. */
    WorkflowActionHandler getHandler();

    /**
     * Whether this provider should be registered. Override to skip registration when a prerequisite
     * (e.g. an environment variable) is missing.
     */
    default boolean isEnabled() {
        return true;
    }
}
