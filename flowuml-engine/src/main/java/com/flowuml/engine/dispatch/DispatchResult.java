package com.flowuml.engine.dispatch;

import java.util.Map;

/**
 * Outcome of dispatching the action of one node. Only {@link Status#EXECUTED} results carry variable
 * updates, and only those updates were applied to the instance.
 */
public final class DispatchResult {

    public enum Status {
        /** Handler ran and its updates were applied. */
        EXECUTED,
        /** Node carries no action descriptor. */
        NOT_ACTIONABLE,
        /** No handler registered for the action name. */
        UNKNOWN_ACTION,
        /** Handler threw, or its updates could not be applied. */
        FAILED,
        CANCELLED,
        TIMED_OUT
    }

    private final Status status;
    private final String nodeId;
    private final String actionName;
    private final Map<String, String> params;
    private final Map<String, String> updates;
    private final Throwable error;
    private final long durationMs;

    private DispatchResult(Status status, String nodeId, String actionName, Map<String, String> params,
                           Map<String, String> updates, Throwable error, long durationMs) {
        this.status = status;
        this.nodeId = nodeId;
        this.actionName = actionName;
        this.params = params != null ? Map.copyOf(params) : Map.of();
        this.updates = updates != null ? Map.copyOf(updates) : Map.of();
        this.error = error;
        this.durationMs = durationMs;
    }

    public static DispatchResult notActionable(String nodeId) {
        return new DispatchResult(Status.NOT_ACTIONABLE, nodeId, null, null, null, null, 0L);
    }

    public static DispatchResult unknownAction(String nodeId, String actionName, Map<String, String> params) {
        return new DispatchResult(Status.UNKNOWN_ACTION, nodeId, actionName, params, null, null, 0L);
    }

    public static DispatchResult executed(String nodeId, String actionName, Map<String, String> params,
                                          Map<String, String> updates, long durationMs) {
        return new DispatchResult(Status.EXECUTED, nodeId, actionName, params, updates, null, durationMs);
    }

    public static DispatchResult failed(String nodeId, String actionName, Map<String, String> params,
                                        Throwable error, long durationMs) {
        return new DispatchResult(Status.FAILED, nodeId, actionName, params, null, error, durationMs);
    }

    public static DispatchResult cancelled(String nodeId, String actionName, Map<String, String> params) {
        return new DispatchResult(Status.CANCELLED, nodeId, actionName, params, null, null, 0L);
    }

    public static DispatchResult timedOut(String nodeId, String actionName, Map<String, String> params, long durationMs) {
        return new DispatchResult(Status.TIMED_OUT, nodeId, actionName, params, null, null, durationMs);
    }

    public Status getStatus() {
        return status;
    }

    /** True for every outcome except {@link Status#NOT_ACTIONABLE}. */
    public boolean isActionable() {
        return status != Status.NOT_ACTIONABLE;
    }

    public boolean isExecuted() {
        return status == Status.EXECUTED;
    }

    public String getNodeId() {
        return nodeId;
    }

    /** Action name from the descriptor; null when not actionable. */
    public String getActionName() {
        return actionName;
    }

    /** Parameters after template substitution. */
    public Map<String, String> getParams() {
        return params;
    }

    public Map<String, String> getUpdates() {
        return updates;
    }

    /** Handler failure cause; null unless {@link Status#FAILED}. */
    public Throwable getError() {
        return error;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "DispatchResult{status=" + status + ", nodeId='" + nodeId + "', action='" + actionName + "'}";
    }
}
