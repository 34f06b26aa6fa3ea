package com.flowuml.action;

import java.util.Map;

/**
 * Contract for named workflow actions: run with the resolved parameters of an action node and
 * return variable updates for the instance.
 * <p>
 * <b>Threading:</b> the dispatcher runs handlers on its own executor and waits for the result, so a
 * handler may block. Long-running handlers should poll {@link ActionHandlerContext#getCancellation()}
 * and stop early when it is cancelled.
 */
@FunctionalInterface
public interface WorkflowActionHandler {

    /**
     * Executes the action.
     *
     * @param context node, definition, instance variables and cancellation signal; never null
     * @param params  action parameters after {@code {{variable}}} substitution; never null
     * @return variable updates to apply to the instance; null or empty for none
     * @throws Exception on failure; the dispatcher reports the failure and applies no updates
     */
    Map<String, String> handle(ActionHandlerContext context, Map<String, String> params) throws Exception;
}
