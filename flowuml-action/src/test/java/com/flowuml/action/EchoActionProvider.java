package com.flowuml.action;

import java.util.HashMap;
import java.util.Map;

/** Discovered in tests: copies every parameter into a variable named {@code echo.<param>}. */
public class EchoActionProvider implements ActionHandlerProvider {

    @Override
    public String getActionName() {
        return "Echo";
    }

    @Override
    public WorkflowActionHandler getHandler() {
        return (context, params) -> {
            Map<String, String> updates = new HashMap<>();
            params.forEach((k, v) -> updates.put("echo." + k, v));
            return updates;
        };
    }
}
