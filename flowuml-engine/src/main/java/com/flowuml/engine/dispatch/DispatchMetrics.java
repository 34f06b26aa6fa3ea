package com.flowuml.engine.dispatch;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Records one timer sample per actionable dispatch ({@value #DISPATCH_TIMER}, tagged with action name
 * and outcome). Non-actionable nodes only bump {@value #NOT_ACTIONABLE_COUNTER}.
 */
final class DispatchMetrics {

    static final String DISPATCH_TIMER = "flowuml.action.dispatch";
    static final String NOT_ACTIONABLE_COUNTER = "flowuml.action.not_actionable";

    private final MeterRegistry registry;

    DispatchMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    DispatchResult record(DispatchResult result) {
        if (!result.isActionable()) {
            registry.counter(NOT_ACTIONABLE_COUNTER).increment();
            return result;
        }
        Timer.builder(DISPATCH_TIMER)
                .tag("action", nullToUnknown(result.getActionName()))
                .tag("status", result.getStatus().name())
                .register(registry)
                .record(result.getDurationMs(), TimeUnit.MILLISECONDS);
        return result;
    }

    private static String nullToUnknown(String s) {
        return s != null && !s.isBlank() ? s : "unknown";
    }
}
