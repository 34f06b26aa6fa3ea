package com.flowuml.engine.dispatch;

import com.flowuml.action.ActionDescriptor;
import com.flowuml.action.ActionHandlerContext;
import com.flowuml.action.ActionHandlerRegistry;
import com.flowuml.action.CancellationSignal;
import com.flowuml.action.TemplateResolver;
import com.flowuml.action.WorkflowActionHandler;
import com.flowuml.config.EngineConfig;
import com.flowuml.engine.instance.WorkflowInstanceManager;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the action embedded in a node: reads the descriptor, substitutes {@code {{variable}}} markers
 * from the instance variables, invokes the registered handler once and applies the returned updates
 * to the instance before returning.
 * <p>
 * Handlers run on a pool owned by this dispatcher while the calling thread waits, so the updates are
 * visible to whatever the caller computes next. Handler failures, cancellation and timeouts are
 * reported as {@link DispatchResult} outcomes and never thrown.
 */
public final class ActionDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private static final long SHUTDOWN_WAIT_SECONDS = 5;

    private final ActionHandlerRegistry registry;
    private final WorkflowInstanceManager instances;
    private final EngineConfig config;
    private final ExecutorService executor;
    private final DispatchMetrics metrics;

    public ActionDispatcher(ActionHandlerRegistry registry, WorkflowInstanceManager instances, EngineConfig config) {
        this(registry, instances, config, new SimpleMeterRegistry());
    }

    /** @param meterRegistry receives the {@code flowuml.action.dispatch} timers */
    public ActionDispatcher(ActionHandlerRegistry registry, WorkflowInstanceManager instances, EngineConfig config,
                            MeterRegistry meterRegistry) {
        this.metrics = new DispatchMetrics(meterRegistry);
        this.registry = Objects.requireNonNull(registry, "registry");
        this.instances = Objects.requireNonNull(instances, "instances");
        this.config = config != null ? config : EngineConfig.defaults();
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "flowuml-action-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public DispatchResult dispatch(String instanceId, WorkflowDefinition definition, WorkflowNode node) {
        return dispatch(instanceId, definition, node, CancellationSignal.none());
    }

    /**
     * Dispatches the node's action for the instance.
     *
     * @param cancellation checked before the handler runs and again before updates are applied;
     *                     also handed to the handler through its context
     */
    public DispatchResult dispatch(String instanceId, WorkflowDefinition definition, WorkflowNode node,
                                   CancellationSignal cancellation) {
        Objects.requireNonNull(instanceId, "instanceId");
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(node, "node");
        return metrics.record(doDispatch(instanceId, definition, node, cancellation));
    }

    private DispatchResult doDispatch(String instanceId, WorkflowDefinition definition, WorkflowNode node,
                                      CancellationSignal cancellation) {
        CancellationSignal signal = cancellation != null ? cancellation : CancellationSignal.none();

        Optional<ActionDescriptor> descriptor = ActionDescriptor.fromNode(node);
        if (descriptor.isEmpty()) {
            return DispatchResult.notActionable(node.getId());
        }
        String actionName = descriptor.get().getActionName();
        Map<String, String> variables = instances.getVariables(instanceId);
        Map<String, String> params = TemplateResolver.resolveAll(descriptor.get().getParams(), variables::get);

        Optional<WorkflowActionHandler> handler = registry.find(actionName);
        if (handler.isEmpty()) {
            log.warn("Unknown action | instanceId={} | nodeId={} | action={}", instanceId, node.getId(), actionName);
            return DispatchResult.unknownAction(node.getId(), actionName, params);
        }
        if (signal.isCancelled()) {
            log.info("Action cancelled before start | instanceId={} | nodeId={} | action={}",
                    instanceId, node.getId(), actionName);
            return DispatchResult.cancelled(node.getId(), actionName, params);
        }

        ActionHandlerContext context = new ActionHandlerContext(instanceId, node, definition, variables, signal);
        WorkflowActionHandler h = handler.get();
        long start = System.nanoTime();
        Future<Map<String, String>> future = executor.submit(() -> h.handle(context, params));
        Map<String, String> updates;
        try {
            int timeoutSeconds = config.getHandlerTimeoutSeconds();
            updates = timeoutSeconds > 0 ? future.get(timeoutSeconds, TimeUnit.SECONDS) : future.get();
        } catch (TimeoutException e) {
            future.cancel(true);
            long durationMs = elapsedMs(start);
            log.warn("Action timed out | instanceId={} | nodeId={} | action={} | durationMs={}",
                    instanceId, node.getId(), actionName, durationMs);
            return DispatchResult.timedOut(node.getId(), actionName, params, durationMs);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            log.info("Action interrupted | instanceId={} | nodeId={} | action={}", instanceId, node.getId(), actionName);
            return DispatchResult.cancelled(node.getId(), actionName, params);
        } catch (CancellationException e) {
            return DispatchResult.cancelled(node.getId(), actionName, params);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof CancellationException || cause instanceof InterruptedException) {
                log.info("Action cancelled by handler | instanceId={} | nodeId={} | action={}",
                        instanceId, node.getId(), actionName);
                return DispatchResult.cancelled(node.getId(), actionName, params);
            }
            long durationMs = elapsedMs(start);
            log.error("Action failed | instanceId={} | nodeId={} | action={} | durationMs={}",
                    instanceId, node.getId(), actionName, durationMs, cause);
            return DispatchResult.failed(node.getId(), actionName, params, cause, durationMs);
        }
        long durationMs = elapsedMs(start);
        if (config.isLogHandlerTiming()) {
            log.info("Action handler finished | action={} | nodeId={} | durationMs={}", actionName, node.getId(), durationMs);
        }

        if (signal.isCancelled()) {
            log.info("Action cancelled, updates discarded | instanceId={} | nodeId={} | action={}",
                    instanceId, node.getId(), actionName);
            return DispatchResult.cancelled(node.getId(), actionName, params);
        }
        Map<String, String> safeUpdates = new LinkedHashMap<>();
        if (updates != null) {
            updates.forEach((k, v) -> safeUpdates.put(k, v != null ? v : ""));
        }
        try {
            instances.applyVariableUpdates(instanceId, safeUpdates);
        } catch (IllegalArgumentException e) {
            log.error("Action updates rejected | instanceId={} | nodeId={} | action={}",
                    instanceId, node.getId(), actionName, e);
            return DispatchResult.failed(node.getId(), actionName, params, e, durationMs);
        }
        log.info("Action executed | instanceId={} | nodeId={} | action={} | updates={}",
                instanceId, node.getId(), actionName, safeUpdates.keySet());
        return DispatchResult.executed(node.getId(), actionName, params, safeUpdates, durationMs);
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /** Stops the handler pool, waiting briefly for running handlers. */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
