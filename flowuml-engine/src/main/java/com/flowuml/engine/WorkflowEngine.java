package com.flowuml.engine;

import com.flowuml.action.ActionHandlerRegistry;
import com.flowuml.action.CancellationSignal;
import com.flowuml.config.EngineConfig;
import com.flowuml.engine.dispatch.ActionDispatcher;
import com.flowuml.engine.dispatch.DispatchResult;
import com.flowuml.engine.instance.InMemoryWorkflowInstanceManager;
import com.flowuml.engine.instance.WorkflowInstanceManager;
import com.flowuml.engine.load.DiagramLoader;
import com.flowuml.engine.store.InMemoryWorkflowDefinitionStore;
import com.flowuml.engine.store.WorkflowDefinitionStore;
import com.flowuml.model.Transition;
import com.flowuml.model.WorkflowDefinition;
import com.flowuml.model.WorkflowNode;
import com.flowuml.model.WorkflowStatePayload;
import com.flowuml.parser.ActivityDiagramParser;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for running diagram workflows: compiles and stores definitions, starts instances,
 * reports the current payload, advances on user choices and runs node actions.
 * <p>
 * After an actionable node is dispatched (any outcome except not actionable) and the node has exactly
 * one unguarded outgoing transition, the instance moves on to its target. The move is a
 * compare-and-set on the current node, so a concurrent {@link #advance} that already moved the
 * instance wins. Only one hop is taken; the action of the node moved to is not run.
 */
public final class WorkflowEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final EngineConfig config;
    private final ActivityDiagramParser parser;
    private final WorkflowDefinitionStore definitions;
    private final WorkflowInstanceManager instances;
    private final ActionHandlerRegistry registry;
    private final ActionDispatcher dispatcher;

    /** Engine with in-memory definition and instance storage. */
    public WorkflowEngine(EngineConfig config, ActionHandlerRegistry registry) {
        this(config, new InMemoryWorkflowDefinitionStore(), new InMemoryWorkflowInstanceManager(), registry);
    }

    public WorkflowEngine(EngineConfig config,
                          WorkflowDefinitionStore definitions,
                          WorkflowInstanceManager instances,
                          ActionHandlerRegistry registry) {
        this(config, definitions, instances, registry, new SimpleMeterRegistry());
    }

    public WorkflowEngine(EngineConfig config,
                          WorkflowDefinitionStore definitions,
                          WorkflowInstanceManager instances,
                          ActionHandlerRegistry registry,
                          MeterRegistry meterRegistry) {
        this.config = config != null ? config : EngineConfig.defaults();
        this.parser = new ActivityDiagramParser(this.config.getDefaultWorkflowName());
        this.definitions = Objects.requireNonNull(definitions, "definitions");
        this.instances = Objects.requireNonNull(instances, "instances");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.dispatcher = new ActionDispatcher(registry, instances, this.config, meterRegistry);
    }

    /**
     * Compiles the diagram and stores the definition, replacing any definition with the same id.
     *
     * @param definitionId id to store under; a random id is generated when null
     * @param name         display name; the diagram title or the configured default when null
     */
    public WorkflowDefinition importWorkflow(String diagramText, String definitionId, String name) {
        if (diagramText == null || diagramText.isBlank()) {
            throw new IllegalArgumentException("Diagram text must be non-blank");
        }
        WorkflowDefinition definition = parser.parse(diagramText, definitionId, name);
        definitions.store(definition);
        log.info("Workflow imported | definitionId={} | name={} | nodes={} | transitions={}",
                definition.getId(), definition.getName(), definition.getNodes().size(),
                definition.getTransitions().size());
        return definition;
    }

    /** Stores an already compiled definition (for example one read back from JSON). */
    public void registerDefinition(WorkflowDefinition definition) {
        definitions.store(Objects.requireNonNull(definition, "definition"));
    }

    /** Loader that compiles diagram files into this engine's definition store. */
    public DiagramLoader diagramLoader() {
        return new DiagramLoader(parser, definitions, config);
    }

    /**
     * Binds the instance to the definition and moves it to the start node. The action of the declared
     * start node runs first when the start node was advanced past it, then the action of the node the
     * instance starts at.
     *
     * @return the node the instance is at afterwards, empty when the definition has no nodes
     * @throws IllegalStateException if the definition is unknown
     */
    public Optional<String> startInstance(String definitionId, String instanceId) {
        requireId(definitionId, "definitionId");
        requireId(instanceId, "instanceId");
        WorkflowDefinition definition = requireDefinition(definitionId);
        instances.bindDefinition(instanceId, definitionId);

        Optional<String> startNode = WorkflowStateCalculator.calculateStartNode(definition);
        if (startNode.isEmpty()) {
            instances.clearCurrentNodeId(instanceId);
            log.warn("Instance started without nodes | definitionId={} | instanceId={}", definitionId, instanceId);
            return Optional.empty();
        }
        instances.setCurrentNodeId(instanceId, startNode.get());
        log.info("Instance started | definitionId={} | instanceId={} | nodeId={}",
                definitionId, instanceId, startNode.get());

        Optional<String> declared = WorkflowStateCalculator.declaredStartNode(definition);
        if (declared.isPresent() && !declared.get().equals(startNode.get())) {
            definition.findNode(declared.get())
                    .ifPresent(node -> runNodeAction(instanceId, definition, node, CancellationSignal.none()));
        }
        definition.findNode(startNode.get())
                .ifPresent(node -> runNodeAction(instanceId, definition, node, CancellationSignal.none()));
        return instances.getCurrentNodeId(instanceId);
    }

    /**
     * Clears the variables and current node of the instance and starts it again on its bound definition.
     *
     * @throws IllegalStateException if the instance or its definition is unknown
     */
    public Optional<String> restartInstance(String instanceId) {
        requireId(instanceId, "instanceId");
        String definitionId = requireBoundDefinitionId(instanceId);
        instances.clearVariables(instanceId);
        instances.clearCurrentNodeId(instanceId);
        log.info("Instance restarting | definitionId={} | instanceId={}", definitionId, instanceId);
        return startInstance(definitionId, instanceId);
    }

    public Optional<String> getCurrentNodeId(String instanceId) {
        requireId(instanceId, "instanceId");
        return instances.getCurrentNodeId(instanceId);
    }

    /** @throws IllegalStateException if the instance or its definition is unknown */
    public WorkflowStatePayload getCurrentPayload(String instanceId) {
        requireId(instanceId, "instanceId");
        WorkflowDefinition definition = requireDefinition(requireBoundDefinitionId(instanceId));
        return WorkflowStateCalculator.calculateCurrentPayload(definition, instances.getCurrentNodeId(instanceId).orElse(null));
    }

    public boolean advance(String instanceId, Object choiceValue) {
        return advance(instanceId, choiceValue, CancellationSignal.none());
    }

    /**
     * Follows the outgoing transition selected by {@code choiceValue}, then runs the action of the new
     * node. The value is matched, in order, against target node ids, target labels, an {@link Integer}
     * index, and a numeric string index; {@code null} selects the only transition when there is one.
     * An instance without a current node is started first.
     *
     * @return false when nothing matched or the current node has no outgoing transitions
     * @throws IllegalStateException if the instance or its definition is unknown
     */
    public boolean advance(String instanceId, Object choiceValue, CancellationSignal cancellation) {
        requireId(instanceId, "instanceId");
        String definitionId = requireBoundDefinitionId(instanceId);
        WorkflowDefinition definition = requireDefinition(definitionId);

        Optional<String> current = instances.getCurrentNodeId(instanceId);
        if (current.isEmpty()) {
            current = startInstance(definitionId, instanceId);
            if (current.isEmpty()) return false;
        }
        List<Transition> outgoing = definition.outgoing(current.get());
        Optional<String> next = ChoiceResolver.resolve(outgoing, definition, choiceValue);
        if (next.isEmpty()) {
            log.info("Advance rejected | instanceId={} | nodeId={} | choice={} | options={}",
                    instanceId, current.get(), choiceValue, outgoing.size());
            return false;
        }
        instances.setCurrentNodeId(instanceId, next.get());
        log.info("Instance advanced | instanceId={} | from={} | to={}", instanceId, current.get(), next.get());
        definition.findNode(next.get())
                .ifPresent(node -> runNodeAction(instanceId, definition, node, cancellation));
        return true;
    }

    /**
     * Dispatches the node's action and, when the node was actionable and has a single unguarded
     * outgoing transition, moves the instance past it if it is still at the node.
     */
    public DispatchResult runNodeAction(String instanceId, WorkflowDefinition definition, WorkflowNode node,
                                        CancellationSignal cancellation) {
        DispatchResult result = dispatcher.dispatch(instanceId, definition, node, cancellation);
        if (!result.isActionable() || !config.isAutoAdvanceAfterAction()) {
            return result;
        }
        List<Transition> outgoing = definition.outgoing(node.getId());
        if (outgoing.size() == 1 && !outgoing.get(0).hasCondition()) {
            String target = outgoing.get(0).getToNodeId();
            if (instances.compareAndSetCurrentNodeId(instanceId, node.getId(), target)) {
                log.info("Instance auto-advanced | instanceId={} | from={} | to={} | outcome={}",
                        instanceId, node.getId(), target, result.getStatus());
            }
        }
        return result;
    }

    public WorkflowDefinitionStore getDefinitionStore() {
        return definitions;
    }

    public WorkflowInstanceManager getInstanceManager() {
        return instances;
    }

    public ActionHandlerRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        dispatcher.close();
    }

    private WorkflowDefinition requireDefinition(String definitionId) {
        return definitions.getById(definitionId)
                .orElseThrow(() -> new IllegalStateException("Unknown workflow definition: " + definitionId));
    }

    private String requireBoundDefinitionId(String instanceId) {
        return instances.getDefinitionId(instanceId)
                .orElseThrow(() -> new IllegalStateException("Unknown workflow instance: " + instanceId));
    }

    private static void requireId(String id, String what) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(what + " must be non-blank");
        }
    }
}
