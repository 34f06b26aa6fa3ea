package com.flowuml.engine.store;

import com.flowuml.model.WorkflowDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/** Thread-safe {@link WorkflowDefinitionStore} backed by a {@link ConcurrentHashMap}. */
public final class InMemoryWorkflowDefinitionStore implements WorkflowDefinitionStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWorkflowDefinitionStore.class);

    private final Map<String, WorkflowDefinition> definitionsById = new ConcurrentHashMap<>();

    @Override
    public void store(WorkflowDefinition definition) {
        Objects.requireNonNull(definition, "definition");
        WorkflowDefinition previous = definitionsById.put(definition.getId(), definition);
        if (previous != null) {
            log.info("Workflow definition replaced | definitionId={}", definition.getId());
        }
    }

    @Override
    public Optional<WorkflowDefinition> getById(String definitionId) {
        if (definitionId == null) return Optional.empty();
        return Optional.ofNullable(definitionsById.get(definitionId));
    }

    @Override
    public boolean exists(String definitionId) {
        return definitionId != null && definitionsById.containsKey(definitionId);
    }

    @Override
    public Set<String> ids() {
        return Collections.unmodifiableSet(new TreeSet<>(definitionsById.keySet()));
    }
}
