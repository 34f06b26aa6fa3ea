package com.flowuml.engine.instance;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * {@link WorkflowInstanceManager} held in process memory. Each instance has its own lock; the map of
 * instances is a {@link ConcurrentHashMap}, so distinct instances never contend.
 */
public final class InMemoryWorkflowInstanceManager implements WorkflowInstanceManager {

    private final Map<String, InstanceState> instances = new ConcurrentHashMap<>();

    private static final class InstanceState {
        private final ReentrantLock lock = new ReentrantLock();
        private final TreeMap<String, String> variables = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        private String definitionId;
        private String currentNodeId;
    }

    @Override
    public void bindDefinition(String instanceId, String definitionId) {
        write(instanceId, s -> {
            s.definitionId = definitionId;
            return null;
        });
    }

    @Override
    public Optional<String> getDefinitionId(String instanceId) {
        return read(instanceId, s -> s.definitionId);
    }

    @Override
    public Optional<String> getCurrentNodeId(String instanceId) {
        return read(instanceId, s -> s.currentNodeId);
    }

    @Override
    public void setCurrentNodeId(String instanceId, String nodeId) {
        write(instanceId, s -> {
            s.currentNodeId = nodeId;
            return null;
        });
    }

    @Override
    public void clearCurrentNodeId(String instanceId) {
        InstanceState state = existing(instanceId);
        if (state == null) return;
        withLock(state, s -> {
            s.currentNodeId = null;
            return null;
        });
    }

    @Override
    public boolean compareAndSetCurrentNodeId(String instanceId, String expectedNodeId, String nextNodeId) {
        InstanceState state = existing(instanceId);
        if (state == null) return false;
        return withLock(state, s -> {
            if (!Objects.equals(s.currentNodeId, expectedNodeId)) {
                return false;
            }
            s.currentNodeId = nextNodeId;
            return true;
        });
    }

    @Override
    public Optional<String> getVariable(String instanceId, String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        return read(instanceId, s -> s.variables.get(name.trim()));
    }

    @Override
    public void setVariable(String instanceId, String name, String value) {
        String key = requireName(name);
        write(instanceId, s -> s.variables.put(key, value != null ? value : ""));
    }

    @Override
    public Map<String, String> getVariables(String instanceId) {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        InstanceState state = existing(instanceId);
        if (state != null) {
            withLock(state, s -> {
                copy.putAll(s.variables);
                return null;
            });
        }
        return Collections.unmodifiableMap(copy);
    }

    @Override
    public void applyVariableUpdates(String instanceId, Map<String, String> updates) {
        if (updates == null || updates.isEmpty()) return;
        TreeMap<String, String> validated = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        updates.forEach((name, value) -> validated.put(requireName(name), value != null ? value : ""));
        write(instanceId, s -> {
            s.variables.putAll(validated);
            return null;
        });
    }

    @Override
    public void clearVariables(String instanceId) {
        InstanceState state = existing(instanceId);
        if (state == null) return;
        withLock(state, s -> {
            s.variables.clear();
            return null;
        });
    }

    @Override
    public boolean exists(String instanceId) {
        return existing(instanceId) != null;
    }

    @Override
    public boolean remove(String instanceId) {
        if (instanceId == null) return false;
        return instances.remove(instanceId) != null;
    }

    private InstanceState existing(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) return null;
        return instances.get(instanceId);
    }

    private <T> Optional<T> read(String instanceId, Function<InstanceState, T> reader) {
        InstanceState state = existing(instanceId);
        if (state == null) return Optional.empty();
        return Optional.ofNullable(withLock(state, reader));
    }

    private <T> T write(String instanceId, Function<InstanceState, T> writer) {
        if (instanceId == null || instanceId.isBlank()) {
            throw new IllegalArgumentException("Instance id must be non-blank");
        }
        return withLock(instances.computeIfAbsent(instanceId, k -> new InstanceState()), writer);
    }

    private static <T> T withLock(InstanceState state, Function<InstanceState, T> action) {
        state.lock.lock();
        try {
            return action.apply(state);
        } finally {
            state.lock.unlock();
        }
    }

    private static String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Variable name must be non-blank");
        }
        return name.trim();
    }
}
