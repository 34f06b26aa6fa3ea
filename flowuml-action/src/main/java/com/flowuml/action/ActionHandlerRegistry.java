package com.flowuml.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of action handlers by action name. Names are matched case-insensitively, so metadata
 * written as {@code "loadProfile"} reaches a handler registered as {@code "LoadProfile"}.
 * Thread-safe; registration and lookup may happen concurrently.
 */
public final class ActionHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);

    /** lower-case name → entry */
    private final Map<String, Entry> handlersByKey = new ConcurrentHashMap<>();

    private record Entry(String name, WorkflowActionHandler handler) {
    }

    /**
     * Registers a handler under the given action name.
     *
     * @throws IllegalArgumentException if name is blank or a handler is already registered for it
     */
    public void register(String name, WorkflowActionHandler handler) {
        Objects.requireNonNull(handler, "handler");
        String trimmed = Objects.requireNonNull(name, "name").trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Action name must be non-blank");
        }
        if (handlersByKey.putIfAbsent(key(trimmed), new Entry(trimmed, handler)) != null) {
            throw new IllegalArgumentException("Action handler already registered: " + trimmed);
        }
        log.debug("Action handler registered | action={}", trimmed);
    }

    /** Handler for the action name (case-insensitive), or empty when none is registered. */
    public Optional<WorkflowActionHandler> find(String name) {
        if (name == null || name.isBlank()) return Optional.empty();
        Entry entry = handlersByKey.get(key(name.trim()));
        return entry != null ? Optional.of(entry.handler()) : Optional.empty();
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    /** Registered action names as given at registration, sorted. */
    public Set<String> names() {
        Set<String> names = new TreeSet<>();
        handlersByKey.values().forEach(e -> names.add(e.name()));
        return Collections.unmodifiableSet(names);
    }

    public void clear() {
        handlersByKey.clear();
    }

    /** Registers every enabled {@link ActionHandlerProvider} visible to the thread context class loader. */
    public int registerDiscovered() {
        return registerDiscovered(Thread.currentThread().getContextClassLoader());
    }

    /**
     * Registers every enabled {@link ActionHandlerProvider} found through {@link ServiceLoader}. Providers
     * that fail to load or collide with an existing name are logged and skipped.
     *
     * @return number of handlers registered
     */
    public int registerDiscovered(ClassLoader classLoader) {
        int registered = 0;
        ServiceLoader<ActionHandlerProvider> loader = ServiceLoader.load(ActionHandlerProvider.class, classLoader);
        for (ServiceLoader.Provider<ActionHandlerProvider> candidate : loader.stream().toList()) {
            ActionHandlerProvider provider;
            try {
                provider = candidate.get();
            } catch (ServiceConfigurationError e) {
                log.error("Action handler provider failed to load | type={}", candidate.type().getName(), e);
                continue;
            }
            if (!provider.isEnabled()) {
                log.info("Action handler provider disabled, skipped | action={}", provider.getActionName());
                continue;
            }
            try {
                register(provider.getActionName(), provider.getHandler());
                registered++;
                log.info("Action handler discovered | action={} | provider={}",
                        provider.getActionName(), provider.getClass().getName());
            } catch (IllegalArgumentException | NullPointerException e) {
                log.warn("Action handler provider skipped | provider={} | reason={}",
                        provider.getClass().getName(), e.getMessage());
            }
        }
        return registered;
    }

    private static String key(String name) {
        return name.toLowerCase(Locale.ROOT);
    }
}
