package com.flowuml.engine.instance;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryWorkflowInstanceManagerTest {

    private final InMemoryWorkflowInstanceManager manager = new InMemoryWorkflowInstanceManager();

    @Test
    void variablesAreCaseInsensitive() {
        manager.setVariable("i1", "userId", "42");

        assertEquals(Optional.of("42"), manager.getVariable("i1", "USERID"));
        manager.setVariable("i1", "USERID", "43");
        assertEquals(Map.of("userId", "43"), new HashMap<>(manager.getVariables("i1")));
    }

    @Test
    void variableSnapshotDoesNotSeeLaterWrites() {
        manager.setVariable("i1", "a", "1");
        Map<String, String> snapshot = manager.getVariables("i1");

        manager.setVariable("i1", "b", "2");

        assertEquals(1, snapshot.size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.put("c", "3"));
    }

    @Test
    void updatesWithBlankNameAreRejectedAsAWhole() {
        manager.setVariable("i1", "a", "1");
        Map<String, String> updates = new LinkedHashMap<>();
        updates.put("b", "2");
        updates.put(" ", "3");

        assertThrows(IllegalArgumentException.class, () -> manager.applyVariableUpdates("i1", updates));
        assertEquals(Optional.empty(), manager.getVariable("i1", "b"));
        assertEquals(Optional.of("1"), manager.getVariable("i1", "a"));
    }

    @Test
    void nullValuesAreStoredAsEmpty() {
        Map<String, String> updates = new HashMap<>();
        updates.put("x", null);
        manager.applyVariableUpdates("i1", updates);

        assertEquals(Optional.of(""), manager.getVariable("i1", "x"));
    }

    @Test
    void compareAndSetOnlyMovesFromExpectedNode() {
        manager.setCurrentNodeId("i1", "A");

        assertFalse(manager.compareAndSetCurrentNodeId("i1", "B", "C"));
        assertEquals(Optional.of("A"), manager.getCurrentNodeId("i1"));
        assertTrue(manager.compareAndSetCurrentNodeId("i1", "A", "C"));
        assertEquals(Optional.of("C"), manager.getCurrentNodeId("i1"));
        assertFalse(manager.compareAndSetCurrentNodeId("unknown", null, "C"));
    }

    @Test
    void readersTolerateUnknownAndBlankIdsButWritersDoNot() {
        assertEquals(Optional.empty(), manager.getCurrentNodeId("nope"));
        assertEquals(Optional.empty(), manager.getDefinitionId(" "));
        assertTrue(manager.getVariables(null).isEmpty());
        assertFalse(manager.exists("nope"));

        assertThrows(IllegalArgumentException.class, () -> manager.setCurrentNodeId(" ", "A"));
        assertThrows(IllegalArgumentException.class, () -> manager.bindDefinition(null, "wf"));
        assertThrows(IllegalArgumentException.class, () -> manager.setVariable("i1", "", "v"));
    }

    @Test
    void clearAndRemove() {
        manager.bindDefinition("i1", "wf");
        manager.setCurrentNodeId("i1", "A");
        manager.setVariable("i1", "a", "1");

        manager.clearCurrentNodeId("i1");
        manager.clearVariables("i1");
        assertEquals(Optional.empty(), manager.getCurrentNodeId("i1"));
        assertTrue(manager.getVariables("i1").isEmpty());
        assertEquals(Optional.of("wf"), manager.getDefinitionId("i1"));

        assertTrue(manager.remove("i1"));
        assertFalse(manager.exists("i1"));
        assertFalse(manager.remove("i1"));
    }

    @Test
    void concurrentUpdatesOnOneInstanceAreNotLost() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger casWins = new AtomicInteger();
        manager.setCurrentNodeId("i1", "n0");
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    go.await();
                    for (int i = 0; i < perThread; i++) {
                        manager.applyVariableUpdates("i1", Map.of("k" + thread + "_" + i, String.valueOf(i)));
                    }
                    if (manager.compareAndSetCurrentNodeId("i1", "n0", "n" + (thread + 1))) {
                        casWins.incrementAndGet();
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(threads * perThread, manager.getVariables("i1").size());
        assertEquals(1, casWins.get());
    }
}
