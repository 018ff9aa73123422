package org.latticeville.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.latticeville.junit.extensions.logging.ExpectLog;
import org.latticeville.junit.extensions.logging.LogLevel;
import org.latticeville.junit.extensions.logging.LogWatchExtension;
import org.latticeville.runtime.action.Action;
import org.latticeville.runtime.action.ValidTargets;
import org.latticeville.runtime.spi.DecisionRequest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DecisionWorkerPoolTest {

    private final DecisionWorkerPool pool = new DecisionWorkerPool(3);

    @AfterEach
    void tearDown() {
        pool.shutdown();
    }

    private static List<DecisionRequest> requests(String... agentIds) {
        List<DecisionRequest> requests = new ArrayList<>();
        for (String agentId : agentIds) {
            requests.add(new DecisionRequest(agentId, agentId, "", "", 0, null, null, List.of(), ValidTargets.NONE));
        }
        return requests;
    }

    @Test
    void decidesConcurrentlyAndReturnsResultsById() {
        // Setup
        CountDownLatch allStarted = new CountDownLatch(3);
        Set<String> threads = ConcurrentHashMap.newKeySet();

        // Execute
        Map<String, Action> results = pool.decideAll(request -> {
            threads.add(Thread.currentThread().getName());
            allStarted.countDown();
            allStarted.await(5, TimeUnit.SECONDS);
            return new Action.Say("x", request.agentId());
        }, requests("c", "a", "b"), 5000);

        // Verify
        assertThat(results).containsOnlyKeys("a", "b", "c");
        assertThat(results.keySet()).containsExactly("a", "b", "c");
        assertThat(results.get("c")).isEqualTo(new Action.Say("x", "c"));
        assertThat(threads).hasSize(3).allSatisfy(name -> assertThat(name).startsWith("decision-worker-"));
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*DecisionWorkerPool",
            messagePattern = "Decision policy timed out after 200 ms for agent stuck at tick 0, using IDLE")
    void callIgnoringInterruptDoesNotStarveLaterBatches() {
        // Setup
        DecisionWorkerPool single = new DecisionWorkerPool(1);
        AtomicBoolean release = new AtomicBoolean();
        try {
            Map<String, Action> first = single.decideAll(request -> {
                while (!release.get()) {
                    Thread.onSpinWait();
                }
                return Action.IDLE;
            }, requests("stuck"), 200);

            // Execute
            Map<String, Action> second = single.decideAll(request -> new Action.Say("stuck", "hi"),
                    requests("healthy"), 2000);

            // Verify
            assertThat(first).containsEntry("stuck", Action.IDLE);
            assertThat(second).containsEntry("healthy", new Action.Say("stuck", "hi"));
        } finally {
            release.set(true);
            single.shutdown();
        }
    }

    @Test
    void rejectsBatchesAfterShutdown() {
        pool.shutdown();

        assertThatThrownBy(() -> pool.decideAll(request -> Action.IDLE, requests("a"), 100))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsNonPositiveParallelism() {
        assertThatThrownBy(() -> new DecisionWorkerPool(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
