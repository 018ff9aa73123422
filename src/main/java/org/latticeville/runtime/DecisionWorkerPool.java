package org.latticeville.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.latticeville.runtime.action.Action;
import org.latticeville.runtime.spi.DecisionRequest;
import org.latticeville.runtime.spi.IDecisionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans the decide phase of a tick out over a fixed set of daemon threads.
 * <p>
 * All requests of a tick are submitted at once and share one deadline of
 * {@code timeoutMs} from dispatch. Results are collected in ascending agent id, so the
 * order in which policies finish never leaks into the simulation. A call that throws,
 * returns {@code null} or misses the deadline yields {@link Action#IDLE} and a WARN; a
 * late call is cancelled with an interrupt.
 * <p>
 * A policy may ignore the interrupt and keep its worker busy. After any missed deadline the
 * workers are therefore replaced by a fresh set; the old threads are abandoned to finish on
 * their own and can no longer delay later ticks.
 * <p>
 * <b>Thread safety:</b> {@link #decideAll} must only be called from the simulation thread.
 * {@link #shutdown()} is idempotent and safe to call from any thread.
 */
public class DecisionWorkerPool {

    private static final Logger LOG = LoggerFactory.getLogger(DecisionWorkerPool.class);

    private final AtomicInteger threadIndex = new AtomicInteger();
    private final int parallelism;
    private ExecutorService executor;
    private boolean closed;

    /**
     * @param parallelism Number of worker threads. Must be &gt;= 1.
     * @throws IllegalArgumentException if parallelism &lt; 1
     */
    public DecisionWorkerPool(int parallelism) {
        if (parallelism < 1) {
            throw new IllegalArgumentException("Parallelism must be >= 1, got " + parallelism);
        }
        this.parallelism = parallelism;
        this.executor = newExecutor();
    }

    private ExecutorService newExecutor() {
        return Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "decision-worker-" + threadIndex.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs the policy for every request and blocks until all results are in or the
     * deadline has passed.
     *
     * @param policy    The decision policy.
     * @param requests  One request per agent.
     * @param timeoutMs Deadline for the whole batch, in milliseconds.
     * @return Proposed action per agent id, sorted by id. Never contains {@code null}.
     */
    public Map<String, Action> decideAll(IDecisionPolicy policy, List<DecisionRequest> requests, long timeoutMs) {
        ExecutorService workers = currentExecutor();
        List<Future<Action>> futures = new ArrayList<>(requests.size());
        for (DecisionRequest request : requests) {
            futures.add(workers.submit(() -> policy.decide(request)));
        }

        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(timeoutMs);
        Map<String, Action> results = new TreeMap<>();
        int late = 0;
        for (int i = 0; i < requests.size(); i++) {
            DecisionRequest request = requests.get(i);
            Future<Action> future = futures.get(i);
            results.put(request.agentId(), await(future, request, deadline, timeoutMs));
            if (future.isCancelled()) {
                late++;
            }
        }
        if (late > 0) {
            replaceExecutor(workers, late, requests.get(0).tick());
        }
        return results;
    }

    private synchronized ExecutorService currentExecutor() {
        if (closed) {
            throw new IllegalStateException("Decision workers have been shut down");
        }
        return executor;
    }

    private synchronized void replaceExecutor(ExecutorService stale, int late, long tick) {
        if (closed || executor != stale) {
            return;
        }
        stale.shutdownNow();
        executor = newExecutor();
        LOG.info("Replaced decision workers after {} calls missed the deadline at tick {}", late, tick);
    }

    private Action await(Future<Action> future, DecisionRequest request, long deadline, long timeoutMs) {
        try {
            Action action = future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            if (action == null) {
                LOG.warn("Decision policy returned no action for agent {} at tick {}, using IDLE",
                        request.agentId(), request.tick());
                return Action.IDLE;
            }
            return action;
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Decision policy timed out after {} ms for agent {} at tick {}, using IDLE",
                    timeoutMs, request.agentId(), request.tick());
            return Action.IDLE;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            LOG.warn("Decision policy failed for agent {} at tick {}, using IDLE: {}",
                    request.agentId(), request.tick(), cause.toString());
            return Action.IDLE;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for agent {} at tick {}, using IDLE",
                    request.agentId(), request.tick());
            return Action.IDLE;
        }
    }

    /**
     * Stops the worker threads, interrupting decisions still running.
     */
    public void shutdown() {
        ExecutorService workers;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            workers = executor;
        }
        workers.shutdownNow();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Decision workers did not terminate within 5 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public int getParallelism() {
        return parallelism;
    }
}
