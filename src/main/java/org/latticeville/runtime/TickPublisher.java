package org.latticeville.runtime;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

import org.latticeville.runtime.event.TickPayload;
import org.latticeville.runtime.spi.ITickSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Delivers published ticks to sinks without ever blocking the simulation.
 * <p>
 * Every sink gets its own unbounded queue and daemon delivery thread, so payloads reach
 * each sink in tick order and a slow or failing sink affects nobody else. Backlog policies
 * such as keep-latest-only belong in the sink.
 */
public class TickPublisher {

    private static final Logger LOG = LoggerFactory.getLogger(TickPublisher.class);

    private final List<Delivery> deliveries = new ArrayList<>();
    private volatile boolean closed;

    /**
     * Registers a sink. Sinks added later miss the ticks published before.
     *
     * @param sink The sink.
     */
    public synchronized void addSink(ITickSink sink) {
        if (closed) {
            throw new IllegalStateException("Publisher is closed");
        }
        Delivery delivery = new Delivery(sink, deliveries.size() + 1);
        deliveries.add(delivery);
        delivery.thread.start();
    }

    /**
     * Enqueues the payload for every sink and returns immediately.
     *
     * @param payload The tick payload.
     */
    public synchronized void publish(TickPayload payload) {
        if (closed) {
            throw new IllegalStateException("Publisher is closed");
        }
        for (Delivery delivery : deliveries) {
            delivery.queue.add(payload);
        }
    }

    /**
     * Drains all queues, closes the sinks and stops the delivery threads. Idempotent.
     *
     * @param timeoutMs How long to wait for each sink to drain.
     */
    public void close(long timeoutMs) {
        List<Delivery> toJoin;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toJoin = new ArrayList<>(deliveries);
        }
        for (Delivery delivery : toJoin) {
            delivery.queue.add(Delivery.END);
        }
        for (Delivery delivery : toJoin) {
            try {
                delivery.thread.join(timeoutMs);
                if (delivery.thread.isAlive()) {
                    LOG.warn("Sink {} did not drain within {} ms", delivery.sink.getClass().getSimpleName(), timeoutMs);
                    delivery.thread.interrupt();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /**
     * @return Payloads queued but not yet delivered, over all sinks.
     */
    public int backlog() {
        int total = 0;
        for (Delivery delivery : deliveries) {
            total += delivery.queue.size();
        }
        return total;
    }

    private static final class Delivery {
        private static final TickPayload END = new TickPayload(-1L, null, List.of());

        private final ITickSink sink;
        private final BlockingQueue<TickPayload> queue = new LinkedBlockingQueue<>();
        private final Thread thread;

        private Delivery(ITickSink sink, int index) {
            this.sink = sink;
            this.thread = new Thread(this::run, "tick-sink-" + index);
            this.thread.setDaemon(true);
        }

        private void run() {
            try {
                while (true) {
                    TickPayload payload = queue.take();
                    if (payload == END) {
                        break;
                    }
                    try {
                        sink.onTick(payload);
                    } catch (Exception e) {
                        LOG.warn("Sink {} failed at tick {}: {}", sink.getClass().getSimpleName(),
                                payload.tick(), e.getMessage());
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                try {
                    sink.close();
                } catch (Exception e) {
                    LOG.warn("Sink {} failed to close: {}", sink.getClass().getSimpleName(), e.getMessage());
                }
            }
        }
    }
}
