package org.latticeville.runtime;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
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
import org.latticeville.runtime.event.TickPayload;
import org.latticeville.runtime.spi.ITickSink;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class TickPublisherTest {

    private final TickPublisher publisher = new TickPublisher();

    @AfterEach
    void tearDown() {
        publisher.close(1000);
    }

    private static TickPayload payload(long tick) {
        return new TickPayload(tick, null, List.of());
    }

    @Test
    void slowSinkDoesNotDelayOthers() throws InterruptedException {
        // Setup
        CountDownLatch release = new CountDownLatch(1);
        List<Long> fast = Collections.synchronizedList(new ArrayList<>());
        publisher.addSink(payload -> release.await(5, TimeUnit.SECONDS));
        publisher.addSink(payload -> fast.add(payload.tick()));

        // Execute
        for (long tick = 0; tick < 3; tick++) {
            publisher.publish(payload(tick));
        }

        // Verify
        await().atMost(Duration.ofSeconds(2)).until(() -> fast.size() == 3);
        assertThat(fast).containsExactly(0L, 1L, 2L);
        assertThat(publisher.backlog()).isPositive();
        release.countDown();
    }

    @Test
    void closeDrainsQueuesAndClosesSinks() {
        // Setup
        List<Long> delivered = Collections.synchronizedList(new ArrayList<>());
        AtomicBoolean closed = new AtomicBoolean();
        publisher.addSink(new ITickSink() {
            @Override
            public void onTick(TickPayload payload) {
                delivered.add(payload.tick());
            }

            @Override
            public void close() {
                closed.set(true);
            }
        });
        for (long tick = 0; tick < 100; tick++) {
            publisher.publish(payload(tick));
        }

        // Execute
        publisher.close(2000);

        // Verify
        assertThat(delivered).hasSize(100);
        assertThat(closed).isTrue();
        assertThat(publisher.backlog()).isZero();
        assertThatThrownBy(() -> publisher.publish(payload(100))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*TickPublisher", messagePattern = "Sink .* failed at tick 1: .*")
    void failingSinkKeepsReceiving() {
        // Setup
        List<Long> delivered = Collections.synchronizedList(new ArrayList<>());
        publisher.addSink(payload -> {
            if (payload.tick() == 1) {
                throw new IllegalStateException("disk full");
            }
            delivered.add(payload.tick());
        });

        // Execute
        for (long tick = 0; tick < 3; tick++) {
            publisher.publish(payload(tick));
        }

        // Verify
        await().atMost(Duration.ofSeconds(2)).until(() -> delivered.size() == 2);
        assertThat(delivered).containsExactly(0L, 2L);
    }
}
