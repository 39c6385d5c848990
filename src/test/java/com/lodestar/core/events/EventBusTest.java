package com.lodestar.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    // -- Per-run delivery -----------------------------------------------------

    @Nested
    @DisplayName("per-run subscriptions")
    class RunSubscriptionTests {

        @Test
        @DisplayName("delivers events of the subscribed run in publish order")
        void deliversInOrder() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("LDST-1", received::add);

            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, "LDST-1", null, Map.of()));
            eventBus.publish(PipelineEvent.of(PipelineEvent.STAGE_COMPLETED, "LDST-1", "extract_anchor", Map.of()));
            eventBus.publish(PipelineEvent.of(PipelineEvent.GATE_AWAITING, "LDST-1", null, Map.of("phase", "DISCOVERY")));

            assertEquals(List.of("run.started", "stage.completed", "gate.awaiting"),
                    received.stream().map(PipelineEvent::eventType).toList());
            assertEquals("extract_anchor", received.get(1).stage());
        }

        @Test
        @DisplayName("ignores events of other runs")
        void ignoresOtherRuns() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("LDST-2", received::add);

            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, "LDST-1", null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("unsubscribing stops delivery to that subscriber only")
        void unsubscribe() {
            List<PipelineEvent> first = new ArrayList<>();
            List<PipelineEvent> second = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribe("LDST-1", first::add);
            eventBus.subscribe("LDST-1", second::add);

            subscription.unsubscribe();
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_COMPLETED, "LDST-1", null, Map.of()));

            assertTrue(first.isEmpty());
            assertEquals(1, second.size());
        }
    }

    // -- Global delivery ------------------------------------------------------

    @Nested
    @DisplayName("global subscriptions")
    class GlobalSubscriptionTests {

        @Test
        @DisplayName("a global subscriber sees every run until it unsubscribes")
        void globalSubscriber() {
            List<PipelineEvent> received = new ArrayList<>();
            EventBus.Subscription subscription = eventBus.subscribeAll(received::add);

            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, "LDST-1", null, Map.of()));
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, "LDST-2", null, Map.of()));
            subscription.unsubscribe();
            eventBus.publish(PipelineEvent.of(PipelineEvent.RUN_STARTED, "LDST-3", null, Map.of()));

            assertEquals(List.of("LDST-1", "LDST-2"), received.stream().map(PipelineEvent::runId).toList());
        }
    }

    // -- Robustness -----------------------------------------------------------

    @Nested
    @DisplayName("robustness")
    class RobustnessTests {

        @Test
        @DisplayName("a throwing subscriber does not stop delivery to others")
        void throwingSubscriberIsIsolated() {
            List<PipelineEvent> received = new ArrayList<>();
            eventBus.subscribe("LDST-1", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("LDST-1", received::add);

            assertDoesNotThrow(() ->
                    eventBus.publish(PipelineEvent.of(PipelineEvent.STAGE_FAILED, "LDST-1", "architect", Map.of())));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes safely")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<PipelineEvent> received = new CopyOnWriteArrayList<>();
            eventBus.subscribe("LDST-1", received::add);

            int threads = 8;
            int perThread = 50;
            CountDownLatch latch = new CountDownLatch(threads);
            for (int t = 0; t < threads; t++) {
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        eventBus.publish(PipelineEvent.of(PipelineEvent.STAGE_COMPLETED, "LDST-1", "s" + i, Map.of()));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }
}
