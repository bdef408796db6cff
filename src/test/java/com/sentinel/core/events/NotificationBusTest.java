package com.sentinel.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link NotificationBus}.
 */
class NotificationBusTest {

    private NotificationBus bus;

    @BeforeEach
    void setUp() {
        bus = new NotificationBus();
    }

    private static GovernanceAlert alert(String type, AlertSeverity severity) {
        return new GovernanceAlert(type, severity, "subject-1", type + " raised", Map.of(), Instant.now());
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers alert to subscribers of its type")
        void deliversToTypeSubscriber() {
            List<GovernanceAlert> received = new ArrayList<>();
            bus.subscribe("kill_switch.hard_stop", received::add);

            GovernanceAlert alert = alert("kill_switch.hard_stop", AlertSeverity.CRITICAL);
            bus.publish(alert);

            assertEquals(List.of(alert), received);
        }

        @Test
        @DisplayName("does not deliver alerts of other types")
        void skipsOtherTypes() {
            List<GovernanceAlert> received = new ArrayList<>();
            bus.subscribe("change.rollback_failed", received::add);

            bus.publish(alert("break_glass.requested", AlertSeverity.WARNING));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("global subscriber receives every alert, alongside typed subscribers")
        void globalSubscriber() {
            List<GovernanceAlert> all = new ArrayList<>();
            List<GovernanceAlert> typed = new ArrayList<>();
            bus.subscribeAll(all::add);
            bus.subscribe("ledger.tamper_detected", typed::add);

            bus.publish(alert("ledger.tamper_detected", AlertSeverity.CRITICAL));
            bus.publish(alert("change.rolled_back", AlertSeverity.WARNING));

            assertEquals(2, all.size());
            assertEquals(1, typed.size());
            assertEquals("change.rolled_back", all.get(1).alertType());
        }
    }

    // -- Unsubscribe tests ----------------------------------------------------

    @Nested
    @DisplayName("unsubscribe")
    class UnsubscribeTests {

        @Test
        @DisplayName("unsubscribing stops delivery of future alerts")
        void unsubscribeStopsDelivery() {
            List<GovernanceAlert> received = new ArrayList<>();
            NotificationBus.Subscription subscription = bus.subscribe("change.rolled_back", received::add);
            bus.publish(alert("change.rolled_back", AlertSeverity.WARNING));

            subscription.unsubscribe();
            bus.publish(alert("change.rolled_back", AlertSeverity.WARNING));

            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("unsubscribing a global subscriber stops delivery")
        void unsubscribeGlobal() {
            List<GovernanceAlert> received = new ArrayList<>();
            NotificationBus.Subscription subscription = bus.subscribeAll(received::add);

            subscription.unsubscribe();
            bus.publish(alert("change.rolled_back", AlertSeverity.INFO));

            assertTrue(received.isEmpty());
        }
    }

    // -- Delivery safety ------------------------------------------------------

    @Nested
    @DisplayName("delivery safety")
    class DeliverySafetyTests {

        @Test
        @DisplayName("a throwing subscriber neither reaches the publisher nor blocks others")
        void failingSubscriberIsIsolated() {
            List<GovernanceAlert> received = new ArrayList<>();
            bus.subscribe("kill_switch.hard_stop", a -> {
                throw new IllegalStateException("pager offline");
            });
            bus.subscribe("kill_switch.hard_stop", received::add);

            assertDoesNotThrow(() -> bus.publish(alert("kill_switch.hard_stop", AlertSeverity.CRITICAL)));
            assertEquals(1, received.size());
        }

        @Test
        @DisplayName("handles concurrent publishes safely")
        void concurrentPublishes() throws InterruptedException {
            CopyOnWriteArrayList<GovernanceAlert> received = new CopyOnWriteArrayList<>();
            bus.subscribeAll(received::add);

            int threadCount = 8;
            int alertsPerThread = 50;
            CountDownLatch latch = new CountDownLatch(threadCount);
            for (int t = 0; t < threadCount; t++) {
                new Thread(() -> {
                    for (int i = 0; i < alertsPerThread; i++) {
                        bus.publish(alert("gate.degraded", AlertSeverity.INFO));
                    }
                    latch.countDown();
                }).start();
            }

            assertTrue(latch.await(10, TimeUnit.SECONDS));
            assertEquals(threadCount * alertsPerThread, received.size());
        }
    }
}
