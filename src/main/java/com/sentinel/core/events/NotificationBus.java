package com.sentinel.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process pub/sub bus that fans governance alerts out to notification adapters.
 * <p>
 * Supports per-alert-type subscriptions and global subscriptions that receive all alerts.
 * Thread-safe for concurrent publish and subscribe operations. A failing subscriber
 * is logged and skipped; it never affects the publisher or other subscribers.
 */
@Service
public class NotificationBus implements NotificationPublisher {

    private static final Logger log = LoggerFactory.getLogger(NotificationBus.class);

    /** Subscribers keyed by alert type. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GovernanceAlert>>> typeSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every alert. */
    private final CopyOnWriteArrayList<Consumer<GovernanceAlert>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    @Override
    public void publish(GovernanceAlert alert) {
        switch (alert.severity()) {
            case CRITICAL -> log.error("[{}] {} ({})", alert.alertType(), alert.message(), alert.subjectId());
            case WARNING -> log.warn("[{}] {} ({})", alert.alertType(), alert.message(), alert.subjectId());
            default -> log.info("[{}] {} ({})", alert.alertType(), alert.message(), alert.subjectId());
        }

        List<Consumer<GovernanceAlert>> typed = typeSubscribers.get(alert.alertType());
        if (typed != null) {
            for (Consumer<GovernanceAlert> subscriber : typed) {
                deliverSafely(subscriber, alert);
            }
        }

        for (Consumer<GovernanceAlert> subscriber : globalSubscribers) {
            deliverSafely(subscriber, alert);
        }
    }

    /**
     * Subscribe to alerts of one type.
     *
     * @param alertType the alert type to receive
     * @param consumer  callback invoked for each alert
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String alertType, Consumer<GovernanceAlert> consumer) {
        typeSubscribers.computeIfAbsent(alertType, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<GovernanceAlert>> subs = typeSubscribers.get(alertType);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<GovernanceAlert> consumer) {
        globalSubscribers.add(consumer);
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<GovernanceAlert> subscriber, GovernanceAlert alert) {
        try {
            subscriber.accept(alert);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing alert {}: {}",
                    alert.alertType(), e.getMessage(), e);
        }
    }
}
