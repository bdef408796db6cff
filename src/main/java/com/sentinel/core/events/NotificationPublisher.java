package com.sentinel.core.events;

/**
 * Fire-and-forget outlet for governance alerts. Implementations must never
 * throw back into the caller; delivery is best-effort.
 */
public interface NotificationPublisher {

    void publish(GovernanceAlert alert);
}
