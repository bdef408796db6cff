package com.sentinel.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * An operational alert handed to the notification collaborator.
 *
 * @param alertType  dotted alert type, e.g. "kill_switch.hard_stop", "change.rollback_failed"
 * @param severity   how urgently operators must react
 * @param subjectId  the kill switch, change request or gate the alert concerns
 * @param message    human-readable summary
 * @param payload    arbitrary key-value data associated with the alert
 * @param timestamp  when the alert was raised
 */
public record GovernanceAlert(
    String alertType,
    AlertSeverity severity,
    String subjectId,
    String message,
    Map<String, Object> payload,
    Instant timestamp
) {}
