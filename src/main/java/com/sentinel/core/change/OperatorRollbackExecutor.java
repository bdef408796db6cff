package com.sentinel.core.change;

import com.sentinel.core.error.RollbackFailureException;
import com.sentinel.core.events.AlertSeverity;
import com.sentinel.core.events.GovernanceAlert;
import com.sentinel.core.events.NotificationPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Default {@link RollbackExecutor}: the core never performs the governed action itself,
 * so the rollback procedure is dispatched to operators as a critical alert.
 */
@Component
public class OperatorRollbackExecutor implements RollbackExecutor {

    private static final Logger log = LoggerFactory.getLogger(OperatorRollbackExecutor.class);

    private final NotificationPublisher notifications;
    private final Clock clock;

    public OperatorRollbackExecutor(NotificationPublisher notifications, Clock clock) {
        this.notifications = notifications;
        this.clock = clock;
    }

    @Override
    public RollbackReport execute(ChangeRequest request, String reason) {
        String procedure = request.getRollbackProcedure();
        if (procedure == null || procedure.isBlank()) {
            throw new RollbackFailureException("Change request " + request.getChangeKey()
                    + " has no rollback procedure");
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("changeId", request.getId().toString());
        payload.put("changeKey", request.getChangeKey());
        payload.put("riskLevel", String.valueOf(request.getRiskLevel()));
        payload.put("procedure", procedure);
        payload.put("reason", reason);

        notifications.publish(new GovernanceAlert("change.rollback_dispatched", AlertSeverity.CRITICAL,
                request.getId().toString(),
                "Roll back change " + request.getChangeKey() + ": " + reason,
                payload, clock.instant()));
        log.warn("Rollback of change {} dispatched to operators", request.getChangeKey());
        return RollbackReport.success("Rollback procedure dispatched to operators");
    }
}
