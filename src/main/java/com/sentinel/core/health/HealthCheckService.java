package com.sentinel.core.health;

import com.sentinel.core.change.ChangeProperties;
import com.sentinel.core.ledger.AuditEvent;
import com.sentinel.core.ledger.ChainVerification;
import com.sentinel.core.ledger.Ledger;
import com.sentinel.core.policy.EnforcementGate;
import com.sentinel.core.policy.GovernanceRegistry;
import com.sentinel.core.policy.KillSwitch;
import com.sentinel.core.policy.KillSwitchMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final Ledger ledger;
    private final GovernanceRegistry registry;
    private final ChangeProperties changeProperties;
    private final Clock clock;
    private final DataSource dataSource;

    public HealthCheckService(
            Ledger ledger,
            GovernanceRegistry registry,
            ChangeProperties changeProperties,
            Clock clock,
            @Autowired(required = false) DataSource dataSource) {
        this.ledger = ledger;
        this.registry = registry;
        this.changeProperties = changeProperties;
        this.clock = clock;
        this.dataSource = dataSource;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkLedger());
        results.add(checkPolicySource());
        results.add(checkKillSwitches());
        results.add(checkDatabase());
        return results;
    }

    HealthStatus checkLedger() {
        if (ledger.isHalted()) {
            return new HealthStatus("ledger", HealthStatus.Status.DOWN,
                    "Ledger halted after an integrity failure", Map.of());
        }
        try {
            ChainVerification tipCheck = ledger.verifyTip();
            if (!tipCheck.valid()) {
                return new HealthStatus("ledger", HealthStatus.Status.DOWN,
                        "Tip verification failed at sequence " + tipCheck.firstMismatch() + ": " + tipCheck.reason(),
                        Map.of("firstMismatch", String.valueOf(tipCheck.firstMismatch())));
            }
            Optional<AuditEvent> tip = ledger.tip();
            if (tip.isEmpty()) {
                return new HealthStatus("ledger", HealthStatus.Status.UP, "Ledger empty", Map.of("sequence", "0"));
            }
            return new HealthStatus("ledger", HealthStatus.Status.UP, "Chain tip verified",
                    Map.of("sequence", String.valueOf(tip.get().sequence()),
                            "hash", tip.get().eventHash()));
        } catch (Exception e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            return new HealthStatus("ledger", HealthStatus.Status.DOWN,
                    "Ledger error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkPolicySource() {
        try {
            List<EnforcementGate> gates = registry.gates();
            String productionGate = changeProperties.getProductionGateKey();
            boolean hasProductionGate = registry.gate(productionGate).filter(EnforcementGate::active).isPresent();
            Map<String, String> metadata = Map.of("gates", String.valueOf(gates.size()));
            if (!hasProductionGate) {
                return new HealthStatus("policy-source", HealthStatus.Status.DEGRADED,
                        "Production change gate '" + productionGate + "' is not configured; executions will be blocked",
                        metadata);
            }
            return new HealthStatus("policy-source", HealthStatus.Status.UP,
                    gates.size() + " gate(s) available", metadata);
        } catch (Exception e) {
            log.warn("Policy source health check failed: {}", e.getMessage());
            return new HealthStatus("policy-source", HealthStatus.Status.DOWN,
                    "Policy source error: " + e.getMessage(), Map.of());
        }
    }

    private HealthStatus checkKillSwitches() {
        Instant now = clock.instant();
        List<String> engaged = registry.killSwitches().stream()
                .filter(ks -> ks.isEffective(now))
                .map(KillSwitch::key)
                .toList();
        boolean hardStop = registry.killSwitches().stream()
                .anyMatch(ks -> ks.isEffective(now) && ks.mode() == KillSwitchMode.HARD_STOP);
        if (engaged.isEmpty()) {
            return new HealthStatus("kill-switches", HealthStatus.Status.UP, "No kill switch engaged", Map.of());
        }
        return new HealthStatus("kill-switches", HealthStatus.Status.DEGRADED,
                engaged.size() + " kill switch(es) engaged" + (hardStop ? ", including a HARD_STOP" : ""),
                Map.of("engaged", String.join(",", engaged)));
    }

    private HealthStatus checkDatabase() {
        if (dataSource == null) {
            return new HealthStatus("database", HealthStatus.Status.DEGRADED,
                    "No DataSource configured; using in-memory stores", Map.of());
        }
        try (var conn = dataSource.getConnection()) {
            if (conn.isValid(5)) {
                return new HealthStatus("database", HealthStatus.Status.UP,
                        "Database connection valid", Map.of());
            }
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database connection invalid", Map.of());
        } catch (Exception e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return new HealthStatus("database", HealthStatus.Status.DOWN,
                    "Database error: " + e.getMessage(), Map.of());
        }
    }
}
