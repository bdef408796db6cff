package com.sentinel.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.core.gate.EvaluationRequest;
import com.sentinel.core.gate.GateDecision;
import com.sentinel.core.gate.GateEvaluator;
import com.sentinel.core.gate.OperationKind;
import com.sentinel.core.ledger.Actor;
import com.sentinel.core.policy.Scope;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * CLI command: sentinel evaluate
 * <p>
 * Runs an ad-hoc gate evaluation. The decision is recorded in the ledger like any
 * other evaluation. Exits with 1 when the outcome stops execution.
 */
@Command(name = "evaluate", mixinStandardHelpOptions = true, description = "Evaluate an enforcement gate")
@Component
public class EvaluateCommand implements Callable<Integer> {

    private static final ObjectMapper JSON = new ObjectMapper();

    @Option(names = {"--gate", "-g"}, required = true, description = "Gate key")
    private String gateKey;

    @Option(names = "--actor", description = "Acting user id", defaultValue = "cli")
    private String actorId;

    @Option(names = "--read", description = "Evaluate as a read operation")
    private boolean read;

    @Option(names = {"--context", "-c"}, description = "Context value as key=value (JSON values accepted)")
    private Map<String, String> context = new LinkedHashMap<>();

    @Option(names = "--workflow", description = "Workflow scope")
    private String workflowId;

    @Option(names = "--capability", description = "Capability scope")
    private String capabilityId;

    @Option(names = "--timeout-ms", description = "Evaluation timeout in milliseconds")
    private Long timeoutMs;

    @Option(names = "--grant", description = "Break-glass grant id to apply")
    private UUID grantId;

    private final GateEvaluator gateEvaluator;

    public EvaluateCommand(GateEvaluator gateEvaluator) {
        this.gateEvaluator = gateEvaluator;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        EvaluationRequest request = EvaluationRequest.builder(gateKey, Actor.user(actorId))
                .context(parseContext(context))
                .operation(read ? OperationKind.READ : OperationKind.WRITE)
                .scope(new Scope(workflowId, capabilityId))
                .breakGlassGrant(grantId)
                .build();

        ConsoleOutput.info("Evaluating gate " + gateKey + " as " + request.actor());
        GateDecision decision = gateEvaluator.evaluate(request,
                timeoutMs != null ? Duration.ofMillis(timeoutMs) : null);

        ConsoleOutput.decision(decision);
        ConsoleOutput.field("Gate execution", decision.gateExecutionId());
        ConsoleOutput.field("Ledger event", decision.ledgerEventId());
        return decision.outcome().isBlocking() ? 1 : 0;
    }

    static Map<String, Object> parseContext(Map<String, String> raw) {
        Map<String, Object> parsed = new LinkedHashMap<>();
        raw.forEach((key, value) -> parsed.put(key, parseValue(value)));
        return parsed;
    }

    private static Object parseValue(String value) {
        try {
            return JSON.readValue(value, Object.class);
        } catch (JsonProcessingException e) {
            return value;
        }
    }
}
