package com.sentinel.core.gate;

import com.sentinel.core.ledger.Actor;
import com.sentinel.core.policy.Scope;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * A request to pass an enforcement gate.
 *
 * @param gateKey           gate to evaluate
 * @param actor             who is asking
 * @param context           values policies are evaluated against
 * @param operation         read or write; writes are what soft-stop and read-only switches refuse
 * @param inputs            action inputs, captured as evidence when the gate asks for it
 * @param outputs           action outputs, captured as evidence when the gate asks for it
 * @param executionId       caller's correlation id for the governed execution
 * @param requestId         caller's request id (nullable)
 * @param scope             workflow/capability the action runs in; fills what the gate leaves open
 * @param breakGlassGrantId emergency override to apply (nullable)
 */
public record EvaluationRequest(
    String gateKey,
    Actor actor,
    Map<String, Object> context,
    OperationKind operation,
    Map<String, Object> inputs,
    Map<String, Object> outputs,
    String executionId,
    String requestId,
    Scope scope,
    UUID breakGlassGrantId
) {

    public EvaluationRequest {
        Objects.requireNonNull(gateKey, "gateKey must not be null");
        Objects.requireNonNull(actor, "actor must not be null");
        context = context == null ? Map.of() : context;
        operation = operation == null ? OperationKind.WRITE : operation;
        inputs = inputs == null ? Map.of() : inputs;
        outputs = outputs == null ? Map.of() : outputs;
        executionId = executionId == null ? UUID.randomUUID().toString() : executionId;
        scope = scope == null ? Scope.GLOBAL : scope;
    }

    public static EvaluationRequest of(String gateKey, Actor actor, Map<String, Object> context) {
        return builder(gateKey, actor).context(context).build();
    }

    public static Builder builder(String gateKey, Actor actor) {
        return new Builder(gateKey, actor);
    }

    public static final class Builder {

        private final String gateKey;
        private final Actor actor;
        private final Map<String, Object> context = new LinkedHashMap<>();
        private OperationKind operation = OperationKind.WRITE;
        private Map<String, Object> inputs;
        private Map<String, Object> outputs;
        private String executionId;
        private String requestId;
        private Scope scope;
        private UUID breakGlassGrantId;

        private Builder(String gateKey, Actor actor) {
            this.gateKey = gateKey;
            this.actor = actor;
        }

        public Builder context(Map<String, ?> values) {
            if (values != null) {
                context.putAll(values);
            }
            return this;
        }

        public Builder context(String key, Object value) {
            context.put(key, value);
            return this;
        }

        public Builder operation(OperationKind operation) {
            this.operation = operation;
            return this;
        }

        public Builder inputs(Map<String, Object> inputs) {
            this.inputs = inputs;
            return this;
        }

        public Builder outputs(Map<String, Object> outputs) {
            this.outputs = outputs;
            return this;
        }

        public Builder executionId(String executionId) {
            this.executionId = executionId;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder scope(Scope scope) {
            this.scope = scope;
            return this;
        }

        public Builder breakGlassGrant(UUID grantId) {
            this.breakGlassGrantId = grantId;
            return this;
        }

        public EvaluationRequest build() {
            return new EvaluationRequest(gateKey, actor, context, operation, inputs, outputs,
                    executionId, requestId, scope, breakGlassGrantId);
        }
    }
}
