package com.sentinel.core.ledger;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Caller-supplied part of an audit event. The ledger assigns sequence,
 * timestamp and hashes on append.
 *
 * @param id        pre-generated event id so callers can link the event before it is written (nullable)
 * @param eventType what happened
 * @param action    short action label
 * @param actor     who did it
 * @param resource  what it concerned (nullable)
 * @param outcome   result of the action
 * @param context   structured details
 */
public record AuditEventDraft(
    UUID id,
    AuditEventType eventType,
    String action,
    Actor actor,
    ResourceRef resource,
    EventOutcome outcome,
    Map<String, Object> context
) {

    public AuditEventDraft {
        Objects.requireNonNull(eventType, "eventType must not be null");
        Objects.requireNonNull(actor, "actor must not be null");
        outcome = outcome == null ? EventOutcome.SUCCESS : outcome;
        context = context == null ? Map.of() : context;
    }

    public static Builder builder(AuditEventType eventType) {
        return new Builder(eventType);
    }

    /**
     * Fluent builder; context entries keep insertion order until the ledger canonicalizes them.
     */
    public static final class Builder {

        private final AuditEventType eventType;
        private UUID id;
        private String action;
        private Actor actor;
        private ResourceRef resource;
        private EventOutcome outcome = EventOutcome.SUCCESS;
        private final Map<String, Object> context = new LinkedHashMap<>();

        private Builder(AuditEventType eventType) {
            this.eventType = eventType;
            this.action = eventType.name().toLowerCase().replace('_', '.');
        }

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder actor(Actor actor) {
            this.actor = actor;
            return this;
        }

        public Builder resource(String type, Object id, String name) {
            this.resource = ResourceRef.of(type, id, name);
            return this;
        }

        public Builder outcome(EventOutcome outcome) {
            this.outcome = outcome;
            return this;
        }

        public Builder context(String key, Object value) {
            this.context.put(key, value);
            return this;
        }

        public Builder context(Map<String, ?> values) {
            if (values != null) {
                this.context.putAll(values);
            }
            return this;
        }

        public AuditEventDraft build() {
            return new AuditEventDraft(id, eventType, action, actor, resource, outcome, context);
        }
    }
}
