package com.sentinel.core.ledger;

/**
 * Weak reference to the resource an audit event concerns.
 *
 * @param type resource kind, e.g. {@code change_request} or {@code enforcement_gate}
 * @param id   resource identifier
 * @param name human-readable label (nullable)
 */
public record ResourceRef(String type, String id, String name) {

    public static ResourceRef of(String type, Object id, String name) {
        return new ResourceRef(type, id == null ? null : id.toString(), name);
    }
}
