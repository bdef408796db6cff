package com.sentinel.core.ledger;

import java.util.Objects;

/**
 * Identity of whoever performed an audited action.
 *
 * @param id   stable identifier (user id, agent id, service name)
 * @param type kind of actor
 */
public record Actor(String id, ActorType type) {

    public Actor {
        Objects.requireNonNull(id, "actor id must not be null");
        Objects.requireNonNull(type, "actor type must not be null");
    }

    public static Actor user(String id) {
        return new Actor(id, ActorType.USER);
    }

    public static Actor agent(String id) {
        return new Actor(id, ActorType.AGENT);
    }

    public static Actor service(String id) {
        return new Actor(id, ActorType.SERVICE);
    }

    public static Actor system(String id) {
        return new Actor(id, ActorType.SYSTEM);
    }

    @Override
    public String toString() {
        return type.name().toLowerCase() + ":" + id;
    }
}
