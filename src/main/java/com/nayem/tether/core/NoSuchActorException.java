package com.nayem.tether.core;

/**
 * Thrown at call time when a request reached no subscriber on the actor's channel.
 */
public class NoSuchActorException extends RuntimeException {

    private final String actorId;

    public NoSuchActorException(String actorId) {
        super("No such actor: " + actorId);
        this.actorId = actorId;
    }

    public String getActorId() {
        return actorId;
    }
}
