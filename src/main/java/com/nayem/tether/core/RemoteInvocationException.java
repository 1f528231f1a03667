package com.nayem.tether.core;

/**
 * Completes a call handle when the actor-side method failed.
 */
public class RemoteInvocationException extends RuntimeException {

    private final String actorId;

    public RemoteInvocationException(String actorId, String message) {
        super("Actor " + actorId + " failed: " + message);
        this.actorId = actorId;
    }

    public String getActorId() {
        return actorId;
    }
}
