package com.nayem.tether.core;

/**
 * Channel names on the coordination service.
 */
public final class Channels {

    public static final String ACTOR_PREFIX = "actor:";
    public static final String PROXY_PREFIX = "proxy:";

    private Channels() {
    }

    /** Shared request channel of an actor. */
    public static String actor(String actorId) {
        return ACTOR_PREFIX + actorId;
    }

    /** Private reply channel of a proxy. */
    public static String proxy(String proxyId) {
        return PROXY_PREFIX + proxyId;
    }
}
