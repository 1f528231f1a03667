package com.nayem.tether.hook;

import com.nayem.tether.core.ActorMethod;

import java.time.Duration;

/**
 * The call-tagging decorators.
 * <p>
 * Each decorator returns a new {@link DecoratedMethod}; applied to an already decorated
 * method it appends to the existing pipeline, so decorators compose:
 * {@code blocking(singular(body))} is one pipeline tagged with both.
 * </p>
 */
public final class Decorations {

    public static final String BLOCKING = "blocking";
    public static final String SINGULAR = "singular";

    /** Result of a singular call that did not get the lock. */
    public static final Object VETOED = Boolean.FALSE;

    private Decorations() {
    }

    /**
     * Tags the method {@code blocking}: callers going through
     * {@link com.nayem.tether.core.Actor#send} wait for its result. Adds no hooks.
     */
    public static DecoratedMethod blocking(ActorMethod method) {
        return DecoratedMethod.of(method).withDecoration(BLOCKING);
    }

    /**
     * Tags the method {@code singular} and guards it with the actor runtime's distributed
     * lock under the runtime's default context and TTL.
     */
    public static DecoratedMethod singular(ActorMethod method) {
        return singular(method, null, null);
    }

    /**
     * Tags the method {@code singular} and guards it with the distributed lock named
     * {@code context:methodName}. While another caller anywhere in the cluster holds the
     * lock, the call does not run and returns {@link #VETOED}.
     *
     * @param context Lock namespace; null for the runtime default
     * @param ttl     Lock window; null for the runtime default
     */
    public static DecoratedMethod singular(ActorMethod method, String context, Duration ttl) {
        SingularGuard guard = new SingularGuard(context, ttl);
        return DecoratedMethod.of(method).decorate(SINGULAR, guard::acquire, guard::release);
    }
}
