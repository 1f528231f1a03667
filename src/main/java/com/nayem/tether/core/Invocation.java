package com.nayem.tether.core;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * One call of an actor method: the receiving actor, the method name and the call arguments.
 * <p>
 * {@code attributes} is scratch space shared by the hooks of a single call, e.g. a lock
 * acquired in a before-hook and released in the matching after-hook.
 * </p>
 *
 * @param actor      The receiving actor, or null when a pipeline runs outside an actor
 * @param methodName The name the method is registered under
 * @param args       Positional arguments
 * @param kwargs     Keyword arguments
 * @param attributes Per-call hook state
 */
public record Invocation(
        Actor actor,
        String methodName,
        List<Object> args,
        Map<String, Object> kwargs,
        Map<String, Object> attributes) {

    public static Invocation of(Actor actor, String methodName, List<Object> args, Map<String, Object> kwargs) {
        return new Invocation(actor, methodName,
                args == null ? List.of() : args,
                kwargs == null ? Map.of() : kwargs,
                new ConcurrentHashMap<>());
    }

    public static Invocation of(Actor actor, String methodName, Object... args) {
        return of(actor, methodName, Arrays.asList(args), Map.of());
    }

    public Object arg(int index) {
        return args.get(index);
    }

    public Object kwarg(String name) {
        return kwargs.get(name);
    }
}
