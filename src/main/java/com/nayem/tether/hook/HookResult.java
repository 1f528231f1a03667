package com.nayem.tether.hook;

/**
 * Outcome of a before- or after-hook.
 * <p>
 * {@link #proceed()} lets the pipeline continue; {@link #shortCircuit(Object)} ends it and
 * makes {@code value} the result of the call. A short-circuit value may itself be null,
 * false or empty.
 * </p>
 */
public record HookResult(boolean shortCircuit, Object value) {

    private static final HookResult PROCEED = new HookResult(false, null);

    public static HookResult proceed() {
        return PROCEED;
    }

    public static HookResult shortCircuit(Object value) {
        return new HookResult(true, value);
    }
}
