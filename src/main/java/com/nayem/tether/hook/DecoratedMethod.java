package com.nayem.tether.hook;

import com.nayem.tether.core.ActorMethod;
import com.nayem.tether.core.Invocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An actor method wrapped in ordered before- and after-hooks and tagged with decorations.
 * <p>
 * Instances are immutable. Decorating an already decorated method returns a new
 * {@code DecoratedMethod} over the same base method with the hooks appended and the tag
 * added, so several decorations compose into one pipeline and the order in which they
 * are applied is the order their hooks run in.
 * </p>
 *
 * <h3>Invocation</h3>
 * <ol>
 * <li>Before-hooks run in order; the first short-circuit becomes the result.</li>
 * <li>Otherwise the base method runs once.</li>
 * <li>After-hooks run in order; the first short-circuit replaces the result.</li>
 * <li>Otherwise the base result is returned unchanged.</li>
 * </ol>
 * An exception from the base method or any hook propagates and skips the remaining steps.
 */
public final class DecoratedMethod implements ActorMethod {

    private final ActorMethod target;
    private final List<BeforeHook> before;
    private final List<AfterHook> after;
    private final Set<String> decorations;

    private DecoratedMethod(ActorMethod target, List<BeforeHook> before, List<AfterHook> after,
            Set<String> decorations) {
        this.target = target;
        this.before = before;
        this.after = after;
        this.decorations = decorations;
    }

    /**
     * Returns the method itself if it is already decorated, otherwise wraps it in an
     * empty pipeline.
     */
    public static DecoratedMethod of(ActorMethod method) {
        if (method instanceof DecoratedMethod decorated) {
            return decorated;
        }
        return new DecoratedMethod(method, List.of(), List.of(), Set.of());
    }

    /**
     * Adds a decoration tag and, when not null, appends a before- and an after-hook.
     */
    public DecoratedMethod decorate(String decoration, BeforeHook beforeHook, AfterHook afterHook) {
        List<BeforeHook> nextBefore = new ArrayList<>(before);
        if (beforeHook != null) {
            nextBefore.add(beforeHook);
        }
        List<AfterHook> nextAfter = new ArrayList<>(after);
        if (afterHook != null) {
            nextAfter.add(afterHook);
        }
        Set<String> nextDecorations = new LinkedHashSet<>(decorations);
        nextDecorations.add(decoration);
        return new DecoratedMethod(target,
                Collections.unmodifiableList(nextBefore),
                Collections.unmodifiableList(nextAfter),
                Collections.unmodifiableSet(nextDecorations));
    }

    public DecoratedMethod withDecoration(String decoration) {
        return decorate(decoration, null, null);
    }

    @Override
    public Object invoke(Invocation invocation) throws Exception {
        for (BeforeHook hook : before) {
            HookResult outcome = hook.before(invocation);
            if (outcome.shortCircuit()) {
                return outcome.value();
            }
        }

        Object result = target.invoke(invocation);

        for (AfterHook hook : after) {
            HookResult outcome = hook.after(invocation, result);
            if (outcome.shortCircuit()) {
                return outcome.value();
            }
        }

        return result;
    }

    public boolean hasDecoration(String decoration) {
        return decorations.contains(decoration);
    }

    public Set<String> getDecorations() {
        return decorations;
    }

    public List<BeforeHook> getBefore() {
        return before;
    }

    public List<AfterHook> getAfter() {
        return after;
    }

    public ActorMethod getTarget() {
        return target;
    }
}
