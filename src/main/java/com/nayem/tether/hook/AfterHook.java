package com.nayem.tether.hook;

import com.nayem.tether.core.Invocation;

/**
 * Runs after the base method returned normally. Short-circuiting replaces the result and
 * skips the remaining after-hooks.
 */
@FunctionalInterface
public interface AfterHook {

    HookResult after(Invocation invocation, Object result) throws Exception;
}
