package com.nayem.tether.hook;

import com.nayem.tether.core.Invocation;

/**
 * Runs before the base method. Short-circuiting vetoes the call: the base method and all
 * after-hooks are skipped.
 */
@FunctionalInterface
public interface BeforeHook {

    HookResult before(Invocation invocation) throws Exception;
}
