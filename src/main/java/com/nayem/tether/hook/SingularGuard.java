package com.nayem.tether.hook;

import com.nayem.tether.core.ActorRuntime;
import com.nayem.tether.core.Invocation;
import com.nayem.tether.lock.DistributedLock;
import com.nayem.tether.lock.LockHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Acquire/release hook pair behind {@link Decorations#singular}.
 * The handle travels from the before-hook to the after-hook in the invocation attributes.
 */
class SingularGuard {

    private static final Logger log = LoggerFactory.getLogger(SingularGuard.class);

    private final String context;
    private final Duration ttl;

    SingularGuard(String context, Duration ttl) {
        this.context = context;
        this.ttl = ttl;
    }

    HookResult acquire(Invocation invocation) {
        ActorRuntime runtime = runtime(invocation);
        String lockName = lockName(invocation, runtime);
        Duration window = ttl != null ? ttl : runtime.getLockTtl();

        Optional<LockHandle> handle = runtime.getDistributedLock().tryAcquire(lockName, window);
        if (handle.isEmpty()) {
            log.debug("Skipping {}: lock {} is held", invocation.methodName(), lockName);
            return HookResult.shortCircuit(Decorations.VETOED);
        }
        invocation.attributes().put(attributeKey(lockName), handle.get());
        return HookResult.proceed();
    }

    HookResult release(Invocation invocation, Object result) {
        ActorRuntime runtime = runtime(invocation);
        String lockName = lockName(invocation, runtime);
        DistributedLock lock = runtime.getDistributedLock();

        Object handle = invocation.attributes().remove(attributeKey(lockName));
        if (handle instanceof LockHandle lockHandle) {
            lock.release(lockHandle);
        } else {
            log.warn("No lock handle recorded for {}, deleting {} anyway", invocation.methodName(), lockName);
            lock.release(new LockHandle(lockName, null));
        }
        return HookResult.proceed();
    }

    private String lockName(Invocation invocation, ActorRuntime runtime) {
        String lockContext = context != null && !context.isEmpty() ? context : runtime.getLockContext();
        return lockContext + ":" + invocation.methodName();
    }

    private static String attributeKey(String lockName) {
        return "singular.lock." + lockName;
    }

    private static ActorRuntime runtime(Invocation invocation) {
        if (invocation.actor() == null) {
            throw new IllegalStateException("Singular method " + invocation.methodName() + " must run on an actor");
        }
        return invocation.actor().getRuntime();
    }
}
