package com.nayem.tether.spring;

import com.nayem.tether.lock.DistributedLock;
import com.nayem.tether.lock.LockHandle;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Array;
import java.time.Duration;
import java.util.Optional;

/**
 * Guards {@link Singular} methods with the distributed lock.
 * The lock is released after the method returns normally; if it throws, the lock is left
 * to expire.
 */
@Aspect
public class SingularAspect {

    private static final Logger log = LoggerFactory.getLogger(SingularAspect.class);

    private final DistributedLock distributedLock;
    private final TetherProperties properties;

    public SingularAspect(DistributedLock distributedLock, TetherProperties properties) {
        this.distributedLock = distributedLock;
        this.properties = properties;
    }

    @Around(value = "@annotation(singular)", argNames = "joinPoint,singular")
    public Object guard(ProceedingJoinPoint joinPoint, Singular singular) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        String context = singular.context().isEmpty() ? properties.getLock().getContext() : singular.context();
        String lockName = context + ":" + signature.getMethod().getName();
        Duration ttl = singular.ttlSeconds() > 0
                ? Duration.ofSeconds(singular.ttlSeconds())
                : properties.getLock().getTtl();

        Optional<LockHandle> handle = distributedLock.tryAcquire(lockName, ttl);
        if (handle.isEmpty()) {
            log.debug("Skipping {}: lock {} is held", signature.toShortString(), lockName);
            return vetoed(signature.getReturnType());
        }

        Object result = joinPoint.proceed();
        distributedLock.release(handle.get());
        return result;
    }

    private static Object vetoed(Class<?> returnType) {
        if (returnType == boolean.class || returnType == Boolean.class) {
            return Boolean.FALSE;
        }
        if (returnType.isPrimitive() && returnType != void.class) {
            return Array.get(Array.newInstance(returnType, 1), 0);
        }
        return null;
    }
}
