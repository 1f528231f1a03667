package com.nayem.tether.lock;

import com.nayem.tether.coordination.CoordinationService;
import com.nayem.tether.core.TetherMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * {@link DistributedLock} whose key holds its own expiry timestamp.
 * <p>
 * The value of the key, an epoch-seconds expiry, is the only source of truth for ownership:
 * a lock whose stored expiry has passed may be taken over with GETSET even if the store
 * never expired the key. The TTL set after a successful acquisition only cleans up
 * abandoned keys.
 * </p>
 * <p>
 * By default release deletes the key unconditionally. A holder whose lock was taken over
 * after expiry therefore deletes the new holder's key when it finishes. With
 * {@code verifyOwner} enabled, release only deletes the key while it still holds the
 * value this holder wrote.
 * </p>
 */
public class ExpiringLock implements DistributedLock {

    private static final Logger log = LoggerFactory.getLogger(ExpiringLock.class);

    private final CoordinationService coordination;
    private final Clock clock;
    private final boolean verifyOwner;
    private final TetherMetrics metrics;

    public ExpiringLock(CoordinationService coordination) {
        this(coordination, Clock.systemUTC(), false, TetherMetrics.noOp());
    }

    public ExpiringLock(CoordinationService coordination, Clock clock, boolean verifyOwner, TetherMetrics metrics) {
        this.coordination = coordination;
        this.clock = clock;
        this.verifyOwner = verifyOwner;
        this.metrics = metrics;
    }

    @Override
    public Optional<LockHandle> tryAcquire(String lockName, Duration ttl) {
        BigDecimal now = BigDecimal.valueOf(clock.millis(), 3);
        BigDecimal expires = now.add(BigDecimal.valueOf(ttl.toMillis(), 3)).add(BigDecimal.ONE);
        String expiry = expires.toPlainString();

        if (!coordination.setIfAbsent(lockName, expiry)) {
            if (isFuture(coordination.get(lockName), now, lockName)) {
                metrics.recordLockVetoed();
                return Optional.empty();
            }
            if (isFuture(coordination.getAndSet(lockName, expiry), now, lockName)) {
                log.debug("Lost takeover race for expired lock {}", lockName);
                metrics.recordLockVetoed();
                return Optional.empty();
            }
            log.debug("Took over expired lock {}", lockName);
            metrics.recordLockStolen();
        }

        coordination.expire(lockName, ttl);
        metrics.recordLockAcquired();
        return Optional.of(new LockHandle(lockName, expiry));
    }

    @Override
    public void release(LockHandle handle) {
        if (!verifyOwner) {
            coordination.delete(handle.name());
            return;
        }
        if (handle.expiry() == null || !coordination.deleteIfEquals(handle.name(), handle.expiry())) {
            log.warn("Lock {} is no longer held by this caller, leaving it in place", handle.name());
        }
    }

    public boolean isVerifyOwner() {
        return verifyOwner;
    }

    private static boolean isFuture(String stored, BigDecimal now, String lockName) {
        if (stored == null) {
            return false;
        }
        try {
            return now.compareTo(new BigDecimal(stored)) < 0;
        } catch (NumberFormatException e) {
            log.warn("Lock {} holds unreadable expiry '{}', treating it as expired", lockName, stored);
            return false;
        }
    }
}
