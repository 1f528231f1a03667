package com.nayem.tether.lock;

import com.nayem.tether.coordination.CoordinationService;
import com.nayem.tether.coordination.InMemoryCoordinationService;
import com.nayem.tether.coordination.MutableClock;
import com.nayem.tether.core.TetherMetrics;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExpiringLockTest {

    private static final String LOCK = "global.lock:incr";
    private static final Duration TTL = Duration.ofSeconds(2);

    private MutableClock clock;
    private InMemoryCoordinationService coordination;
    private ExpiringLock lock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        coordination = new InMemoryCoordinationService(clock);
        lock = new ExpiringLock(coordination, clock, false, TetherMetrics.noOp());
    }

    @Test
    void firstAttemptWritesExpiryOneSecondPastTtl() {
        Optional<LockHandle> handle = lock.tryAcquire(LOCK, TTL);

        assertTrue(handle.isPresent());
        BigDecimal expected = BigDecimal.valueOf(clock.millis(), 3).add(BigDecimal.valueOf(3));
        assertEquals(0, expected.compareTo(new BigDecimal(coordination.get(LOCK))));
        assertEquals(handle.get().expiry(), coordination.get(LOCK));
    }

    @Test
    void attemptBeforeExpiryFails() {
        assertTrue(lock.tryAcquire(LOCK, TTL).isPresent());
        clock.advance(Duration.ofMillis(1500));

        assertTrue(lock.tryAcquire(LOCK, TTL).isEmpty());
    }

    @Test
    void staleKeyWithoutTtlIsTakenOver() {
        // holder wrote its expiry but died before setting a TTL
        BigDecimal past = BigDecimal.valueOf(clock.millis(), 3).subtract(BigDecimal.ONE);
        coordination.setIfAbsent(LOCK, past.toPlainString());

        Optional<LockHandle> handle = lock.tryAcquire(LOCK, TTL);

        assertTrue(handle.isPresent());
        assertEquals(handle.get().expiry(), coordination.get(LOCK));
    }

    @Test
    void storeExpiredKeyIsAcquiredAgain() {
        assertTrue(lock.tryAcquire(LOCK, TTL).isPresent());
        clock.advance(Duration.ofSeconds(2));

        assertTrue(lock.tryAcquire(LOCK, TTL).isPresent());
    }

    @Test
    void unreadableExpiryCountsAsExpired() {
        coordination.setIfAbsent(LOCK, "not-a-timestamp");

        assertTrue(lock.tryAcquire(LOCK, TTL).isPresent());
    }

    @Test
    void losingTheTakeoverRaceFails() {
        CoordinationService store = mock(CoordinationService.class);
        long now = clock.millis();
        when(store.setIfAbsent(eq(LOCK), anyString())).thenReturn(false);
        when(store.get(LOCK)).thenReturn(BigDecimal.valueOf(now - 1000, 3).toPlainString());
        when(store.getAndSet(eq(LOCK), anyString())).thenReturn(BigDecimal.valueOf(now + 3000, 3).toPlainString());

        ExpiringLock racing = new ExpiringLock(store, clock, false, TetherMetrics.noOp());

        assertTrue(racing.tryAcquire(LOCK, TTL).isEmpty());
        verify(store, never()).expire(anyString(), eq(TTL));
    }

    @Test
    void heldLockIsNeverOverwritten() {
        CoordinationService store = mock(CoordinationService.class);
        when(store.setIfAbsent(eq(LOCK), anyString())).thenReturn(false);
        when(store.get(LOCK)).thenReturn(BigDecimal.valueOf(clock.millis() + 1000, 3).toPlainString());

        ExpiringLock blocked = new ExpiringLock(store, clock, false, TetherMetrics.noOp());

        assertTrue(blocked.tryAcquire(LOCK, TTL).isEmpty());
        verify(store, never()).getAndSet(anyString(), anyString());
    }

    @Test
    void successfulAcquisitionSetsTtl() {
        CoordinationService store = mock(CoordinationService.class);
        when(store.setIfAbsent(eq(LOCK), anyString())).thenReturn(true);

        new ExpiringLock(store, clock, false, TetherMetrics.noOp()).tryAcquire(LOCK, TTL);

        verify(store).expire(LOCK, TTL);
    }

    @Test
    void concurrentAttemptsOnFreshKeyHaveOneWinner() throws Exception {
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> outcomes = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            outcomes.add(pool.submit(() -> {
                start.await();
                return lock.tryAcquire(LOCK, TTL).isPresent();
            }));
        }
        start.countDown();

        int winners = 0;
        for (Future<Boolean> outcome : outcomes) {
            if (outcome.get(5, TimeUnit.SECONDS)) {
                winners++;
            }
        }
        pool.shutdown();

        assertEquals(1, winners);
    }

    @Test
    void releaseDeletesEvenAStolenLock() {
        LockHandle first = lock.tryAcquire(LOCK, TTL).orElseThrow();
        // the first holder overran its window; the key lost its TTL and was taken over
        coordination.getAndSet(LOCK, BigDecimal.valueOf(clock.millis() - 1, 3).toPlainString());
        LockHandle second = lock.tryAcquire(LOCK, TTL).orElseThrow();
        assertThat(second.expiry()).isEqualTo(coordination.get(LOCK));

        lock.release(first);

        assertThat(coordination.get(LOCK)).isNull();
    }

    @Test
    void ownerVerifiedReleaseLeavesAStolenLockAlone() {
        ExpiringLock verifying = new ExpiringLock(coordination, clock, true, TetherMetrics.noOp());
        LockHandle first = verifying.tryAcquire(LOCK, TTL).orElseThrow();
        coordination.getAndSet(LOCK, BigDecimal.valueOf(clock.millis() - 1, 3).toPlainString());
        clock.advance(Duration.ofMillis(10));
        LockHandle second = verifying.tryAcquire(LOCK, TTL).orElseThrow();

        verifying.release(first);
        assertEquals(second.expiry(), coordination.get(LOCK));

        verifying.release(second);
        assertThat(coordination.get(LOCK)).isNull();
    }

    @Test
    void releaseFreesTheLockForTheNextCaller() {
        LockHandle handle = lock.tryAcquire(LOCK, TTL).orElseThrow();
        lock.release(handle);

        assertFalse(lock.tryAcquire(LOCK, TTL).isEmpty());
    }
}
