package com.nayem.tether.core;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Micrometer counters for proxy traffic and distributed lock outcomes.
 * All recorders are no-ops when no registry is available.
 */
public class TetherMetrics {

    private final Counter callCounter;
    private final Counter replyCounter;
    private final Counter droppedReplyCounter;
    private final Counter noSuchActorCounter;
    private final Counter timeoutCounter;
    private final Counter lockAcquiredCounter;
    private final Counter lockVetoedCounter;
    private final Counter lockStolenCounter;

    public TetherMetrics(MeterRegistry registry) {
        if (registry != null) {
            this.callCounter = Counter.builder("tether.proxy.calls")
                    .description("Requests published by proxies")
                    .register(registry);

            this.replyCounter = Counter.builder("tether.proxy.replies")
                    .description("Responses correlated to a pending call")
                    .register(registry);

            this.droppedReplyCounter = Counter.builder("tether.proxy.replies.dropped")
                    .description("Responses for unknown or already resolved reply slots")
                    .register(registry);

            this.noSuchActorCounter = Counter.builder("tether.proxy.no_such_actor")
                    .description("Requests that reached no actor")
                    .register(registry);

            this.timeoutCounter = Counter.builder("tether.proxy.timeouts")
                    .description("Calls abandoned after their timeout")
                    .register(registry);

            this.lockAcquiredCounter = Counter.builder("tether.lock.acquired")
                    .description("Successful distributed lock acquisitions")
                    .register(registry);

            this.lockVetoedCounter = Counter.builder("tether.lock.vetoed")
                    .description("Acquisitions refused because the lock was held")
                    .register(registry);

            this.lockStolenCounter = Counter.builder("tether.lock.stolen")
                    .description("Acquisitions that took over an expired lock")
                    .register(registry);
        } else {
            this.callCounter = null;
            this.replyCounter = null;
            this.droppedReplyCounter = null;
            this.noSuchActorCounter = null;
            this.timeoutCounter = null;
            this.lockAcquiredCounter = null;
            this.lockVetoedCounter = null;
            this.lockStolenCounter = null;
        }
    }

    public void recordCall() {
        increment(callCounter);
    }

    public void recordReply() {
        increment(replyCounter);
    }

    public void recordDroppedReply() {
        increment(droppedReplyCounter);
    }

    public void recordNoSuchActor() {
        increment(noSuchActorCounter);
    }

    public void recordTimeout() {
        increment(timeoutCounter);
    }

    public void recordLockAcquired() {
        increment(lockAcquiredCounter);
    }

    public void recordLockVetoed() {
        increment(lockVetoedCounter);
    }

    public void recordLockStolen() {
        increment(lockStolenCounter);
    }

    private static void increment(Counter counter) {
        if (counter != null) {
            counter.increment();
        }
    }

    public static TetherMetrics noOp() {
        return new TetherMetrics(null);
    }
}
