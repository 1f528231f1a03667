package com.nayem.tether.coordination;

import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Subscription backed by an unbounded in-process queue. Whatever transport delivers
 * the channel's messages offers them here; the owner drains them with {@link #poll}.
 */
public class QueueSubscription implements Subscription {

    private final String channel;
    private final BlockingQueue<String> messages = new LinkedBlockingQueue<>();
    private final Consumer<QueueSubscription> onClose;
    private volatile boolean closed = false;

    public QueueSubscription(String channel, Consumer<QueueSubscription> onClose) {
        this.channel = channel;
        this.onClose = onClose;
    }

    @Override
    public String channel() {
        return channel;
    }

    /**
     * @return false if the subscription is already closed and the message was not buffered
     */
    public boolean offer(String payload) {
        if (closed) {
            return false;
        }
        return messages.offer(payload);
    }

    @Override
    public String poll(Duration timeout) throws InterruptedException {
        return messages.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public boolean isClosed() {
        return closed;
    }

    public int size() {
        return messages.size();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        messages.clear();
        onClose.accept(this);
    }
}
