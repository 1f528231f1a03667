package com.nayem.tether.core;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reply slots of one proxy that still wait for their response.
 * <p>
 * Written by calling threads (register, abandon) and by the reply listener (take).
 * A slot can be taken at most once, so a duplicate response finds nothing.
 * </p>
 */
class PendingReplies {

    private final ConcurrentHashMap<String, CompletableFuture<Object>> slots = new ConcurrentHashMap<>();

    CompletableFuture<Object> register(String replySlotId) {
        CompletableFuture<Object> reply = new CompletableFuture<>();
        if (slots.putIfAbsent(replySlotId, reply) != null) {
            throw new IllegalStateException("Reply slot already pending: " + replySlotId);
        }
        return reply;
    }

    /**
     * Removes the slot and returns its handle, or null if the slot is unknown or resolved.
     */
    CompletableFuture<Object> take(String replySlotId) {
        return slots.remove(replySlotId);
    }

    boolean abandon(String replySlotId) {
        return slots.remove(replySlotId) != null;
    }

    boolean contains(String replySlotId) {
        return slots.containsKey(replySlotId);
    }

    int size() {
        return slots.size();
    }

    void cancelAll() {
        slots.keySet().forEach(slot -> {
            CompletableFuture<Object> reply = slots.remove(slot);
            if (reply != null) {
                reply.cancel(false);
            }
        });
    }
}
