package com.nayem.tether.core;

import com.nayem.tether.coordination.CoordinationService;
import com.nayem.tether.coordination.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Local stand-in for a remote {@link Actor}.
 * <p>
 * Every call publishes a {@link RequestEnvelope} on the actor's shared channel and returns a
 * future that a background listener completes once the matching {@link ResponseEnvelope}
 * arrives on this proxy's private reply channel. Calls are correlated independently and may
 * complete in any order.
 * </p>
 *
 * <h3>Method surface</h3>
 * A proxy cloned from a local actor takes the actor's public method names directly. A proxy
 * attached by id asks the actor with the internal {@code _get_methods} call. Either way the
 * names become a dispatch table of {@link ProxyMethod}s built once at construction; names
 * starting with {@code _} are never exposed.
 *
 * <h3>Timeouts</h3>
 * Without a call timeout a call whose response never arrives stays pending forever. With
 * one, the call completes with {@link TimeoutException} and its reply slot is released.
 */
public class ActorProxy implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ActorProxy.class);

    private final CoordinationService coordination;
    private final EnvelopeCodec codec;
    private final TetherMetrics metrics;
    private final ProxySettings settings;
    private final String proxyId;
    private final String actorId;
    private final PendingReplies pendingReplies = new PendingReplies();
    private final Subscription subscription;
    private final Thread listener;
    private final Map<String, ProxyMethod> methods;

    private volatile boolean running = true;

    private ActorProxy(Builder builder) {
        if ((builder.actor == null) == (builder.actorId == null)) {
            throw new ProxyConfigurationException("Provide either an actor to clone or an actor id, not "
                    + (builder.actor == null ? "neither" : "both"));
        }
        if (builder.coordination == null) {
            throw new ProxyConfigurationException("A coordination service is required");
        }

        this.coordination = builder.coordination;
        this.codec = builder.codec;
        this.metrics = builder.metrics;
        this.settings = builder.settings;
        this.actorId = builder.actor != null ? builder.actor.getId() : builder.actorId;
        this.proxyId = UUID.randomUUID().toString();

        this.subscription = coordination.subscribe(Channels.proxy(proxyId));
        this.listener = new Thread(this::listen, "tether-proxy-" + proxyId.substring(0, 8));
        this.listener.setDaemon(true);
        this.listener.start();

        try {
            Collection<String> names = builder.actor != null
                    ? builder.actor.publicMethodNames()
                    : discoverMethods();
            this.methods = buildDispatchTable(names);
        } catch (RuntimeException e) {
            close();
            throw e;
        }

        log.debug("Proxy {} attached to actor {} with methods {}", proxyId, actorId, methods.keySet());
    }

    public static Builder builder() {
        return new Builder();
    }

    private Map<String, ProxyMethod> buildDispatchTable(Collection<String> names) {
        Map<String, ProxyMethod> table = new LinkedHashMap<>();
        for (String name : names) {
            if (name.startsWith(Actor.INTERNAL_PREFIX)) {
                continue;
            }
            table.put(name, (args, kwargs) -> dispatch(name, args, kwargs));
        }
        return Collections.unmodifiableMap(table);
    }

    private Collection<String> discoverMethods() {
        Object names = awaitResult(dispatch(Actor.GET_METHODS, List.of(), Map.of()));
        if (!(names instanceof Collection<?> collection)) {
            throw new RemoteInvocationException(actorId, Actor.GET_METHODS + " returned " + names);
        }
        return collection.stream().map(String::valueOf).toList();
    }

    /**
     * Calls a proxied method with positional arguments.
     *
     * @throws IllegalArgumentException if the actor exposes no such method
     * @throws NoSuchActorException     if no actor is listening
     */
    public CompletableFuture<Object> call(String methodName, Object... args) {
        return method(methodName).invoke(args);
    }

    public CompletableFuture<Object> call(String methodName, List<Object> args, Map<String, Object> kwargs) {
        return method(methodName).call(args, kwargs);
    }

    public ProxyMethod method(String methodName) {
        ProxyMethod method = methods.get(methodName);
        if (method == null) {
            throw new IllegalArgumentException("Actor " + actorId + " exposes no method '" + methodName + "'");
        }
        return method;
    }

    public CompletableFuture<Object> dispatch(String methodName, List<Object> args, Map<String, Object> kwargs) {
        return dispatch(methodName, args, kwargs, settings.callTimeout());
    }

    /**
     * Publishes one request and returns the handle its response will complete.
     * <p>
     * The reply slot is registered before publishing so that a fast response cannot overtake
     * it. If the request reached no subscriber the slot is removed again and
     * {@link NoSuchActorException} is thrown, leaving the pending registry unchanged.
     * </p>
     *
     * @param timeout How long the handle may stay pending; null or non-positive waits forever
     */
    public CompletableFuture<Object> dispatch(String methodName, List<Object> args, Map<String, Object> kwargs,
            Duration timeout) {
        if (!running) {
            throw new IllegalStateException("Proxy " + proxyId + " is closed");
        }

        String replySlotId = UUID.randomUUID().toString();
        String payload = codec.encodeRequest(new RequestEnvelope(proxyId, replySlotId, methodName, args, kwargs));

        CompletableFuture<Object> reply = pendingReplies.register(replySlotId);
        if (!running) {
            // close() may have cancelled the pending slots before this one was registered
            pendingReplies.abandon(replySlotId);
            throw new IllegalStateException("Proxy " + proxyId + " is closed");
        }
        long receivers;
        try {
            receivers = coordination.publish(Channels.actor(actorId), payload);
        } catch (RuntimeException e) {
            pendingReplies.abandon(replySlotId);
            throw e;
        }

        if (receivers == 0) {
            pendingReplies.abandon(replySlotId);
            metrics.recordNoSuchActor();
            throw new NoSuchActorException(actorId);
        }

        metrics.recordCall();
        log.debug("Proxy {} sent {} to actor {} (slot {})", proxyId, methodName, actorId, replySlotId);

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            // the slot is released before the handle fails, so a late reply is simply dropped
            CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
                if (pendingReplies.abandon(replySlotId)) {
                    metrics.recordTimeout();
                    log.debug("Call {} on actor {} timed out after {}", methodName, actorId, timeout);
                    reply.completeExceptionally(new TimeoutException(
                            "No reply from actor " + actorId + " to " + methodName + " within " + timeout));
                }
            });
        }

        return reply;
    }

    private void listen() {
        while (running) {
            try {
                String message = subscription.poll(settings.pollTimeout());
                if (message != null) {
                    handleReply(message);
                }
                if (!settings.pollInterval().isZero()) {
                    TimeUnit.MILLISECONDS.sleep(settings.pollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error handling reply for proxy {}", proxyId, e);
            }
        }
        log.debug("Reply listener of proxy {} stopped", proxyId);
    }

    /**
     * Completes the pending call a response belongs to. Responses for unknown or
     * already resolved slots are dropped.
     */
    void handleReply(String payload) {
        ResponseEnvelope response;
        try {
            response = codec.decodeResponse(payload);
        } catch (EnvelopeCodecException e) {
            log.warn("Proxy {} dropped undecodable reply: {}", proxyId, e.getMessage());
            return;
        }

        CompletableFuture<Object> reply = pendingReplies.take(response.replySlotId());
        if (reply == null) {
            metrics.recordDroppedReply();
            log.debug("Proxy {} dropped reply for unknown slot {}", proxyId, response.replySlotId());
            return;
        }

        metrics.recordReply();
        if (response.isFailure()) {
            reply.completeExceptionally(new RemoteInvocationException(actorId, response.error()));
        } else {
            reply.complete(response.result());
        }
    }

    /**
     * Waits for a call handle without timeout and unwraps a failure into its cause.
     */
    public static Object awaitResult(CompletableFuture<Object> reply) {
        try {
            return reply.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    public Set<String> methodNames() {
        return methods.keySet();
    }

    public boolean hasMethod(String methodName) {
        return methods.containsKey(methodName);
    }

    public String getProxyId() {
        return proxyId;
    }

    public String getActorId() {
        return actorId;
    }

    public int getPendingReplyCount() {
        return pendingReplies.size();
    }

    boolean isPending(String replySlotId) {
        return pendingReplies.contains(replySlotId);
    }

    public boolean isClosed() {
        return !running;
    }

    /**
     * Stops the reply listener, closes the reply subscription and cancels pending calls.
     */
    @Override
    public void close() {
        if (!running) {
            return;
        }
        running = false;
        listener.interrupt();
        subscription.close();
        pendingReplies.cancelAll();
        log.debug("Proxy {} for actor {} closed", proxyId, actorId);
    }

    /**
     * Builder for creating an {@link ActorProxy}.
     */
    public static class Builder {
        private CoordinationService coordination;
        private EnvelopeCodec codec = new EnvelopeCodec();
        private TetherMetrics metrics = TetherMetrics.noOp();
        private ProxySettings settings = ProxySettings.defaults();
        private Actor actor;
        private String actorId;

        /**
         * Sets the coordination service requests and replies travel through. Required.
         */
        public Builder coordination(CoordinationService coordination) {
            this.coordination = coordination;
            return this;
        }

        public Builder codec(EnvelopeCodec codec) {
            this.codec = codec;
            return this;
        }

        public Builder metrics(TetherMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder settings(ProxySettings settings) {
            this.settings = settings;
            return this;
        }

        /**
         * Clones a local actor: no discovery round-trip is made.
         */
        public Builder actor(Actor actor) {
            this.actor = actor;
            return this;
        }

        /**
         * Attaches to a remote actor by id: the method surface is discovered over the channel.
         */
        public Builder actorId(String actorId) {
            this.actorId = actorId;
            return this;
        }

        /**
         * @throws ProxyConfigurationException if not exactly one of actor and actor id is set
         * @throws NoSuchActorException        if attaching by id and no actor is listening
         */
        public ActorProxy build() {
            return new ActorProxy(this);
        }
    }
}
