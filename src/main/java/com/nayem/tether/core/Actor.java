package com.nayem.tether.core;

import com.nayem.tether.coordination.Subscription;
import com.nayem.tether.hook.DecoratedMethod;
import com.nayem.tether.hook.Decorations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Base class for addressable objects whose methods can be called remotely.
 * <p>
 * Subclasses register their methods in the constructor; the registered names form the
 * actor's public surface. Once {@link #start() started}, the actor listens on
 * {@code actor:<id>}, runs every request through the method's hook pipeline on its own
 * executor and publishes the result on the caller's reply channel.
 * </p>
 *
 * <h3>Usage Example</h3>
 *
 * <pre>{@code
 * public class CounterActor extends Actor {
 *     private final AtomicInteger count = new AtomicInteger();
 *
 *     public CounterActor(ActorRuntime runtime) {
 *         super(runtime);
 *         register("ping", call -> "pong");
 *         register("incr", Decorations.singular(call -> count.incrementAndGet()));
 *         register("total", Decorations.blocking(call -> count.get()));
 *     }
 * }
 * }</pre>
 */
public abstract class Actor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Actor.class);

    /** Names starting with this marker are internal and never proxied. */
    public static final String INTERNAL_PREFIX = "_";

    /** Internal method answering the list of public method names. */
    public static final String GET_METHODS = "_get_methods";

    private final String id;
    private final ActorRuntime runtime;
    private final Map<String, ActorMethod> methods = new ConcurrentHashMap<>();
    private final ExecutorService executor;

    private volatile boolean running = false;
    private volatile Subscription subscription;
    private volatile Thread listener;
    private volatile ActorProxy selfProxy;

    protected Actor(ActorRuntime runtime) {
        this(runtime, UUID.randomUUID().toString());
    }

    protected Actor(ActorRuntime runtime, String id) {
        this.runtime = runtime;
        this.id = id;
        this.methods.put(GET_METHODS, call -> new ArrayList<>(publicMethodNames()));

        AtomicInteger threadCount = new AtomicInteger();
        String prefix = runtime.getThreadNamePrefix();
        this.executor = Executors.newCachedThreadPool(task -> {
            Thread thread = new Thread(task, prefix + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Adds a method to the dispatch table.
     *
     * @throws IllegalArgumentException if the name starts with the internal marker
     */
    protected final void register(String name, ActorMethod method) {
        if (name.startsWith(INTERNAL_PREFIX)) {
            throw new IllegalArgumentException("Method names starting with '" + INTERNAL_PREFIX + "' are reserved: " + name);
        }
        methods.put(name, method);
    }

    public Set<String> publicMethodNames() {
        Set<String> names = new TreeSet<>();
        for (String name : methods.keySet()) {
            if (!name.startsWith(INTERNAL_PREFIX)) {
                names.add(name);
            }
        }
        return names;
    }

    public Optional<ActorMethod> getMethod(String name) {
        return Optional.ofNullable(methods.get(name));
    }

    public boolean hasDecoration(String methodName, String decoration) {
        return methods.get(methodName) instanceof DecoratedMethod decorated && decorated.hasDecoration(decoration);
    }

    /**
     * Runs a method in the calling thread through its hook pipeline.
     *
     * @throws IllegalArgumentException if no such method is registered
     */
    public Object invoke(String methodName, List<Object> args, Map<String, Object> kwargs) throws Exception {
        ActorMethod method = methods.get(methodName);
        if (method == null) {
            throw new IllegalArgumentException("Actor " + id + " has no method '" + methodName + "'");
        }
        return method.invoke(Invocation.of(this, methodName, args, kwargs));
    }

    /**
     * Subscribes to the actor channel and starts serving requests.
     *
     * @return this actor
     */
    public synchronized Actor start() {
        if (running) {
            return this;
        }
        running = true;
        subscription = runtime.getCoordination().subscribe(Channels.actor(id));
        listener = new Thread(this::listen, "tether-actor-listener-" + id);
        listener.setDaemon(true);
        listener.start();
        log.info("Actor {} ({}) started with methods {}", id, getClass().getSimpleName(), publicMethodNames());
        return this;
    }

    /**
     * Calls one of this actor's methods the way a remote caller would, through the actor's
     * own proxy. Methods tagged {@code blocking} wait for and return the result; all other
     * methods return the unresolved {@link CompletableFuture}.
     */
    public Object send(String methodName, Object... args) {
        CompletableFuture<Object> reply = proxy().call(methodName, args);
        if (hasDecoration(methodName, Decorations.BLOCKING)) {
            return ActorProxy.awaitResult(reply);
        }
        return reply;
    }

    /**
     * @return a proxy cloned from this actor, created on first use
     */
    public ActorProxy proxy() {
        ActorProxy proxy = selfProxy;
        if (proxy == null) {
            synchronized (this) {
                if (selfProxy == null) {
                    selfProxy = runtime.proxyOf(this);
                }
                proxy = selfProxy;
            }
        }
        return proxy;
    }

    private void listen() {
        while (running) {
            try {
                String message = subscription.poll(runtime.getProxySettings().pollTimeout());
                if (message != null) {
                    handleRequest(message);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error receiving request for actor {}", id, e);
            }
        }
        log.debug("Request listener of actor {} stopped", id);
    }

    private void handleRequest(String payload) {
        RequestEnvelope request;
        try {
            request = runtime.getCodec().decodeRequest(payload);
        } catch (EnvelopeCodecException e) {
            log.warn("Actor {} dropped undecodable request: {}", id, e.getMessage());
            return;
        }

        executor.execute(() -> {
            ResponseEnvelope response;
            try {
                Object result = invoke(request.methodName(), request.args(), request.kwargs());
                response = ResponseEnvelope.success(request.replySlotId(), result);
            } catch (Exception e) {
                log.warn("Actor {} failed to run {}: {}", id, request.methodName(), e.toString());
                response = ResponseEnvelope.failure(request.replySlotId(),
                        e.getMessage() != null ? e.getMessage() : e.getClass().getName());
            }
            reply(request, response);
        });
    }

    private void reply(RequestEnvelope request, ResponseEnvelope response) {
        String payload;
        try {
            payload = runtime.getCodec().encodeResponse(response);
        } catch (EnvelopeCodecException e) {
            log.error("Actor {} could not encode the result of {}", id, request.methodName(), e);
            payload = runtime.getCodec().encodeResponse(ResponseEnvelope.failure(request.replySlotId(),
                    "Result of " + request.methodName() + " could not be encoded: " + e.getMessage()));
        }

        try {
            long receivers = runtime.getCoordination().publish(Channels.proxy(request.senderProxyId()), payload);
            if (receivers == 0) {
                log.debug("Reply to proxy {} for {} found no listener", request.senderProxyId(),
                        request.methodName());
            }
        } catch (RuntimeException e) {
            log.error("Actor {} failed to publish the reply to {} for proxy {}", id, request.methodName(),
                    request.senderProxyId(), e);
        }
    }

    public String getId() {
        return id;
    }

    public ActorRuntime getRuntime() {
        return runtime;
    }

    public boolean isRunning() {
        return running;
    }

    @Override
    public synchronized void close() {
        if (executor.isShutdown()) {
            return;
        }
        running = false;
        if (listener != null) {
            listener.interrupt();
            listener = null;
        }
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
        if (selfProxy != null) {
            selfProxy.close();
            selfProxy = null;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Actor {} executor did not terminate within 5 seconds, forcing shutdown", id);
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("Actor {} stopped", id);
    }
}
