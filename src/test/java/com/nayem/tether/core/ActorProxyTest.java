package com.nayem.tether.core;

import com.nayem.tether.coordination.InMemoryCoordinationService;
import com.nayem.tether.coordination.Subscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;

class ActorProxyTest {

    private InMemoryCoordinationService coordination;
    private ActorRuntime runtime;
    private EnvelopeCodec codec;
    private final List<AutoCloseable> resources = new ArrayList<>();

    @BeforeEach
    void setUp() {
        coordination = spy(new InMemoryCoordinationService());
        codec = new EnvelopeCodec();
        runtime = ActorRuntime.builder().coordination(coordination).codec(codec).build();
        resources.add(runtime);
    }

    @AfterEach
    void tearDown() throws Exception {
        for (AutoCloseable resource : resources) {
            resource.close();
        }
    }

    private ScriptedActor startedActor(String id) {
        ScriptedActor actor = new ScriptedActor(runtime, id)
                .with("ping", call -> "pong")
                .with("add", call -> ((Number) call.arg(0)).intValue() + ((Number) call.arg(1)).intValue())
                .with("greet", call -> "hello " + call.kwarg("name"))
                .with("fail", call -> {
                    throw new IllegalStateException("actor exploded");
                });
        actor.start();
        resources.add(actor);
        return actor;
    }

    /** An actor id with a raw subscription standing in for the actor. */
    private Subscription silentActor(String id) {
        Subscription subscription = coordination.subscribe(Channels.actor(id));
        resources.add(subscription);
        return subscription;
    }

    private ActorProxy cloneOf(String id, String... methods) {
        ScriptedActor actor = new ScriptedActor(runtime, id);
        for (String method : methods) {
            actor.with(method, call -> null);
        }
        ActorProxy proxy = runtime.proxyOf(actor);
        resources.add(proxy);
        return proxy;
    }

    @Test
    void pingResolvesToPong() throws Exception {
        startedActor("a1");
        ActorProxy proxy = runtime.attach("a1");

        Object result = proxy.call("ping").get(5, TimeUnit.SECONDS);

        assertEquals("pong", result);

        ArgumentCaptor<String> payloads = ArgumentCaptor.forClass(String.class);
        verify(coordination, atLeastOnce()).publish(eq("actor:a1"), payloads.capture());
        RequestEnvelope request = codec.decodeRequest(payloads.getValue());
        assertEquals("ping", request.methodName());
        assertEquals(proxy.getProxyId(), request.senderProxyId());

        verify(coordination, atLeastOnce()).publish(eq("proxy:" + proxy.getProxyId()), payloads.capture());
        ResponseEnvelope response = codec.decodeResponse(payloads.getValue());
        assertEquals(request.replySlotId(), response.replySlotId());
        assertEquals("pong", response.result());
        assertEquals(0, proxy.getPendingReplyCount());
    }

    @Test
    void clonedAndAttachedProxiesExposeSameMethods() {
        ScriptedActor actor = startedActor("same-surface");

        ActorProxy cloned = runtime.proxyOf(actor);
        resources.add(cloned);
        ActorProxy attached = runtime.attach("same-surface");

        assertEquals(Set.of("ping", "add", "greet", "fail"), cloned.methodNames());
        assertEquals(cloned.methodNames(), attached.methodNames());
        assertFalse(attached.hasMethod(Actor.GET_METHODS));
    }

    @Test
    void argumentsAndKeywordArgumentsReachTheActor() throws Exception {
        startedActor("args");
        ActorProxy proxy = runtime.attach("args");

        assertEquals(5, proxy.call("add", 2, 3).get(5, TimeUnit.SECONDS));
        assertEquals("hello ada", proxy.call("greet", List.of(), Map.of("name", "ada")).get(5, TimeUnit.SECONDS));
    }

    @Test
    void actorFailureCompletesCallExceptionally() {
        startedActor("failing");
        ActorProxy proxy = runtime.attach("failing");

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> proxy.call("fail").get(5, TimeUnit.SECONDS));
        assertThat(error.getCause())
                .isInstanceOf(RemoteInvocationException.class)
                .hasMessageContaining("actor exploded");
    }

    @Test
    void unknownMethodIsRejectedLocally() {
        ActorProxy proxy = cloneOf("local", "ping");

        assertThatThrownBy(() -> proxy.call("missing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void callWithoutListeningActorFailsBeforeRegisteringSlot() {
        ActorProxy proxy = cloneOf("nobody-home", "ping");

        assertThrows(NoSuchActorException.class, () -> proxy.call("ping"));
        assertEquals(0, proxy.getPendingReplyCount());
    }

    @Test
    void attachingToMissingActorFails() {
        NoSuchActorException error = assertThrows(NoSuchActorException.class, () -> runtime.attach("ghost"));
        assertEquals("ghost", error.getActorId());
        assertEquals(0, runtime.getAttachedProxyCount());
    }

    @Test
    void proxyNeedsExactlyOneOfActorAndId() {
        ScriptedActor actor = new ScriptedActor(runtime, "x");

        assertThrows(ProxyConfigurationException.class,
                () -> ActorProxy.builder().coordination(coordination).build());
        assertThrows(ProxyConfigurationException.class,
                () -> ActorProxy.builder().coordination(coordination).actor(actor).actorId("x").build());
    }

    @Test
    void eachCallGetsItsOwnReplySlot() throws Exception {
        Subscription actorChannel = silentActor("busy");
        ActorProxy proxy = cloneOf("busy", "work");

        int calls = 20;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<CompletableFuture<Object>>> handles = new ArrayList<>();
        for (int i = 0; i < calls; i++) {
            handles.add(pool.submit(() -> proxy.call("work")));
        }
        for (Future<CompletableFuture<Object>> handle : handles) {
            handle.get(5, TimeUnit.SECONDS);
        }
        pool.shutdown();

        Set<String> slots = new HashSet<>();
        for (int i = 0; i < calls; i++) {
            RequestEnvelope request = codec.decodeRequest(actorChannel.poll(Duration.ofSeconds(1)));
            assertEquals("work", request.methodName());
            slots.add(request.replySlotId());
        }
        assertEquals(calls, slots.size());
        assertEquals(calls, proxy.getPendingReplyCount());
    }

    @Test
    void responseIsDeliveredOnceAndDuplicatesAreDropped() throws Exception {
        Subscription actorChannel = silentActor("manual");
        ActorProxy proxy = cloneOf("manual", "work");

        CompletableFuture<Object> reply = proxy.call("work");
        RequestEnvelope request = codec.decodeRequest(actorChannel.poll(Duration.ofSeconds(1)));
        assertTrue(proxy.isPending(request.replySlotId()));

        String response = codec.encodeResponse(ResponseEnvelope.success(request.replySlotId(), List.of(1, "two")));
        proxy.handleReply(response);
        proxy.handleReply(codec.encodeResponse(ResponseEnvelope.success(request.replySlotId(), "again")));

        assertEquals(List.of(1, "two"), reply.get(1, TimeUnit.SECONDS));
        assertFalse(proxy.isPending(request.replySlotId()));
        assertEquals(0, proxy.getPendingReplyCount());
    }

    @Test
    void responsesMayCompleteOutOfOrder() throws Exception {
        Subscription actorChannel = silentActor("unordered");
        ActorProxy proxy = cloneOf("unordered", "work");

        CompletableFuture<Object> first = proxy.call("work");
        CompletableFuture<Object> second = proxy.call("work");
        RequestEnvelope firstRequest = codec.decodeRequest(actorChannel.poll(Duration.ofSeconds(1)));
        RequestEnvelope secondRequest = codec.decodeRequest(actorChannel.poll(Duration.ofSeconds(1)));

        coordination.publish(Channels.proxy(proxy.getProxyId()),
                codec.encodeResponse(ResponseEnvelope.success(secondRequest.replySlotId(), "second")));
        assertEquals("second", second.get(5, TimeUnit.SECONDS));
        assertFalse(first.isDone());

        coordination.publish(Channels.proxy(proxy.getProxyId()),
                codec.encodeResponse(ResponseEnvelope.success(firstRequest.replySlotId(), "first")));
        assertEquals("first", first.get(5, TimeUnit.SECONDS));
    }

    @Test
    void undecodableReplyIsIgnored() {
        silentActor("noisy");
        ActorProxy proxy = cloneOf("noisy", "work");
        CompletableFuture<Object> reply = proxy.call("work");

        proxy.handleReply("not json");

        assertFalse(reply.isDone());
        assertEquals(1, proxy.getPendingReplyCount());
    }

    @Test
    void timedOutCallReleasesItsSlot() {
        silentActor("slow");
        ActorProxy proxy = cloneOf("slow", "work");

        CompletableFuture<Object> reply = proxy.dispatch("work", List.of(), Map.of(), Duration.ofMillis(100));

        ExecutionException error = assertThrows(ExecutionException.class, () -> reply.get(5, TimeUnit.SECONDS));
        assertThat(error.getCause()).isInstanceOf(TimeoutException.class);
        assertEquals(0, proxy.getPendingReplyCount());
    }

    @Test
    void callWithoutTimeoutStaysPending() throws Exception {
        silentActor("forever");
        ActorProxy proxy = cloneOf("forever", "work");

        CompletableFuture<Object> reply = proxy.call("work");
        Thread.sleep(200);

        assertFalse(reply.isDone());
        assertEquals(1, proxy.getPendingReplyCount());
    }

    @Test
    void closingCancelsPendingCallsAndUnsubscribes() {
        silentActor("closing");
        ActorProxy proxy = cloneOf("closing", "work");
        CompletableFuture<Object> reply = proxy.call("work");

        proxy.close();

        assertTrue(reply.isCancelled());
        assertTrue(proxy.isClosed());
        assertEquals(0, coordination.subscriberCount(Channels.proxy(proxy.getProxyId())));
        assertThrows(IllegalStateException.class, () -> proxy.call("work"));
    }

    @Test
    void attachedProxiesAreCachedPerActor() {
        startedActor("cached");

        ActorProxy first = runtime.attach("cached");
        ActorProxy second = runtime.attach("cached");

        assertSame(first, second);
        first.close();
        assertNotSame(first, runtime.attach("cached"));
    }

    @Test
    void callRacingCloseLeavesNoPendingSlot() throws Exception {
        silentActor("racing");
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            for (int i = 0; i < 50; i++) {
                ActorProxy proxy = cloneOf("racing", "work");
                CountDownLatch go = new CountDownLatch(1);
                Future<CompletableFuture<Object>> call = pool.submit(() -> {
                    go.await();
                    try {
                        return proxy.call("work");
                    } catch (IllegalStateException closed) {
                        return null;
                    }
                });

                go.countDown();
                proxy.close();

                CompletableFuture<Object> reply = call.get(5, TimeUnit.SECONDS);
                if (reply != null) {
                    assertTrue(reply.isCancelled());
                }
                assertEquals(0, proxy.getPendingReplyCount());
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void slowDiscoveryDoesNotBlockOtherAttachments() throws Exception {
        Subscription muteActor = silentActor("mute");
        startedActor("lively");
        ActorRuntime impatient = ActorRuntime.builder()
                .coordination(coordination)
                .codec(codec)
                .proxySettings(ProxySettings.defaults().withCallTimeout(Duration.ofMillis(500)))
                .build();
        resources.add(impatient);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ActorProxy> muted = pool.submit(() -> impatient.attach("mute"));
            assertNotNull(muteActor.poll(Duration.ofSeconds(2)));

            ActorProxy lively = assertTimeoutPreemptively(Duration.ofMillis(400), () -> impatient.attach("lively"));
            assertTrue(lively.hasMethod("ping"));

            ExecutionException error = assertThrows(ExecutionException.class, () -> muted.get(5, TimeUnit.SECONDS));
            assertThat(error).hasRootCauseInstanceOf(TimeoutException.class);
            assertEquals(1, impatient.getAttachedProxyCount());
        } finally {
            pool.shutdownNow();
        }
    }
}
