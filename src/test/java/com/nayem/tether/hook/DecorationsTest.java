package com.nayem.tether.hook;

import com.nayem.tether.coordination.InMemoryCoordinationService;
import com.nayem.tether.core.ActorRuntime;
import com.nayem.tether.core.Invocation;
import com.nayem.tether.core.ScriptedActor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

class DecorationsTest {

    private InMemoryCoordinationService coordination;
    private ActorRuntime runtime;
    private ScriptedActor actor;

    @BeforeEach
    void setUp() {
        coordination = new InMemoryCoordinationService();
        runtime = ActorRuntime.builder().coordination(coordination).build();
        actor = new ScriptedActor(runtime);
    }

    @AfterEach
    void tearDown() {
        actor.close();
        runtime.close();
    }

    @Test
    void blockingOnlyAddsTheTag() {
        DecoratedMethod method = Decorations.blocking(call -> "done");

        assertThat(method.getDecorations()).containsExactly(Decorations.BLOCKING);
        assertThat(method.getBefore()).isEmpty();
        assertThat(method.getAfter()).isEmpty();
    }

    @Test
    void decoratorsComposeIntoOnePipeline() {
        DecoratedMethod method = Decorations.blocking(Decorations.singular(call -> "done"));

        assertThat(method.getDecorations()).containsExactlyInAnyOrder(Decorations.BLOCKING, Decorations.SINGULAR);
        assertThat(method.getBefore()).hasSize(1);
        assertThat(method.getAfter()).hasSize(1);
    }

    @Test
    void singularRunsAndReleasesWhenLockIsFree() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        DecoratedMethod incr = Decorations.singular(call -> runs.incrementAndGet());

        assertEquals(1, incr.invoke(Invocation.of(actor, "incr")));
        assertEquals(2, incr.invoke(Invocation.of(actor, "incr")));
        assertThat(coordination.get("global.lock:incr")).isNull();
    }

    @Test
    void singularVetoesWhileAnotherHolderHasTheLock() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        DecoratedMethod incr = Decorations.singular(call -> runs.incrementAndGet());

        runtime.getDistributedLock().tryAcquire("global.lock:incr", Duration.ofSeconds(2));

        assertEquals(Decorations.VETOED, incr.invoke(Invocation.of(actor, "incr")));
        assertEquals(0, runs.get());
        assertThat(coordination.get("global.lock:incr")).isNotNull();
    }

    @Test
    void singularUsesExplicitContext() throws Exception {
        DecoratedMethod method = Decorations.singular(call -> {
            assertThat(coordination.get("billing:charge")).isNotNull();
            return "charged";
        }, "billing", Duration.ofSeconds(5));

        assertEquals("charged", method.invoke(Invocation.of(actor, "charge", List.of(), Map.of())));
        assertThat(coordination.get("billing:charge")).isNull();
    }

    @Test
    void singularKeepsLockWhenBaseThrows() {
        DecoratedMethod method = Decorations.singular(call -> {
            throw new IllegalStateException("failed");
        });

        assertThatThrownBy(() -> method.invoke(Invocation.of(actor, "explode")))
                .isInstanceOf(IllegalStateException.class);
        assertThat(coordination.get("global.lock:explode")).isNotNull();
    }

    @Test
    void singularNeedsAnActor() {
        DecoratedMethod method = Decorations.singular(call -> "x");

        assertThatThrownBy(() -> method.invoke(Invocation.of(null, "orphan")))
                .isInstanceOf(IllegalStateException.class);
    }
}
