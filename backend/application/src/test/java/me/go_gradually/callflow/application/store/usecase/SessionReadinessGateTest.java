package me.go_gradually.callflow.application.store.usecase;

import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.support.FakeSessionStore;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class SessionReadinessGateTest {

    @Test
    void awaitReady_returnsImmediatelyOnceMarked() {
        FakeSessionStore store = new FakeSessionStore();
        SessionReadinessGate gate = new SessionReadinessGate(store, Duration.ofMillis(20));

        gate.markReady("call-1", Duration.ofMinutes(5));

        assertTrue(gate.awaitReady("call-1", Duration.ZERO));
        assertTrue(store.getFlag("call-1", SessionFlag.SESSION_READY));
    }

    @Test
    void awaitReady_wakesWhenMarkedOnThisWorker() throws Exception {
        SessionReadinessGate gate = new SessionReadinessGate(new FakeSessionStore(), Duration.ofSeconds(5));

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> gate.awaitReady("call-1", Duration.ofSeconds(5)));
        Thread.sleep(50);
        gate.markReady("call-1", Duration.ofMinutes(5));

        assertTrue(waiter.get(1, TimeUnit.SECONDS));
    }

    @Test
    void awaitReady_seesFlagWrittenByAnotherWorker() throws Exception {
        FakeSessionStore store = new FakeSessionStore();
        SessionReadinessGate gate = new SessionReadinessGate(store, Duration.ofMillis(20));

        CompletableFuture<Boolean> waiter = CompletableFuture.supplyAsync(() -> gate.awaitReady("call-1", Duration.ofSeconds(2)));
        Thread.sleep(50);
        store.setFlag("call-1", SessionFlag.SESSION_READY, Duration.ofMinutes(5));

        assertTrue(waiter.get(1, TimeUnit.SECONDS));
    }

    @Test
    void awaitReady_givesUpAfterTimeout() {
        SessionReadinessGate gate = new SessionReadinessGate(new FakeSessionStore(), Duration.ofMillis(20));

        long started = System.nanoTime();
        boolean ready = gate.awaitReady("call-1", Duration.ofMillis(100));
        long elapsedMs = Duration.ofNanos(System.nanoTime() - started).toMillis();

        assertFalse(ready);
        assertTrue(elapsedMs >= 90 && elapsedMs < 1000, "took " + elapsedMs + "ms");
    }
}
