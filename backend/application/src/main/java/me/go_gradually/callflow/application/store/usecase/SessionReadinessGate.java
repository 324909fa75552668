package me.go_gradually.callflow.application.store.usecase;

import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Explicit "session ready" signal. Waiters on the creating worker are woken directly;
 * waiters elsewhere see the shared flag on their next recheck.
 */
public class SessionReadinessGate {
    private static final Logger log = Logger.getLogger(SessionReadinessGate.class.getName());

    private final SharedSessionStorePort store;
    private final Duration recheckInterval;
    private final Map<String, CompletableFuture<Void>> signals = new ConcurrentHashMap<>();

    public SessionReadinessGate(SharedSessionStorePort store, Duration recheckInterval) {
        this.store = store;
        this.recheckInterval = recheckInterval == null || recheckInterval.isNegative() || recheckInterval.isZero()
                ? Duration.ofMillis(100)
                : recheckInterval;
    }

    public void markReady(String callId, Duration ttl) {
        store.setFlag(callId, SessionFlag.SESSION_READY, ttl);
        signal(callId).complete(null);
    }

    public boolean isReady(String callId) {
        CompletableFuture<Void> signal = signals.get(callId);
        return (signal != null && signal.isDone()) || store.getFlag(callId, SessionFlag.SESSION_READY);
    }

    public boolean awaitReady(String callId, Duration timeout) {
        if (isReady(callId)) {
            return true;
        }
        CompletableFuture<Void> signal = signal(callId);
        long deadline = System.nanoTime() + Math.max(0L, timeout.toNanos());
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                boolean ready = store.getFlag(callId, SessionFlag.SESSION_READY);
                if (!ready) {
                    log.warning(() -> "session.ready.timeout callId=" + callId + " waitedMs=" + timeout.toMillis());
                }
                return ready;
            }
            try {
                signal.get(Math.min(remaining, recheckInterval.toNanos()), TimeUnit.NANOSECONDS);
                return true;
            } catch (TimeoutException e) {
                if (store.getFlag(callId, SessionFlag.SESSION_READY)) {
                    return true;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            } catch (ExecutionException e) {
                return false;
            }
        }
    }

    public void forget(String callId) {
        CompletableFuture<Void> signal = signals.remove(callId);
        if (signal != null && !signal.isDone()) {
            signal.cancel(false);
        }
    }

    private CompletableFuture<Void> signal(String callId) {
        return signals.computeIfAbsent(callId, key -> new CompletableFuture<>());
    }
}
