package me.go_gradually.callflow.infrastructure.shared.scheduling;

import me.go_gradually.callflow.application.shared.port.TickScheduler;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs periodic call ticks on a shared scheduled pool. A failing task is logged and keeps its schedule.
 */
public class ScheduledTickScheduler implements TickScheduler {
    private static final Logger log = Logger.getLogger(ScheduledTickScheduler.class.getName());

    private final ScheduledExecutorService executor;

    public ScheduledTickScheduler(ScheduledExecutorService executor) {
        this.executor = executor;
    }

    @Override
    public ScheduledTick scheduleAtFixedRate(Runnable task, Duration period) {
        long periodMs = Math.max(1L, period.toMillis());
        ScheduledFuture<?> future = executor.scheduleAtFixedRate(() -> runSafely(task), periodMs, periodMs, TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    private void runSafely(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "tick.failed", e);
        }
    }
}
