package me.go_gradually.callflow.application.shared.port;

import java.time.Duration;

public interface TickScheduler {
    ScheduledTick scheduleAtFixedRate(Runnable task, Duration period);

    interface ScheduledTick {
        void cancel();
    }
}
