package me.go_gradually.callflow.application.shared.port;

public interface AsyncExecutor {
    void execute(Runnable task);
}
