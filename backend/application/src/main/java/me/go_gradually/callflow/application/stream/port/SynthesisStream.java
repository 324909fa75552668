package me.go_gradually.callflow.application.stream.port;

import java.time.Duration;

public interface SynthesisStream extends AutoCloseable {
    byte[] synthesize(String text, boolean first, boolean last, Duration timeout) throws Exception;

    String mimeType();

    void cancelPending();

    void keepAlive();

    boolean isOpen();

    @Override
    void close();
}
