package me.go_gradually.callflow.application.stream.port;

public interface SpeechSynthesisGateway {
    SynthesisStream open(String callId) throws Exception;
}
