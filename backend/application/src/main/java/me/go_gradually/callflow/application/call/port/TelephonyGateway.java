package me.go_gradually.callflow.application.call.port;

import java.util.List;

public interface TelephonyGateway {
    /**
     * Starts playback of synthesized audio and returns the provider playback id.
     */
    String startPlayback(String callId, byte[] audio, String mimeType) throws Exception;

    /**
     * Stops the given playbacks, or everything on the call when the list is empty.
     */
    void stopPlayback(String callId, List<String> playbackIds) throws Exception;

    void hangup(String callId) throws Exception;

    void transfer(String callId, String destination) throws Exception;
}
