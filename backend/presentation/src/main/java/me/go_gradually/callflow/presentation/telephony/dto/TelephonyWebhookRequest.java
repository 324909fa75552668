package me.go_gradually.callflow.presentation.telephony.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

/**
 * Telnyx call control envelope. Only the fields the call engine reads are mapped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TelephonyWebhookRequest {
    @Valid
    @NotNull
    private Data data;

    public Data getData() {
        return data;
    }

    public void setData(Data data) {
        this.data = data;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Data {
        private String id;
        @NotBlank
        @JsonProperty("event_type")
        private String eventType;
        @Valid
        @NotNull
        private Payload payload;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getEventType() {
            return eventType;
        }

        public void setEventType(String eventType) {
            this.eventType = eventType;
        }

        public Payload getPayload() {
            return payload;
        }

        public void setPayload(Payload payload) {
            this.payload = payload;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        @NotBlank
        @JsonProperty("call_control_id")
        private String callControlId;
        @JsonProperty("playback_id")
        private String playbackId;
        @JsonProperty("client_state")
        private String clientState;

        public String getCallControlId() {
            return callControlId;
        }

        public void setCallControlId(String callControlId) {
            this.callControlId = callControlId;
        }

        public String getPlaybackId() {
            return playbackId;
        }

        public void setPlaybackId(String playbackId) {
            this.playbackId = playbackId;
        }

        public String getClientState() {
            return clientState;
        }

        public void setClientState(String clientState) {
            this.clientState = clientState;
        }
    }
}
