package me.go_gradually.callflow.presentation.call.controller;

import jakarta.validation.Valid;
import me.go_gradually.callflow.application.call.model.CallSnapshot;
import me.go_gradually.callflow.application.call.model.TranscriptCommand;
import me.go_gradually.callflow.application.call.usecase.SessionOrchestrator;
import me.go_gradually.callflow.presentation.call.dto.CallSnapshotResponse;
import me.go_gradually.callflow.presentation.call.dto.TranscriptRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/calls")
public class CallController {
    private final SessionOrchestrator sessionOrchestrator;

    public CallController(SessionOrchestrator sessionOrchestrator) {
        this.sessionOrchestrator = sessionOrchestrator;
    }

    @PostMapping("/{callId}/transcripts")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public void transcript(@PathVariable("callId") String callId,
                           @Valid @RequestBody TranscriptRequest request) {
        TranscriptCommand command = new TranscriptCommand();
        command.setCallId(callId);
        command.setText(request.getText());
        command.setFinalTranscript(request.getIsFinal());
        command.setTimestamp(request.getTimestamp());
        sessionOrchestrator.onTranscript(command);
    }

    @GetMapping("/{callId}")
    public CallSnapshotResponse snapshot(@PathVariable("callId") String callId) {
        return toResponse(sessionOrchestrator.snapshot(callId));
    }

    @PostMapping("/{callId}/hangup")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void hangup(@PathVariable("callId") String callId) {
        sessionOrchestrator.hangup(callId);
    }

    private CallSnapshotResponse toResponse(CallSnapshot snapshot) {
        CallSnapshotResponse response = new CallSnapshotResponse();
        response.setCallId(snapshot.callId());
        response.setAgentId(snapshot.agentId());
        response.setCurrentNodeId(snapshot.currentNodeId());
        response.setActivePlaybackCount(snapshot.activePlaybackCount());
        response.setAgentSpeaking(snapshot.agentSpeaking());
        response.setUserSpeaking(snapshot.userSpeaking());
        response.setCheckinCount(snapshot.checkinCount());
        response.setSilenceStartedAt(snapshot.silenceStartedAt());
        response.setVariables(snapshot.variables());
        response.setEnded(snapshot.ended());
        response.setEndReason(snapshot.endReason());
        return response;
    }
}
