package me.go_gradually.callflow.domain.call;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of one live call. Every mutator is synchronized on the session, which serializes
 * transcript handling, silence ticks and playback callbacks for the same call.
 */
public class CallSession {
    private static final int RECENT_AGENT_TEXT_MAX = 5;
    private static final int EARLY_END_MAX = 32;

    private final CallId callId;
    private final String agentId;
    private final Instant callStartedAt;
    private final int historyLimit;
    private final Map<String, String> sessionVariables = new LinkedHashMap<>();
    private final Deque<ConversationTurn> conversationHistory = new ArrayDeque<>();
    private final Deque<String> recentAgentTexts = new ArrayDeque<>();
    private final Map<String, PlaybackUnit> activePlaybacks = new LinkedHashMap<>();
    private final Set<String> endedBeforeRegistration = new HashSet<>();

    private String currentNodeId;
    private int activePlaybackCount;
    private boolean userSpeaking;
    private Instant silenceStartedAt;
    private int checkinCount;
    private boolean lastUtteranceWasCheckin;
    private Instant lastCheckinAt;
    private Instant maxCheckinsReachedAt;
    private boolean checkinInProgress;
    private boolean holdOnRequested;
    private boolean generatingResponse;
    private boolean executingWebhook;
    private boolean userHasSpoken;
    private String contentDispatchedForNode;
    private String lastAgentText = "";
    private Instant agentExpectedQuietAt;
    private Instant currentPlaybackStartedAt;
    private long turnEpoch;
    private boolean shouldEndCall;
    private CallEndReason endReason;

    public CallSession(CallId callId, String agentId, Instant callStartedAt, int historyLimit) {
        if (callId == null) {
            throw new IllegalArgumentException("CallId is required");
        }
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (callStartedAt == null) {
            throw new IllegalArgumentException("callStartedAt is required");
        }
        this.callId = callId;
        this.agentId = agentId;
        this.callStartedAt = callStartedAt;
        this.historyLimit = Math.max(2, historyLimit);
    }

    public static CallSession restore(CallId callId,
                                      String agentId,
                                      Instant callStartedAt,
                                      int historyLimit,
                                      String currentNodeId,
                                      Map<String, String> variables,
                                      String lastAgentText,
                                      List<String> recentAgentTexts,
                                      boolean userHasSpoken,
                                      int checkinCount,
                                      Instant now) {
        CallSession session = new CallSession(callId, agentId, callStartedAt, historyLimit);
        session.currentNodeId = currentNodeId;
        if (variables != null) {
            variables.forEach(session::putVariable);
        }
        if (recentAgentTexts != null) {
            recentAgentTexts.forEach(session::rememberAgentText);
        }
        if (lastAgentText != null && !lastAgentText.isBlank() && !lastAgentText.trim().equals(session.lastAgentText)) {
            session.rememberAgentText(lastAgentText);
        }
        session.userHasSpoken = userHasSpoken;
        session.checkinCount = Math.max(0, checkinCount);
        session.silenceStartedAt = now;
        return session;
    }

    public CallId getCallId() {
        return callId;
    }

    public String getAgentId() {
        return agentId;
    }

    public Instant getCallStartedAt() {
        return callStartedAt;
    }

    public synchronized String getCurrentNodeId() {
        return currentNodeId;
    }

    public synchronized void moveTo(String nodeId) {
        if (nodeId == null || nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId is required");
        }
        if (!nodeId.equals(currentNodeId)) {
            contentDispatchedForNode = null;
        }
        this.currentNodeId = nodeId;
    }

    public synchronized void markContentDispatched(String nodeId) {
        this.contentDispatchedForNode = nodeId;
    }

    public synchronized boolean isContentDispatchedFor(String nodeId) {
        return nodeId != null && nodeId.equals(contentDispatchedForNode);
    }

    public synchronized void putVariable(String name, String value) {
        if (name == null || name.isBlank()) {
            return;
        }
        if (value == null || value.isBlank()) {
            sessionVariables.remove(name);
            return;
        }
        sessionVariables.put(name, value.trim());
    }

    public synchronized Map<String, String> getVariables() {
        return Map.copyOf(sessionVariables);
    }

    public synchronized boolean hasVariable(String name) {
        return sessionVariables.containsKey(name);
    }

    public synchronized void appendTurn(Speaker speaker, String text, Instant at) {
        if (text == null || text.isBlank()) {
            return;
        }
        conversationHistory.addLast(new ConversationTurn(speaker, text, at));
        while (conversationHistory.size() > historyLimit) {
            conversationHistory.removeFirst();
        }
    }

    public synchronized List<ConversationTurn> recentHistory(int maxTurns) {
        List<ConversationTurn> all = new ArrayList<>(conversationHistory);
        int from = Math.max(0, all.size() - Math.max(0, maxTurns));
        return List.copyOf(all.subList(from, all.size()));
    }

    public synchronized void recordAgentText(String text, Instant at) {
        if (text == null || text.isBlank()) {
            return;
        }
        rememberAgentText(text);
        appendTurn(Speaker.AGENT, text, at);
    }

    private void rememberAgentText(String text) {
        lastAgentText = text.trim();
        recentAgentTexts.addLast(lastAgentText);
        while (recentAgentTexts.size() > RECENT_AGENT_TEXT_MAX) {
            recentAgentTexts.removeFirst();
        }
    }

    public synchronized String getLastAgentText() {
        return lastAgentText;
    }

    public synchronized List<String> getRecentAgentTexts() {
        return List.copyOf(recentAgentTexts);
    }

    public synchronized long getTurnEpoch() {
        return turnEpoch;
    }

    /**
     * Registers a unit the provider accepted. Returns false when the unit belongs to a cancelled
     * epoch or its playback already ended, in which case the counter is left untouched.
     */
    public synchronized boolean registerPlayback(PlaybackUnit unit, Instant now) {
        if (unit == null || !unit.isDispatched() || shouldEndCall) {
            return false;
        }
        if (unit.epoch() != turnEpoch) {
            return false;
        }
        if (endedBeforeRegistration.remove(unit.playbackId())) {
            return false;
        }
        if (activePlaybacks.putIfAbsent(unit.playbackId(), unit) != null) {
            return false;
        }
        activePlaybackCount += 1;
        silenceStartedAt = null;
        Instant startedAt = unit.startedAt() == null ? now : unit.startedAt();
        Instant base = agentExpectedQuietAt != null && agentExpectedQuietAt.isAfter(startedAt) ? agentExpectedQuietAt : startedAt;
        agentExpectedQuietAt = unit.estimatedDuration() == null ? base : base.plus(unit.estimatedDuration());
        if (unit.first() || currentPlaybackStartedAt == null) {
            currentPlaybackStartedAt = unit.startedAt();
        }
        return true;
    }

    public synchronized void markPlaybackStarted(String playbackId, Instant at) {
        if (playbackId != null && activePlaybacks.containsKey(playbackId)) {
            currentPlaybackStartedAt = at;
        }
    }

    /**
     * Re-registers playbacks another worker started, so a reconstructed session sees the same
     * counter as the shared store.
     */
    public synchronized void restorePlaybacks(Collection<String> playbackIds, Instant now) {
        if (playbackIds == null) {
            return;
        }
        for (String playbackId : playbackIds) {
            PlaybackUnit unit = PlaybackUnit.pending(callId.value(), 0, false, false, "", Duration.ZERO, turnEpoch)
                    .dispatched(playbackId, now);
            if (activePlaybacks.putIfAbsent(playbackId, unit) == null) {
                activePlaybackCount += 1;
                silenceStartedAt = null;
            }
        }
    }

    /**
     * Returns true only the first time a known playback id is reported as finished.
     */
    public synchronized boolean completePlayback(String playbackId, Instant now) {
        if (playbackId == null) {
            return false;
        }
        PlaybackUnit removed = activePlaybacks.remove(playbackId);
        if (removed == null) {
            if (endedBeforeRegistration.size() >= EARLY_END_MAX) {
                endedBeforeRegistration.clear();
            }
            endedBeforeRegistration.add(playbackId);
            return false;
        }
        activePlaybackCount = Math.max(0, activePlaybackCount - 1);
        if (activePlaybackCount == 0) {
            onAgentIdle(now);
        }
        return true;
    }

    /**
     * Ends local playbacks that the shared set no longer holds because their "ended" report reached
     * another worker. Nothing is ended before the queued audio is expected to have finished.
     */
    public synchronized int reconcilePlaybacks(Set<String> sharedPlaybackIds, Instant now) {
        if (activePlaybacks.isEmpty() || sharedPlaybackIds == null) {
            return 0;
        }
        if (agentExpectedQuietAt != null && now.isBefore(agentExpectedQuietAt)) {
            return 0;
        }
        int ended = 0;
        Iterator<String> ids = activePlaybacks.keySet().iterator();
        while (ids.hasNext()) {
            if (!sharedPlaybackIds.contains(ids.next())) {
                ids.remove();
                ended += 1;
            }
        }
        if (ended == 0) {
            return 0;
        }
        activePlaybackCount = Math.max(0, activePlaybackCount - ended);
        if (activePlaybackCount == 0) {
            onAgentIdle(now);
        }
        return ended;
    }

    public synchronized long cancelAllPlayback(Instant now) {
        turnEpoch += 1;
        activePlaybacks.clear();
        activePlaybackCount = 0;
        onAgentIdle(now);
        return turnEpoch;
    }

    private void onAgentIdle(Instant now) {
        currentPlaybackStartedAt = null;
        agentExpectedQuietAt = now;
        checkinInProgress = false;
        if (!userSpeaking) {
            silenceStartedAt = now;
        }
    }

    public synchronized int getActivePlaybackCount() {
        return activePlaybackCount;
    }

    public synchronized List<String> getActivePlaybackIds() {
        return List.copyOf(activePlaybacks.keySet());
    }

    public synchronized List<String> getActivePlaybackTexts() {
        List<String> texts = new ArrayList<>();
        for (PlaybackUnit unit : activePlaybacks.values()) {
            if (unit.text() != null && !unit.text().isBlank()) {
                texts.add(unit.text());
            }
        }
        return texts;
    }

    public synchronized boolean isAgentSpeaking() {
        return activePlaybackCount > 0;
    }

    public synchronized boolean isUserSpeaking() {
        return userSpeaking;
    }

    public synchronized Instant getCurrentPlaybackStartedAt() {
        return currentPlaybackStartedAt;
    }

    /**
     * Time since the agent's audio is expected to have finished, based on the estimated
     * duration of every registered unit. Zero while audio is still expected to play.
     */
    public synchronized Duration agentQuietFor(Instant now) {
        Instant quietSince = agentExpectedQuietAt == null ? callStartedAt : agentExpectedQuietAt;
        if (now.isBefore(quietSince)) {
            return Duration.ZERO;
        }
        return Duration.between(quietSince, now);
    }

    public synchronized Instant getSilenceStartedAt() {
        return silenceStartedAt;
    }

    public synchronized void userSpeechStarted() {
        userSpeaking = true;
        silenceStartedAt = null;
    }

    public synchronized void userSpeechEnded(Instant now) {
        userSpeaking = false;
        restartSilence(now);
    }

    private void restartSilence(Instant now) {
        silenceStartedAt = activePlaybackCount == 0 && !userSpeaking ? now : null;
    }

    /**
     * Applies a final user utterance to the silence state. An acknowledgement-only reply to the
     * check-in just issued leaves the check-in count alone; any other utterance clears it.
     */
    public synchronized void applyUserResponse(boolean acknowledgementOnly, boolean holdOn, Instant now) {
        boolean keepCheckinProgress = lastUtteranceWasCheckin && acknowledgementOnly;
        if (!keepCheckinProgress) {
            checkinCount = 0;
            maxCheckinsReachedAt = null;
        }
        holdOnRequested = holdOn;
        lastUtteranceWasCheckin = false;
        userHasSpoken = true;
        userSpeaking = false;
        restartSilence(now);
    }

    public synchronized int recordCheckin(Instant now, int maxCheckins) {
        checkinCount += 1;
        lastUtteranceWasCheckin = true;
        lastCheckinAt = now;
        checkinInProgress = true;
        holdOnRequested = false;
        silenceStartedAt = null;
        if (checkinCount >= maxCheckins && maxCheckinsReachedAt == null) {
            maxCheckinsReachedAt = now;
        }
        return checkinCount;
    }

    public synchronized void finishCheckin(Instant now) {
        checkinInProgress = false;
        restartSilence(now);
    }

    public synchronized int getCheckinCount() {
        return checkinCount;
    }

    public synchronized boolean isLastUtteranceWasCheckin() {
        return lastUtteranceWasCheckin;
    }

    public synchronized void clearLastUtteranceWasCheckin() {
        lastUtteranceWasCheckin = false;
    }

    public synchronized boolean isHoldOnRequested() {
        return holdOnRequested;
    }

    public synchronized boolean isUserHasSpoken() {
        return userHasSpoken;
    }

    public synchronized void setGeneratingResponse(boolean generatingResponse, Instant now) {
        this.generatingResponse = generatingResponse;
        if (!generatingResponse) {
            restartSilenceIfUnset(now);
        }
    }

    public synchronized void setExecutingWebhook(boolean executingWebhook, Instant now) {
        this.executingWebhook = executingWebhook;
        if (!executingWebhook) {
            restartSilenceIfUnset(now);
        }
    }

    private void restartSilenceIfUnset(Instant now) {
        if (silenceStartedAt == null) {
            restartSilence(now);
        }
    }

    public synchronized boolean isGeneratingResponse() {
        return generatingResponse;
    }

    public synchronized boolean isExecutingWebhook() {
        return executingWebhook;
    }

    public synchronized boolean markEnded(CallEndReason reason) {
        if (shouldEndCall) {
            return false;
        }
        shouldEndCall = true;
        endReason = reason;
        return true;
    }

    public synchronized boolean isShouldEndCall() {
        return shouldEndCall;
    }

    public synchronized CallEndReason getEndReason() {
        return endReason;
    }

    public synchronized SilenceSnapshot silenceSnapshot() {
        return new SilenceSnapshot(
                activePlaybackCount > 0,
                userSpeaking,
                silenceStartedAt,
                checkinCount,
                lastCheckinAt,
                maxCheckinsReachedAt,
                holdOnRequested,
                generatingResponse || executingWebhook || checkinInProgress,
                callStartedAt,
                shouldEndCall
        );
    }

    public synchronized void putVariables(Map<String, String> values) {
        if (values != null) {
            values.forEach(this::putVariable);
        }
    }
}
