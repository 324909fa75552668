package me.go_gradually.callflow.application.call.usecase;

import me.go_gradually.callflow.application.call.model.CallSnapshot;
import me.go_gradually.callflow.application.call.model.TelephonyEventCommand;
import me.go_gradually.callflow.application.call.model.TranscriptCommand;
import me.go_gradually.callflow.application.call.policy.SessionPolicy;
import me.go_gradually.callflow.application.call.port.FlowRepository;
import me.go_gradually.callflow.application.call.port.TelephonyGateway;
import me.go_gradually.callflow.application.interruption.model.InterruptionOutcome;
import me.go_gradually.callflow.application.interruption.usecase.InterruptionController;
import me.go_gradually.callflow.application.shared.port.AsyncExecutor;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.shared.port.TickScheduler;
import me.go_gradually.callflow.application.silence.model.SilenceVerdict;
import me.go_gradually.callflow.application.silence.usecase.SilenceMonitor;
import me.go_gradually.callflow.application.store.model.SessionCounter;
import me.go_gradually.callflow.application.store.model.SessionDescriptor;
import me.go_gradually.callflow.application.store.model.SessionFlag;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;
import me.go_gradually.callflow.application.store.usecase.SessionReadinessGate;
import me.go_gradually.callflow.application.stream.usecase.AudioStreamCoordinator;
import me.go_gradually.callflow.application.transition.model.TransitionDecision;
import me.go_gradually.callflow.application.transition.usecase.TransitionEvaluator;
import me.go_gradually.callflow.domain.call.CallEndReason;
import me.go_gradually.callflow.domain.call.CallId;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.call.Speaker;
import me.go_gradually.callflow.domain.call.UtteranceClass;
import me.go_gradually.callflow.domain.flow.ContentMode;
import me.go_gradually.callflow.domain.flow.FlowGraph;
import me.go_gradually.callflow.domain.flow.FlowNode;
import me.go_gradually.callflow.domain.flow.InputValidation;
import me.go_gradually.callflow.domain.flow.Transition;
import me.go_gradually.callflow.domain.flow.VariableSpec;
import me.go_gradually.callflow.domain.util.TextUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the live calls of this worker. Turn work for a call runs one task at a time; silence ticks
 * and playback callbacks go straight to the session, which serializes them under its own lock.
 */
public class SessionOrchestrator {
    private static final Logger log = Logger.getLogger(SessionOrchestrator.class.getName());
    private static final int HOLD_ON_MAX_WORDS = 6;

    private final FlowRepository flowRepository;
    private final TelephonyGateway telephonyGateway;
    private final SharedSessionStorePort store;
    private final SessionReadinessGate readinessGate;
    private final TransitionEvaluator transitionEvaluator;
    private final SilenceMonitor silenceMonitor;
    private final InterruptionController interruptionController;
    private final AudioStreamCoordinator audioStreamCoordinator;
    private final ContentGenerator contentGenerator;
    private final VariableExtractor variableExtractor;
    private final WebhookExecutor webhookExecutor;
    private final AsyncExecutor asyncExecutor;
    private final TickScheduler tickScheduler;
    private final SessionPolicy policy;
    private final Duration tickInterval;
    private final MetricsPort metrics;
    private final Clock clock;
    private final Map<String, RuntimeContext> contexts = new ConcurrentHashMap<>();

    public SessionOrchestrator(FlowRepository flowRepository,
                               TelephonyGateway telephonyGateway,
                               SharedSessionStorePort store,
                               SessionReadinessGate readinessGate,
                               TransitionEvaluator transitionEvaluator,
                               SilenceMonitor silenceMonitor,
                               InterruptionController interruptionController,
                               AudioStreamCoordinator audioStreamCoordinator,
                               ContentGenerator contentGenerator,
                               VariableExtractor variableExtractor,
                               WebhookExecutor webhookExecutor,
                               AsyncExecutor asyncExecutor,
                               TickScheduler tickScheduler,
                               SessionPolicy policy,
                               Duration tickInterval,
                               MetricsPort metrics,
                               Clock clock) {
        this.flowRepository = flowRepository;
        this.telephonyGateway = telephonyGateway;
        this.store = store;
        this.readinessGate = readinessGate;
        this.transitionEvaluator = transitionEvaluator;
        this.silenceMonitor = silenceMonitor;
        this.interruptionController = interruptionController;
        this.audioStreamCoordinator = audioStreamCoordinator;
        this.contentGenerator = contentGenerator;
        this.variableExtractor = variableExtractor;
        this.webhookExecutor = webhookExecutor;
        this.asyncExecutor = asyncExecutor;
        this.tickScheduler = tickScheduler;
        this.policy = policy;
        this.tickInterval = tickInterval;
        this.metrics = metrics;
        this.clock = clock;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String firstNonBlank(String candidate, String fallback) {
        return isBlank(candidate) ? fallback : candidate;
    }

    public void onTelephonyEvent(TelephonyEventCommand command) {
        if (command == null || isBlank(command.getCallId()) || command.getEventType() == null) {
            throw new IllegalArgumentException("callId and event type are required");
        }
        if (!isBlank(command.getEventId()) && !store.markEventProcessed(command.getEventId(), policy.sessionTtl())) {
            log.fine(() -> "call.event.duplicate eventId=" + command.getEventId());
            return;
        }
        switch (command.getEventType()) {
            case CALL_ANSWERED -> onCallAnswered(command.getCallId(), command.getAgentId(), command.getVariables());
            case PLAYBACK_STARTED -> onPlaybackEvent(command.getCallId(), command.getPlaybackId(), false);
            case PLAYBACK_ENDED -> onPlaybackEvent(command.getCallId(), command.getPlaybackId(), true);
            case CALL_HANGUP -> onCallHangup(command.getCallId());
            default -> log.fine(() -> "call.event.ignored callId=" + command.getCallId());
        }
    }

    public CallSnapshot onCallAnswered(String callId, String agentId, Map<String, String> variables) {
        if (isBlank(callId)) {
            throw new IllegalArgumentException("callId is required");
        }
        RuntimeContext existing = contexts.get(callId);
        if (existing != null) {
            return snapshot(existing.session);
        }
        String resolvedAgentId = firstNonBlank(agentId, policy.defaultAgentId());
        FlowGraph flow = flowRepository.findByAgentId(resolvedAgentId)
                .orElseThrow(() -> new NoSuchElementException("Unknown agent: " + resolvedAgentId));

        CallSession session = new CallSession(CallId.of(callId), resolvedAgentId, clock.instant(), policy.historyLimit());
        session.putVariables(variables);
        session.moveTo(flow.startNodeId());
        RuntimeContext context = new RuntimeContext(session, flow);
        RuntimeContext raced = contexts.putIfAbsent(callId, context);
        if (raced != null) {
            return snapshot(raced.session);
        }
        start(context);
        readinessGate.markReady(callId, policy.sessionTtl());
        log.info(() -> "call.answered callId=" + callId + " agentId=" + resolvedAgentId + " startNode=" + flow.startNodeId());
        submit(context, () -> enterNode(context, flow.startNode(), 0));
        return snapshot(session);
    }

    public void onTranscript(TranscriptCommand command) {
        if (command == null || isBlank(command.getCallId())) {
            throw new IllegalArgumentException("callId is required");
        }
        String text = command.getText() == null ? "" : command.getText().trim();
        if (TextUtils.wordCount(text) == 0) {
            if (command.isFinalTranscript()) {
                closeUserSpeech(command.getCallId());
            }
            return;
        }
        Optional<RuntimeContext> found = findOrRestore(command.getCallId());
        if (found.isEmpty()) {
            return;
        }
        RuntimeContext context = found.get();
        CallSession session = context.session;
        if (context.isClosing()) {
            return;
        }
        Instant utteranceAt = command.getTimestamp() == null ? clock.instant() : command.getTimestamp();
        if (!command.isFinalTranscript()) {
            if (session.isAgentSpeaking()
                    && interruptionController.handle(session, text, utteranceAt).utteranceClass() == UtteranceClass.ECHO) {
                return;
            }
            session.userSpeechStarted();
            return;
        }
        InterruptionOutcome outcome = interruptionController.handle(session, text, utteranceAt);
        if (!outcome.accepted()) {
            session.userSpeechEnded(clock.instant());
            log.fine(() -> "call.utterance.filtered callId=" + command.getCallId()
                    + " class=" + outcome.utteranceClass().code());
            return;
        }
        submit(context, () -> processUtterance(context, text));
    }

    private void closeUserSpeech(String callId) {
        RuntimeContext context = contexts.get(callId);
        if (context != null && context.session.isUserSpeaking()) {
            context.session.userSpeechEnded(clock.instant());
        }
    }

    public void onPlaybackEvent(String callId, String playbackId, boolean ended) {
        if (isBlank(callId) || isBlank(playbackId)) {
            throw new IllegalArgumentException("callId and playbackId are required");
        }
        RuntimeContext context = contexts.get(callId);
        if (context == null) {
            // another worker runs this call
            if (ended) {
                audioStreamCoordinator.onPlaybackEndedElsewhere(callId, playbackId);
            }
            return;
        }
        if (!ended) {
            context.session.markPlaybackStarted(playbackId, clock.instant());
            return;
        }
        audioStreamCoordinator.onPlaybackEnded(context.session, playbackId);
        if (context.teardown.get() != null) {
            maybeExecuteTeardown(context);
        }
    }

    public void onSilenceTick(String callId) {
        RuntimeContext context = contexts.get(callId);
        if (context == null || context.closed.get()) {
            return;
        }
        try {
            audioStreamCoordinator.reconcilePlaybacks(context.session);
            if (context.teardown.get() != null) {
                maybeExecuteTeardown(context);
                return;
            }
            SilenceVerdict verdict = silenceMonitor.tick(context.session);
            if (verdict.terminated() && verdict.endReason() != null) {
                if (verdict.endReason() == CallEndReason.MAX_DURATION) {
                    audioStreamCoordinator.cancelAll(context.session);
                }
                requestTeardown(context, Teardown.hangup(verdict.endReason(), clock.instant()));
                maybeExecuteTeardown(context);
            }
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "call.tick.failed callId=" + callId, e);
        }
    }

    public void onCallHangup(String callId) {
        RuntimeContext context = contexts.get(callId);
        if (context == null) {
            readinessGate.forget(callId);
            store.expire(callId);
            return;
        }
        if (context.session.markEnded(CallEndReason.CALLER_HANGUP)) {
            metrics.incrementCallEnded(CallEndReason.CALLER_HANGUP.code());
        }
        context.tornDown.set(true);
        release(context);
    }

    public void hangup(String callId) {
        RuntimeContext context = contexts.get(callId);
        if (context == null) {
            throw new NoSuchElementException("Unknown call: " + callId);
        }
        requestTeardown(context, Teardown.hangup(CallEndReason.OPERATOR_HANGUP, clock.instant()));
        audioStreamCoordinator.cancelAll(context.session);
        maybeExecuteTeardown(context);
    }

    public CallSnapshot snapshot(String callId) {
        RuntimeContext context = contexts.get(callId);
        if (context != null) {
            return snapshot(context.session);
        }
        SessionDescriptor descriptor = store.get(callId)
                .orElseThrow(() -> new NoSuchElementException("Unknown call: " + callId));
        int playing = (int) store.counter(callId, SessionCounter.ACTIVE_PLAYBACK_COUNT);
        return new CallSnapshot(
                callId,
                descriptor.agentId(),
                descriptor.currentNodeId(),
                playing,
                playing > 0,
                false,
                descriptor.checkinCount(),
                null,
                descriptor.variables(),
                false,
                null
        );
    }

    private CallSnapshot snapshot(CallSession session) {
        CallEndReason reason = session.getEndReason();
        return new CallSnapshot(
                session.getCallId().value(),
                session.getAgentId(),
                session.getCurrentNodeId(),
                session.getActivePlaybackCount(),
                session.isAgentSpeaking(),
                session.isUserSpeaking(),
                session.getCheckinCount(),
                session.getSilenceStartedAt(),
                session.getVariables(),
                session.isShouldEndCall(),
                reason == null ? null : reason.code()
        );
    }

    private void start(RuntimeContext context) {
        String callId = context.session.getCallId().value();
        persist(context);
        audioStreamCoordinator.open(context.session);
        context.tick = tickScheduler.scheduleAtFixedRate(() -> onSilenceTick(callId), tickInterval);
    }

    private Optional<RuntimeContext> findOrRestore(String callId) {
        RuntimeContext context = contexts.get(callId);
        if (context != null) {
            return Optional.of(context);
        }
        if (!readinessGate.awaitReady(callId, policy.readyWaitTimeout())) {
            log.warning("call.unknown callId=" + callId);
            return Optional.empty();
        }
        Optional<SessionDescriptor> descriptor = store.get(callId);
        Optional<FlowGraph> flow = descriptor
                .filter(SessionDescriptor::isRestorable)
                .flatMap(found -> flowRepository.findByAgentId(found.agentId()))
                .filter(graph -> graph.node(descriptor.get().currentNodeId()).isPresent());
        if (flow.isEmpty()) {
            endUnrestorable(callId, descriptor.map(SessionDescriptor::agentId).orElse(null));
            return Optional.empty();
        }
        SessionDescriptor restored = descriptor.get();
        Instant now = clock.instant();
        CallSession session = CallSession.restore(
                CallId.of(callId),
                restored.agentId(),
                Instant.ofEpochMilli(restored.callStartedAtEpochMs()),
                policy.historyLimit(),
                restored.currentNodeId(),
                restored.variables(),
                restored.lastAgentText(),
                restored.recentAgentTexts(),
                restored.userHasSpoken(),
                restored.checkinCount(),
                now
        );
        session.restorePlaybacks(store.playbackIds(callId), now);
        RuntimeContext created = new RuntimeContext(session, flow.get());
        RuntimeContext raced = contexts.putIfAbsent(callId, created);
        if (raced != null) {
            return Optional.of(raced);
        }
        start(created);
        log.info(() -> "call.restored callId=" + callId + " nodeId=" + restored.currentNodeId());
        return Optional.of(created);
    }

    private void endUnrestorable(String callId, String agentId) {
        log.warning("call.restore.failed callId=" + callId);
        CallSession session = new CallSession(CallId.of(callId), firstNonBlank(agentId, policy.defaultAgentId()),
                clock.instant(), policy.historyLimit());
        RuntimeContext context = new RuntimeContext(session, null);
        if (contexts.putIfAbsent(callId, context) != null) {
            return;
        }
        start(context);
        requestTeardown(context, Teardown.hangup(CallEndReason.RECONSTRUCTION_FAILED, clock.instant()));
        contentGenerator.say(session, policy.closingLine());
    }

    private void submit(RuntimeContext context, Runnable task) {
        context.pendingTurns.add(task);
        if (context.startTurnProcessing()) {
            asyncExecutor.execute(() -> drainTurns(context));
        }
    }

    private void drainTurns(RuntimeContext context) {
        try {
            Runnable task;
            while ((task = context.pendingTurns.poll()) != null) {
                if (context.isClosing()) {
                    context.pendingTurns.clear();
                    return;
                }
                runTurn(context, task);
            }
        } finally {
            context.completeTurnProcessing();
            if (!context.pendingTurns.isEmpty() && !context.isClosing() && context.startTurnProcessing()) {
                asyncExecutor.execute(() -> drainTurns(context));
            }
        }
    }

    private void runTurn(RuntimeContext context, Runnable task) {
        CallSession session = context.session;
        Instant started = clock.instant();
        session.setGeneratingResponse(true, started);
        try {
            task.run();
        } catch (RuntimeException e) {
            failGracefully(context, e);
        } finally {
            session.setGeneratingResponse(false, clock.instant());
            persist(context);
            metrics.recordTurnLatency(Duration.between(started, clock.instant()));
        }
    }

    private void processUtterance(RuntimeContext context, String text) {
        CallSession session = context.session;
        String callId = session.getCallId().value();
        Instant now = clock.instant();
        boolean acknowledgementOnly = interruptionController.isAcknowledgementOnly(text);
        boolean holdOn = interruptionController.isHoldOn(text);
        boolean answeringCheckin = session.isLastUtteranceWasCheckin();

        session.appendTurn(Speaker.USER, text, now);
        session.applyUserResponse(acknowledgementOnly, holdOn, now);
        store.clearFlag(callId, SessionFlag.CHECKIN_IN_PROGRESS);

        FlowNode node = context.flow.requireNode(session.getCurrentNodeId());
        if (answeringCheckin && acknowledgementOnly) {
            log.info(() -> "call.checkin.acknowledged callId=" + callId + " checkins=" + session.getCheckinCount());
            contentGenerator.deliver(session, context.flow, node);
            return;
        }
        if (holdOn && TextUtils.wordCount(text) <= HOLD_ON_MAX_WORDS) {
            contentGenerator.say(session, policy.holdOnReply());
            return;
        }
        handleReply(context, node, text);
    }

    private void handleReply(RuntimeContext context, FlowNode node, String text) {
        CallSession session = context.session;
        switch (node.type()) {
            case PRESS_DIGIT -> {
                Optional<FlowNode.DigitRoute> route = node.routeDigit(text);
                if (route.isPresent() && route.get().mapped()) {
                    session.putVariable(node.id(), route.get().digit());
                    enterNode(context, context.flow.requireNode(route.get().targetNodeId()), 1);
                    return;
                }
                contentGenerator.say(session, firstNonBlank(node.errorMessage(), policy.digitPrompt()));
                return;
            }
            case COLLECT_INPUT -> {
                InputValidation validation = node.inputType().validate(text);
                if (!validation.valid()) {
                    contentGenerator.say(session, firstNonBlank(node.errorMessage(), validation.errorMessage()));
                    return;
                }
                String name = node.variables().isEmpty() ? node.id() : node.variables().get(0).name();
                session.putVariable(name, validation.value());
            }
            default -> {
                List<VariableSpec> missing = node.mandatoryVariables().stream()
                        .filter(spec -> !session.hasVariable(spec.name()))
                        .toList();
                if (!missing.isEmpty()) {
                    variableExtractor.extractMandatory(session, missing, text);
                }
                variableExtractor.extractOptionalAsync(session, node.optionalVariables(), text);
                Optional<VariableSpec> stillMissing = node.mandatoryVariables().stream()
                        .filter(spec -> !session.hasVariable(spec.name()))
                        .findFirst();
                if (stillMissing.isPresent() && !hasSatisfiedTransition(node, session)) {
                    contentGenerator.say(session, firstNonBlank(node.errorMessage(),
                            "Sorry, could you tell me your " + stillMissing.get().description() + "?"));
                    return;
                }
            }
        }
        TransitionDecision decision = transitionEvaluator.evaluate(
                node, text, session.getVariables(), session.recentHistory(policy.historyLimit()));
        applyDecision(context, node, decision);
    }

    private boolean hasSatisfiedTransition(FlowNode node, CallSession session) {
        Map<String, String> variables = session.getVariables();
        return node.transitions().stream().anyMatch(transition -> transition.isSatisfiedBy(variables));
    }

    private void applyDecision(RuntimeContext context, FlowNode node, TransitionDecision decision) {
        CallSession session = context.session;
        if (!decision.stay()) {
            enterNode(context, context.flow.requireNode(decision.targetNodeId()), 1);
            return;
        }
        if (node.hasGoal()) {
            contentGenerator.steer(session, context.flow, node);
            return;
        }
        if (node.contentMode() == ContentMode.PROMPT
                || !session.isContentDispatchedFor(node.id())) {
            contentGenerator.deliver(session, context.flow, node);
        }
    }

    private void enterNode(RuntimeContext context, FlowNode node, int hops) {
        if (hops > policy.maxNodeHops()) {
            throw new IllegalStateException("Too many node hops at " + node.id());
        }
        CallSession session = context.session;
        session.moveTo(node.id());
        persist(context);
        log.info(() -> "call.node callId=" + session.getCallId().value() + " nodeId=" + node.id()
                + " type=" + node.type().code());
        switch (node.type()) {
            case LOGIC_SPLIT -> {
                String target = node.logicSplit()
                        .flatMap(split -> split.route(session.getVariables()))
                        .orElseGet(() -> firstTarget(node, session));
                if (target == null) {
                    throw new IllegalStateException("No route out of " + node.id());
                }
                enterNode(context, context.flow.requireNode(target), hops + 1);
            }
            case FUNCTION_CALL -> {
                Optional<String> response = node.webhook().flatMap(spec -> webhookExecutor.execute(session, spec));
                if (!isBlank(node.content())) {
                    contentGenerator.deliver(session, context.flow, node);
                }
                TransitionDecision decision = transitionEvaluator.evaluate(
                        node, response.orElse(""), session.getVariables(), session.recentHistory(policy.historyLimit()));
                if (!decision.stay()) {
                    enterNode(context, context.flow.requireNode(decision.targetNodeId()), hops + 1);
                }
            }
            case TRANSFER -> {
                contentGenerator.say(session, firstNonBlank(node.content(), policy.transferMessage()));
                String destination = node.transferDestination()
                        .orElseThrow(() -> new IllegalStateException("Transfer destination missing at " + node.id()));
                requestTeardown(context, Teardown.transfer(destination, clock.instant()));
            }
            case ENDING -> {
                contentGenerator.deliver(session, context.flow, node);
                requestTeardown(context, Teardown.hangup(CallEndReason.FLOW_COMPLETED, clock.instant()));
            }
            default -> {
                contentGenerator.deliver(session, context.flow, node);
                if (node.autoTransition()) {
                    String target = firstTarget(node, session);
                    if (target != null) {
                        enterNode(context, context.flow.requireNode(target), hops + 1);
                    }
                }
            }
        }
    }

    private String firstTarget(FlowNode node, CallSession session) {
        Map<String, String> variables = session.getVariables();
        List<Transition> candidates = node.transitions().stream()
                .filter(transition -> transition.isSatisfiedBy(variables))
                .toList();
        return candidates.stream()
                .filter(Transition::isDefault)
                .findFirst()
                .or(() -> candidates.stream().findFirst())
                .map(Transition::targetNodeId)
                .orElse(null);
    }

    private void failGracefully(RuntimeContext context, RuntimeException error) {
        String callId = context.session.getCallId().value();
        log.log(Level.WARNING, "call.turn.failed callId=" + callId, error);
        if (context.teardown.get() != null) {
            return;
        }
        requestTeardown(context, Teardown.hangup(CallEndReason.SESSION_ERROR, clock.instant()));
        contentGenerator.say(context.session, policy.closingLine());
    }

    private void requestTeardown(RuntimeContext context, Teardown teardown) {
        if (context.teardown.compareAndSet(null, teardown)) {
            log.info(() -> "call.closing callId=" + context.session.getCallId().value() + " reason=" + teardown.reason().code());
        }
    }

    private void maybeExecuteTeardown(RuntimeContext context) {
        Teardown teardown = context.teardown.get();
        if (teardown == null) {
            return;
        }
        String callId = context.session.getCallId().value();
        boolean drained = context.session.getActivePlaybackCount() == 0 && audioStreamCoordinator.isIdle(callId);
        boolean overdue = !clock.instant().isBefore(teardown.requestedAt().plus(policy.teardownDrainTimeout()));
        if (drained || overdue) {
            executeTeardown(context, teardown);
        }
    }

    private void executeTeardown(RuntimeContext context, Teardown teardown) {
        if (!context.tornDown.compareAndSet(false, true)) {
            return;
        }
        CallSession session = context.session;
        String callId = session.getCallId().value();
        if (session.markEnded(teardown.reason())) {
            metrics.incrementCallEnded(teardown.reason().code());
        }
        try {
            if (teardown.transferDestination() != null) {
                telephonyGateway.transfer(callId, teardown.transferDestination());
            } else {
                telephonyGateway.hangup(callId);
            }
        } catch (Exception e) {
            log.log(Level.WARNING, "call.teardown.failed callId=" + callId, e);
        } finally {
            release(context);
        }
    }

    private void release(RuntimeContext context) {
        String callId = context.session.getCallId().value();
        context.closed.set(true);
        contexts.remove(callId, context);
        if (context.tick != null) {
            context.tick.cancel();
        }
        audioStreamCoordinator.close(callId);
        readinessGate.forget(callId);
        store.expire(callId);
        CallEndReason reason = context.session.getEndReason();
        log.info(() -> "call.released callId=" + callId + " reason=" + (reason == null ? "unknown" : reason.code()));
    }

    private void persist(RuntimeContext context) {
        if (context.flow == null || context.closed.get()) {
            return;
        }
        store.set(context.session.getCallId().value(), SessionDescriptor.from(context.session), policy.sessionTtl());
    }

    private record Teardown(CallEndReason reason, String transferDestination, Instant requestedAt) {
        private static Teardown hangup(CallEndReason reason, Instant requestedAt) {
            return new Teardown(reason, null, requestedAt);
        }

        private static Teardown transfer(String destination, Instant requestedAt) {
            return new Teardown(CallEndReason.TRANSFERRED, destination, requestedAt);
        }
    }

    private static final class RuntimeContext {
        private final CallSession session;
        private final FlowGraph flow;
        private final Queue<Runnable> pendingTurns = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean turnProcessing = new AtomicBoolean(false);
        private final AtomicBoolean closed = new AtomicBoolean(false);
        private final AtomicBoolean tornDown = new AtomicBoolean(false);
        private final AtomicReference<Teardown> teardown = new AtomicReference<>();
        private volatile TickScheduler.ScheduledTick tick;

        private RuntimeContext(CallSession session, FlowGraph flow) {
            this.session = session;
            this.flow = flow;
        }

        private boolean startTurnProcessing() {
            return turnProcessing.compareAndSet(false, true);
        }

        private void completeTurnProcessing() {
            turnProcessing.set(false);
        }

        private boolean isClosing() {
            return closed.get() || teardown.get() != null;
        }
    }
}
