package me.go_gradually.callflow.application.call.usecase;

import me.go_gradually.callflow.application.call.policy.SessionPolicy;
import me.go_gradually.callflow.application.llm.model.LlmMessage;
import me.go_gradually.callflow.application.llm.model.LlmRequest;
import me.go_gradually.callflow.application.llm.port.LlmClient;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.stream.usecase.AudioStreamCoordinator;
import me.go_gradually.callflow.application.stream.usecase.ContentStream;
import me.go_gradually.callflow.domain.call.CallSession;
import me.go_gradually.callflow.domain.call.ConversationTurn;
import me.go_gradually.callflow.domain.call.PlaybackUnit;
import me.go_gradually.callflow.domain.call.Speaker;
import me.go_gradually.callflow.domain.flow.ContentMode;
import me.go_gradually.callflow.domain.flow.FlowGraph;
import me.go_gradually.callflow.domain.flow.FlowNode;
import me.go_gradually.callflow.domain.util.TemplateRenderer;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

public class ContentGenerator {
    private static final Logger log = Logger.getLogger(ContentGenerator.class.getName());

    private final LlmClient llmClient;
    private final AudioStreamCoordinator audioStreamCoordinator;
    private final SessionPolicy policy;
    private final MetricsPort metrics;
    private final Clock clock;

    public ContentGenerator(LlmClient llmClient,
                            AudioStreamCoordinator audioStreamCoordinator,
                            SessionPolicy policy,
                            MetricsPort metrics,
                            Clock clock) {
        this.llmClient = llmClient;
        this.audioStreamCoordinator = audioStreamCoordinator;
        this.policy = policy;
        this.metrics = metrics;
        this.clock = clock;
    }

    public List<PlaybackUnit> deliver(CallSession session, FlowGraph flow, FlowNode node) {
        List<PlaybackUnit> units;
        if (node.contentMode() == ContentMode.PROMPT) {
            units = generate(session, flow, node, node.content());
        } else {
            units = say(session, node.content());
        }
        if (!units.isEmpty()) {
            session.markContentDispatched(node.id());
        }
        return units;
    }

    /**
     * Replies to the caller while steering back toward the node's goal.
     */
    public List<PlaybackUnit> steer(CallSession session, FlowGraph flow, FlowNode node) {
        String goal = node.goal().orElse("");
        String instruction = "The caller has not reached the goal of this step yet: " + goal
                + ". Reply briefly to what they just said and guide them back toward the goal.";
        if (node.contentMode() == ContentMode.PROMPT && node.content() != null && !node.content().isBlank()) {
            instruction = node.content() + "\n\n" + instruction;
        }
        return generate(session, flow, node, instruction);
    }

    public List<PlaybackUnit> say(CallSession session, String template) {
        String text = TemplateRenderer.render(template, session.getVariables());
        if (text.isBlank()) {
            return List.of();
        }
        return audioStreamCoordinator.streamContent(session, text);
    }

    private List<PlaybackUnit> generate(CallSession session, FlowGraph flow, FlowNode node, String instruction) {
        ContentStream stream = audioStreamCoordinator.begin(session);
        LlmRequest request = buildRequest(session, flow, instruction);
        long started = System.nanoTime();
        try {
            llmClient.stream(request, policy.contentTimeout(), stream::append);
            metrics.recordLlmLatency(Duration.ofNanos(System.nanoTime() - started));
        } catch (Exception e) {
            log.warning("content.generate.failed callId=" + session.getCallId().value() + " nodeId=" + node.id()
                    + " error=" + e.getMessage());
        }
        if (stream.text().isBlank()) {
            stream.append(policy.fallbackLine());
        }
        return stream.finish(clock.instant());
    }

    private LlmRequest buildRequest(CallSession session, FlowGraph flow, String instruction) {
        List<LlmMessage> messages = new ArrayList<>();
        StringBuilder system = new StringBuilder();
        if (flow.globalPrompt() != null && !flow.globalPrompt().isBlank()) {
            system.append(TemplateRenderer.render(flow.globalPrompt(), session.getVariables())).append("\n\n");
        }
        system.append(TemplateRenderer.render(instruction, session.getVariables()))
                .append("\n\nYou are speaking on a phone call. Keep replies short and conversational.");
        messages.add(LlmMessage.system(system.toString()));
        for (ConversationTurn turn : session.recentHistory(policy.historyLimit())) {
            messages.add(turn.speaker() == Speaker.USER
                    ? LlmMessage.user(turn.text())
                    : LlmMessage.assistant(turn.text()));
        }
        if (messages.size() == 1) {
            messages.add(LlmMessage.user("(The call has just connected.)"));
        }
        return new LlmRequest(policy.contentModel(), messages, 300, 0.7);
    }
}
