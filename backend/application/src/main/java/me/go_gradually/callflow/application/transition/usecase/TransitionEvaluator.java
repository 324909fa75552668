package me.go_gradually.callflow.application.transition.usecase;

import me.go_gradually.callflow.application.llm.model.LlmMessage;
import me.go_gradually.callflow.application.llm.model.LlmRequest;
import me.go_gradually.callflow.application.llm.port.LlmClient;
import me.go_gradually.callflow.application.shared.port.AsyncExecutor;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.transition.model.TransitionDecision;
import me.go_gradually.callflow.application.transition.model.TransitionOutcome;
import me.go_gradually.callflow.application.transition.policy.TransitionPolicy;
import me.go_gradually.callflow.domain.call.ConversationTurn;
import me.go_gradually.callflow.domain.flow.FlowNode;
import me.go_gradually.callflow.domain.flow.Transition;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class TransitionEvaluator {
    private static final Logger log = Logger.getLogger(TransitionEvaluator.class.getName());
    private static final Pattern INDEX = Pattern.compile("-?\\d{1,4}");

    private final LlmClient llmClient;
    private final AsyncExecutor asyncExecutor;
    private final TransitionPolicy policy;
    private final MetricsPort metrics;
    private final FastPathMatcher fastPathMatcher;

    public TransitionEvaluator(LlmClient llmClient,
                               AsyncExecutor asyncExecutor,
                               TransitionPolicy policy,
                               MetricsPort metrics) {
        this.llmClient = llmClient;
        this.asyncExecutor = asyncExecutor;
        this.policy = policy;
        this.metrics = metrics;
        this.fastPathMatcher = new FastPathMatcher(policy.affirmativePrefixes(), policy.negativePrefixes());
    }

    public TransitionDecision evaluate(FlowNode node,
                                       String utterance,
                                       Map<String, String> variables,
                                       List<ConversationTurn> history) {
        long started = System.nanoTime();
        TransitionDecision decision = decide(node, utterance, variables, history);
        metrics.recordTransitionLatency(Duration.ofNanos(System.nanoTime() - started));
        metrics.incrementTransitionOutcome(decision.outcome().code());
        log.info(() -> "transition.decided nodeId=" + node.id() + " outcome=" + decision.outcome().code()
                + " target=" + decision.targetNodeId());
        return decision;
    }

    private TransitionDecision decide(FlowNode node,
                                      String utterance,
                                      Map<String, String> variables,
                                      List<ConversationTurn> history) {
        List<Transition> candidates = node.transitions().stream()
                .filter(transition -> transition.isSatisfiedBy(variables))
                .toList();
        if (candidates.isEmpty()) {
            return TransitionDecision.stay(node.id(), TransitionOutcome.NONE);
        }
        if (candidates.size() == 1) {
            return TransitionDecision.move(candidates.get(0).targetNodeId(), TransitionOutcome.SINGLE_PATH);
        }
        Optional<Transition> fastPath = fastPathMatcher.match(utterance, candidates);
        if (fastPath.isPresent()) {
            return TransitionDecision.move(fastPath.get().targetNodeId(), TransitionOutcome.FAST_PATH);
        }
        Optional<Integer> chosen = askModel(node, candidates, utterance, history);
        if (chosen.isPresent()) {
            return TransitionDecision.move(candidates.get(chosen.get()).targetNodeId(), TransitionOutcome.MODEL);
        }
        if (node.hasGoal()) {
            return TransitionDecision.stay(node.id(), TransitionOutcome.STAY);
        }
        Transition fallback = candidates.stream()
                .filter(Transition::isDefault)
                .findFirst()
                .orElse(candidates.get(0));
        return TransitionDecision.move(fallback.targetNodeId(), TransitionOutcome.FALLBACK);
    }

    private Optional<Integer> askModel(FlowNode node,
                                       List<Transition> candidates,
                                       String utterance,
                                       List<ConversationTurn> history) {
        Duration timeout = policy.transitionTimeout();
        LlmRequest request = buildRequest(node, candidates, utterance, history);
        CompletableFuture<String> future = CompletableFuture.supplyAsync(() -> {
            try {
                return llmClient.complete(request, timeout);
            } catch (Exception e) {
                throw new IllegalStateException(e);
            }
        }, asyncExecutor::execute);
        try {
            String answer = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return parseIndex(answer, candidates.size());
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.incrementModelTimeout();
            log.warning("transition.model.timeout nodeId=" + node.id() + " timeoutMs=" + timeout.toMillis());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null && e.getCause().getCause() != null ? e.getCause().getCause() : e.getCause();
            log.warning("transition.model.failed nodeId=" + node.id() + " error=" + (cause == null ? "unknown" : cause.getMessage()));
            return Optional.empty();
        }
    }

    private LlmRequest buildRequest(FlowNode node,
                                    List<Transition> candidates,
                                    String utterance,
                                    List<ConversationTurn> history) {
        StringBuilder options = new StringBuilder();
        for (int i = 0; i < candidates.size(); i += 1) {
            options.append("Option ").append(i + 1).append(": Condition: ")
                    .append(candidates.get(i).condition()).append('\n');
        }
        StringBuilder transcript = new StringBuilder();
        List<ConversationTurn> window = history == null ? List.of() : history;
        int from = Math.max(0, window.size() - policy.historyWindow());
        for (ConversationTurn turn : window.subList(from, window.size())) {
            transcript.append(turn.speaker().code()).append(": ").append(turn.text()).append('\n');
        }
        String system = "You route a phone conversation. Pick the option whose condition matches the caller's latest reply. "
                + "Answer with the option number only, or 0 if no option applies.";
        String user = (node.hasGoal() ? "Goal of this step: " + node.goal().orElse("") + "\n" : "")
                + "Conversation so far:\n" + transcript
                + "Caller's latest reply: " + (utterance == null ? "" : utterance) + "\n\n"
                + options;
        return new LlmRequest(policy.transitionModel(), List.of(LlmMessage.system(system), LlmMessage.user(user)), 8, 0.0);
    }

    private Optional<Integer> parseIndex(String answer, int candidateCount) {
        if (answer == null) {
            return Optional.empty();
        }
        Matcher matcher = INDEX.matcher(answer);
        if (!matcher.find()) {
            return Optional.empty();
        }
        int option = Integer.parseInt(matcher.group());
        if (option < 1 || option > candidateCount) {
            return Optional.empty();
        }
        return Optional.of(option - 1);
    }
}
