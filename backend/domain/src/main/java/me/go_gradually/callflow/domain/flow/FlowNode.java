package me.go_gradually.callflow.domain.flow;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class FlowNode {
    private static final Pattern DIGIT = Pattern.compile("[0-9*#]");

    private final String id;
    private final NodeType type;
    private final ContentMode contentMode;
    private final String content;
    private final String goal;
    private final List<Transition> transitions;
    private final List<VariableSpec> variables;
    private final LogicSplit logicSplit;
    private final Map<String, String> digitMappings;
    private final String transferDestination;
    private final WebhookSpec webhook;
    private final InputType inputType;
    private final String errorMessage;
    private final boolean autoTransition;

    private FlowNode(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.contentMode = builder.contentMode;
        this.content = builder.content == null ? "" : builder.content;
        this.goal = builder.goal == null || builder.goal.isBlank() ? null : builder.goal.trim();
        this.transitions = List.copyOf(builder.transitions);
        this.variables = List.copyOf(builder.variables);
        this.logicSplit = builder.logicSplit;
        this.digitMappings = Map.copyOf(builder.digitMappings);
        this.transferDestination = builder.transferDestination;
        this.webhook = builder.webhook;
        this.inputType = builder.inputType;
        this.errorMessage = builder.errorMessage;
        this.autoTransition = builder.autoTransition;
    }

    public static Builder builder(String id, NodeType type) {
        return new Builder(id, type);
    }

    public String id() {
        return id;
    }

    public NodeType type() {
        return type;
    }

    public ContentMode contentMode() {
        return contentMode;
    }

    public String content() {
        return content;
    }

    public Optional<String> goal() {
        return Optional.ofNullable(goal);
    }

    public boolean hasGoal() {
        return goal != null;
    }

    public List<Transition> transitions() {
        return transitions;
    }

    public List<VariableSpec> variables() {
        return variables;
    }

    public List<VariableSpec> mandatoryVariables() {
        return variables.stream().filter(VariableSpec::mandatory).toList();
    }

    public List<VariableSpec> optionalVariables() {
        return variables.stream().filter(spec -> !spec.mandatory()).toList();
    }

    public Optional<LogicSplit> logicSplit() {
        return Optional.ofNullable(logicSplit);
    }

    public Optional<String> transferDestination() {
        return Optional.ofNullable(transferDestination);
    }

    public Optional<WebhookSpec> webhook() {
        return Optional.ofNullable(webhook);
    }

    public InputType inputType() {
        return inputType;
    }

    public String errorMessage() {
        return errorMessage;
    }

    public boolean autoTransition() {
        return autoTransition;
    }

    public Optional<DigitRoute> routeDigit(String utterance) {
        if (utterance == null) {
            return Optional.empty();
        }
        Matcher matcher = DIGIT.matcher(utterance);
        if (!matcher.find()) {
            return Optional.empty();
        }
        String digit = matcher.group();
        return Optional.of(new DigitRoute(digit, digitMappings.get(digit)));
    }

    public record DigitRoute(String digit, String targetNodeId) {
        public boolean mapped() {
            return targetNodeId != null && !targetNodeId.isBlank();
        }
    }

    public static final class Builder {
        private final String id;
        private final NodeType type;
        private ContentMode contentMode = ContentMode.SCRIPT;
        private String content;
        private String goal;
        private final List<Transition> transitions = new ArrayList<>();
        private final List<VariableSpec> variables = new ArrayList<>();
        private LogicSplit logicSplit;
        private final Map<String, String> digitMappings = new LinkedHashMap<>();
        private String transferDestination;
        private WebhookSpec webhook;
        private InputType inputType = InputType.TEXT;
        private String errorMessage = "";
        private boolean autoTransition;

        private Builder(String id, NodeType type) {
            if (id == null || id.isBlank()) {
                throw new IllegalArgumentException("Node id is required");
            }
            this.id = id;
            this.type = type == null ? NodeType.CONVERSATION : type;
        }

        public Builder contentMode(ContentMode contentMode) {
            this.contentMode = contentMode == null ? ContentMode.SCRIPT : contentMode;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder goal(String goal) {
            this.goal = goal;
            return this;
        }

        public Builder transition(Transition transition) {
            if (transition != null) {
                this.transitions.add(transition);
            }
            return this;
        }

        public Builder variable(VariableSpec variable) {
            if (variable != null) {
                this.variables.add(variable);
            }
            return this;
        }

        public Builder logicSplit(LogicSplit logicSplit) {
            this.logicSplit = logicSplit;
            return this;
        }

        public Builder digit(String digit, String targetNodeId) {
            if (digit != null && !digit.isBlank() && targetNodeId != null && !targetNodeId.isBlank()) {
                this.digitMappings.put(digit.trim(), targetNodeId);
            }
            return this;
        }

        public Builder transferDestination(String transferDestination) {
            this.transferDestination = transferDestination == null || transferDestination.isBlank()
                    ? null
                    : transferDestination.trim();
            return this;
        }

        public Builder webhook(WebhookSpec webhook) {
            this.webhook = webhook;
            return this;
        }

        public Builder inputType(InputType inputType) {
            this.inputType = inputType == null ? InputType.TEXT : inputType;
            return this;
        }

        public Builder errorMessage(String errorMessage) {
            this.errorMessage = errorMessage == null ? "" : errorMessage;
            return this;
        }

        public Builder autoTransition(boolean autoTransition) {
            this.autoTransition = autoTransition;
            return this;
        }

        public FlowNode build() {
            return new FlowNode(this);
        }
    }
}
