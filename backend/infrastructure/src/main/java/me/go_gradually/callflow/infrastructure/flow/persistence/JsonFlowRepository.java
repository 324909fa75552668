package me.go_gradually.callflow.infrastructure.flow.persistence;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.call.port.FlowRepository;
import me.go_gradually.callflow.domain.flow.ContentMode;
import me.go_gradually.callflow.domain.flow.FlowGraph;
import me.go_gradually.callflow.domain.flow.FlowNode;
import me.go_gradually.callflow.domain.flow.InputType;
import me.go_gradually.callflow.domain.flow.LogicCondition;
import me.go_gradually.callflow.domain.flow.LogicOperator;
import me.go_gradually.callflow.domain.flow.LogicSplit;
import me.go_gradually.callflow.domain.flow.NodeType;
import me.go_gradually.callflow.domain.flow.Transition;
import me.go_gradually.callflow.domain.flow.VariableSpec;
import me.go_gradually.callflow.domain.flow.WebhookSpec;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Logger;

/**
 * Read-only flows loaded once from JSON documents under a resource location, one agent per file.
 */
public class JsonFlowRepository implements FlowRepository {
    private static final Logger log = Logger.getLogger(JsonFlowRepository.class.getName());

    private final String location;
    private final ObjectMapper objectMapper;
    private final ResourcePatternResolver resolver = new PathMatchingResourcePatternResolver();
    private volatile Map<String, FlowGraph> flows;

    public JsonFlowRepository(String location, ObjectMapper objectMapper) {
        this.location = location.endsWith("/") ? location : location + "/";
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<FlowGraph> findByAgentId(String agentId) {
        if (agentId == null || agentId.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(flows().get(agentId));
    }

    private Map<String, FlowGraph> flows() {
        Map<String, FlowGraph> loaded = flows;
        if (loaded == null) {
            synchronized (this) {
                loaded = flows;
                if (loaded == null) {
                    loaded = loadAll();
                    flows = loaded;
                }
            }
        }
        return loaded;
    }

    private Map<String, FlowGraph> loadAll() {
        Map<String, FlowGraph> loaded = new ConcurrentHashMap<>();
        try {
            for (Resource resource : resolver.getResources(location + "*.json")) {
                FlowGraph flow = read(resource);
                if (loaded.putIfAbsent(flow.agentId(), flow) != null) {
                    throw new IllegalStateException("Duplicate flow for agent " + flow.agentId());
                }
                log.info(() -> "flow.loaded agentId=" + flow.agentId() + " nodes=" + flow.size()
                        + " source=" + resource.getFilename());
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load flows from " + location, e);
        }
        return loaded;
    }

    private FlowGraph read(Resource resource) throws IOException {
        try (InputStream in = resource.getInputStream()) {
            return parse(objectMapper.readTree(in));
        }
    }

    FlowGraph parse(JsonNode root) {
        List<FlowNode> nodes = new ArrayList<>();
        for (JsonNode node : root.path("nodes")) {
            nodes.add(parseNode(node));
        }
        return FlowGraph.of(
                text(root, "agentId"),
                text(root, "startNodeId"),
                text(root, "globalPrompt"),
                nodes
        );
    }

    private FlowNode parseNode(JsonNode node) {
        FlowNode.Builder builder = FlowNode.builder(text(node, "id"), NodeType.fromCode(text(node, "type")))
                .content(text(node, "content"))
                .goal(text(node, "goal"))
                .transferDestination(text(node, "transferDestination"))
                .errorMessage(text(node, "errorMessage"))
                .autoTransition(node.path("autoTransition").asBoolean(false));
        if (node.hasNonNull("contentMode")) {
            builder.contentMode(ContentMode.fromCode(text(node, "contentMode")));
        }
        if (node.hasNonNull("inputType")) {
            builder.inputType(InputType.fromCode(text(node, "inputType")));
        }
        for (JsonNode transition : node.path("transitions")) {
            Set<String> required = new LinkedHashSet<>();
            transition.path("requiredVariables").forEach(name -> required.add(name.asText()));
            builder.transition(new Transition(text(transition, "condition"), text(transition, "target"), required));
        }
        for (JsonNode variable : node.path("variables")) {
            builder.variable(new VariableSpec(
                    text(variable, "name"),
                    text(variable, "description"),
                    variable.path("mandatory").asBoolean(false)));
        }
        JsonNode split = node.path("logicSplit");
        if (split.isObject()) {
            List<LogicCondition> conditions = new ArrayList<>();
            for (JsonNode condition : split.path("conditions")) {
                conditions.add(new LogicCondition(
                        text(condition, "variable"),
                        LogicOperator.fromCode(text(condition, "operator")),
                        text(condition, "value"),
                        text(condition, "target")));
            }
            builder.logicSplit(new LogicSplit(conditions, text(split, "defaultTarget")));
        }
        Iterator<Map.Entry<String, JsonNode>> digits = node.path("digits").fields();
        while (digits.hasNext()) {
            Map.Entry<String, JsonNode> digit = digits.next();
            builder.digit(digit.getKey(), digit.getValue().asText());
        }
        JsonNode webhook = node.path("webhook");
        if (webhook.isObject()) {
            builder.webhook(new WebhookSpec(
                    text(webhook, "url"),
                    text(webhook, "method"),
                    webhook.path("body").isTextual() ? webhook.path("body").asText() : bodyOf(webhook.path("body")),
                    text(webhook, "responseVariable")));
        }
        return builder.build();
    }

    private String bodyOf(JsonNode body) {
        if (body.isMissingNode() || body.isNull()) {
            return null;
        }
        return body.toString();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
