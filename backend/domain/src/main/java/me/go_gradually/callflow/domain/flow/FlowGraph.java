package me.go_gradually.callflow.domain.flow;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;

public final class FlowGraph {
    private final String agentId;
    private final String startNodeId;
    private final String globalPrompt;
    private final Map<String, FlowNode> nodes;

    private FlowGraph(String agentId, String startNodeId, String globalPrompt, Map<String, FlowNode> nodes) {
        this.agentId = agentId;
        this.startNodeId = startNodeId;
        this.globalPrompt = globalPrompt == null ? "" : globalPrompt;
        this.nodes = nodes;
    }

    public static FlowGraph of(String agentId, String startNodeId, String globalPrompt, Collection<FlowNode> nodes) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agentId is required");
        }
        if (nodes == null || nodes.isEmpty()) {
            throw new IllegalArgumentException("Flow " + agentId + " has no nodes");
        }
        Map<String, FlowNode> byId = new LinkedHashMap<>();
        for (FlowNode node : nodes) {
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new IllegalArgumentException("Duplicate node id " + node.id() + " in flow " + agentId);
            }
        }
        String resolvedStart = resolveStart(agentId, startNodeId, byId);
        for (FlowNode node : byId.values()) {
            validateTargets(agentId, node, byId);
        }
        return new FlowGraph(agentId, resolvedStart, globalPrompt, Map.copyOf(byId));
    }

    private static String resolveStart(String agentId, String startNodeId, Map<String, FlowNode> byId) {
        if (startNodeId != null && !startNodeId.isBlank()) {
            if (!byId.containsKey(startNodeId)) {
                throw new IllegalArgumentException("Start node " + startNodeId + " not found in flow " + agentId);
            }
            return startNodeId;
        }
        return byId.values().stream()
                .filter(node -> node.type() == NodeType.START)
                .map(FlowNode::id)
                .findFirst()
                .orElseGet(() -> byId.keySet().iterator().next());
    }

    private static void validateTargets(String agentId, FlowNode node, Map<String, FlowNode> byId) {
        for (Transition transition : node.transitions()) {
            requireTarget(agentId, node, transition.targetNodeId(), byId);
        }
        node.logicSplit().ifPresent(split -> {
            split.conditions().forEach(condition -> requireTarget(agentId, node, condition.targetNodeId(), byId));
            if (split.defaultTargetNodeId() != null && !split.defaultTargetNodeId().isBlank()) {
                requireTarget(agentId, node, split.defaultTargetNodeId(), byId);
            }
        });
    }

    private static void requireTarget(String agentId, FlowNode node, String target, Map<String, FlowNode> byId) {
        if (target != null && !target.isBlank() && !byId.containsKey(target)) {
            throw new IllegalArgumentException("Node " + node.id() + " in flow " + agentId
                    + " points to unknown node " + target);
        }
    }

    public String agentId() {
        return agentId;
    }

    public String startNodeId() {
        return startNodeId;
    }

    public String globalPrompt() {
        return globalPrompt;
    }

    public FlowNode startNode() {
        return nodes.get(startNodeId);
    }

    public Optional<FlowNode> node(String nodeId) {
        if (nodeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(nodes.get(nodeId));
    }

    public FlowNode requireNode(String nodeId) {
        return node(nodeId).orElseThrow(() -> new NoSuchElementException(
                "Node " + nodeId + " not found in flow " + agentId));
    }

    public int size() {
        return nodes.size();
    }
}
