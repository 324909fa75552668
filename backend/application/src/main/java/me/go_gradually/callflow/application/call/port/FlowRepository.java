package me.go_gradually.callflow.application.call.port;

import me.go_gradually.callflow.domain.flow.FlowGraph;

import java.util.Optional;

public interface FlowRepository {
    Optional<FlowGraph> findByAgentId(String agentId);
}
