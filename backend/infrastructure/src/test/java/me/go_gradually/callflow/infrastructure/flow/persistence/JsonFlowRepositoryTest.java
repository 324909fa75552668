package me.go_gradually.callflow.infrastructure.flow.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.domain.flow.ContentMode;
import me.go_gradually.callflow.domain.flow.FlowGraph;
import me.go_gradually.callflow.domain.flow.FlowNode;
import me.go_gradually.callflow.domain.flow.InputType;
import me.go_gradually.callflow.domain.flow.LogicOperator;
import me.go_gradually.callflow.domain.flow.NodeType;
import me.go_gradually.callflow.domain.flow.WebhookSpec;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonFlowRepositoryTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void findByAgentId_loadsEveryFlowInLocation() {
        JsonFlowRepository repository = new JsonFlowRepository("classpath:flows-test", objectMapper);

        FlowGraph booking = repository.findByAgentId("booking").orElseThrow();
        FlowGraph survey = repository.findByAgentId("survey").orElseThrow();

        assertEquals("greeting", booking.startNodeId());
        assertEquals(7, booking.size());
        assertEquals("You book dental appointments for Bright Smile.", booking.globalPrompt());
        assertEquals("intro", survey.startNodeId());
        assertTrue(repository.findByAgentId("missing").isEmpty());
        assertTrue(repository.findByAgentId(" ").isEmpty());
    }

    @Test
    void parse_mapsNodeDetails() {
        FlowGraph booking = new JsonFlowRepository("classpath:flows-test/", objectMapper)
                .findByAgentId("booking").orElseThrow();

        FlowNode greeting = booking.requireNode("greeting");
        assertEquals(NodeType.CONVERSATION, greeting.type());
        assertEquals(ContentMode.SCRIPT, greeting.contentMode());
        assertEquals(2, greeting.transitions().size());
        assertTrue(greeting.transitions().get(1).isDefault());

        FlowNode collect = booking.requireNode("collect_email");
        assertEquals(NodeType.COLLECT_INPUT, collect.type());
        assertEquals(InputType.EMAIL, collect.inputType());
        assertEquals("email", collect.mandatoryVariables().get(0).name());
        assertTrue(collect.transitions().get(0).requiredVariables().contains("email"));

        FlowNode book = booking.requireNode("book");
        WebhookSpec webhook = book.webhook().orElseThrow();
        assertEquals("POST", webhook.method());
        assertEquals("{\"email\":\"{{email}}\"}", webhook.bodyTemplate());
        assertEquals("booking", webhook.responseVariable());
        assertTrue(book.autoTransition());

        FlowNode route = booking.requireNode("route");
        assertEquals(LogicOperator.CONTAINS, route.logicSplit().orElseThrow().conditions().get(0).operator());
        assertEquals("menu", route.logicSplit().orElseThrow().route(Map.of("booking", "pending")).orElseThrow());

        FlowNode menu = booking.requireNode("menu");
        assertEquals("front_desk", menu.routeDigit("one, I mean 1").orElseThrow().targetNodeId());

        assertEquals("+15550100", booking.requireNode("front_desk").transferDestination().orElseThrow());
        assertEquals(ContentMode.PROMPT, booking.requireNode("goodbye").contentMode());
    }

    @Test
    void findByAgentId_rejectsDuplicateAgents() {
        JsonFlowRepository repository = new JsonFlowRepository("classpath:flows-duplicate/", objectMapper);

        assertThrows(IllegalStateException.class, () -> repository.findByAgentId("twin"));
    }

    @Test
    void parse_rejectsDanglingTargets() throws Exception {
        JsonFlowRepository repository = new JsonFlowRepository("classpath:flows-test/", objectMapper);
        String json = "{\"agentId\":\"broken\",\"nodes\":[{\"id\":\"a\",\"type\":\"conversation\","
                + "\"transitions\":[{\"condition\":\"always\",\"target\":\"nowhere\"}]}]}";

        assertThrows(IllegalArgumentException.class, () -> repository.parse(objectMapper.readTree(json)));
    }
}
