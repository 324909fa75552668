package me.go_gradually.callflow.infrastructure.flow.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.call.port.FlowRepository;
import me.go_gradually.callflow.infrastructure.flow.persistence.JsonFlowRepository;
import me.go_gradually.callflow.infrastructure.shared.config.AppProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class FlowRepositoryConfig {
    @Bean
    public FlowRepository flowRepository(AppProperties properties, ObjectMapper objectMapper) {
        return new JsonFlowRepository(properties.getFlows().getLocation(), objectMapper);
    }
}
