package me.go_gradually.callflow.bootstrap;

import me.go_gradually.callflow.infrastructure.shared.config.AppProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(AppProperties.class)
public class AppConfig {
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
