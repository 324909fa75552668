package me.go_gradually.callflow.infrastructure.store.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;
import me.go_gradually.callflow.infrastructure.shared.config.AppProperties;
import me.go_gradually.callflow.infrastructure.store.memory.InMemorySharedSessionStore;
import me.go_gradually.callflow.infrastructure.store.redis.RedisSharedSessionStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.util.logging.Logger;

@Configuration
public class SharedSessionStoreConfig {
    private static final Logger log = Logger.getLogger(SharedSessionStoreConfig.class.getName());

    @Bean
    public SharedSessionStorePort sharedSessionStore(AppProperties properties,
                                                     ObjectProvider<StringRedisTemplate> redisTemplate,
                                                     ObjectMapper objectMapper,
                                                     MetricsPort metricsPort,
                                                     Clock clock) {
        String mode = properties.getSession().getStore();
        if ("redis".equalsIgnoreCase(mode)) {
            StringRedisTemplate template = redisTemplate.getIfAvailable();
            if (template == null) {
                throw new IllegalStateException("callflow.session.store=redis but no Redis connection is configured");
            }
            log.info("store.mode=redis");
            return new RedisSharedSessionStore(template, objectMapper, properties.sessionTtl(), metricsPort);
        }
        log.info("store.mode=memory");
        return new InMemorySharedSessionStore(clock);
    }
}
