package me.go_gradually.callflow.bootstrap;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.go_gradually.callflow.application.call.policy.SessionPolicy;
import me.go_gradually.callflow.application.call.port.FlowRepository;
import me.go_gradually.callflow.application.call.port.TelephonyGateway;
import me.go_gradually.callflow.application.call.usecase.ContentGenerator;
import me.go_gradually.callflow.application.call.usecase.SessionOrchestrator;
import me.go_gradually.callflow.application.call.usecase.VariableExtractor;
import me.go_gradually.callflow.application.call.usecase.WebhookExecutor;
import me.go_gradually.callflow.application.interruption.policy.InterruptionPolicy;
import me.go_gradually.callflow.application.interruption.usecase.InterruptionController;
import me.go_gradually.callflow.application.llm.port.LlmClient;
import me.go_gradually.callflow.application.shared.port.AsyncExecutor;
import me.go_gradually.callflow.application.shared.port.MetricsPort;
import me.go_gradually.callflow.application.shared.port.TickScheduler;
import me.go_gradually.callflow.application.silence.policy.SilencePolicy;
import me.go_gradually.callflow.application.silence.usecase.SilenceMonitor;
import me.go_gradually.callflow.application.store.port.SharedSessionStorePort;
import me.go_gradually.callflow.application.store.usecase.SessionReadinessGate;
import me.go_gradually.callflow.application.stream.policy.StreamingPolicy;
import me.go_gradually.callflow.application.stream.port.SpeechSynthesisGateway;
import me.go_gradually.callflow.application.stream.usecase.AudioStreamCoordinator;
import me.go_gradually.callflow.application.transition.policy.TransitionPolicy;
import me.go_gradually.callflow.application.transition.usecase.TransitionEvaluator;
import me.go_gradually.callflow.application.webhook.port.WebhookGateway;
import me.go_gradually.callflow.infrastructure.shared.scheduling.ScheduledTickScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
public class UseCaseConfig {
    private static final Duration READY_RECHECK_INTERVAL = Duration.ofMillis(100);

    @Bean(destroyMethod = "shutdown")
    public ExecutorService callExecutorService() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService tickExecutorService() {
        return Executors.newScheduledThreadPool(Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    @Bean
    public AsyncExecutor asyncExecutor(ExecutorService callExecutorService) {
        return callExecutorService::execute;
    }

    @Bean
    public TickScheduler tickScheduler(ScheduledExecutorService tickExecutorService) {
        return new ScheduledTickScheduler(tickExecutorService);
    }

    @Bean
    public SessionReadinessGate sessionReadinessGate(SharedSessionStorePort sharedSessionStore) {
        return new SessionReadinessGate(sharedSessionStore, READY_RECHECK_INTERVAL);
    }

    @Bean
    public AudioStreamCoordinator audioStreamCoordinator(SpeechSynthesisGateway speechSynthesisGateway,
                                                         TelephonyGateway telephonyGateway,
                                                         SharedSessionStorePort sharedSessionStore,
                                                         AsyncExecutor asyncExecutor,
                                                         TickScheduler tickScheduler,
                                                         StreamingPolicy streamingPolicy,
                                                         SessionPolicy sessionPolicy,
                                                         MetricsPort metricsPort,
                                                         Clock clock) {
        return new AudioStreamCoordinator(speechSynthesisGateway, telephonyGateway, sharedSessionStore,
                asyncExecutor, tickScheduler, streamingPolicy, metricsPort, clock, sessionPolicy.sessionTtl());
    }

    @Bean
    public InterruptionController interruptionController(InterruptionPolicy interruptionPolicy,
                                                         AudioStreamCoordinator audioStreamCoordinator,
                                                         MetricsPort metricsPort,
                                                         Clock clock) {
        return new InterruptionController(interruptionPolicy, audioStreamCoordinator, metricsPort, clock);
    }

    @Bean
    public TransitionEvaluator transitionEvaluator(LlmClient llmClient,
                                                   AsyncExecutor asyncExecutor,
                                                   TransitionPolicy transitionPolicy,
                                                   MetricsPort metricsPort) {
        return new TransitionEvaluator(llmClient, asyncExecutor, transitionPolicy, metricsPort);
    }

    @Bean
    public SilenceMonitor silenceMonitor(SilencePolicy silencePolicy,
                                         AudioStreamCoordinator audioStreamCoordinator,
                                         SharedSessionStorePort sharedSessionStore,
                                         SessionPolicy sessionPolicy,
                                         MetricsPort metricsPort,
                                         Clock clock) {
        return new SilenceMonitor(silencePolicy, audioStreamCoordinator, sharedSessionStore, metricsPort, clock,
                sessionPolicy.flagTtl());
    }

    @Bean
    public ContentGenerator contentGenerator(LlmClient llmClient,
                                             AudioStreamCoordinator audioStreamCoordinator,
                                             SessionPolicy sessionPolicy,
                                             MetricsPort metricsPort,
                                             Clock clock) {
        return new ContentGenerator(llmClient, audioStreamCoordinator, sessionPolicy, metricsPort, clock);
    }

    @Bean
    public VariableExtractor variableExtractor(LlmClient llmClient,
                                               AsyncExecutor asyncExecutor,
                                               ObjectMapper objectMapper,
                                               SessionPolicy sessionPolicy) {
        return new VariableExtractor(llmClient, asyncExecutor, objectMapper,
                sessionPolicy.contentModel(), sessionPolicy.extractionTimeout());
    }

    @Bean
    public WebhookExecutor webhookExecutor(WebhookGateway webhookGateway,
                                           ObjectMapper objectMapper,
                                           SessionPolicy sessionPolicy,
                                           MetricsPort metricsPort,
                                           Clock clock) {
        return new WebhookExecutor(webhookGateway, objectMapper, metricsPort, clock,
                sessionPolicy.webhookTimeout(), sessionPolicy.webhookAttempts());
    }

    @Bean
    public SessionOrchestrator sessionOrchestrator(FlowRepository flowRepository,
                                                   TelephonyGateway telephonyGateway,
                                                   SharedSessionStorePort sharedSessionStore,
                                                   SessionReadinessGate sessionReadinessGate,
                                                   TransitionEvaluator transitionEvaluator,
                                                   SilenceMonitor silenceMonitor,
                                                   InterruptionController interruptionController,
                                                   AudioStreamCoordinator audioStreamCoordinator,
                                                   ContentGenerator contentGenerator,
                                                   VariableExtractor variableExtractor,
                                                   WebhookExecutor webhookExecutor,
                                                   AsyncExecutor asyncExecutor,
                                                   TickScheduler tickScheduler,
                                                   SessionPolicy sessionPolicy,
                                                   SilencePolicy silencePolicy,
                                                   MetricsPort metricsPort,
                                                   Clock clock) {
        return new SessionOrchestrator(flowRepository, telephonyGateway, sharedSessionStore, sessionReadinessGate,
                transitionEvaluator, silenceMonitor, interruptionController, audioStreamCoordinator,
                contentGenerator, variableExtractor, webhookExecutor, asyncExecutor, tickScheduler,
                sessionPolicy, silencePolicy.tickInterval(), metricsPort, clock);
    }
}
