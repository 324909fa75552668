package me.go_gradually.callflow.infrastructure.shared.config;

import me.go_gradually.callflow.application.call.policy.SessionPolicy;
import me.go_gradually.callflow.application.interruption.policy.InterruptionPolicy;
import me.go_gradually.callflow.application.silence.policy.SilencePolicy;
import me.go_gradually.callflow.application.stream.policy.StreamingPolicy;
import me.go_gradually.callflow.application.transition.policy.TransitionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "callflow")
public class AppProperties implements SilencePolicy, InterruptionPolicy, TransitionPolicy, StreamingPolicy, SessionPolicy {
    private Silence silence = new Silence();
    private Interruption interruption = new Interruption();
    private Transition transition = new Transition();
    private Streaming streaming = new Streaming();
    private Session session = new Session();
    private Integrations integrations = new Integrations();
    private Flows flows = new Flows();

    public Silence getSilence() {
        return silence;
    }

    public void setSilence(Silence silence) {
        this.silence = silence;
    }

    public Interruption getInterruption() {
        return interruption;
    }

    public void setInterruption(Interruption interruption) {
        this.interruption = interruption;
    }

    public Transition getTransition() {
        return transition;
    }

    public void setTransition(Transition transition) {
        this.transition = transition;
    }

    public Streaming getStreaming() {
        return streaming;
    }

    public void setStreaming(Streaming streaming) {
        this.streaming = streaming;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Integrations getIntegrations() {
        return integrations;
    }

    public void setIntegrations(Integrations integrations) {
        this.integrations = integrations;
    }

    public Flows getFlows() {
        return flows;
    }

    public void setFlows(Flows flows) {
        this.flows = flows;
    }

    @Override
    public Duration silenceTimeout() {
        return silence.getTimeout();
    }

    @Override
    public Duration holdOnSilenceTimeout() {
        return silence.getHoldOnTimeout();
    }

    @Override
    public int maxCheckins() {
        return silence.getMaxCheckins();
    }

    @Override
    public String checkinMessage() {
        return silence.getCheckinMessage();
    }

    @Override
    public Duration minCheckinInterval() {
        return silence.getMinCheckinInterval();
    }

    @Override
    public Duration maxCallDuration() {
        return silence.getMaxCallDuration();
    }

    @Override
    public Duration tickInterval() {
        return silence.getTickInterval();
    }

    @Override
    public List<String> acknowledgementWords() {
        return List.copyOf(interruption.getAcknowledgementWords());
    }

    @Override
    public int acknowledgementMaxWords() {
        return interruption.getAcknowledgementMaxWords();
    }

    @Override
    public int minInterruptWords() {
        return interruption.getMinInterruptWords();
    }

    @Override
    public Duration agentQuietGrace() {
        return interruption.getAgentQuietGrace();
    }

    @Override
    public double echoOverlapThreshold() {
        return interruption.getEchoOverlapThreshold();
    }

    @Override
    public Duration playbackStartBuffer() {
        return interruption.getPlaybackStartBuffer();
    }

    @Override
    public List<String> holdOnPhrases() {
        return List.copyOf(interruption.getHoldOnPhrases());
    }

    @Override
    public Duration transitionTimeout() {
        return transition.getTimeout();
    }

    @Override
    public int historyWindow() {
        return transition.getHistoryWindow();
    }

    @Override
    public String transitionModel() {
        return transition.getModel();
    }

    @Override
    public List<String> affirmativePrefixes() {
        return List.copyOf(transition.getAffirmativePrefixes());
    }

    @Override
    public List<String> negativePrefixes() {
        return List.copyOf(transition.getNegativePrefixes());
    }

    @Override
    public int maxFragmentChars() {
        return streaming.getMaxFragmentChars();
    }

    @Override
    public Duration synthesisTimeout() {
        return streaming.getSynthesisTimeout();
    }

    @Override
    public int playbackAttempts() {
        return streaming.getPlaybackAttempts();
    }

    @Override
    public Duration keepAliveInterval() {
        return streaming.getKeepAliveInterval();
    }

    @Override
    public int historyLimit() {
        return session.getHistoryLimit();
    }

    @Override
    public Duration sessionTtl() {
        return session.getTtl();
    }

    @Override
    public Duration flagTtl() {
        return session.getFlagTtl();
    }

    @Override
    public Duration readyWaitTimeout() {
        return session.getReadyWaitTimeout();
    }

    @Override
    public String defaultAgentId() {
        return session.getDefaultAgentId();
    }

    @Override
    public String contentModel() {
        return session.getContentModel();
    }

    @Override
    public Duration contentTimeout() {
        return session.getContentTimeout();
    }

    @Override
    public Duration extractionTimeout() {
        return session.getExtractionTimeout();
    }

    @Override
    public Duration webhookTimeout() {
        return session.getWebhookTimeout();
    }

    @Override
    public int webhookAttempts() {
        return session.getWebhookAttempts();
    }

    @Override
    public String closingLine() {
        return session.getClosingLine();
    }

    @Override
    public String fallbackLine() {
        return session.getFallbackLine();
    }

    @Override
    public String holdOnReply() {
        return session.getHoldOnReply();
    }

    @Override
    public String transferMessage() {
        return session.getTransferMessage();
    }

    @Override
    public String digitPrompt() {
        return session.getDigitPrompt();
    }

    @Override
    public Duration teardownDrainTimeout() {
        return session.getTeardownDrainTimeout();
    }

    @Override
    public int maxNodeHops() {
        return session.getMaxNodeHops();
    }

    public static class Silence {
        private Duration timeout = Duration.ofSeconds(7);
        private Duration holdOnTimeout = Duration.ofSeconds(25);
        private int maxCheckins = 2;
        private String checkinMessage = "Are you still there?";
        private Duration minCheckinInterval = Duration.ofSeconds(3);
        private Duration maxCallDuration = Duration.ofSeconds(1500);
        private Duration tickInterval = Duration.ofMillis(500);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public Duration getHoldOnTimeout() {
            return holdOnTimeout;
        }

        public void setHoldOnTimeout(Duration holdOnTimeout) {
            this.holdOnTimeout = holdOnTimeout;
        }

        public int getMaxCheckins() {
            return maxCheckins;
        }

        public void setMaxCheckins(int maxCheckins) {
            this.maxCheckins = maxCheckins;
        }

        public String getCheckinMessage() {
            return checkinMessage;
        }

        public void setCheckinMessage(String checkinMessage) {
            this.checkinMessage = checkinMessage;
        }

        public Duration getMinCheckinInterval() {
            return minCheckinInterval;
        }

        public void setMinCheckinInterval(Duration minCheckinInterval) {
            this.minCheckinInterval = minCheckinInterval;
        }

        public Duration getMaxCallDuration() {
            return maxCallDuration;
        }

        public void setMaxCallDuration(Duration maxCallDuration) {
            this.maxCallDuration = maxCallDuration;
        }

        public Duration getTickInterval() {
            return tickInterval;
        }

        public void setTickInterval(Duration tickInterval) {
            this.tickInterval = tickInterval;
        }
    }

    public static class Interruption {
        private List<String> acknowledgementWords = new ArrayList<>(List.of(
                "yeah", "yes", "yep", "yup", "okay", "ok", "sure", "uh-huh", "mhm", "right", "got it", "go ahead"));
        private int acknowledgementMaxWords = 2;
        private int minInterruptWords = 2;
        private Duration agentQuietGrace = Duration.ofMillis(1500);
        private double echoOverlapThreshold = 0.3;
        private Duration playbackStartBuffer = Duration.ofMillis(500);
        private List<String> holdOnPhrases = new ArrayList<>(List.of(
                "hold on", "wait", "one moment", "one second", "give me a second", "hang on", "just a sec", "one sec"));

        public List<String> getAcknowledgementWords() {
            return acknowledgementWords;
        }

        public void setAcknowledgementWords(List<String> acknowledgementWords) {
            this.acknowledgementWords = acknowledgementWords;
        }

        public int getAcknowledgementMaxWords() {
            return acknowledgementMaxWords;
        }

        public void setAcknowledgementMaxWords(int acknowledgementMaxWords) {
            this.acknowledgementMaxWords = acknowledgementMaxWords;
        }

        public int getMinInterruptWords() {
            return minInterruptWords;
        }

        public void setMinInterruptWords(int minInterruptWords) {
            this.minInterruptWords = minInterruptWords;
        }

        public Duration getAgentQuietGrace() {
            return agentQuietGrace;
        }

        public void setAgentQuietGrace(Duration agentQuietGrace) {
            this.agentQuietGrace = agentQuietGrace;
        }

        public double getEchoOverlapThreshold() {
            return echoOverlapThreshold;
        }

        public void setEchoOverlapThreshold(double echoOverlapThreshold) {
            this.echoOverlapThreshold = echoOverlapThreshold;
        }

        public Duration getPlaybackStartBuffer() {
            return playbackStartBuffer;
        }

        public void setPlaybackStartBuffer(Duration playbackStartBuffer) {
            this.playbackStartBuffer = playbackStartBuffer;
        }

        public List<String> getHoldOnPhrases() {
            return holdOnPhrases;
        }

        public void setHoldOnPhrases(List<String> holdOnPhrases) {
            this.holdOnPhrases = holdOnPhrases;
        }
    }

    public static class Transition {
        private Duration timeout = Duration.ofMillis(1500);
        private int historyWindow = 10;
        private String model = "gpt-4o-mini";
        private List<String> affirmativePrefixes = new ArrayList<>(List.of(
                "yes", "yeah", "yep", "yup", "sure", "absolutely", "definitely", "of course", "okay", "ok",
                "correct", "sounds good", "that's right"));
        private List<String> negativePrefixes = new ArrayList<>(List.of(
                "no", "nope", "nah", "not really", "not interested", "no thanks", "never"));

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getHistoryWindow() {
            return historyWindow;
        }

        public void setHistoryWindow(int historyWindow) {
            this.historyWindow = historyWindow;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public List<String> getAffirmativePrefixes() {
            return affirmativePrefixes;
        }

        public void setAffirmativePrefixes(List<String> affirmativePrefixes) {
            this.affirmativePrefixes = affirmativePrefixes;
        }

        public List<String> getNegativePrefixes() {
            return negativePrefixes;
        }

        public void setNegativePrefixes(List<String> negativePrefixes) {
            this.negativePrefixes = negativePrefixes;
        }
    }

    public static class Streaming {
        private int maxFragmentChars = 180;
        private Duration synthesisTimeout = Duration.ofSeconds(5);
        private int playbackAttempts = 2;
        private Duration keepAliveInterval = Duration.ofSeconds(10);

        public int getMaxFragmentChars() {
            return maxFragmentChars;
        }

        public void setMaxFragmentChars(int maxFragmentChars) {
            this.maxFragmentChars = maxFragmentChars;
        }

        public Duration getSynthesisTimeout() {
            return synthesisTimeout;
        }

        public void setSynthesisTimeout(Duration synthesisTimeout) {
            this.synthesisTimeout = synthesisTimeout;
        }

        public int getPlaybackAttempts() {
            return playbackAttempts;
        }

        public void setPlaybackAttempts(int playbackAttempts) {
            this.playbackAttempts = playbackAttempts;
        }

        public Duration getKeepAliveInterval() {
            return keepAliveInterval;
        }

        public void setKeepAliveInterval(Duration keepAliveInterval) {
            this.keepAliveInterval = keepAliveInterval;
        }
    }

    public static class Session {
        private int historyLimit = 20;
        private Duration ttl = Duration.ofHours(1);
        private Duration flagTtl = Duration.ofSeconds(10);
        private Duration readyWaitTimeout = Duration.ofSeconds(2);
        private String defaultAgentId = "default";
        private String contentModel = "gpt-4o-mini";
        private Duration contentTimeout = Duration.ofSeconds(8);
        private Duration extractionTimeout = Duration.ofSeconds(3);
        private Duration webhookTimeout = Duration.ofSeconds(10);
        private int webhookAttempts = 2;
        private String closingLine = "I'm sorry, something went wrong on our side. Goodbye.";
        private String fallbackLine = "Sorry, could you say that again?";
        private String holdOnReply = "Sure, take your time.";
        private String transferMessage = "Please hold while I transfer your call.";
        private String digitPrompt = "Please press a digit on your keypad.";
        private Duration teardownDrainTimeout = Duration.ofSeconds(30);
        private int maxNodeHops = 10;
        private String store = "memory";

        public int getHistoryLimit() {
            return historyLimit;
        }

        public void setHistoryLimit(int historyLimit) {
            this.historyLimit = historyLimit;
        }

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getFlagTtl() {
            return flagTtl;
        }

        public void setFlagTtl(Duration flagTtl) {
            this.flagTtl = flagTtl;
        }

        public Duration getReadyWaitTimeout() {
            return readyWaitTimeout;
        }

        public void setReadyWaitTimeout(Duration readyWaitTimeout) {
            this.readyWaitTimeout = readyWaitTimeout;
        }

        public String getDefaultAgentId() {
            return defaultAgentId;
        }

        public void setDefaultAgentId(String defaultAgentId) {
            this.defaultAgentId = defaultAgentId;
        }

        public String getContentModel() {
            return contentModel;
        }

        public void setContentModel(String contentModel) {
            this.contentModel = contentModel;
        }

        public Duration getContentTimeout() {
            return contentTimeout;
        }

        public void setContentTimeout(Duration contentTimeout) {
            this.contentTimeout = contentTimeout;
        }

        public Duration getExtractionTimeout() {
            return extractionTimeout;
        }

        public void setExtractionTimeout(Duration extractionTimeout) {
            this.extractionTimeout = extractionTimeout;
        }

        public Duration getWebhookTimeout() {
            return webhookTimeout;
        }

        public void setWebhookTimeout(Duration webhookTimeout) {
            this.webhookTimeout = webhookTimeout;
        }

        public int getWebhookAttempts() {
            return webhookAttempts;
        }

        public void setWebhookAttempts(int webhookAttempts) {
            this.webhookAttempts = webhookAttempts;
        }

        public String getClosingLine() {
            return closingLine;
        }

        public void setClosingLine(String closingLine) {
            this.closingLine = closingLine;
        }

        public String getFallbackLine() {
            return fallbackLine;
        }

        public void setFallbackLine(String fallbackLine) {
            this.fallbackLine = fallbackLine;
        }

        public String getHoldOnReply() {
            return holdOnReply;
        }

        public void setHoldOnReply(String holdOnReply) {
            this.holdOnReply = holdOnReply;
        }

        public String getTransferMessage() {
            return transferMessage;
        }

        public void setTransferMessage(String transferMessage) {
            this.transferMessage = transferMessage;
        }

        public String getDigitPrompt() {
            return digitPrompt;
        }

        public void setDigitPrompt(String digitPrompt) {
            this.digitPrompt = digitPrompt;
        }

        public Duration getTeardownDrainTimeout() {
            return teardownDrainTimeout;
        }

        public void setTeardownDrainTimeout(Duration teardownDrainTimeout) {
            this.teardownDrainTimeout = teardownDrainTimeout;
        }

        public int getMaxNodeHops() {
            return maxNodeHops;
        }

        public void setMaxNodeHops(int maxNodeHops) {
            this.maxNodeHops = maxNodeHops;
        }

        public String getStore() {
            return store;
        }

        public void setStore(String store) {
            this.store = store;
        }
    }

    public static class Integrations {
        private Telnyx telnyx = new Telnyx();
        private Openai openai = new Openai();
        private Synthesis synthesis = new Synthesis();

        public Telnyx getTelnyx() {
            return telnyx;
        }

        public void setTelnyx(Telnyx telnyx) {
            this.telnyx = telnyx;
        }

        public Openai getOpenai() {
            return openai;
        }

        public void setOpenai(Openai openai) {
            this.openai = openai;
        }

        public Synthesis getSynthesis() {
            return synthesis;
        }

        public void setSynthesis(Synthesis synthesis) {
            this.synthesis = synthesis;
        }
    }

    public static class Telnyx {
        private String baseUrl = "https://api.telnyx.com";
        private String apiKey = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    public static class Openai {
        private String baseUrl = "https://api.openai.com";
        private String apiKey = "";

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }
    }

    public static class Synthesis {
        private String baseUrl = "wss://api.elevenlabs.io";
        private String apiKey = "";
        private String voiceId = "21m00Tcm4TlvDq8ikWAM";
        private String modelId = "eleven_flash_v2_5";
        private String outputFormat = "mp3_44100_128";
        private String mimeType = "audio/mpeg";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration idleAfterFlush = Duration.ofMillis(500);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getVoiceId() {
            return voiceId;
        }

        public void setVoiceId(String voiceId) {
            this.voiceId = voiceId;
        }

        public String getModelId() {
            return modelId;
        }

        public void setModelId(String modelId) {
            this.modelId = modelId;
        }

        public String getOutputFormat() {
            return outputFormat;
        }

        public void setOutputFormat(String outputFormat) {
            this.outputFormat = outputFormat;
        }

        public String getMimeType() {
            return mimeType;
        }

        public void setMimeType(String mimeType) {
            this.mimeType = mimeType;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }

        public Duration getIdleAfterFlush() {
            return idleAfterFlush;
        }

        public void setIdleAfterFlush(Duration idleAfterFlush) {
            this.idleAfterFlush = idleAfterFlush;
        }
    }

    public static class Flows {
        private String location = "classpath:flows/";

        public String getLocation() {
            return location;
        }

        public void setLocation(String location) {
            this.location = location;
        }
    }
}
