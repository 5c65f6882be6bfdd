package me.go_gradually.voiceinterview.infrastructure.shared.config;

import me.go_gradually.voiceinterview.application.connection.policy.ConnectionPolicy;
import me.go_gradually.voiceinterview.application.form.policy.FormPolicy;
import me.go_gradually.voiceinterview.application.health.policy.SystemStatusPolicy;
import me.go_gradually.voiceinterview.application.report.policy.CompletionPolicy;
import me.go_gradually.voiceinterview.application.setup.policy.SetupPolicy;
import me.go_gradually.voiceinterview.application.status.policy.StatusPollPolicy;
import me.go_gradually.voiceinterview.domain.setup.SetupStep;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "voiceinterview")
public class AppProperties implements FormPolicy, SetupPolicy, ConnectionPolicy, StatusPollPolicy,
        CompletionPolicy, SystemStatusPolicy {
    private Backend backend = new Backend();
    private Form form = new Form();
    private Setup setup = new Setup();
    private Connection connection = new Connection();
    private Status status = new Status();
    private Report report = new Report();
    private Audio audio = new Audio();
    private Health health = new Health();

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public Form getForm() {
        return form;
    }

    public void setForm(Form form) {
        this.form = form;
    }

    public Setup getSetup() {
        return setup;
    }

    public void setSetup(Setup setup) {
        this.setup = setup;
    }

    public Connection getConnection() {
        return connection;
    }

    public void setConnection(Connection connection) {
        this.connection = connection;
    }

    public Status getStatus() {
        return status;
    }

    public void setStatus(Status status) {
        this.status = status;
    }

    public Report getReport() {
        return report;
    }

    public void setReport(Report report) {
        this.report = report;
    }

    public Audio getAudio() {
        return audio;
    }

    public void setAudio(Audio audio) {
        this.audio = audio;
    }

    public Health getHealth() {
        return health;
    }

    public void setHealth(Health health) {
        this.health = health;
    }

    @Override
    public long maxAttachmentBytes() {
        return form.getMaxAttachmentBytes();
    }

    @Override
    public Duration validationDebounce() {
        return Duration.ofMillis(form.getValidationDebounceMs());
    }

    @Override
    public Duration stepTimeout(SetupStep step) {
        long millis = switch (step) {
            case UPLOAD -> setup.getUploadTimeoutMs();
            case ANALYZE -> setup.getAnalyzeTimeoutMs();
            case GENERATE_QUESTIONS -> setup.getQuestionsTimeoutMs();
            case CREATE_SESSION -> setup.getCreateSessionTimeoutMs();
        };
        return Duration.ofMillis(millis);
    }

    @Override
    public int questionCount() {
        return setup.getQuestionCount();
    }

    @Override
    public Duration autoConnectDelay() {
        return Duration.ofMillis(setup.getAutoConnectDelayMs());
    }

    @Override
    public Duration microphoneProbeTimeout() {
        return Duration.ofMillis(connection.getMicrophoneProbeTimeoutMs());
    }

    @Override
    public Duration connectTimeout() {
        return Duration.ofMillis(connection.getConnectTimeoutMs());
    }

    @Override
    public Duration publishTimeout() {
        return Duration.ofMillis(connection.getPublishTimeoutMs());
    }

    @Override
    public Duration trackVerificationDelay() {
        return Duration.ofMillis(connection.getTrackVerificationDelayMs());
    }

    @Override
    public int maxConnectionAttempts() {
        return connection.getMaxAttempts();
    }

    @Override
    public Duration retryBaseDelay() {
        return Duration.ofMillis(connection.getRetryBaseDelayMs());
    }

    @Override
    public Duration audioSampleInterval() {
        return Duration.ofMillis(audio.getSampleIntervalMs());
    }

    @Override
    public Duration disconnectResultsDelay() {
        return Duration.ofMillis(connection.getDisconnectResultsDelayMs());
    }

    @Override
    public Duration pollInterval() {
        return Duration.ofMillis(status.getPollIntervalMs());
    }

    @Override
    public int maxPollAttempts() {
        return status.getMaxPollAttempts();
    }

    @Override
    public Duration pollRequestTimeout() {
        return Duration.ofMillis(status.getPollRequestTimeoutMs());
    }

    @Override
    public Duration resultsDelay() {
        return Duration.ofMillis(report.getResultsDelayMs());
    }

    @Override
    public Duration healthCheckTimeout() {
        return Duration.ofMillis(health.getTimeoutMs());
    }

    public static class Backend {
        private String baseUrl = "http://localhost:8000";
        private int maxConnections = 50;
        private long pendingAcquireTimeoutMs = 30000;
        private long responseTimeoutMs = 60000;
        private int maxInMemoryBytes = 20 * 1024 * 1024;

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public int getMaxConnections() {
            return maxConnections;
        }

        public void setMaxConnections(int maxConnections) {
            this.maxConnections = maxConnections;
        }

        public long getPendingAcquireTimeoutMs() {
            return pendingAcquireTimeoutMs;
        }

        public void setPendingAcquireTimeoutMs(long pendingAcquireTimeoutMs) {
            this.pendingAcquireTimeoutMs = pendingAcquireTimeoutMs;
        }

        public long getResponseTimeoutMs() {
            return responseTimeoutMs;
        }

        public void setResponseTimeoutMs(long responseTimeoutMs) {
            this.responseTimeoutMs = responseTimeoutMs;
        }

        public int getMaxInMemoryBytes() {
            return maxInMemoryBytes;
        }

        public void setMaxInMemoryBytes(int maxInMemoryBytes) {
            this.maxInMemoryBytes = maxInMemoryBytes;
        }
    }

    public static class Form {
        private long maxAttachmentBytes = 10L * 1024 * 1024;
        private long validationDebounceMs = 300;

        public long getMaxAttachmentBytes() {
            return maxAttachmentBytes;
        }

        public void setMaxAttachmentBytes(long maxAttachmentBytes) {
            this.maxAttachmentBytes = maxAttachmentBytes;
        }

        public long getValidationDebounceMs() {
            return validationDebounceMs;
        }

        public void setValidationDebounceMs(long validationDebounceMs) {
            this.validationDebounceMs = validationDebounceMs;
        }
    }

    public static class Setup {
        private long uploadTimeoutMs = 30000;
        private long analyzeTimeoutMs = 45000;
        private long questionsTimeoutMs = 45000;
        private long createSessionTimeoutMs = 30000;
        private int questionCount = 6;
        private long autoConnectDelayMs = 1000;

        public long getUploadTimeoutMs() {
            return uploadTimeoutMs;
        }

        public void setUploadTimeoutMs(long uploadTimeoutMs) {
            this.uploadTimeoutMs = uploadTimeoutMs;
        }

        public long getAnalyzeTimeoutMs() {
            return analyzeTimeoutMs;
        }

        public void setAnalyzeTimeoutMs(long analyzeTimeoutMs) {
            this.analyzeTimeoutMs = analyzeTimeoutMs;
        }

        public long getQuestionsTimeoutMs() {
            return questionsTimeoutMs;
        }

        public void setQuestionsTimeoutMs(long questionsTimeoutMs) {
            this.questionsTimeoutMs = questionsTimeoutMs;
        }

        public long getCreateSessionTimeoutMs() {
            return createSessionTimeoutMs;
        }

        public void setCreateSessionTimeoutMs(long createSessionTimeoutMs) {
            this.createSessionTimeoutMs = createSessionTimeoutMs;
        }

        public int getQuestionCount() {
            return questionCount;
        }

        public void setQuestionCount(int questionCount) {
            this.questionCount = questionCount;
        }

        public long getAutoConnectDelayMs() {
            return autoConnectDelayMs;
        }

        public void setAutoConnectDelayMs(long autoConnectDelayMs) {
            this.autoConnectDelayMs = autoConnectDelayMs;
        }
    }

    public static class Connection {
        private long microphoneProbeTimeoutMs = 15000;
        private long connectTimeoutMs = 30000;
        private long publishTimeoutMs = 15000;
        private long trackVerificationDelayMs = 1000;
        private int maxAttempts = 3;
        private long retryBaseDelayMs = 2000;
        private long disconnectResultsDelayMs = 2000;

        public long getMicrophoneProbeTimeoutMs() {
            return microphoneProbeTimeoutMs;
        }

        public void setMicrophoneProbeTimeoutMs(long microphoneProbeTimeoutMs) {
            this.microphoneProbeTimeoutMs = microphoneProbeTimeoutMs;
        }

        public long getConnectTimeoutMs() {
            return connectTimeoutMs;
        }

        public void setConnectTimeoutMs(long connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
        }

        public long getPublishTimeoutMs() {
            return publishTimeoutMs;
        }

        public void setPublishTimeoutMs(long publishTimeoutMs) {
            this.publishTimeoutMs = publishTimeoutMs;
        }

        public long getTrackVerificationDelayMs() {
            return trackVerificationDelayMs;
        }

        public void setTrackVerificationDelayMs(long trackVerificationDelayMs) {
            this.trackVerificationDelayMs = trackVerificationDelayMs;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getRetryBaseDelayMs() {
            return retryBaseDelayMs;
        }

        public void setRetryBaseDelayMs(long retryBaseDelayMs) {
            this.retryBaseDelayMs = retryBaseDelayMs;
        }

        public long getDisconnectResultsDelayMs() {
            return disconnectResultsDelayMs;
        }

        public void setDisconnectResultsDelayMs(long disconnectResultsDelayMs) {
            this.disconnectResultsDelayMs = disconnectResultsDelayMs;
        }
    }

    public static class Status {
        private long pollIntervalMs = 1000;
        private int maxPollAttempts = 30;
        private long pollRequestTimeoutMs = 5000;

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getMaxPollAttempts() {
            return maxPollAttempts;
        }

        public void setMaxPollAttempts(int maxPollAttempts) {
            this.maxPollAttempts = maxPollAttempts;
        }

        public long getPollRequestTimeoutMs() {
            return pollRequestTimeoutMs;
        }

        public void setPollRequestTimeoutMs(long pollRequestTimeoutMs) {
            this.pollRequestTimeoutMs = pollRequestTimeoutMs;
        }
    }

    public static class Report {
        private long resultsDelayMs = 1000;

        public long getResultsDelayMs() {
            return resultsDelayMs;
        }

        public void setResultsDelayMs(long resultsDelayMs) {
            this.resultsDelayMs = resultsDelayMs;
        }
    }

    public static class Audio {
        private long sampleIntervalMs = 100;
        private float sampleRate = 16000f;
        private int frameMs = 20;

        public long getSampleIntervalMs() {
            return sampleIntervalMs;
        }

        public void setSampleIntervalMs(long sampleIntervalMs) {
            this.sampleIntervalMs = sampleIntervalMs;
        }

        public float getSampleRate() {
            return sampleRate;
        }

        public void setSampleRate(float sampleRate) {
            this.sampleRate = sampleRate;
        }

        public int getFrameMs() {
            return frameMs;
        }

        public void setFrameMs(int frameMs) {
            this.frameMs = frameMs;
        }
    }

    public static class Health {
        private long timeoutMs = 10000;

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }
}
