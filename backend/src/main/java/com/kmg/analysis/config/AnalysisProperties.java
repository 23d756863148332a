package com.kmg.analysis.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "analysis")
public class AnalysisProperties {
    @Valid
    @NotNull
    private State state = new State();
    @Valid
    @NotNull
    private Logs logs = new Logs();
    @Valid
    @NotNull
    private Worker worker = new Worker();
    @Valid
    @NotNull
    private Backoff backoff = new Backoff();
    @Valid
    @NotNull
    private Classifier classifier = new Classifier();

    public State getState() {
        return state;
    }

    public void setState(State state) {
        this.state = state;
    }

    public Logs getLogs() {
        return logs;
    }

    public void setLogs(Logs logs) {
        this.logs = logs;
    }

    public Worker getWorker() {
        return worker;
    }

    public void setWorker(Worker worker) {
        this.worker = worker;
    }

    public Backoff getBackoff() {
        return backoff;
    }

    public void setBackoff(Backoff backoff) {
        this.backoff = backoff;
    }

    public Classifier getClassifier() {
        return classifier;
    }

    public void setClassifier(Classifier classifier) {
        this.classifier = classifier;
    }

    public Duration retryBudget() {
        long budget = classifier.getCallTimeout().toMillis();
        long exponential = backoff.getBaseDelay().toMillis();
        long max = backoff.getMaxDelay().toMillis();
        for (int attempt = 1; attempt < worker.getMaxAttempts(); attempt++) {
            long capped = Math.min(exponential, max);
            budget += Math.min(capped + (long) (capped * backoff.getJitterFactor()), max);
            exponential = Math.min(exponential * 2, max);
        }
        return Duration.ofMillis(budget);
    }

    // claims are refreshed before each pacing wait and each provider call
    public Duration staleTimeoutFloor() {
        long pacing = Math.max(worker.getMinRequestInterval().toMillis(),
                (long) Math.ceil(1000.0 / classifier.getDefaultRatePerSecond()));
        return retryBudget().plusMillis(pacing);
    }

    @AssertTrue(message = "worker.stale-processing-timeout must exceed classifier.call-timeout plus one pacing interval plus the retry backoff budget")
    public boolean isStaleTimeoutAboveRetryBudget() {
        if (worker.getStaleProcessingTimeout() == null || classifier.getCallTimeout() == null
                || backoff.getBaseDelay() == null || backoff.getMaxDelay() == null
                || worker.getMinRequestInterval() == null || classifier.getDefaultRatePerSecond() <= 0) {
            return true;
        }
        return worker.getStaleProcessingTimeout().compareTo(staleTimeoutFloor()) > 0;
    }

    public static class State {
        @NotBlank
        private String dbPath = "data/analysis.db";

        public String getDbPath() {
            return dbPath;
        }

        public void setDbPath(String dbPath) {
            this.dbPath = dbPath;
        }
    }

    public static class Logs {
        @NotBlank
        private String dir = "logs";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        @Positive
        private int concurrency = 1;
        private String id;
        @Positive
        private int chunkSize = 10;
        @NotNull
        private Duration sleepInterval = Duration.ofSeconds(5);
        @NotNull
        private Duration minRequestInterval = Duration.ofMillis(500);
        @Positive
        private int maxAttempts = 3;
        @Positive
        private int maxRunsPerCycle = 5;
        @NotNull
        private Duration staleProcessingTimeout = Duration.ofMinutes(5);
        @NotNull
        private Duration runHeartbeatTimeout = Duration.ofMinutes(10);
        @NotNull
        private Duration sweepInterval = Duration.ofSeconds(60);
        private boolean resetStaleOnStart = true;
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double failureRatioThreshold = 0.5;
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        @AssertTrue(message = "worker durations must be positive")
        public boolean isDurationsPositive() {
            return isPositive(sleepInterval) && isPositive(minRequestInterval) && isPositive(staleProcessingTimeout)
                    && isPositive(runHeartbeatTimeout) && isPositive(sweepInterval) && isPositive(shutdownTimeout);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public int getChunkSize() {
            return chunkSize;
        }

        public void setChunkSize(int chunkSize) {
            this.chunkSize = chunkSize;
        }

        public Duration getSleepInterval() {
            return sleepInterval;
        }

        public void setSleepInterval(Duration sleepInterval) {
            this.sleepInterval = sleepInterval;
        }

        public Duration getMinRequestInterval() {
            return minRequestInterval;
        }

        public void setMinRequestInterval(Duration minRequestInterval) {
            this.minRequestInterval = minRequestInterval;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public int getMaxRunsPerCycle() {
            return maxRunsPerCycle;
        }

        public void setMaxRunsPerCycle(int maxRunsPerCycle) {
            this.maxRunsPerCycle = maxRunsPerCycle;
        }

        public Duration getStaleProcessingTimeout() {
            return staleProcessingTimeout;
        }

        public void setStaleProcessingTimeout(Duration staleProcessingTimeout) {
            this.staleProcessingTimeout = staleProcessingTimeout;
        }

        public Duration getRunHeartbeatTimeout() {
            return runHeartbeatTimeout;
        }

        public void setRunHeartbeatTimeout(Duration runHeartbeatTimeout) {
            this.runHeartbeatTimeout = runHeartbeatTimeout;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public boolean isResetStaleOnStart() {
            return resetStaleOnStart;
        }

        public void setResetStaleOnStart(boolean resetStaleOnStart) {
            this.resetStaleOnStart = resetStaleOnStart;
        }

        public double getFailureRatioThreshold() {
            return failureRatioThreshold;
        }

        public void setFailureRatioThreshold(double failureRatioThreshold) {
            this.failureRatioThreshold = failureRatioThreshold;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }
    }

    public static class Backoff {
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(2);
        @NotNull
        private Duration maxDelay = Duration.ofSeconds(60);
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.1;

        @AssertTrue(message = "backoff.max-delay must be positive and not shorter than backoff.base-delay")
        public boolean isDelayRangeValid() {
            if (baseDelay == null || maxDelay == null) {
                return true;
            }
            return isPositive(baseDelay) && maxDelay.compareTo(baseDelay) >= 0;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }
    }

    public static class Classifier {
        @NotBlank
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        @NotNull
        private Duration callTimeout = Duration.ofSeconds(8);
        @NotBlank
        private String defaultModel = "gpt-4.1-nano";
        @Positive
        private double defaultRatePerSecond = 1.0;
        @Positive
        private int maxOutputTokens = 500;
        @Positive
        private int contentMaxChars = 800;
        @PositiveOrZero
        private int estimatedTokensPerItem = 500;
        @Positive
        private int circuitFailureThreshold = 3;
        @NotNull
        private Duration circuitOpenDuration = Duration.ofSeconds(60);

        @AssertTrue(message = "classifier.call-timeout and classifier.circuit-open-duration must be positive")
        public boolean isCallTimeoutPositive() {
            return (callTimeout == null || isPositive(callTimeout))
                    && (circuitOpenDuration == null || isPositive(circuitOpenDuration));
        }

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

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public String getDefaultModel() {
            return defaultModel;
        }

        public void setDefaultModel(String defaultModel) {
            this.defaultModel = defaultModel;
        }

        public double getDefaultRatePerSecond() {
            return defaultRatePerSecond;
        }

        public void setDefaultRatePerSecond(double defaultRatePerSecond) {
            this.defaultRatePerSecond = defaultRatePerSecond;
        }

        public int getMaxOutputTokens() {
            return maxOutputTokens;
        }

        public void setMaxOutputTokens(int maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
        }

        public int getContentMaxChars() {
            return contentMaxChars;
        }

        public void setContentMaxChars(int contentMaxChars) {
            this.contentMaxChars = contentMaxChars;
        }

        public int getEstimatedTokensPerItem() {
            return estimatedTokensPerItem;
        }

        public void setEstimatedTokensPerItem(int estimatedTokensPerItem) {
            this.estimatedTokensPerItem = estimatedTokensPerItem;
        }

        public int getCircuitFailureThreshold() {
            return circuitFailureThreshold;
        }

        public void setCircuitFailureThreshold(int circuitFailureThreshold) {
            this.circuitFailureThreshold = circuitFailureThreshold;
        }

        public Duration getCircuitOpenDuration() {
            return circuitOpenDuration;
        }

        public void setCircuitOpenDuration(Duration circuitOpenDuration) {
            this.circuitOpenDuration = circuitOpenDuration;
        }
    }

    private static boolean isPositive(Duration duration) {
        return duration != null && !duration.isNegative() && !duration.isZero();
    }
}
