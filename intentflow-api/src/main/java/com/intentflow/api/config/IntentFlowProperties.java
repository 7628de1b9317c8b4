package com.intentflow.api.config;

import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.model.DataSensitivity;
import com.intentflow.core.model.RetryPolicy;
import com.intentflow.engine.execution.ExecutionSettings;
import com.intentflow.engine.security.RiskThresholds;
import com.intentflow.engine.security.RiskWeights;
import com.intentflow.learning.LearningService;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Settings bound from the {@code intentflow} prefix.
 */
@ConfigurationProperties(prefix = "intentflow")
public class IntentFlowProperties {

    private final Security security = new Security();
    private final Execution execution = new Execution();
    private final Lease lease = new Lease();
    private final Memory memory = new Memory();
    private final Learning learning = new Learning();
    private final Bus bus = new Bus();
    private final Persistence persistence = new Persistence();
    private final Executors executors = new Executors();

    public Security getSecurity() {
        return security;
    }

    public Execution getExecution() {
        return execution;
    }

    public Lease getLease() {
        return lease;
    }

    public Memory getMemory() {
        return memory;
    }

    public Learning getLearning() {
        return learning;
    }

    public Bus getBus() {
        return bus;
    }

    public Persistence getPersistence() {
        return persistence;
    }

    public Executors getExecutors() {
        return executors;
    }

    // ========== Security gate ==========

    public static class Security {

        private double lowThreshold = 0.30;
        private double highThreshold = 0.80;
        private Duration confirmationTtl = Duration.ofMinutes(5);
        private Duration confirmationSweepInterval = Duration.ofSeconds(10);
        private String tokenSecret;
        private Map<ActionCategory, Double> categoryWeights = new EnumMap<>(RiskWeights.defaults().categoryWeights());
        private Map<DataSensitivity, Double> sensitivityWeights =
            new EnumMap<>(RiskWeights.defaults().sensitivityWeights());
        private double categoryFactor = RiskWeights.defaults().categoryFactor();
        private double sensitivityFactor = RiskWeights.defaults().sensitivityFactor();
        private double historyFactor = RiskWeights.defaults().historyFactor();

        public RiskThresholds thresholds() {
            return new RiskThresholds(lowThreshold, highThreshold);
        }

        public RiskWeights weights() {
            Map<ActionCategory, Double> categories = new EnumMap<>(RiskWeights.defaults().categoryWeights());
            categories.putAll(categoryWeights);
            Map<DataSensitivity, Double> sensitivities = new EnumMap<>(RiskWeights.defaults().sensitivityWeights());
            sensitivities.putAll(sensitivityWeights);
            return new RiskWeights(categories, sensitivities, categoryFactor, sensitivityFactor, historyFactor);
        }

        public double getLowThreshold() {
            return lowThreshold;
        }

        public void setLowThreshold(double lowThreshold) {
            this.lowThreshold = lowThreshold;
        }

        public double getHighThreshold() {
            return highThreshold;
        }

        public void setHighThreshold(double highThreshold) {
            this.highThreshold = highThreshold;
        }

        public Duration getConfirmationTtl() {
            return confirmationTtl;
        }

        public void setConfirmationTtl(Duration confirmationTtl) {
            this.confirmationTtl = confirmationTtl;
        }

        public Duration getConfirmationSweepInterval() {
            return confirmationSweepInterval;
        }

        public void setConfirmationSweepInterval(Duration confirmationSweepInterval) {
            this.confirmationSweepInterval = confirmationSweepInterval;
        }

        public String getTokenSecret() {
            return tokenSecret;
        }

        public void setTokenSecret(String tokenSecret) {
            this.tokenSecret = tokenSecret;
        }

        public Map<ActionCategory, Double> getCategoryWeights() {
            return categoryWeights;
        }

        public void setCategoryWeights(Map<ActionCategory, Double> categoryWeights) {
            this.categoryWeights = categoryWeights;
        }

        public Map<DataSensitivity, Double> getSensitivityWeights() {
            return sensitivityWeights;
        }

        public void setSensitivityWeights(Map<DataSensitivity, Double> sensitivityWeights) {
            this.sensitivityWeights = sensitivityWeights;
        }

        public double getCategoryFactor() {
            return categoryFactor;
        }

        public void setCategoryFactor(double categoryFactor) {
            this.categoryFactor = categoryFactor;
        }

        public double getSensitivityFactor() {
            return sensitivityFactor;
        }

        public void setSensitivityFactor(double sensitivityFactor) {
            this.sensitivityFactor = sensitivityFactor;
        }

        public double getHistoryFactor() {
            return historyFactor;
        }

        public void setHistoryFactor(double historyFactor) {
            this.historyFactor = historyFactor;
        }
    }

    // ========== Execution ==========

    public static class Execution {

        private int concurrencyLimit = 4;
        private int maxAttempts = 3;
        private Duration backoffBase = Duration.ofSeconds(1);
        private Duration maxBackoff = Duration.ofMinutes(1);
        private double backoffMultiplier = 2.0;
        private double jitterFactor = 0.1;
        private Duration stepTimeout = Duration.ofMinutes(2);
        private int replanAttempts = 0;
        private int workerConcurrency = 8;

        public RetryPolicy retryPolicy() {
            return new RetryPolicy(maxAttempts, backoffBase, maxBackoff, backoffMultiplier, jitterFactor, Set.of());
        }

        public ExecutionSettings settings() {
            return new ExecutionSettings(concurrencyLimit, stepTimeout);
        }

        public int getConcurrencyLimit() {
            return concurrencyLimit;
        }

        public void setConcurrencyLimit(int concurrencyLimit) {
            this.concurrencyLimit = concurrencyLimit;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBackoffBase() {
            return backoffBase;
        }

        public void setBackoffBase(Duration backoffBase) {
            this.backoffBase = backoffBase;
        }

        public Duration getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(Duration maxBackoff) {
            this.maxBackoff = maxBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        public Duration getStepTimeout() {
            return stepTimeout;
        }

        public void setStepTimeout(Duration stepTimeout) {
            this.stepTimeout = stepTimeout;
        }

        public int getReplanAttempts() {
            return replanAttempts;
        }

        public void setReplanAttempts(int replanAttempts) {
            this.replanAttempts = replanAttempts;
        }

        public int getWorkerConcurrency() {
            return workerConcurrency;
        }

        public void setWorkerConcurrency(int workerConcurrency) {
            this.workerConcurrency = workerConcurrency;
        }
    }

    // ========== Leases ==========

    public static class Lease {

        private Duration ttl = Duration.ofSeconds(30);
        private Duration renewInterval = Duration.ofSeconds(10);
        private Duration recoveryInterval = Duration.ofSeconds(5);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getRenewInterval() {
            return renewInterval;
        }

        public void setRenewInterval(Duration renewInterval) {
            this.renewInterval = renewInterval;
        }

        public Duration getRecoveryInterval() {
            return recoveryInterval;
        }

        public void setRecoveryInterval(Duration recoveryInterval) {
            this.recoveryInterval = recoveryInterval;
        }
    }

    // ========== Memory ==========

    public static class Memory {

        private Duration recencyHalfLife = Duration.ofDays(7);
        private double centralityBoost = 0.5;
        private Duration queryTimeout = Duration.ofSeconds(2);
        private int contextLimit = 10;

        public Duration getRecencyHalfLife() {
            return recencyHalfLife;
        }

        public void setRecencyHalfLife(Duration recencyHalfLife) {
            this.recencyHalfLife = recencyHalfLife;
        }

        public double getCentralityBoost() {
            return centralityBoost;
        }

        public void setCentralityBoost(double centralityBoost) {
            this.centralityBoost = centralityBoost;
        }

        public Duration getQueryTimeout() {
            return queryTimeout;
        }

        public void setQueryTimeout(Duration queryTimeout) {
            this.queryTimeout = queryTimeout;
        }

        public int getContextLimit() {
            return contextLimit;
        }

        public void setContextLimit(int contextLimit) {
            this.contextLimit = contextLimit;
        }
    }

    // ========== Learning ==========

    public static class Learning {

        private double smoothing = 0.2;
        private Duration evaluationWindow = Duration.ofMinutes(1);
        private double minWeight = 0.0;
        private double maxWeight = 1.0;

        public LearningService.Settings settings() {
            return new LearningService.Settings(smoothing, evaluationWindow, minWeight, maxWeight);
        }

        public double getSmoothing() {
            return smoothing;
        }

        public void setSmoothing(double smoothing) {
            this.smoothing = smoothing;
        }

        public Duration getEvaluationWindow() {
            return evaluationWindow;
        }

        public void setEvaluationWindow(Duration evaluationWindow) {
            this.evaluationWindow = evaluationWindow;
        }

        public double getMinWeight() {
            return minWeight;
        }

        public void setMinWeight(double minWeight) {
            this.minWeight = minWeight;
        }

        public double getMaxWeight() {
            return maxWeight;
        }

        public void setMaxWeight(double maxWeight) {
            this.maxWeight = maxWeight;
        }
    }

    // ========== Bus ==========

    public static class Bus {

        private String type = "memory";
        private int partitions = 8;
        private int maxDeliveries = 5;
        private String bootstrapServers = "localhost:9092";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }

        public int getPartitions() {
            return partitions;
        }

        public void setPartitions(int partitions) {
            this.partitions = partitions;
        }

        public int getMaxDeliveries() {
            return maxDeliveries;
        }

        public void setMaxDeliveries(int maxDeliveries) {
            this.maxDeliveries = maxDeliveries;
        }

        public String getBootstrapServers() {
            return bootstrapServers;
        }

        public void setBootstrapServers(String bootstrapServers) {
            this.bootstrapServers = bootstrapServers;
        }
    }

    // ========== Persistence ==========

    public static class Persistence {

        private String type = "memory";

        public String getType() {
            return type;
        }

        public void setType(String type) {
            this.type = type;
        }
    }

    // ========== Executors ==========

    /**
     * Where step executors live. Without a base URL no executor is registered and
     * every plan fails validation until one is added programmatically.
     */
    public static class Executors {

        private String httpBaseUrl;
        private Duration requestTimeout = Duration.ofSeconds(30);
        private int maxPerCategory = 4;

        public String getHttpBaseUrl() {
            return httpBaseUrl;
        }

        public void setHttpBaseUrl(String httpBaseUrl) {
            this.httpBaseUrl = httpBaseUrl;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }

        public int getMaxPerCategory() {
            return maxPerCategory;
        }

        public void setMaxPerCategory(int maxPerCategory) {
            this.maxPerCategory = maxPerCategory;
        }
    }
}
