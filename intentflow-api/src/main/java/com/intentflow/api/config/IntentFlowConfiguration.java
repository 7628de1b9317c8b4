package com.intentflow.api.config;

import com.intentflow.bus.InMemoryMessageBus;
import com.intentflow.bus.KafkaMessageBus;
import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.health.HealthReporter;
import com.intentflow.core.model.ActionCategory;
import com.intentflow.core.repository.AuditRepository;
import com.intentflow.core.repository.LeaseRepository;
import com.intentflow.core.repository.MemoryGraphRepository;
import com.intentflow.core.repository.PlanRepository;
import com.intentflow.core.repository.StepResultRepository;
import com.intentflow.core.repository.TaskRepository;
import com.intentflow.engine.coordinator.LeaseManager;
import com.intentflow.engine.coordinator.OrchestratorAgent;
import com.intentflow.engine.coordinator.TaskOrchestrator;
import com.intentflow.engine.execution.BusStepDispatcher;
import com.intentflow.engine.execution.ExecutionEngine;
import com.intentflow.engine.health.AgentHealthIndicator;
import com.intentflow.engine.health.KafkaHealthIndicator;
import com.intentflow.engine.lifecycle.GracefulShutdownHandler;
import com.intentflow.engine.memory.ContextRanker;
import com.intentflow.engine.memory.MemoryAgent;
import com.intentflow.engine.memory.MemoryStore;
import com.intentflow.engine.metrics.OrchestratorMetrics;
import com.intentflow.engine.planning.BusMemoryClient;
import com.intentflow.engine.planning.IntentDecomposer;
import com.intentflow.engine.planning.LocalMemoryClient;
import com.intentflow.engine.planning.MemoryClient;
import com.intentflow.engine.planning.PlanValidator;
import com.intentflow.engine.planning.PlanningService;
import com.intentflow.engine.security.AuditLog;
import com.intentflow.engine.security.ConfirmationTokenService;
import com.intentflow.engine.security.RiskScorer;
import com.intentflow.engine.security.SecurityGate;
import com.intentflow.learning.LearningAgent;
import com.intentflow.learning.LearningService;
import com.intentflow.recovery.LeaseRecoveryEngine;
import com.intentflow.scheduler.ConfirmationExpiryScheduler;
import com.intentflow.worker.ExecutionAgent;
import com.intentflow.worker.ExecutorRegistry;
import com.intentflow.worker.HttpStepExecutor;
import com.intentflow.worker.tool.ToolSpecValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceProperties;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Wires one IntentFlow process: bus, agents and background loops.
 * Repositories and metrics are picked up by component scanning.
 */
@Configuration
@EnableConfigurationProperties(IntentFlowProperties.class)
public class IntentFlowConfiguration {

    private static final Logger log = LoggerFactory.getLogger(IntentFlowConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public MessageCodec messageCodec() {
        return new MessageCodec();
    }

    // ========== Message bus ==========

    @Bean
    @ConditionalOnProperty(name = "intentflow.bus.type", havingValue = "memory", matchIfMissing = true)
    public MessageBus inMemoryMessageBus(IntentFlowProperties properties) {
        return new InMemoryMessageBus(properties.getBus().getPartitions(), properties.getBus().getMaxDeliveries());
    }

    @Bean
    @ConditionalOnProperty(name = "intentflow.bus.type", havingValue = "memory", matchIfMissing = true)
    public MemoryClient localMemoryClient(MemoryStore memoryStore, IntentFlowProperties properties) {
        return new LocalMemoryClient(memoryStore, properties.getMemory().getQueryTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "intentflow.bus.type", havingValue = "kafka")
    public MessageBus kafkaMessageBus(IntentFlowProperties properties, MessageCodec codec) {
        return new KafkaMessageBus(properties.getBus().getBootstrapServers(), "intentflow-" + hostName(),
            properties.getBus().getMaxDeliveries(), codec);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(name = "intentflow.bus.type", havingValue = "kafka")
    public MemoryClient busMemoryClient(MessageBus bus, MessageCodec codec, Clock clock,
                                        IntentFlowProperties properties) {
        return new BusMemoryClient(bus, codec, clock, properties.getMemory().getQueryTimeout());
    }

    @Bean
    @ConditionalOnProperty(name = "intentflow.bus.type", havingValue = "kafka")
    public KafkaHealthIndicator kafkaHealthIndicator(IntentFlowProperties properties) {
        return new KafkaHealthIndicator(properties.getBus().getBootstrapServers());
    }

    // ========== Persistence ==========

    // repositories are scanned; only the JDBC data source needs building here
    @Configuration
    @ConditionalOnProperty(name = "intentflow.persistence.type", havingValue = "jdbc")
    static class JdbcDataSource {

        @Bean
        @ConfigurationProperties("spring.datasource")
        public DataSourceProperties dataSourceProperties() {
            return new DataSourceProperties();
        }

        @Bean
        public DataSource dataSource(DataSourceProperties dataSourceProperties) {
            return dataSourceProperties.initializeDataSourceBuilder().build();
        }
    }

    // ========== Memory ==========

    @Bean
    public MemoryStore memoryStore(MemoryGraphRepository graph, IntentFlowProperties properties, Clock clock) {
        IntentFlowProperties.Memory memory = properties.getMemory();
        return new MemoryStore(graph, new ContextRanker(memory.getRecencyHalfLife(), memory.getCentralityBoost(), clock),
            clock);
    }

    @Bean(initMethod = "start")
    public MemoryAgent memoryAgent(MessageBus bus, MessageCodec codec, MemoryStore memoryStore, Clock clock) {
        return new MemoryAgent(bus, codec, memoryStore, clock);
    }

    // ========== Learning ==========

    @Bean
    public LearningService learningService(IntentFlowProperties properties, Clock clock) {
        return new LearningService(properties.getLearning().settings(), clock);
    }

    @Bean(initMethod = "start")
    public LearningAgent learningAgent(MessageBus bus, MessageCodec codec, LearningService learning, Clock clock) {
        return new LearningAgent(bus, codec, learning, clock);
    }

    // ========== Execution agent ==========

    @Bean
    public ExecutorRegistry executorRegistry(IntentFlowProperties properties, MessageCodec codec) {
        IntentFlowProperties.Executors executors = properties.getExecutors();
        ExecutorRegistry registry = new ExecutorRegistry(executors.getMaxPerCategory(), new ToolSpecValidator());
        if (executors.getHttpBaseUrl() != null && !executors.getHttpBaseUrl().isBlank()) {
            HttpStepExecutor http = new HttpStepExecutor(executors.getHttpBaseUrl(), codec.objectMapper(),
                executors.getRequestTimeout());
            for (ActionCategory category : ActionCategory.values()) {
                registry.register(category, http);
            }
            log.info("Registered HTTP executor at {} for all action categories", executors.getHttpBaseUrl());
        } else {
            log.warn("No step executor configured; plans will fail validation until one is registered");
        }
        return registry;
    }

    @Bean(initMethod = "start")
    public ExecutionAgent executionAgent(MessageBus bus, MessageCodec codec, ExecutorRegistry registry, Clock clock,
                                         IntentFlowProperties properties) {
        return new ExecutionAgent(bus, codec, registry, clock, properties.getExecution().getWorkerConcurrency(),
            10_000);
    }

    // ========== Orchestration ==========

    @Bean
    public AuditLog auditLog(AuditRepository auditRepository, Clock clock) {
        return new AuditLog(auditRepository, clock);
    }

    @Bean
    public ConfirmationTokenService confirmationTokenService(IntentFlowProperties properties, Clock clock) {
        IntentFlowProperties.Security security = properties.getSecurity();
        return new ConfirmationTokenService(security.getTokenSecret(), security.getConfirmationTtl(), clock);
    }

    @Bean
    public SecurityGate securityGate(IntentFlowProperties properties, LearningService learning,
                                     ConfirmationTokenService tokens, AuditLog auditLog) {
        IntentFlowProperties.Security security = properties.getSecurity();
        return new SecurityGate(new RiskScorer(security.weights(), learning), security.thresholds(), tokens, auditLog);
    }

    @Bean
    public PlanningService planningService(MemoryClient memoryClient, LearningService learning,
                                           ExecutorRegistry registry, IntentFlowProperties properties, Clock clock) {
        return new PlanningService(memoryClient,
            new IntentDecomposer(learning, properties.getExecution().retryPolicy()),
            new PlanValidator(registry), properties.getMemory().getContextLimit(), clock);
    }

    @Bean
    public ExecutionEngine executionEngine(MessageBus bus, MessageCodec codec, AuditLog auditLog,
                                           IntentFlowProperties properties, OrchestratorMetrics metrics, Clock clock) {
        return new ExecutionEngine(new BusStepDispatcher(bus, codec, clock), auditLog,
            properties.getExecution().settings(), metrics, clock);
    }

    @Bean
    public LeaseManager leaseManager(LeaseRepository leaseRepository, IntentFlowProperties properties,
                                     OrchestratorMetrics metrics, Clock clock) {
        return new LeaseManager(leaseRepository, UUID.randomUUID(), hostName(), properties.getLease().getTtl(),
            clock, metrics);
    }

    @Bean
    public TaskOrchestrator taskOrchestrator(
            TaskRepository taskRepository,
            PlanRepository planRepository,
            StepResultRepository stepResultRepository,
            AuditLog auditLog,
            PlanningService planningService,
            SecurityGate securityGate,
            ConfirmationTokenService tokens,
            ExecutionEngine executionEngine,
            LeaseManager leaseManager,
            MessageBus bus,
            MessageCodec codec,
            OrchestratorMetrics metrics,
            Clock clock,
            IntentFlowProperties properties) {
        return new TaskOrchestrator(taskRepository, planRepository, stepResultRepository, auditLog, planningService,
            securityGate, tokens, executionEngine, leaseManager, bus, codec, metrics, clock,
            properties.getExecution().getReplanAttempts());
    }

    @Bean(initMethod = "start")
    public OrchestratorAgent orchestratorAgent(MessageBus bus, MessageCodec codec, TaskOrchestrator orchestrator,
                                               Clock clock) {
        return new OrchestratorAgent(bus, codec, orchestrator, clock);
    }

    // ========== Background loops ==========

    @Bean(initMethod = "start")
    public LeaseRecoveryEngine leaseRecoveryEngine(LeaseManager leaseManager, LeaseRepository leaseRepository,
                                                   TaskRepository taskRepository, TaskOrchestrator orchestrator,
                                                   IntentFlowProperties properties, Clock clock) {
        IntentFlowProperties.Lease lease = properties.getLease();
        return new LeaseRecoveryEngine(leaseManager, leaseRepository, taskRepository, orchestrator, clock,
            lease.getRenewInterval(), lease.getRecoveryInterval(), lease.getTtl());
    }

    @Bean(initMethod = "start")
    public ConfirmationExpiryScheduler confirmationExpiryScheduler(TaskRepository taskRepository,
                                                                   TaskOrchestrator orchestrator,
                                                                   IntentFlowProperties properties) {
        return new ConfirmationExpiryScheduler(taskRepository, orchestrator::expireConfirmation,
            properties.getSecurity().getConfirmationSweepInterval());
    }

    // ========== Health and shutdown ==========

    @Bean
    public AgentHealthIndicator agentHealthIndicator(OrchestratorAgent orchestratorAgent,
                                                     ExecutionAgent executionAgent,
                                                     MemoryAgent memoryAgent,
                                                     LearningAgent learningAgent) {
        List<HealthReporter> reporters = List.of(orchestratorAgent, executionAgent, memoryAgent, learningAgent);
        return new AgentHealthIndicator(reporters);
    }

    @Bean
    public GracefulShutdownHandler gracefulShutdownHandler(LeaseManager leaseManager,
                                                           OrchestratorAgent orchestratorAgent,
                                                           ExecutionAgent executionAgent,
                                                           MemoryAgent memoryAgent,
                                                           LearningAgent learningAgent,
                                                           LeaseRecoveryEngine recovery,
                                                           ConfirmationExpiryScheduler expiry) {
        GracefulShutdownHandler handler = new GracefulShutdownHandler(leaseManager);
        handler.register("orchestrator-agent", orchestratorAgent::stop);
        handler.register("execution-agent", executionAgent::stop);
        handler.register("memory-agent", memoryAgent::stop);
        handler.register("learning-agent", learningAgent::stop);
        handler.register("lease-recovery", recovery::stop);
        handler.register("confirmation-expiry", expiry::stop);
        return handler;
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            log.warn("Could not resolve local host name: {}", e.getMessage());
            return "unknown-host";
        }
    }
}
