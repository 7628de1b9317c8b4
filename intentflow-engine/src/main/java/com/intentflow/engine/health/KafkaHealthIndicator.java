package com.intentflow.engine.health;

import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.HashMap;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.TimeUnit;

/**
 * Health indicator for broker connectivity. Only registered when the Kafka bus is configured.
 */
public class KafkaHealthIndicator implements HealthIndicator {

    private static final long TIMEOUT_MS = 5000;

    private final String bootstrapServers;

    public KafkaHealthIndicator(String bootstrapServers) {
        this.bootstrapServers = bootstrapServers;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        details.put("bootstrapServers", bootstrapServers);

        Properties props = new Properties();
        props.put(AdminClientConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, (int) TIMEOUT_MS);
        props.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, (int) TIMEOUT_MS);

        try (AdminClient adminClient = AdminClient.create(props)) {
            var nodes = adminClient.describeCluster().nodes().get(TIMEOUT_MS, TimeUnit.MILLISECONDS);
            details.put("brokerCount", nodes.size());
            details.put("status", "connected");
            return Health.up().withDetails(details).build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.down().withDetails(details).withException(e).build();
        } catch (Exception e) {
            details.put("status", "disconnected");
            details.put("error", e.getMessage());
            return Health.down().withDetails(details).build();
        }
    }
}
