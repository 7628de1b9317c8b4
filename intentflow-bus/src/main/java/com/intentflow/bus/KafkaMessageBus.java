package com.intentflow.bus;

import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageHandler;
import com.intentflow.core.bus.Subscription;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.ByteArrayDeserializer;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka-backed bus. Records are keyed by correlationId so one task's messages share a
 * partition; Kafka's group protocol gives each partition a single consumer. Offsets are
 * committed after the handler returns, which yields at-least-once delivery.
 */
public class KafkaMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageBus.class);
    private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);
    private static final long SEND_TIMEOUT_SECONDS = 10;

    private final String bootstrapServers;
    private final String clientId;
    private final int maxDeliveries;
    private final MessageCodec codec;
    private final KafkaProducer<String, byte[]> producer;
    private final ScheduledExecutorService delayer = Executors.newSingleThreadScheduledExecutor();
    private final List<ConsumerLoop> consumers = new CopyOnWriteArrayList<>();

    public KafkaMessageBus(String bootstrapServers, String clientId, int maxDeliveries, MessageCodec codec) {
        this.bootstrapServers = bootstrapServers;
        this.clientId = clientId;
        this.maxDeliveries = Math.max(1, maxDeliveries);
        this.codec = codec;

        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.CLIENT_ID_CONFIG, clientId + "-producer");
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        this.producer = new KafkaProducer<>(props);
    }

    @Override
    public void publish(String topic, MessageEnvelope envelope) {
        ProducerRecord<String, byte[]> record =
            new ProducerRecord<>(topic, envelope.partitionKey(), codec.encode(envelope));
        try {
            producer.send(record).get(SEND_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while publishing to " + topic, e);
        } catch (ExecutionException | TimeoutException e) {
            throw new IllegalStateException("Failed to publish " + envelope.messageType() + " to " + topic, e);
        }
    }

    @Override
    public void publishDelayed(String topic, MessageEnvelope envelope, Duration delay) {
        delayer.schedule(() -> {
            try {
                publish(topic, envelope);
            } catch (RuntimeException e) {
                log.error("Delayed publish of {} to {} failed", envelope.messageType(), topic, e);
            }
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    @Override
    public Subscription subscribe(String topic, String consumerGroup, MessageHandler handler) {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, consumerGroup);
        props.put(ConsumerConfig.CLIENT_ID_CONFIG, clientId + "-" + consumerGroup);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ByteArrayDeserializer.class.getName());

        ConsumerLoop loop = new ConsumerLoop(topic, consumerGroup, new KafkaConsumer<>(props), handler);
        consumers.add(loop);
        Thread thread = new Thread(loop, "kafka-" + consumerGroup + "-" + topic);
        thread.setDaemon(true);
        thread.start();
        log.info("Subscribed to Kafka topic {} as group {}", topic, consumerGroup);
        return loop;
    }

    @Override
    public void close() {
        consumers.forEach(ConsumerLoop::close);
        delayer.shutdownNow();
        producer.close(Duration.ofSeconds(5));
        log.info("Kafka bus closed");
    }

    private final class ConsumerLoop implements Runnable, Subscription {
        private final String topic;
        private final String group;
        private final KafkaConsumer<String, byte[]> consumer;
        private final MessageHandler handler;
        private volatile boolean running = true;

        private ConsumerLoop(String topic, String group, KafkaConsumer<String, byte[]> consumer,
                             MessageHandler handler) {
            this.topic = topic;
            this.group = group;
            this.consumer = consumer;
            this.handler = handler;
        }

        @Override
        public void run() {
            try {
                consumer.subscribe(List.of(topic));
                while (running) {
                    ConsumerRecords<String, byte[]> records = consumer.poll(POLL_TIMEOUT);
                    for (ConsumerRecord<String, byte[]> record : records) {
                        deliver(record);
                    }
                    if (!records.isEmpty()) {
                        consumer.commitSync();
                    }
                }
            } catch (WakeupException e) {
                if (running) {
                    throw e;
                }
            } finally {
                consumer.close();
            }
        }

        private void deliver(ConsumerRecord<String, byte[]> record) {
            MessageEnvelope envelope;
            try {
                envelope = codec.decode(record.value());
            } catch (IllegalArgumentException e) {
                log.error("Skipping malformed record at {}-{}@{}", topic, record.partition(), record.offset(), e);
                return;
            }
            for (int delivery = 1; delivery <= maxDeliveries; delivery++) {
                try {
                    handler.handle(envelope);
                    return;
                } catch (Exception e) {
                    log.warn("Delivery {}/{} of {} to group {} failed: {}", delivery, maxDeliveries,
                        envelope.messageType(), group, e.getMessage());
                }
            }
            log.error("Giving up on {} {} for group {} after {} deliveries",
                envelope.messageType(), envelope.messageId(), group, maxDeliveries);
        }

        @Override
        public String topic() {
            return topic;
        }

        @Override
        public String consumerGroup() {
            return group;
        }

        @Override
        public void close() {
            running = false;
            consumer.wakeup();
            consumers.remove(this);
        }
    }
}
