package com.intentflow.bus;

import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageHandler;
import com.intentflow.core.bus.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-process bus with the same delivery contract as the Kafka one.
 *
 * Every (topic, consumer group) pair owns a fixed number of partition lanes. A lane is
 * drained by at most one thread at a time, so messages sharing a partition key reach a
 * group in publish order. Members of a group split the lanes between them. A handler
 * that throws gets the same message again, up to {@code maxDeliveries}; after that the
 * message is parked as a dead letter.
 */
public class InMemoryMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private final int partitions;
    private final int maxDeliveries;
    private final ExecutorService workers;
    private final ScheduledExecutorService delayer;
    private final Map<String, List<GroupState>> topics = new ConcurrentHashMap<>();
    private final List<MessageEnvelope> deadLetters = new CopyOnWriteArrayList<>();
    private final AtomicInteger outstanding = new AtomicInteger();
    private volatile boolean closed;

    public InMemoryMessageBus(int partitions, int maxDeliveries) {
        if (partitions < 1) {
            throw new IllegalArgumentException("partitions must be >= 1");
        }
        this.partitions = partitions;
        this.maxDeliveries = Math.max(1, maxDeliveries);
        this.workers = Executors.newCachedThreadPool(namedThreads("bus-worker"));
        this.delayer = Executors.newSingleThreadScheduledExecutor(namedThreads("bus-delay"));
    }

    @Override
    public void publish(String topic, MessageEnvelope envelope) {
        if (closed) {
            throw new IllegalStateException("Bus is closed");
        }
        List<GroupState> groups = topics.get(topic);
        if (groups == null || groups.isEmpty()) {
            log.debug("No consumer group on topic {}, dropping {} for {}",
                topic, envelope.messageType(), envelope.correlationId());
            return;
        }
        int partition = partitionFor(envelope.partitionKey());
        for (GroupState group : groups) {
            group.lanes.get(partition).enqueue(envelope);
        }
    }

    @Override
    public void publishDelayed(String topic, MessageEnvelope envelope, Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            publish(topic, envelope);
            return;
        }
        outstanding.incrementAndGet();
        delayer.schedule(() -> {
            try {
                if (!closed) {
                    publish(topic, envelope);
                }
            } finally {
                outstanding.decrementAndGet();
            }
        }, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    @Override
    public Subscription subscribe(String topic, String consumerGroup, MessageHandler handler) {
        List<GroupState> groups = topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
        GroupState group;
        synchronized (groups) {
            group = groups.stream()
                .filter(g -> g.name.equals(consumerGroup))
                .findFirst()
                .orElse(null);
            if (group == null) {
                group = new GroupState(topic, consumerGroup);
                groups.add(group);
            }
        }
        GroupMember member = new GroupMember(handler);
        group.members.add(member);
        log.info("Subscribed to {} as group {} ({} members)", topic, consumerGroup, group.members.size());
        GroupState joined = group;
        return new Subscription() {
            @Override
            public String topic() {
                return topic;
            }

            @Override
            public String consumerGroup() {
                return consumerGroup;
            }

            @Override
            public void close() {
                joined.members.remove(member);
                log.info("Left group {} on {}", consumerGroup, topic);
            }
        };
    }

    /**
     * Wait until no message is queued, in flight or scheduled.
     *
     * @return true if the bus went idle before the timeout
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (outstanding.get() == 0) {
                return true;
            }
            try {
                Thread.sleep(5);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return outstanding.get() == 0;
    }

    public List<MessageEnvelope> deadLetters() {
        return Collections.unmodifiableList(deadLetters);
    }

    public int partitionFor(String key) {
        return Math.floorMod(key.hashCode(), partitions);
    }

    @Override
    public void close() {
        closed = true;
        delayer.shutdownNow();
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("In-memory bus closed");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private final class GroupState {
        private final String topic;
        private final String name;
        private final List<GroupMember> members = new CopyOnWriteArrayList<>();
        private final List<Lane> lanes = new ArrayList<>();

        private GroupState(String topic, String name) {
            this.topic = topic;
            this.name = name;
            for (int p = 0; p < partitions; p++) {
                lanes.add(new Lane(this, p));
            }
        }

        private GroupMember ownerOf(int partition) {
            List<GroupMember> snapshot = List.copyOf(members);
            if (snapshot.isEmpty()) {
                return null;
            }
            return snapshot.get(partition % snapshot.size());
        }
    }

    private record GroupMember(MessageHandler handler) {
    }

    /**
     * One partition of one consumer group. The draining flag keeps it single-consumer.
     */
    private final class Lane {
        private final GroupState group;
        private final int partition;
        private final Queue<MessageEnvelope> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean draining = new AtomicBoolean();

        private Lane(GroupState group, int partition) {
            this.group = group;
            this.partition = partition;
        }

        private void enqueue(MessageEnvelope envelope) {
            outstanding.incrementAndGet();
            queue.add(envelope);
            scheduleDrain();
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                workers.execute(this::drain);
            }
        }

        private void drain() {
            try {
                MessageEnvelope next;
                while ((next = queue.poll()) != null) {
                    try {
                        deliver(next);
                    } finally {
                        outstanding.decrementAndGet();
                    }
                }
            } finally {
                draining.set(false);
            }
            if (!queue.isEmpty()) {
                scheduleDrain();
            }
        }

        private void deliver(MessageEnvelope envelope) {
            for (int delivery = 1; delivery <= maxDeliveries; delivery++) {
                GroupMember owner = group.ownerOf(partition);
                if (owner == null) {
                    log.warn("Group {} on {} has no members, parking {}", group.name, group.topic,
                        envelope.messageId());
                    deadLetters.add(envelope);
                    return;
                }
                try {
                    owner.handler().handle(envelope);
                    return;
                } catch (Exception e) {
                    log.warn("Delivery {}/{} of {} {} to group {} failed: {}", delivery, maxDeliveries,
                        envelope.messageType(), envelope.messageId(), group.name, e.getMessage());
                }
            }
            log.error("Dead-lettering {} {} for group {} after {} deliveries",
                envelope.messageType(), envelope.messageId(), group.name, maxDeliveries);
            deadLetters.add(envelope);
        }
    }
}
