package com.intentflow.engine.planning;

import com.intentflow.core.bus.MessageBus;
import com.intentflow.core.bus.MessageCodec;
import com.intentflow.core.bus.MessageEnvelope;
import com.intentflow.core.bus.MessageType;
import com.intentflow.core.bus.Subscription;
import com.intentflow.core.bus.Topics;
import com.intentflow.core.bus.payload.MemoryQuery;
import com.intentflow.core.bus.payload.MemoryResult;
import com.intentflow.core.exception.MemoryUnavailableException;
import com.intentflow.core.model.RankedContext;
import com.intentflow.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Sends MEMORY_QUERY messages and waits for the matching MEMORY_RESULT.
 *
 * Each client instance reads the reply topic in its own consumer group and completes
 * only the requests it sent.
 */
public class BusMemoryClient implements MemoryClient {

    private static final Logger log = LoggerFactory.getLogger(BusMemoryClient.class);

    private final MessageBus bus;
    private final MessageCodec codec;
    private final Clock clock;
    private final Duration timeout;
    private final String replyGroup = Topics.PLANNING + "-" + UUID.randomUUID();
    private final Map<UUID, CompletableFuture<MemoryResult>> pending = new ConcurrentHashMap<>();

    private volatile Subscription subscription;

    public BusMemoryClient(MessageBus bus, MessageCodec codec, Clock clock, Duration timeout) {
        this.bus = bus;
        this.codec = codec;
        this.clock = clock;
        this.timeout = timeout;
    }

    public void start() {
        subscription = bus.subscribe(Topics.MEMORY_RESULTS, replyGroup, this::onResult);
    }

    public void stop() {
        if (subscription != null) {
            subscription.close();
        }
        pending.values().forEach(f -> f.cancel(true));
        pending.clear();
    }

    @Override
    public List<RankedContext> retrieveContext(UUID taskId, String roleScope, List<String> queryTerms, int limit) {
        UUID requestId = UUID.randomUUID();
        CompletableFuture<MemoryResult> reply = new CompletableFuture<>();
        pending.put(requestId, reply);
        try {
            MemoryQuery query = new MemoryQuery(requestId, roleScope, queryTerms, limit, Topics.MEMORY_RESULTS);
            bus.publish(Topics.MEMORY_QUERIES, MessageEnvelope.create(Topics.PLANNING, Topics.MEMORY,
                MessageType.MEMORY_QUERY, codec.toPayload(query), Task.DEFAULT_PRIORITY,
                taskId.toString(), clock.instant()));

            MemoryResult result = reply.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!result.available()) {
                throw new MemoryUnavailableException("Memory store reported a failure for request " + requestId);
            }
            return result.entries();

        } catch (TimeoutException e) {
            throw new MemoryUnavailableException("No memory result within " + timeout.toMillis() + " ms");
        } catch (ExecutionException e) {
            throw new MemoryUnavailableException("Memory query failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new MemoryUnavailableException("Interrupted while querying memory", e);
        } catch (MemoryUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MemoryUnavailableException("Could not query memory", e);
        } finally {
            pending.remove(requestId);
        }
    }

    void onResult(MessageEnvelope envelope) {
        if (envelope.messageType() != MessageType.MEMORY_RESULT) {
            return;
        }
        MemoryResult result = codec.fromPayload(envelope, MemoryResult.class);
        CompletableFuture<MemoryResult> reply = pending.get(result.requestId());
        if (reply == null) {
            log.debug("Memory result {} is not ours or arrived late", result.requestId());
            return;
        }
        reply.complete(result);
    }
}
