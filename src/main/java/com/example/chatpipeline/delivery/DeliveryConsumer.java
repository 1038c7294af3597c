package com.example.chatpipeline.delivery;

import com.example.chatpipeline.config.PipelineProperties;
import com.example.chatpipeline.dispatch.BatchResult;
import com.example.chatpipeline.dispatch.BoundedCall;
import com.example.chatpipeline.dispatch.StreamConsumer;
import com.example.chatpipeline.error.TransientDispatchException;
import com.example.chatpipeline.model.ChatEvent;
import com.example.chatpipeline.model.ChatEventView;
import com.example.chatpipeline.model.Connection;
import com.example.chatpipeline.registry.ConnectionRegistry;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;

/**
 * Fans every event out to the connections subscribed to its channel.
 *
 * Each push is bounded by a timeout and retried on its own; one bad connection never stops the
 * rest of the fan-out. A connection reported gone is removed from the registry before the next
 * push. Only a failing registry lookup fails the batch.
 */
@Component
public class DeliveryConsumer implements StreamConsumer {

    private static final Logger logger = LoggerFactory.getLogger(DeliveryConsumer.class);

    public static final String NAME = "delivery";

    private final ConnectionRegistry registry;
    private final PushChannel pushChannel;
    private final ObjectMapper objectMapper;
    private final Duration pushTimeout;
    private final Retry pushRetry;
    private final ExecutorService pushExecutor;

    public DeliveryConsumer(ConnectionRegistry registry, PushChannel pushChannel, ObjectMapper objectMapper,
                            PipelineProperties properties) {
        PipelineProperties.Delivery settings = properties.delivery();
        this.registry = registry;
        this.pushChannel = pushChannel;
        this.objectMapper = objectMapper;
        this.pushTimeout = Duration.ofMillis(settings.pushTimeoutMs());
        this.pushRetry = Retry.of("push", RetryConfig.custom()
                .maxAttempts(settings.pushAttempts())
                .waitDuration(Duration.ofMillis(settings.pushBackoffMs()))
                .retryExceptions(TransientDispatchException.class)
                .build());
        this.pushExecutor = BoundedCall.newCallExecutor("delivery-push", properties.dispatch().workerThreads());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BatchResult handle(List<ChatEvent> batch) {
        int pushed = 0;
        int stale = 0;
        List<String> failures = new ArrayList<>();

        for (ChatEvent event : batch) {
            Set<Connection> targets;
            try {
                targets = registry.findByChannel(event.getChannelId());
            } catch (RuntimeException e) {
                logger.error("Connection lookup failed for channel {}", event.getChannelId(), e);
                return BatchResult.failed("Connection lookup failed for channel " + event.getChannelId(), e);
            }
            if (targets.isEmpty()) {
                logger.debug("No live connections on {} for event {}", event.getChannelId(), event.getEventId());
                continue;
            }

            String payload = render(event);
            Set<String> seen = new HashSet<>();
            for (Connection connection : targets) {
                String connectionId = connection.getConnectionId();
                if (!seen.add(connectionId)) {
                    continue;
                }
                PushOutcome outcome;
                try {
                    outcome = push(connectionId, payload);
                } catch (TransientDispatchException e) {
                    logger.warn("Failed to push event {} to connection {}: {}", event.getEventId(), connectionId, e.getMessage());
                    failures.add(connectionId + "@" + event.getEventId());
                    continue;
                }
                if (outcome == PushOutcome.GONE) {
                    stale++;
                    prune(connectionId, event, failures);
                } else {
                    pushed++;
                }
            }
        }

        logger.debug("Delivered batch of {} events: {} pushes, {} stale connections", batch.size(), pushed, stale);
        return failures.isEmpty()
                ? BatchResult.success(pushed, stale)
                : BatchResult.partial(pushed, stale, failures);
    }

    private PushOutcome push(String connectionId, String payload) {
        return Retry.decorateSupplier(pushRetry,
                () -> BoundedCall.run(() -> pushChannel.push(connectionId, payload),
                        pushExecutor, pushTimeout, "Push to " + connectionId)).get();
    }

    private void prune(String connectionId, ChatEvent event, List<String> failures) {
        logger.warn("Found stale connection, deleting {}", connectionId);
        try {
            registry.delete(connectionId);
        } catch (RuntimeException e) {
            logger.error("Failed to delete stale connection {}", connectionId, e);
            failures.add(connectionId + "@" + event.getEventId());
        }
    }

    private String render(ChatEvent event) {
        try {
            return objectMapper.writeValueAsString(ChatEventView.from(event));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot render event " + event.getEventId(), e);
        }
    }

    @PreDestroy
    public void shutdown() {
        pushExecutor.shutdownNow();
    }
}
