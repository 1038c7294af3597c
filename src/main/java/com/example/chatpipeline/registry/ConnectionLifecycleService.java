package com.example.chatpipeline.registry;

import com.example.chatpipeline.config.PipelineProperties;
import com.example.chatpipeline.error.ValidationException;
import com.example.chatpipeline.model.Connection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Connect, disconnect and heartbeat hooks in front of the {@link ConnectionRegistry}. Heartbeats are
 * what keep a live connection from aging out of the registry.
 */
@Service
public class ConnectionLifecycleService {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionLifecycleService.class);

    private final ConnectionRegistry registry;
    private final Clock clock;
    private final Duration connectionTtl;

    public ConnectionLifecycleService(ConnectionRegistry registry, Clock clock, PipelineProperties properties) {
        this.registry = registry;
        this.clock = clock;
        this.connectionTtl = Duration.ofMillis(properties.registry().connectionTtlMs());
    }

    public Connection onConnect(String connectionId, String userId, Collection<String> channelIds) {
        if (connectionId == null || connectionId.isBlank()) {
            throw new ValidationException("connectionId is required");
        }
        Set<String> subscriptions = new LinkedHashSet<>();
        if (channelIds != null) {
            channelIds.stream()
                    .filter(c -> c != null && !c.isBlank())
                    .map(String::trim)
                    .forEach(subscriptions::add);
        }

        Instant now = clock.instant();
        Connection connection = Connection.builder()
                .connectionId(connectionId)
                .userId(userId == null || userId.isBlank() ? "anonymous" : userId)
                .channelIds(subscriptions)
                .connectedAt(now)
                .expiresAt(now.plus(connectionTtl))
                .build();
        registry.put(connection);
        logger.info("Connection established: {} (user {}, channels {})", connectionId, connection.getUserId(), subscriptions);
        return connection;
    }

    public void onDisconnect(String connectionId) {
        registry.delete(connectionId);
        logger.info("Connection disconnected: {}", connectionId);
    }

    public boolean heartbeat(String connectionId) {
        boolean refreshed = registry.refresh(connectionId, connectionTtl);
        if (!refreshed) {
            logger.debug("Heartbeat for unknown or expired connection {}", connectionId);
        }
        return refreshed;
    }

    @Scheduled(fixedDelayString = "${app.pipeline.registry.sweep-interval-ms:60000}",
            initialDelayString = "${app.pipeline.registry.sweep-interval-ms:60000}")
    public void sweep() {
        try {
            int removed = registry.sweepExpired();
            if (removed > 0) {
                logger.info("Connection sweep removed {} expired entries", removed);
            }
        } catch (Exception e) {
            logger.error("Error during scheduled connection sweep", e);
        }
    }

    public Duration getConnectionTtl() {
        return connectionTtl;
    }
}
