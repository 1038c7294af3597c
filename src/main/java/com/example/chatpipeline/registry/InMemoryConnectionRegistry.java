package com.example.chatpipeline.registry;

import com.example.chatpipeline.model.Connection;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "memory")
public class InMemoryConnectionRegistry implements ConnectionRegistry {

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryConnectionRegistry(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void put(Connection connection) {
        connections.put(connection.getConnectionId(), connection);
    }

    @Override
    public Set<Connection> findByChannel(String channelId) {
        Instant now = clock.instant();
        Set<Connection> live = new LinkedHashSet<>();
        for (Connection connection : connections.values()) {
            if (!connection.isExpired(now)
                    && connection.getChannelIds() != null
                    && connection.getChannelIds().contains(channelId)) {
                live.add(connection);
            }
        }
        return live;
    }

    @Override
    public Optional<Connection> find(String connectionId) {
        return Optional.ofNullable(connections.get(connectionId))
                .filter(c -> !c.isExpired(clock.instant()));
    }

    @Override
    public void delete(String connectionId) {
        connections.remove(connectionId);
    }

    @Override
    public boolean refresh(String connectionId, Duration ttl) {
        Instant now = clock.instant();
        Connection updated = connections.computeIfPresent(connectionId,
                (id, c) -> c.isExpired(now) ? c : c.toBuilder().expiresAt(now.plus(ttl)).build());
        return updated != null && !updated.isExpired(now);
    }

    @Override
    public int sweepExpired() {
        Instant now = clock.instant();
        int before = connections.size();
        connections.values().removeIf(c -> c.isExpired(now));
        return before - connections.size();
    }
}
