package com.example.chatpipeline.registry;

import com.example.chatpipeline.kv.KvClient;
import com.example.chatpipeline.model.Connection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Redis layout:
 *   conn:{connectionId}               -> connection JSON, native TTL = expiresAt
 *   channel:{channelId}:connections   -> set of connection ids
 *
 * Index sets carry no TTL; members whose connection key has expired are dropped on read and by
 * {@link #sweepExpired()}.
 */
@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "durable", matchIfMissing = true)
public class RedisConnectionRegistry implements ConnectionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(RedisConnectionRegistry.class);

    static final String CONNECTION_PREFIX = "conn:";
    static final String CHANNEL_PREFIX = "channel:";
    static final String CHANNEL_SUFFIX = ":connections";

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RedisConnectionRegistry(KvClient kvClient, ObjectMapper objectMapper, Clock clock) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void put(Connection connection) {
        Duration ttl = remainingTtl(connection);
        if (ttl.isZero() || ttl.isNegative()) {
            logger.debug("Connection {} already expired, not registering", connection.getConnectionId());
            return;
        }
        kvClient.set(connectionKey(connection.getConnectionId()), serialize(connection), ttl);
        for (String channelId : channels(connection)) {
            kvClient.sadd(channelKey(channelId), connection.getConnectionId());
        }
    }

    @Override
    public Set<Connection> findByChannel(String channelId) {
        String indexKey = channelKey(channelId);
        Set<String> ids = kvClient.smembers(indexKey);
        if (ids.isEmpty()) {
            return Set.of();
        }

        List<String> keys = ids.stream().map(RedisConnectionRegistry::connectionKey).toList();
        Map<String, String> values = kvClient.mget(keys);
        Instant now = clock.instant();
        Set<Connection> live = new LinkedHashSet<>();
        List<String> stale = new ArrayList<>();

        for (String id : ids) {
            Optional<Connection> connection = deserialize(values.get(connectionKey(id)));
            if (connection.isEmpty() || connection.get().isExpired(now)
                    || !channels(connection.get()).contains(channelId)) {
                stale.add(id);
            } else {
                live.add(connection.get());
            }
        }

        if (!stale.isEmpty()) {
            logger.debug("Dropping {} stale members from {}", stale.size(), indexKey);
            kvClient.srem(indexKey, stale.toArray(String[]::new));
        }
        return live;
    }

    @Override
    public Optional<Connection> find(String connectionId) {
        return kvClient.get(connectionKey(connectionId))
                .flatMap(this::deserialize)
                .filter(c -> !c.isExpired(clock.instant()));
    }

    @Override
    public void delete(String connectionId) {
        Optional<Connection> existing = kvClient.get(connectionKey(connectionId)).flatMap(this::deserialize);
        existing.ifPresent(c -> channels(c).forEach(channelId -> kvClient.srem(channelKey(channelId), connectionId)));
        kvClient.del(connectionKey(connectionId));
        logger.debug("Deleted connection {}", connectionId);
    }

    @Override
    public boolean refresh(String connectionId, Duration ttl) {
        Optional<Connection> existing = find(connectionId);
        if (existing.isEmpty()) {
            return false;
        }
        Connection refreshed = existing.get().toBuilder().expiresAt(clock.instant().plus(ttl)).build();
        // XX so a delete racing this refresh is not undone
        boolean written = kvClient.setIfPresent(connectionKey(connectionId), serialize(refreshed), ttl);
        if (!written) {
            logger.debug("Connection {} vanished during refresh", connectionId);
        }
        return written;
    }

    @Override
    public int sweepExpired() {
        int removed = 0;
        for (String indexKey : kvClient.scan(CHANNEL_PREFIX)) {
            if (!indexKey.endsWith(CHANNEL_SUFFIX)) {
                continue;
            }
            List<String> ids = new ArrayList<>(kvClient.smembers(indexKey));
            if (ids.isEmpty()) {
                continue;
            }
            Map<String, String> values = kvClient.mget(ids.stream().map(RedisConnectionRegistry::connectionKey).toList());
            String[] dead = ids.stream()
                    .filter(id -> values.get(connectionKey(id)) == null)
                    .toArray(String[]::new);
            if (dead.length > 0) {
                kvClient.srem(indexKey, dead);
                removed += dead.length;
            }
        }
        return removed;
    }

    private Duration remainingTtl(Connection connection) {
        if (connection.getExpiresAt() == null) {
            throw new IllegalArgumentException("Connection " + connection.getConnectionId() + " has no expiry");
        }
        return Duration.between(clock.instant(), connection.getExpiresAt());
    }

    private String serialize(Connection connection) {
        try {
            return objectMapper.writeValueAsString(connection);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize connection " + connection.getConnectionId(), e);
        }
    }

    private Optional<Connection> deserialize(String json) {
        if (json == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json, Connection.class));
        } catch (JsonProcessingException e) {
            logger.warn("Unreadable connection record, treating as absent: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Set<String> channels(Connection connection) {
        return connection.getChannelIds() == null ? Set.of() : connection.getChannelIds();
    }

    static String connectionKey(String connectionId) {
        return CONNECTION_PREFIX + connectionId;
    }

    static String channelKey(String channelId) {
        return CHANNEL_PREFIX + channelId + CHANNEL_SUFFIX;
    }
}
