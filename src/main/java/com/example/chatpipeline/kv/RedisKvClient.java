package com.example.chatpipeline.kv;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.*;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "durable", matchIfMissing = true)
public class RedisKvClient implements KvClient {

    private static final int SCAN_COUNT = 1000;

    private final StringRedisTemplate redis;

    @Autowired
    public RedisKvClient(StringRedisTemplate redis) {
        this.redis = redis;
    }

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(redis.opsForValue().get(key));
    }

    @Override
    public Map<String, String> mget(List<String> keys) {
        Map<String,String> result = new LinkedHashMap<>();
        if (keys.isEmpty()) return result;
        // multiGet answers positionally, so keep the caller's order
        List<String> values = redis.opsForValue().multiGet(keys);
        for (int i = 0; i < keys.size(); i++) {
            String v = (values != null && i < values.size()) ? values.get(i) : null;
            result.put(keys.get(i), v);
        }
        return result;
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            redis.opsForValue().set(key, value);
        } else {
            redis.opsForValue().set(key, value, ttl);
        }
    }

    @Override
    public boolean setIfPresent(String key, String value, Duration ttl) {
        return Boolean.TRUE.equals(redis.opsForValue().setIfPresent(key, value, ttl));
    }

    @Override
    public void del(String key) {
        redis.delete(key);
    }

    @Override
    public void sadd(String key, String member) {
        redis.opsForSet().add(key, member);
    }

    @Override
    public void srem(String key, String... members) {
        if (members.length == 0) return;
        redis.opsForSet().remove(key, (Object[]) members);
    }

    @Override
    public Set<String> smembers(String key) {
        Set<String> members = redis.opsForSet().members(key);
        return members == null ? Set.of() : members;
    }

    @Override
    public List<String> scan(String prefix) {
        ScanOptions options = ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(SCAN_COUNT).build();
        try (RedisConnection conn = Objects.requireNonNull(redis.getConnectionFactory()).getConnection()) {
            List<String> keys = new ArrayList<>();
            try (var cursor = conn.keyCommands().scan(options)) {
                while (cursor.hasNext()) {
                    keys.add(new String(cursor.next(), StandardCharsets.UTF_8));
                }
            }
            return keys;
        }
    }
}
