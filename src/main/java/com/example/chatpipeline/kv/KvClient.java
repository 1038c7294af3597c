package com.example.chatpipeline.kv;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

public interface KvClient {
    Optional<String> get(String key);
    Map<String, String> mget(List<String> keys);
    void set(String key, String value, Duration ttl);
    /** SET ... XX: writes only when the key still exists. */
    boolean setIfPresent(String key, String value, Duration ttl);
    void del(String key);
    void sadd(String key, String member);
    void srem(String key, String... members);
    Set<String> smembers(String key);
    /** Every key with the prefix, walking the whole SCAN cursor. */
    List<String> scan(String prefix);
}
