package com.example.chatpipeline.registry;

import com.example.chatpipeline.model.Connection;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Owner of live push-capable connections and their channel subscriptions. Records past their
 * expiry are treated as absent by every read.
 */
public interface ConnectionRegistry {

    void put(Connection connection);

    Set<Connection> findByChannel(String channelId);

    Optional<Connection> find(String connectionId);

    void delete(String connectionId);

    /**
     * Push the connection's expiry to now + ttl.
     *
     * @return false when the connection is unknown or already expired
     */
    boolean refresh(String connectionId, Duration ttl);

    /**
     * Remove leftovers of expired connections.
     *
     * @return number of entries removed
     */
    int sweepExpired();
}
