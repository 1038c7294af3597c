package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.model.ChatEvent;

import java.util.List;

/**
 * A feed consumer registered with the {@link StreamDispatcher}. Invoked synchronously with one
 * ordered batch of a single channel; a later batch of that channel is never handed over before
 * this call returns. Delivery is at-least-once, so implementations must be idempotent.
 */
public interface StreamConsumer {

    /**
     * Stable name; cursors and dead letters are keyed by it.
     */
    String name();

    BatchResult handle(List<ChatEvent> batch);
}
