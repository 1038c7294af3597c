package com.example.chatpipeline.feed;

import com.example.chatpipeline.model.ChatEvent;

import java.util.List;

/**
 * @param nextPosition position to commit once {@code events} are handled; may move past the read
 *                     position even when {@code events} is empty (expired records, settled gaps)
 * @param expired      records skipped because they fell out of the retention window
 */
public record FeedBatch(String partition, long fromPosition, List<ChatEvent> events, long nextPosition, int expired) {

    public boolean isEmpty() {
        return events.isEmpty();
    }

    public boolean advances() {
        return nextPosition > fromPosition;
    }
}
