package com.example.chatpipeline.store;

import com.example.chatpipeline.model.ChatEvent;

import java.util.List;

/**
 * One page of a channel, ascending by ts. {@code nextCursor} is the last ts of a full page, null
 * when the channel has no more events at the time of the read.
 */
public record EventPage(List<ChatEvent> items, Long nextCursor) {

    public static EventPage of(List<ChatEvent> items, int limit) {
        Long next = !items.isEmpty() && items.size() >= limit
                ? items.get(items.size() - 1).getTs()
                : null;
        return new EventPage(List.copyOf(items), next);
    }

    public static EventPage empty() {
        return new EventPage(List.of(), null);
    }
}
