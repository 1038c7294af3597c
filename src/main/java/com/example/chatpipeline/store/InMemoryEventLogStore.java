package com.example.chatpipeline.store;

import com.example.chatpipeline.error.DuplicateEventException;
import com.example.chatpipeline.model.ChatEvent;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Single-process event log. All operations are serialized on the instance monitor.
 */
@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "memory")
public class InMemoryEventLogStore implements EventLogStore {

    private final Map<String, NavigableMap<Long, ChatEvent>> channels = new HashMap<>();
    private final Map<String, ChatEvent> byEventId = new HashMap<>();
    private final Clock clock;

    public InMemoryEventLogStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized ChatEvent append(ChatEvent event) {
        ChatEvent existing = byEventId.get(event.getEventId());
        if (existing != null) {
            throw new DuplicateEventException(existing);
        }
        NavigableMap<Long, ChatEvent> channel = channels.computeIfAbsent(event.getChannelId(), k -> new TreeMap<>());
        long ts = channel.isEmpty() ? 1L : channel.lastKey() + 1;
        ChatEvent committed = event.toBuilder()
                .id(ChatEvent.rowId(event.getChannelId(), ts))
                .ts(ts)
                .createdAt(clock.instant())
                .build();
        channel.put(ts, committed);
        byEventId.put(committed.getEventId(), committed);
        return committed;
    }

    @Override
    public synchronized EventPage list(String channelId, long afterTs, int limit) {
        NavigableMap<Long, ChatEvent> channel = channels.get(channelId);
        if (channel == null) {
            return EventPage.empty();
        }
        List<ChatEvent> items = new ArrayList<>();
        for (ChatEvent event : channel.tailMap(afterTs, false).values()) {
            if (items.size() >= limit) {
                break;
            }
            items.add(event);
        }
        return EventPage.of(items, limit);
    }

    @Override
    public synchronized Optional<ChatEvent> findByEventId(String eventId) {
        return Optional.ofNullable(byEventId.get(eventId));
    }

    @Override
    public synchronized List<String> channelsActiveSince(Instant since) {
        List<String> active = new ArrayList<>();
        channels.forEach((channelId, events) -> {
            if (!events.isEmpty() && !events.lastEntry().getValue().getCreatedAt().isBefore(since)) {
                active.add(channelId);
            }
        });
        return active;
    }

    @Override
    public Set<Long> burnedSequences(String channelId, long fromTs, long toTs) {
        // ts is assigned and stored under one lock, numbers are never burned here
        return Set.of();
    }
}
