package com.example.chatpipeline.store;

import com.example.chatpipeline.error.DuplicateEventException;
import com.example.chatpipeline.model.ChatEvent;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only, partitioned log of chat events. The only write path into the pipeline: whatever
 * {@link #append} commits is what the change feed later reads.
 */
public interface EventLogStore {

    /**
     * Conditionally append an event. The store assigns {@code ts}, {@code createdAt} and the row id.
     *
     * @throws DuplicateEventException if the event id is already recorded; carries the stored record
     */
    ChatEvent append(ChatEvent event);

    EventPage list(String channelId, long afterTs, int limit);

    Optional<ChatEvent> findByEventId(String eventId);

    List<String> channelsActiveSince(Instant since);

    /**
     * Sequence numbers in {@code [fromTs, toTs]} known to have been allocated without a row ever
     * being written for them.
     */
    Set<Long> burnedSequences(String channelId, long fromTs, long toTs);
}
