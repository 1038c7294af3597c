package com.example.chatpipeline.store;

import com.example.chatpipeline.error.DuplicateEventException;
import com.example.chatpipeline.model.BurnedSequence;
import com.example.chatpipeline.model.ChannelSequence;
import com.example.chatpipeline.model.ChatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "durable", matchIfMissing = true)
public class MongoEventLogStore implements EventLogStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoEventLogStore.class);

    private final MongoTemplate mongo;
    private final Clock clock;

    public MongoEventLogStore(MongoTemplate mongo, Clock clock) {
        this.mongo = mongo;
        this.clock = clock;
    }

    @Override
    public ChatEvent append(ChatEvent event) {
        // Look up first so a plain retry does not burn a sequence number
        Optional<ChatEvent> existing = findByEventId(event.getEventId());
        if (existing.isPresent()) {
            throw new DuplicateEventException(existing.get());
        }

        long ts = nextSequence(event.getChannelId());
        ChatEvent committed = event.toBuilder()
                .id(ChatEvent.rowId(event.getChannelId(), ts))
                .ts(ts)
                .createdAt(clock.instant())
                .build();
        try {
            mongo.insert(committed);
        } catch (DuplicateKeyException e) {
            ChatEvent winner = findByEventId(event.getEventId()).orElseThrow(() -> e);
            logger.info("Concurrent append of event {} lost to ts {}, sequence {} left unused",
                    event.getEventId(), winner.getTs(), ts);
            markBurned(event.getChannelId(), ts, event.getEventId());
            throw new DuplicateEventException(winner);
        }
        logger.debug("Appended event {} to channel {} at ts {}", committed.getEventId(), committed.getChannelId(), ts);
        return committed;
    }

    private long nextSequence(String channelId) {
        Query query = Query.query(Criteria.where("_id").is(channelId));
        ChannelSequence sequence = mongo.findAndModify(query,
                new Update().inc("seq", 1L),
                FindAndModifyOptions.options().returnNew(true).upsert(true),
                ChannelSequence.class);
        if (sequence == null) {
            throw new IllegalStateException("Sequence allocation returned nothing for channel " + channelId);
        }
        return sequence.getSeq();
    }

    private void markBurned(String channelId, long ts, String eventId) {
        try {
            mongo.save(BurnedSequence.builder()
                    .id(ChatEvent.rowId(channelId, ts))
                    .channelId(channelId)
                    .ts(ts)
                    .eventId(eventId)
                    .burnedAt(clock.instant())
                    .build());
        } catch (DataAccessException e) {
            // the feed falls back to its abandoned-gap window for this number
            logger.error("Failed to record burned sequence {} in {}", ts, channelId, e);
        }
    }

    @Override
    public EventPage list(String channelId, long afterTs, int limit) {
        Query query = Query.query(Criteria.where("channelId").is(channelId).and("ts").gt(afterTs))
                .with(Sort.by(Sort.Direction.ASC, "ts"))
                .limit(limit);
        return EventPage.of(mongo.find(query, ChatEvent.class), limit);
    }

    @Override
    public Optional<ChatEvent> findByEventId(String eventId) {
        return Optional.ofNullable(mongo.findOne(Query.query(Criteria.where("eventId").is(eventId)), ChatEvent.class));
    }

    @Override
    public List<String> channelsActiveSince(Instant since) {
        return mongo.findDistinct(Query.query(Criteria.where("createdAt").gte(since)),
                "channelId", ChatEvent.class, String.class);
    }

    @Override
    public Set<Long> burnedSequences(String channelId, long fromTs, long toTs) {
        Query query = Query.query(Criteria.where("channelId").is(channelId).and("ts").gte(fromTs).lte(toTs));
        return mongo.find(query, BurnedSequence.class).stream()
                .map(BurnedSequence::getTs)
                .collect(Collectors.toSet());
    }
}
