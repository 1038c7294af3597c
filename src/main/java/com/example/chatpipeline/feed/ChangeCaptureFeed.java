package com.example.chatpipeline.feed;

import com.example.chatpipeline.config.PipelineProperties;
import com.example.chatpipeline.model.ChatEvent;
import com.example.chatpipeline.store.EventLogStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Ordered per-channel view of committed events, read straight from the {@link EventLogStore}.
 * A position is the last consumed ts of a channel.
 *
 * Sequence numbers are allocated before the row is written, so a reader can observe ts N+1 while
 * N is still in flight. A batch stops in front of a missing ts until the store reports the number
 * as burned. A number with no row and no burn marker is only given up after the abandoned-gap
 * window, and only if a fresh read still finds no row for it.
 */
@Component
public class ChangeCaptureFeed {

    private static final Logger logger = LoggerFactory.getLogger(ChangeCaptureFeed.class);

    private final EventLogStore store;
    private final Clock clock;
    private final Duration retention;
    private final Duration abandonAfter;
    // reader|partition|ts -> first time the reader found that ts missing
    private final Map<String, Instant> openGaps = new ConcurrentHashMap<>();

    public ChangeCaptureFeed(EventLogStore store, Clock clock, PipelineProperties properties) {
        this.store = store;
        this.clock = clock;
        this.retention = Duration.ofMillis(properties.feed().retentionMs());
        this.abandonAfter = Duration.ofMillis(properties.feed().gapGraceMs());
    }

    public List<String> activePartitions() {
        return store.channelsActiveSince(clock.instant().minus(retention));
    }

    /**
     * Reads up to {@code limit} records after {@code afterPosition}. Gap timers are tracked per
     * {@code reader}, so consumers at different positions never share one.
     */
    public FeedBatch read(String reader, String partition, long afterPosition, int limit) {
        Instant now = clock.instant();
        Instant horizon = now.minus(retention);
        List<ChatEvent> events = new ArrayList<>();
        long expected = afterPosition + 1;
        long next = afterPosition;
        int expired = 0;

        for (ChatEvent event : store.list(partition, afterPosition, limit).items()) {
            if (event.getTs() > expected && !gapSettled(reader, partition, expected, event.getTs(), now)) {
                break;
            }
            openGaps.remove(gapKey(reader, partition, event.getTs()));
            if (event.getCreatedAt() != null && event.getCreatedAt().isBefore(horizon)) {
                expired++;
            } else {
                events.add(event);
            }
            next = event.getTs();
            expected = event.getTs() + 1;
        }

        if (expired > 0) {
            logger.warn("Feed retention exceeded on {}: skipped {} records up to ts {}", partition, expired, next);
        }
        return new FeedBatch(partition, afterPosition, events, next, expired);
    }

    int openGapCount() {
        return openGaps.size();
    }

    private boolean gapSettled(String reader, String partition, long missingFrom, long resumeAt, Instant now) {
        Set<Long> burned = store.burnedSequences(partition, missingFrom, resumeAt - 1);
        boolean waiting = false;
        for (long ts = missingFrom; ts < resumeAt; ts++) {
            String key = gapKey(reader, partition, ts);
            if (burned.contains(ts)) {
                openGaps.remove(key);
                continue;
            }
            Instant firstSeen = openGaps.computeIfAbsent(key, k -> now);
            if (Duration.between(firstSeen, now).compareTo(abandonAfter) < 0) {
                waiting = true;
            }
        }
        if (waiting) {
            logger.debug("Waiting on in-flight ts {}..{} in {} for {}", missingFrom, resumeAt - 1, partition, reader);
            return false;
        }

        if (burned.size() < resumeAt - missingFrom) {
            // last look before giving a number up, the row may have landed since the batch was listed
            boolean landed = store.list(partition, missingFrom - 1, (int) (resumeAt - missingFrom)).items().stream()
                    .anyMatch(e -> e.getTs() < resumeAt);
            if (landed) {
                return false;
            }
            logger.error("No row or burn marker for ts {}..{} in {} after {}, assuming the append crashed",
                    missingFrom, resumeAt - 1, partition, abandonAfter);
        } else {
            logger.debug("Skipping burned ts {}..{} in {}", missingFrom, resumeAt - 1, partition);
        }
        for (long ts = missingFrom; ts < resumeAt; ts++) {
            openGaps.remove(gapKey(reader, partition, ts));
        }
        return true;
    }

    private static String gapKey(String reader, String partition, long ts) {
        return reader + "|" + partition + "|" + ts;
    }
}
