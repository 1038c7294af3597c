package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.model.DeadLetterBatch;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Parking place for batches that exhausted their retry budget. Entries stay until an operator
 * replays them.
 */
public interface DeadLetterSink {

    void record(DeadLetterBatch batch);

    List<DeadLetterBatch> pending();

    long countPending();

    Optional<DeadLetterBatch> find(String id);

    void markReplayed(String id, Instant replayedAt);
}
