package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.model.DeadLetterBatch;
import com.example.chatpipeline.repo.DeadLetterRepo;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "durable", matchIfMissing = true)
public class MongoDeadLetterSink implements DeadLetterSink {

    private final DeadLetterRepo deadLetterRepo;

    public MongoDeadLetterSink(DeadLetterRepo deadLetterRepo) {
        this.deadLetterRepo = deadLetterRepo;
    }

    @Override
    public void record(DeadLetterBatch batch) {
        deadLetterRepo.save(batch);
    }

    @Override
    public List<DeadLetterBatch> pending() {
        return deadLetterRepo.findTop50ByReplayedFalseOrderByFailedAtAsc();
    }

    @Override
    public long countPending() {
        return deadLetterRepo.countByReplayedFalse();
    }

    @Override
    public Optional<DeadLetterBatch> find(String id) {
        return deadLetterRepo.findById(id);
    }

    @Override
    public void markReplayed(String id, Instant replayedAt) {
        deadLetterRepo.findById(id).ifPresent(batch -> {
            batch.setReplayed(true);
            batch.setReplayedAt(replayedAt);
            deadLetterRepo.save(batch);
        });
    }
}
