package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.model.DeadLetterBatch;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "memory")
public class InMemoryDeadLetterSink implements DeadLetterSink {

    private final Map<String, DeadLetterBatch> batches = new ConcurrentHashMap<>();

    @Override
    public void record(DeadLetterBatch batch) {
        batches.put(batch.getId(), batch);
    }

    @Override
    public List<DeadLetterBatch> pending() {
        List<DeadLetterBatch> pending = new ArrayList<>();
        batches.values().stream()
                .filter(b -> !b.isReplayed())
                .sorted(Comparator.comparing(DeadLetterBatch::getFailedAt))
                .forEach(pending::add);
        return pending;
    }

    @Override
    public long countPending() {
        return batches.values().stream().filter(b -> !b.isReplayed()).count();
    }

    @Override
    public Optional<DeadLetterBatch> find(String id) {
        return Optional.ofNullable(batches.get(id));
    }

    @Override
    public void markReplayed(String id, Instant replayedAt) {
        batches.computeIfPresent(id, (k, b) -> {
            b.setReplayed(true);
            b.setReplayedAt(replayedAt);
            return b;
        });
    }
}
