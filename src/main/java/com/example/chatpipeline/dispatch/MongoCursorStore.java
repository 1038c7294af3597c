package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.model.DispatchCursor;
import com.example.chatpipeline.repo.DispatchCursorRepo;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;

@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "durable", matchIfMissing = true)
public class MongoCursorStore implements CursorStore {

    private final DispatchCursorRepo cursorRepo;
    private final Clock clock;

    public MongoCursorStore(DispatchCursorRepo cursorRepo, Clock clock) {
        this.cursorRepo = cursorRepo;
        this.clock = clock;
    }

    @Override
    public long position(String consumer, String partition) {
        return cursorRepo.findById(DispatchCursor.key(consumer, partition))
                .map(DispatchCursor::getPosition)
                .orElse(0L);
    }

    @Override
    public void commit(String consumer, String partition, long position) {
        cursorRepo.save(DispatchCursor.builder()
                .id(DispatchCursor.key(consumer, partition))
                .consumer(consumer)
                .partition(partition)
                .position(position)
                .updatedAt(clock.instant())
                .build());
    }
}
