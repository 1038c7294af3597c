package com.example.chatpipeline.dispatch;

import com.example.chatpipeline.model.DispatchCursor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@Component
@ConditionalOnProperty(prefix = "app.pipeline", name = "storage", havingValue = "memory")
public class InMemoryCursorStore implements CursorStore {

    private final Map<String, Long> positions = new ConcurrentHashMap<>();

    @Override
    public long position(String consumer, String partition) {
        return positions.getOrDefault(DispatchCursor.key(consumer, partition), 0L);
    }

    @Override
    public void commit(String consumer, String partition, long position) {
        positions.merge(DispatchCursor.key(consumer, partition), position, Math::max);
    }
}
