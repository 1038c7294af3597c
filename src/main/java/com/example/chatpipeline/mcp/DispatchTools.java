package com.example.chatpipeline.mcp;

import com.example.chatpipeline.dispatch.BatchResult;
import com.example.chatpipeline.dispatch.DeadLetterSink;
import com.example.chatpipeline.dispatch.StreamDispatcher;
import com.example.chatpipeline.model.DeadLetterBatch;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class DispatchTools {

    private final StreamDispatcher dispatcher;
    private final DeadLetterSink deadLetters;

    public DispatchTools(StreamDispatcher dispatcher, DeadLetterSink deadLetters) {
        this.dispatcher = dispatcher;
        this.deadLetters = deadLetters;
    }

    @Tool(description = "Dispatcher state, in-flight drains, outage count and pending dead letters")
    public Map<String, Object> dispatch_status() {
        return dispatcher.status();
    }

    @Tool(description = "List dead-lettered batches that have not been replayed yet")
    public List<Map<String, Object>> dead_letters_list() {
        return deadLetters.pending().stream().map(DispatchTools::summarize).toList();
    }

    @Tool(description = "Re-run a dead-lettered batch through its consumer")
    public Map<String, Object> dead_letter_replay(String deadLetterId) {
        return dispatcher.replay(deadLetterId)
                .map(BatchResult::toMap)
                .orElseGet(() -> Map.of("ok", false, "error", "Dead letter not found: " + deadLetterId));
    }

    private static Map<String, Object> summarize(DeadLetterBatch batch) {
        Map<String, Object> summary = new HashMap<>();
        summary.put("id", batch.getId());
        summary.put("consumer", batch.getConsumer());
        summary.put("partition", batch.getPartition());
        summary.put("fromPosition", batch.getFromPosition());
        summary.put("toPosition", batch.getToPosition());
        summary.put("attempts", batch.getAttempts());
        summary.put("lastError", batch.getLastError());
        summary.put("failedAt", batch.getFailedAt());
        summary.put("events", batch.getEvents() == null ? 0 : batch.getEvents().size());
        return summary;
    }
}
