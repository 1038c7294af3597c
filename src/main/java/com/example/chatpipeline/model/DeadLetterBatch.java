package com.example.chatpipeline.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("dead_letters")
public class DeadLetterBatch {
    @Id
    private String id;
    private String consumer;
    private String partition;
    private long fromPosition;
    private long toPosition;
    private int attempts;
    private String lastError;
    private Instant failedAt;
    private List<ChatEvent> events;
    private boolean replayed;
    private Instant replayedAt;
}
