package com.example.chatpipeline.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Marks a channel sequence number that was allocated but will never hold an event, so the feed
 * can step over it without waiting.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("burned_sequences")
public class BurnedSequence {
    @Id
    private String id; // channelId:ts
    @Indexed
    private String channelId;
    private long ts;
    private String eventId;
    private Instant burnedAt;
}
