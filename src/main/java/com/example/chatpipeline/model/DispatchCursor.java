package com.example.chatpipeline.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("dispatch_cursors")
public class DispatchCursor {
    @Id
    private String id; // consumer:partition
    private String consumer;
    private String partition;
    private long position;
    private Instant updatedAt;

    public static String key(String consumer, String partition) {
        return consumer + ":" + partition;
    }
}
