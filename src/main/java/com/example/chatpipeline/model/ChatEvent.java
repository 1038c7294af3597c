package com.example.chatpipeline.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * One immutable chat event. Rows are keyed by (channelId, ts); eventId is unique across the store.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@Document("chat_events")
@CompoundIndex(name = "channel_ts", def = "{'channelId': 1, 'ts': 1}", unique = true)
public class ChatEvent {
    @Id
    private String id; // channelId:ts
    private String channelId;
    private long ts;
    @Indexed(unique = true)
    private String eventId;
    private String messageId;
    private String senderId;
    private Role role;
    private String content;
    private ContentType contentType;
    @Indexed
    private Instant createdAt;
    private Map<String, Object> metadata;

    public static String rowId(String channelId, long ts) {
        return channelId + ":" + ts;
    }
}
