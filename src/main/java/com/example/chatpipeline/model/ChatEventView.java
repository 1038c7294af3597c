package com.example.chatpipeline.model;

import java.time.Instant;
import java.util.Map;

/**
 * Public, camelCase rendering of a {@link ChatEvent} used by the query surface and by pushes.
 */
public record ChatEventView(
        String channelId,
        long ts,
        String eventId,
        String messageId,
        String senderId,
        Role role,
        String content,
        ContentType contentType,
        Instant createdAt,
        Map<String, Object> metadata
) {

    public static ChatEventView from(ChatEvent event) {
        return new ChatEventView(
                event.getChannelId(),
                event.getTs(),
                event.getEventId(),
                event.getMessageId(),
                event.getSenderId(),
                event.getRole(),
                event.getContent(),
                event.getContentType(),
                event.getCreatedAt(),
                event.getMetadata() == null ? Map.of() : event.getMetadata()
        );
    }
}
