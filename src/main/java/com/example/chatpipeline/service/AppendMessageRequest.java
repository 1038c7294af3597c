package com.example.chatpipeline.service;

import java.util.Map;

/**
 * Inbound message as posted by a client. Role and content type arrive as wire strings and are
 * validated by {@link ChatEventService}.
 */
public record AppendMessageRequest(
        String eventId,
        String messageId,
        String senderId,
        String role,
        String content,
        String contentType,
        Map<String, Object> metadata
) {}
