package com.example.chatpipeline.service;

import com.example.chatpipeline.error.DuplicateEventException;
import com.example.chatpipeline.error.ValidationException;
import com.example.chatpipeline.model.ChatEvent;
import com.example.chatpipeline.model.ContentType;
import com.example.chatpipeline.model.Role;
import com.example.chatpipeline.store.EventLogStore;
import com.example.chatpipeline.store.EventPage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.UUID;

/**
 * Validating front door to the event log, shared by the REST controller and the MCP tools.
 */
@Service
public class ChatEventService {

    private static final Logger logger = LoggerFactory.getLogger(ChatEventService.class);

    static final int MAX_ID_LENGTH = 128;
    static final int MAX_CONTENT_LENGTH = 65_536;
    static final int DEFAULT_LIMIT = 50;
    static final int MAX_LIMIT = 200;

    private final EventLogStore store;

    public ChatEventService(EventLogStore store) {
        this.store = store;
    }

    public AppendOutcome append(String channelId, AppendMessageRequest request) {
        ChatEvent event = toEvent(channelId, request);
        try {
            ChatEvent stored = store.append(event);
            logger.debug("Appended {} to {} at ts {}", stored.getEventId(), channelId, stored.getTs());
            return new AppendOutcome(stored, false);
        } catch (DuplicateEventException e) {
            logger.info("Event {} already recorded on {}, returning stored copy", event.getEventId(), channelId);
            return new AppendOutcome(e.getExisting(), true);
        }
    }

    public EventPage list(String channelId, Long cursor, Integer limit) {
        List<String> errors = new ArrayList<>();
        requireId("channelId", channelId, errors);
        if (cursor != null && cursor < 0) {
            errors.add("cursor must not be negative");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return store.list(channelId, cursor == null ? 0L : cursor, clampLimit(limit));
    }

    static int clampLimit(Integer limit) {
        if (limit == null) {
            return DEFAULT_LIMIT;
        }
        return Math.max(1, Math.min(MAX_LIMIT, limit));
    }

    private ChatEvent toEvent(String channelId, AppendMessageRequest request) {
        if (request == null) {
            throw new ValidationException("request body is required");
        }
        List<String> errors = new ArrayList<>();
        requireId("channelId", channelId, errors);
        requireId("senderId", request.senderId(), errors);
        optionalId("eventId", request.eventId(), errors);
        optionalId("messageId", request.messageId(), errors);

        Role role = null;
        if (request.role() == null) {
            errors.add("role is required");
        } else {
            try {
                role = Role.fromWire(request.role());
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        ContentType contentType = ContentType.TEXT;
        if (request.contentType() != null) {
            try {
                contentType = ContentType.fromWire(request.contentType());
            } catch (IllegalArgumentException e) {
                errors.add(e.getMessage());
            }
        }

        if (request.content() == null) {
            errors.add("content is required");
        } else if (request.content().length() > MAX_CONTENT_LENGTH) {
            errors.add("content exceeds " + MAX_CONTENT_LENGTH + " characters");
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        return ChatEvent.builder()
                .channelId(channelId)
                .eventId(isBlank(request.eventId()) ? UUID.randomUUID().toString() : request.eventId())
                .messageId(isBlank(request.messageId()) ? UUID.randomUUID().toString() : request.messageId())
                .senderId(request.senderId())
                .role(role)
                .content(request.content())
                .contentType(contentType)
                .metadata(request.metadata() == null ? new HashMap<>() : new HashMap<>(request.metadata()))
                .build();
    }

    private static void requireId(String field, String value, List<String> errors) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        } else if (value.length() > MAX_ID_LENGTH) {
            errors.add(field + " exceeds " + MAX_ID_LENGTH + " characters");
        }
    }

    private static void optionalId(String field, String value, List<String> errors) {
        if (value != null && value.length() > MAX_ID_LENGTH) {
            errors.add(field + " exceeds " + MAX_ID_LENGTH + " characters");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
