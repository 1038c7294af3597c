package com.example.chatpipeline.agent;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Reply event ids are a pure function of the triggering event id, so a redelivered message maps
 * onto the reply that may already exist.
 */
public final class ReplyIds {

    private static final String PREFIX = "reply-";

    private ReplyIds() {
    }

    public static String derive(String sourceEventId) {
        return PREFIX + UUID.nameUUIDFromBytes(("agent-reply:" + sourceEventId).getBytes(StandardCharsets.UTF_8));
    }
}
