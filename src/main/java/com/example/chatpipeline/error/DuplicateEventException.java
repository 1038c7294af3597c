package com.example.chatpipeline.error;

import com.example.chatpipeline.model.ChatEvent;

/**
 * Raised by a conditional append when the event id is already recorded. Callers treat it as
 * "already done" and use {@link #getExisting()}.
 */
public class DuplicateEventException extends ChatPipelineException {

    private final transient ChatEvent existing;

    public DuplicateEventException(ChatEvent existing) {
        super("DUPLICATE_EVENT", "Event " + existing.getEventId() + " already recorded");
        this.existing = existing;
    }

    public ChatEvent getExisting() {
        return existing;
    }
}
