package com.example.chatpipeline.service;

import com.example.chatpipeline.model.ChatEvent;

/**
 * @param duplicate true when the event id was already recorded and {@code event} is the stored copy
 */
public record AppendOutcome(ChatEvent event, boolean duplicate) {}
