package com.example.chatpipeline.agent;

import com.example.chatpipeline.model.ChatEvent;

import java.util.List;

/**
 * What the generator sees for one user message.
 *
 * @param history events of the channel that precede the prompt, oldest first
 */
public record PromptContext(String channelId, String prompt, String senderId, List<ChatEvent> history) {
}
