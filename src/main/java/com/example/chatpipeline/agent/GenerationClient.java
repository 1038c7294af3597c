package com.example.chatpipeline.agent;

/**
 * External text generator behind the automated replies. Implementations may block; the caller
 * bounds every call with a timeout.
 */
public interface GenerationClient {

    String generate(String channelId, PromptContext context);
}
