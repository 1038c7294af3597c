package com.example.chatpipeline.agent;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Deterministic stand-in used until a model is wired in.
 */
@Component
@ConditionalOnProperty(prefix = "app.pipeline.agent", name = "generator", havingValue = "echo", matchIfMissing = true)
public class EchoGenerationClient implements GenerationClient {

    @Override
    public String generate(String channelId, PromptContext context) {
        return "AI Response to: " + context.prompt();
    }
}
