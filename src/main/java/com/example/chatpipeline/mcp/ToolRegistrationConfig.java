package com.example.chatpipeline.mcp;

import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ToolRegistrationConfig {

    private final ChatTools chatTools;
    private final DispatchTools dispatchTools;

    public ToolRegistrationConfig(ChatTools chatTools, DispatchTools dispatchTools) {
        this.chatTools = chatTools;
        this.dispatchTools = dispatchTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(chatTools, dispatchTools)
                .build();
    }
}
