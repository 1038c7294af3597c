package com.example.chatpipeline.agent;

import com.example.chatpipeline.model.ChatEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Generates replies through whichever Spring AI {@link ChatModel} the deployment provides.
 */
@Component
@ConditionalOnProperty(prefix = "app.pipeline.agent", name = "generator", havingValue = "chat-model")
public class ChatModelGenerationClient implements GenerationClient {

    private static final Logger logger = LoggerFactory.getLogger(ChatModelGenerationClient.class);

    private final ChatClient chatClient;

    public ChatModelGenerationClient(ChatModel chatModel,
                                     @Value("${app.pipeline.agent.system-prompt:You are a helpful participant in a group chat. Answer briefly.}") String systemPrompt) {
        this.chatClient = ChatClient.builder(chatModel)
                .defaultSystem(systemPrompt)
                .build();
    }

    @Override
    public String generate(String channelId, PromptContext context) {
        logger.debug("Generating reply in {} with {} history messages", channelId, context.history().size());
        String text = chatClient.prompt()
                .messages(toMessages(context.history()))
                .user(context.prompt())
                .call()
                .content();
        if (text == null || text.isBlank()) {
            throw new IllegalStateException("Model returned an empty reply for channel " + channelId);
        }
        return text;
    }

    static List<Message> toMessages(List<ChatEvent> history) {
        List<Message> messages = new ArrayList<>();
        for (ChatEvent event : history) {
            String content = event.getContent() == null ? "" : event.getContent();
            switch (event.getRole()) {
                case USER -> messages.add(new UserMessage(content));
                case AI -> messages.add(new AssistantMessage(content));
                case SYSTEM -> messages.add(new SystemMessage(content));
            }
        }
        return messages;
    }
}
