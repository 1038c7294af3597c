package com.example.chatpipeline.agent;

import com.example.chatpipeline.config.PipelineProperties;
import com.example.chatpipeline.dispatch.BatchResult;
import com.example.chatpipeline.dispatch.BoundedCall;
import com.example.chatpipeline.dispatch.StreamConsumer;
import com.example.chatpipeline.error.DuplicateEventException;
import com.example.chatpipeline.error.TransientDispatchException;
import com.example.chatpipeline.model.ChatEvent;
import com.example.chatpipeline.model.ContentType;
import com.example.chatpipeline.model.Role;
import com.example.chatpipeline.store.EventLogStore;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Answers user messages with generated replies written back into the event log.
 *
 * Only {@link Role#USER} events trigger generation. Replies are {@link Role#AI} and come back
 * through the feed like any other event, so this filter is what keeps the log from feeding itself.
 */
@Component
public class AgentConsumer implements StreamConsumer {

    private static final Logger logger = LoggerFactory.getLogger(AgentConsumer.class);

    public static final String NAME = "agent";

    private final EventLogStore store;
    private final GenerationClient generator;
    private final PipelineProperties.Agent settings;
    private final Duration generationTimeout;
    private final ExecutorService generationExecutor;

    public AgentConsumer(EventLogStore store, GenerationClient generator, PipelineProperties properties) {
        this.store = store;
        this.generator = generator;
        this.settings = properties.agent();
        this.generationTimeout = Duration.ofMillis(settings.generationTimeoutMs());
        this.generationExecutor = BoundedCall.newCallExecutor("agent-generate", properties.dispatch().workerThreads());
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BatchResult handle(List<ChatEvent> batch) {
        int replied = 0;
        int skipped = 0;

        for (ChatEvent event : batch) {
            if (event.getRole() != Role.USER) {
                skipped++;
                continue;
            }
            String replyId = ReplyIds.derive(event.getEventId());
            if (store.findByEventId(replyId).isPresent()) {
                logger.debug("Reply {} for event {} already recorded", replyId, event.getEventId());
                skipped++;
                continue;
            }

            String text;
            try {
                text = generate(event);
            } catch (TransientDispatchException e) {
                logger.warn("Generation failed for event {} in {}: {}", event.getEventId(), event.getChannelId(), e.getMessage());
                return BatchResult.failed("Generation failed for event " + event.getEventId() + ": " + e.getMessage(), e);
            }

            try {
                ChatEvent reply = store.append(buildReply(event, replyId, text));
                logger.info("Generated reply {} at ts {} for event {} in {}",
                        reply.getEventId(), reply.getTs(), event.getEventId(), event.getChannelId());
                replied++;
            } catch (DuplicateEventException e) {
                logger.debug("Reply {} raced with an earlier delivery, keeping existing", replyId);
                skipped++;
            }
        }
        return BatchResult.success(replied, skipped);
    }

    private String generate(ChatEvent event) {
        PromptContext context = new PromptContext(
                event.getChannelId(),
                event.getContent(),
                event.getSenderId(),
                history(event));
        return BoundedCall.run(() -> generator.generate(event.getChannelId(), context),
                generationExecutor, generationTimeout, "Generation for event " + event.getEventId());
    }

    private List<ChatEvent> history(ChatEvent event) {
        int size = settings.historySize();
        if (size <= 0 || event.getTs() <= 1) {
            return List.of();
        }
        long from = Math.max(0, event.getTs() - size - 1);
        return store.list(event.getChannelId(), from, size).items().stream()
                .filter(e -> e.getTs() < event.getTs())
                .toList();
    }

    private ChatEvent buildReply(ChatEvent source, String replyId, String text) {
        return ChatEvent.builder()
                .channelId(source.getChannelId())
                .eventId(replyId)
                .messageId(UUID.randomUUID().toString())
                .senderId(settings.senderId())
                .role(Role.AI)
                .content(text)
                .contentType(ContentType.TEXT)
                .metadata(Map.of(
                        "inReplyTo", source.getEventId(),
                        "inReplyToMessageId", source.getMessageId() == null ? "" : source.getMessageId()))
                .build();
    }

    @PreDestroy
    public void shutdown() {
        generationExecutor.shutdownNow();
    }
}
