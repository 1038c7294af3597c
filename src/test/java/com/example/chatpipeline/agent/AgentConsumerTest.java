package com.example.chatpipeline.agent;

import com.example.chatpipeline.dispatch.BatchResult;
import com.example.chatpipeline.model.ChatEvent;
import com.example.chatpipeline.model.Role;
import com.example.chatpipeline.store.InMemoryEventLogStore;
import com.example.chatpipeline.support.Events;
import com.example.chatpipeline.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AgentConsumerTest {

    @Mock
    private GenerationClient generator;

    private InMemoryEventLogStore store;
    private AgentConsumer agentConsumer;

    @BeforeEach
    void setUp() {
        store = new InMemoryEventLogStore(Clock.systemUTC());
        agentConsumer = new AgentConsumer(store, generator, TestProperties.defaults());
    }

    @AfterEach
    void tearDown() {
        agentConsumer.shutdown();
    }

    @Test
    void testHandle_UserMessageGetsOneReply() {
        // Given
        ChatEvent question = store.append(Events.draft("room", "e1", Role.USER, "What time is it?"));
        when(generator.generate(eq("room"), any(PromptContext.class))).thenReturn("Noon.");

        // When
        BatchResult result = agentConsumer.handle(List.of(question));

        // Then
        assertEquals(BatchResult.Status.SUCCESS, result.getStatus());
        assertEquals(1, result.getHandled());
        ChatEvent reply = store.findByEventId(ReplyIds.derive("e1")).orElseThrow();
        assertEquals(Role.AI, reply.getRole());
        assertEquals("Noon.", reply.getContent());
        assertEquals("assistant-llm", reply.getSenderId());
        assertEquals(2L, reply.getTs());
        assertEquals("e1", reply.getMetadata().get("inReplyTo"));
        assertEquals("msg-e1", reply.getMetadata().get("inReplyToMessageId"));
    }

    @Test
    void testHandle_NonUserEventsNeverTriggerGeneration() {
        // Given
        ChatEvent aiReply = store.append(Events.draft("room", "e1", Role.AI, "I am a reply"));
        ChatEvent system = store.append(Events.draft("room", "e2", Role.SYSTEM, "user joined"));

        // When
        BatchResult result = agentConsumer.handle(List.of(aiReply, system));

        // Then
        assertEquals(0, result.getHandled());
        assertEquals(2, result.getSkipped());
        verify(generator, never()).generate(anyString(), any(PromptContext.class));
        assertEquals(2, store.list("room", 0, 10).items().size());
    }

    @Test
    void testHandle_RedeliveredBatchDoesNotReplyTwice() {
        // Given
        ChatEvent question = store.append(Events.draft("room", "e1", Role.USER, "hello"));
        when(generator.generate(eq("room"), any(PromptContext.class))).thenReturn("hi there");

        // When
        agentConsumer.handle(List.of(question));
        BatchResult second = agentConsumer.handle(List.of(question));

        // Then
        assertEquals(0, second.getHandled());
        assertEquals(1, second.getSkipped());
        verify(generator, times(1)).generate(eq("room"), any(PromptContext.class));
        assertEquals(2, store.list("room", 0, 10).items().size());
    }

    @Test
    void testHandle_GenerationFailureFailsBatch() {
        // Given
        ChatEvent question = store.append(Events.draft("room", "e1", Role.USER, "hello"));
        when(generator.generate(eq("room"), any(PromptContext.class))).thenThrow(new IllegalStateException("model down"));

        // When
        BatchResult result = agentConsumer.handle(List.of(question));

        // Then
        assertTrue(result.isFailed());
        assertTrue(result.getMessage().contains("e1"));
        assertTrue(store.findByEventId(ReplyIds.derive("e1")).isEmpty());
    }

    @Test
    void testHandle_SlowGenerationTimesOut() {
        // Given
        agentConsumer.shutdown();
        agentConsumer = new AgentConsumer(store, generator, TestProperties.with(TestProperties.agent(50L)));
        ChatEvent question = store.append(Events.draft("room", "e1", Role.USER, "hello"));
        when(generator.generate(eq("room"), any(PromptContext.class))).thenAnswer(invocation -> {
            Thread.sleep(2_000);
            return "too late";
        });

        // When
        BatchResult result = agentConsumer.handle(List.of(question));

        // Then
        assertTrue(result.isFailed());
        assertTrue(result.getMessage().contains("timed out"));
    }

    @Test
    void testHandle_PromptCarriesPriorHistory() {
        // Given
        store.append(Events.draft("room", "e1", Role.USER, "first"));
        store.append(Events.draft("room", "e2", Role.AI, "answer"));
        ChatEvent question = store.append(Events.draft("room", "e3", Role.USER, "follow-up"));
        when(generator.generate(eq("room"), any(PromptContext.class))).thenReturn("ok");

        // When
        agentConsumer.handle(List.of(question));

        // Then
        ArgumentCaptor<PromptContext> context = ArgumentCaptor.forClass(PromptContext.class);
        verify(generator).generate(eq("room"), context.capture());
        assertEquals("follow-up", context.getValue().prompt());
        assertEquals("user-1", context.getValue().senderId());
        assertEquals(List.of("first", "answer"),
                context.getValue().history().stream().map(ChatEvent::getContent).toList());
    }

    @Test
    void testReplyIds_AreStablePerSourceEvent() {
        assertEquals(ReplyIds.derive("e1"), ReplyIds.derive("e1"));
        assertNotEquals(ReplyIds.derive("e1"), ReplyIds.derive("e2"));
        assertTrue(ReplyIds.derive("e1").startsWith("reply-"));
    }
}
