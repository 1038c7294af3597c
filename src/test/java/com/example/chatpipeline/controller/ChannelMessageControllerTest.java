package com.example.chatpipeline.controller;

import com.example.chatpipeline.service.ChatEventService;
import com.example.chatpipeline.store.InMemoryEventLogStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;

class ChannelMessageControllerTest {

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        ChatEventService chatEventService = new ChatEventService(new InMemoryEventLogStore(Clock.systemUTC()));
        webTestClient = WebTestClient.bindToController(new ChannelMessageController(chatEventService))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    private WebTestClient.ResponseSpec post(String body) {
        return webTestClient.post()
                .uri("/channels/room/messages")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .exchange();
    }

    @Test
    void testAppend_CreatedThenDuplicate() {
        String body = "{\"eventId\":\"e1\",\"senderId\":\"user-1\",\"role\":\"user\",\"content\":\"hi\"}";

        post(body).expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.ts").isEqualTo(1)
                .jsonPath("$.role").isEqualTo("user")
                .jsonPath("$.contentType").isEqualTo("text")
                .jsonPath("$.channelId").isEqualTo("room");

        post(body).expectStatus().isOk()
                .expectBody()
                .jsonPath("$.ts").isEqualTo(1);
    }

    @Test
    void testAppend_InvalidRequestIs422() {
        post("{\"senderId\":\"\",\"role\":\"robot\",\"content\":\"hi\"}")
                .expectStatus().isEqualTo(422)
                .expectBody()
                .jsonPath("$.status").isEqualTo(422)
                .jsonPath("$.error.code").isEqualTo("VALIDATION_FAILED")
                .jsonPath("$.errors.length()").isEqualTo(2);
    }

    @Test
    void testList_ReturnsItemsAndCursor() {
        post("{\"senderId\":\"u\",\"role\":\"user\",\"content\":\"one\"}").expectStatus().isCreated();
        post("{\"senderId\":\"u\",\"role\":\"user\",\"content\":\"two\"}").expectStatus().isCreated();

        webTestClient.get()
                .uri("/channels/room/messages?limit=1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.items.length()").isEqualTo(1)
                .jsonPath("$.items[0].content").isEqualTo("one")
                .jsonPath("$.nextCursor").isEqualTo(1);

        webTestClient.get()
                .uri("/channels/room/messages?cursor=1")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.items[0].content").isEqualTo("two")
                .jsonPath("$.nextCursor").isEmpty();
    }
}
