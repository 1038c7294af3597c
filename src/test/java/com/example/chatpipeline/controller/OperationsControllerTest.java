package com.example.chatpipeline.controller;

import com.example.chatpipeline.dispatch.BatchResult;
import com.example.chatpipeline.dispatch.DeadLetterSink;
import com.example.chatpipeline.dispatch.StreamDispatcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Optional;

import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OperationsControllerTest {

    @Mock
    private StreamDispatcher dispatcher;

    @Mock
    private DeadLetterSink deadLetters;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new OperationsController(dispatcher, deadLetters))
                .controllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void testReplay_UnknownDeadLetterIs404() {
        when(dispatcher.replay("missing")).thenReturn(Optional.empty());

        webTestClient.post().uri("/dispatch/dead-letters/missing/replay")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void testReplay_ReturnsBatchResult() {
        when(dispatcher.replay("dl-1")).thenReturn(Optional.of(BatchResult.success(2, 0)));

        webTestClient.post().uri("/dispatch/dead-letters/dl-1/replay")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.status").isEqualTo("SUCCESS")
                .jsonPath("$.handled").isEqualTo(2);
    }

    @Test
    void testResume_ClearsHalt() {
        when(dispatcher.state()).thenReturn(StreamDispatcher.State.RUNNING);

        webTestClient.post().uri("/dispatch/resume")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.state").isEqualTo("RUNNING");

        verify(dispatcher).resume();
    }
}
