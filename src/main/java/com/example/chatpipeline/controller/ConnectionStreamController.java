package com.example.chatpipeline.controller;

import com.example.chatpipeline.config.PipelineProperties;
import com.example.chatpipeline.delivery.SsePushChannel;
import com.example.chatpipeline.registry.ConnectionLifecycleService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.UUID;

/**
 * Holds client streams on this node. Connect registers the stream's channels, ticks refresh the
 * registry TTL, and cancellation deregisters it.
 */
@RestController
@ConditionalOnProperty(prefix = "app.pipeline.delivery", name = "transport", havingValue = "sse", matchIfMissing = true)
public class ConnectionStreamController {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionStreamController.class);

    private final SsePushChannel pushChannel;
    private final ConnectionLifecycleService lifecycle;
    private final Duration heartbeatInterval;

    public ConnectionStreamController(SsePushChannel pushChannel, ConnectionLifecycleService lifecycle,
                                      PipelineProperties properties) {
        this.pushChannel = pushChannel;
        this.lifecycle = lifecycle;
        this.heartbeatInterval = Duration.ofMillis(properties.registry().heartbeatIntervalMs());
    }

    @GetMapping(value = "/connections/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> stream(@RequestParam(required = false) String userId,
                                                @RequestParam List<String> channels) {
        String connectionId = UUID.randomUUID().toString();
        Flux<ServerSentEvent<String>> messages = pushChannel.open(connectionId);

        Flux<ServerSentEvent<String>> heartbeats = Flux.interval(heartbeatInterval)
                .concatMap(tick -> Mono.fromCallable(() -> lifecycle.heartbeat(connectionId))
                        .subscribeOn(Schedulers.boundedElastic())
                        .onErrorResume(e -> {
                            logger.warn("Heartbeat for {} failed: {}", connectionId, e.getMessage());
                            return Mono.just(false);
                        }))
                .map(refreshed -> ServerSentEvent.<String>builder().comment("heartbeat").build());

        return Mono.fromCallable(() -> lifecycle.onConnect(connectionId, userId, channels))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMapMany(connection -> Flux.concat(
                        Mono.just(ServerSentEvent.<String>builder()
                                .event("connected")
                                .data("{\"connectionId\":\"" + connectionId + "\"}")
                                .build()),
                        Flux.merge(messages, heartbeats)))
                .doFinally(signal -> {
                    pushChannel.close(connectionId);
                    Schedulers.boundedElastic().schedule(() -> disconnect(connectionId));
                });
    }

    private void disconnect(String connectionId) {
        try {
            lifecycle.onDisconnect(connectionId);
        } catch (RuntimeException e) {
            logger.warn("Failed to deregister {}, TTL will expire it: {}", connectionId, e.getMessage());
        }
    }
}
