package com.example.chatpipeline.controller;

import com.example.chatpipeline.model.Connection;
import com.example.chatpipeline.registry.ConnectionLifecycleService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Connection hooks for gateways that hold the client sockets themselves and push through the
 * HTTP management transport.
 */
@RestController
@RequestMapping("/connections")
public class ConnectionController {

    private final ConnectionLifecycleService lifecycle;

    public ConnectionController(ConnectionLifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    public record ConnectRequest(String connectionId, String userId, List<String> channelIds) {}

    @PostMapping
    public Mono<ResponseEntity<Connection>> connect(@RequestBody ConnectRequest request) {
        String connectionId = request.connectionId() != null ? request.connectionId() : UUID.randomUUID().toString();
        return Mono.fromCallable(() -> lifecycle.onConnect(connectionId, request.userId(),
                        request.channelIds() == null ? List.of() : request.channelIds()))
                .subscribeOn(Schedulers.boundedElastic())
                .map(connection -> ResponseEntity.status(HttpStatus.CREATED).body(connection));
    }

    @DeleteMapping("/{connectionId}")
    public Mono<ResponseEntity<Void>> disconnect(@PathVariable String connectionId) {
        return Mono.fromRunnable(() -> lifecycle.onDisconnect(connectionId))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PostMapping("/{connectionId}/heartbeat")
    public Mono<ResponseEntity<Map<String, Object>>> heartbeat(@PathVariable String connectionId) {
        return Mono.fromCallable(() -> lifecycle.heartbeat(connectionId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(refreshed -> refreshed
                        ? ResponseEntity.ok(Map.<String, Object>of("connectionId", connectionId, "refreshed", true))
                        : ResponseEntity.status(HttpStatus.NOT_FOUND)
                                .body(Map.<String, Object>of("connectionId", connectionId, "refreshed", false)));
    }
}
