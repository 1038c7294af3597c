package com.example.chatpipeline.controller;

import com.example.chatpipeline.dispatch.BatchResult;
import com.example.chatpipeline.dispatch.DeadLetterSink;
import com.example.chatpipeline.dispatch.StreamDispatcher;
import com.example.chatpipeline.model.DeadLetterBatch;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/dispatch")
public class OperationsController {

    private final StreamDispatcher dispatcher;
    private final DeadLetterSink deadLetters;

    public OperationsController(StreamDispatcher dispatcher, DeadLetterSink deadLetters) {
        this.dispatcher = dispatcher;
        this.deadLetters = deadLetters;
    }

    @GetMapping("/status")
    public Mono<Map<String, Object>> status() {
        return Mono.fromCallable(dispatcher::status).subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/dead-letters")
    public Mono<List<DeadLetterBatch>> deadLetters() {
        return Mono.fromCallable(deadLetters::pending).subscribeOn(Schedulers.boundedElastic());
    }

    @PostMapping("/dead-letters/{id}/replay")
    public Mono<ResponseEntity<Map<String, Object>>> replay(@PathVariable String id) {
        return Mono.fromCallable(() -> dispatcher.replay(id))
                .subscribeOn(Schedulers.boundedElastic())
                .map(result -> result
                        .map(BatchResult::toMap)
                        .map(ResponseEntity::ok)
                        .orElseGet(() -> ResponseEntity.notFound().build()));
    }

    @PostMapping("/resume")
    public Map<String, Object> resume() {
        dispatcher.resume();
        return Map.of("state", dispatcher.state().name());
    }
}
