package com.example.chatpipeline.controller;

import com.example.chatpipeline.dispatch.StreamDispatcher;
import com.example.chatpipeline.registry.ConnectionRegistry;
import com.example.chatpipeline.store.EventLogStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final EventLogStore eventLogStore;
    private final ConnectionRegistry connectionRegistry;
    private final StreamDispatcher dispatcher;

    public HealthController(EventLogStore eventLogStore, ConnectionRegistry connectionRegistry,
                            StreamDispatcher dispatcher) {
        this.eventLogStore = eventLogStore;
        this.connectionRegistry = connectionRegistry;
        this.dispatcher = dispatcher;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "chat-event-pipeline");
        health.put("dispatcher", dispatcher.state().name());

        try {
            eventLogStore.findByEventId("health-check");
            health.put("eventLog", "UP");
        } catch (Exception e) {
            health.put("eventLog", "DOWN");
            health.put("eventLogError", e.getMessage());
            health.put("status", "DEGRADED");
        }

        try {
            connectionRegistry.find("health-check");
            health.put("registry", "UP");
        } catch (Exception e) {
            health.put("registry", "DOWN");
            health.put("registryError", e.getMessage());
            health.put("status", "DEGRADED");
        }

        if (dispatcher.state() == StreamDispatcher.State.HALTED) {
            health.put("status", "DEGRADED");
        }
        return ResponseEntity.ok(health);
    }
}
