package com.example.chatpipeline.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Pipeline configuration, read from application.yml under "app.pipeline":
 *
 * app:
 *   pipeline:
 *     storage: durable            # durable (MongoDB + Redis) | memory
 *     dispatch:
 *       batch-size: 100
 *       max-attempts: 5
 *       initial-backoff-ms: 200
 *     feed:
 *       retention-ms: 86400000
 *     agent:
 *       generator: echo           # echo | chat-model
 *     delivery:
 *       transport: sse            # sse | http
 *     registry:
 *       connection-ttl-ms: 7200000
 */
@ConfigurationProperties(prefix = "app.pipeline")
public record PipelineProperties(
        @DefaultValue("durable") String storage,
        @DefaultValue Dispatch dispatch,
        @DefaultValue Feed feed,
        @DefaultValue Agent agent,
        @DefaultValue Delivery delivery,
        @DefaultValue Registry registry
) {

    /**
     * @param maxAttempts total consumer invocations per batch before it is dead-lettered
     */
    public record Dispatch(
            @DefaultValue("100") int batchSize,
            @DefaultValue("5") int maxAttempts,
            @DefaultValue("200") long initialBackoffMs,
            @DefaultValue("2.0") double backoffMultiplier,
            @DefaultValue("5000") long maxBackoffMs,
            @DefaultValue("8") int workerThreads,
            @DefaultValue("10000") long shutdownTimeoutMs,
            @DefaultValue("5") int maxConsecutiveOutages
    ) {}

    public record Feed(
            @DefaultValue("86400000") long retentionMs,
            @DefaultValue("600000") long gapGraceMs
    ) {}

    public record Agent(
            @DefaultValue("echo") String generator,
            @DefaultValue("assistant-llm") String senderId,
            @DefaultValue("30000") long generationTimeoutMs,
            @DefaultValue("10") int historySize
    ) {}

    public record Delivery(
            @DefaultValue("sse") String transport,
            @DefaultValue("5000") long pushTimeoutMs,
            @DefaultValue("3") int pushAttempts,
            @DefaultValue("100") long pushBackoffMs,
            String endpoint
    ) {}

    /**
     * @param heartbeatIntervalMs how often a held stream refreshes its registry entry; keep well below the TTL
     */
    public record Registry(
            @DefaultValue("7200000") long connectionTtlMs,
            @DefaultValue("60000") long sweepIntervalMs,
            @DefaultValue("30000") long heartbeatIntervalMs
    ) {}
}
