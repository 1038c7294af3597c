package com.example.chatpipeline.delivery;

import com.example.chatpipeline.error.TransientDispatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Pushes to Server-Sent-Events streams held open by this node. A connection without a live stream
 * here is reported as {@link PushOutcome#GONE}, which suits single-node deployments; behind a
 * gateway use the HTTP management transport instead.
 */
@Component
@ConditionalOnProperty(prefix = "app.pipeline.delivery", name = "transport", havingValue = "sse", matchIfMissing = true)
public class SsePushChannel implements PushChannel {

    private static final Logger logger = LoggerFactory.getLogger(SsePushChannel.class);

    private final Map<String, Sinks.Many<ServerSentEvent<String>>> sseConnections = new ConcurrentHashMap<>();

    public Flux<ServerSentEvent<String>> open(String connectionId) {
        Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().multicast().onBackpressureBuffer();
        sseConnections.put(connectionId, sink);
        return sink.asFlux()
                .doFinally(signal -> sseConnections.remove(connectionId, sink));
    }

    public void close(String connectionId) {
        Sinks.Many<ServerSentEvent<String>> sink = sseConnections.remove(connectionId);
        if (sink != null) {
            sink.tryEmitComplete();
        }
    }

    public boolean isOpen(String connectionId) {
        return sseConnections.containsKey(connectionId);
    }

    @Override
    public PushOutcome push(String connectionId, String payload) {
        Sinks.Many<ServerSentEvent<String>> sink = sseConnections.get(connectionId);
        if (sink == null) {
            return PushOutcome.GONE;
        }
        Sinks.EmitResult result = sink.tryEmitNext(ServerSentEvent.<String>builder()
                .event("message")
                .data(payload)
                .build());
        switch (result) {
            case OK:
                return PushOutcome.OK;
            case FAIL_TERMINATED:
            case FAIL_CANCELLED:
            case FAIL_ZERO_SUBSCRIBER:
                sseConnections.remove(connectionId, sink);
                logger.debug("Stream of {} is closed ({})", connectionId, result);
                return PushOutcome.GONE;
            default:
                throw new TransientDispatchException("Stream of " + connectionId + " rejected push: " + result);
        }
    }
}
