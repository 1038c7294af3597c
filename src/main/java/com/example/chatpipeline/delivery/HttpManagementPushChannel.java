package com.example.chatpipeline.delivery;

import com.example.chatpipeline.config.PipelineProperties;
import com.example.chatpipeline.error.TransientDispatchException;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;

/**
 * Pushes through a connection-management API: {@code POST {endpoint}/@connections/{connectionId}}
 * with the payload as body. HTTP 410 means the connection is gone.
 */
@Component
@ConditionalOnProperty(prefix = "app.pipeline.delivery", name = "transport", havingValue = "http")
public class HttpManagementPushChannel implements PushChannel {

    private final WebClient webClient;
    private final Duration timeout;

    public HttpManagementPushChannel(WebClient.Builder builder, PipelineProperties properties) {
        this(builder.baseUrl(requireEndpoint(properties.delivery().endpoint())).build(),
                Duration.ofMillis(properties.delivery().pushTimeoutMs()));
    }

    HttpManagementPushChannel(WebClient webClient, Duration timeout) {
        this.webClient = webClient;
        this.timeout = timeout;
    }

    private static String requireEndpoint(String endpoint) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new IllegalStateException("app.pipeline.delivery.endpoint is required for the http transport");
        }
        return endpoint;
    }

    @Override
    public PushOutcome push(String connectionId, String payload) {
        try {
            webClient.post()
                    .uri("/@connections/{connectionId}", connectionId)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .toBodilessEntity()
                    .block(timeout);
            return PushOutcome.OK;
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.GONE.value()) {
                return PushOutcome.GONE;
            }
            throw new TransientDispatchException("Push to " + connectionId + " failed with HTTP " + e.getStatusCode().value(), e);
        } catch (WebClientRequestException e) {
            throw new TransientDispatchException("Push to " + connectionId + " could not be sent: " + e.getMessage(), e);
        } catch (IllegalStateException e) {
            // block(timeout) signals an elapsed deadline this way
            throw new TransientDispatchException("Push to " + connectionId + " timed out", e);
        }
    }
}
