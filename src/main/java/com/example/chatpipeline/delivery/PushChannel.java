package com.example.chatpipeline.delivery;

/**
 * Transport that reaches one live connection. Failures other than {@link PushOutcome#GONE} are
 * thrown and treated as retryable.
 */
public interface PushChannel {

    PushOutcome push(String connectionId, String payload);
}
