package com.example.chatpipeline.delivery;

public enum PushOutcome {
    OK,
    /** The connection no longer exists on the transport side. */
    GONE
}
