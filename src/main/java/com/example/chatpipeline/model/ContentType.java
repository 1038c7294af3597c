package com.example.chatpipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ContentType {
    TEXT("text"),
    MARKDOWN("markdown");

    private final String wireName;

    ContentType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ContentType fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Content type must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (ContentType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown content type: " + value);
    }
}
