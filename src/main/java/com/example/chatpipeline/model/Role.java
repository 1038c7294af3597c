package com.example.chatpipeline.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Role {
    USER("user"),
    AI("ai"),
    SYSTEM("system");

    private final String wireName;

    Role(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolve a role from its wire name. "assistant" is accepted as an alias for {@link #AI}.
     */
    @JsonCreator
    public static Role fromWire(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Role must not be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("assistant".equals(normalized)) {
            return AI;
        }
        for (Role role : values()) {
            if (role.wireName.equals(normalized)) {
                return role;
            }
        }
        throw new IllegalArgumentException("Unknown role: " + value);
    }
}
