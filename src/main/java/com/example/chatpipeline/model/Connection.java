package com.example.chatpipeline.model;

import lombok.*;

import java.time.Instant;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Connection {
    private String connectionId;
    private String userId;
    private Set<String> channelIds;
    private Instant connectedAt;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }
}
