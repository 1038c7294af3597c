package com.example.chatpipeline.registry;

import com.example.chatpipeline.kv.KvClient;
import com.example.chatpipeline.model.Connection;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RedisConnectionRegistryTest {

    @Mock
    private KvClient kvClient;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final Instant now = Instant.parse("2026-01-01T00:00:00Z");
    private RedisConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new RedisConnectionRegistry(kvClient, objectMapper, Clock.fixed(now, ZoneOffset.UTC));
    }

    private Connection connection(String id, Instant expiresAt, String... channels) {
        return Connection.builder()
                .connectionId(id)
                .userId("user-" + id)
                .channelIds(new LinkedHashSet<>(List.of(channels)))
                .connectedAt(now)
                .expiresAt(expiresAt)
                .build();
    }

    private String json(Connection connection) throws Exception {
        return objectMapper.writeValueAsString(connection);
    }

    @Test
    void testPut_WritesConnectionWithTtlAndIndexesChannels() {
        // Given
        Connection connection = connection("c1", now.plus(Duration.ofHours(2)), "room", "lobby");

        // When
        registry.put(connection);

        // Then
        verify(kvClient).set(eq("conn:c1"), anyString(), eq(Duration.ofHours(2)));
        verify(kvClient).sadd("channel:room:connections", "c1");
        verify(kvClient).sadd("channel:lobby:connections", "c1");
    }

    @Test
    void testPut_ExpiredConnectionIsNotWritten() {
        // When
        registry.put(connection("c1", now.minusSeconds(1), "room"));

        // Then
        verifyNoInteractions(kvClient);
    }

    @Test
    void testFindByChannel_DropsMembersWithoutLiveRecord() throws Exception {
        // Given
        Connection live = connection("c1", now.plus(Duration.ofHours(1)), "room");
        Connection expired = connection("c3", now.minusSeconds(5), "room");
        when(kvClient.smembers("channel:room:connections")).thenReturn(new LinkedHashSet<>(List.of("c1", "c2", "c3")));
        Map<String, String> values = new HashMap<>();
        values.put("conn:c1", json(live));
        values.put("conn:c3", json(expired));
        when(kvClient.mget(anyList())).thenReturn(values);

        // When
        Set<Connection> found = registry.findByChannel("room");

        // Then
        assertEquals(1, found.size());
        assertEquals("c1", found.iterator().next().getConnectionId());
        verify(kvClient).srem("channel:room:connections", "c2", "c3");
    }

    @Test
    void testFindByChannel_EmptyIndex() {
        // Given
        when(kvClient.smembers("channel:room:connections")).thenReturn(Set.of());

        // When
        Set<Connection> found = registry.findByChannel("room");

        // Then
        assertTrue(found.isEmpty());
        verify(kvClient, never()).mget(anyList());
    }

    @Test
    void testDelete_RemovesIndexMembershipAndRecord() throws Exception {
        // Given
        Connection connection = connection("c1", now.plus(Duration.ofHours(1)), "room", "lobby");
        when(kvClient.get("conn:c1")).thenReturn(Optional.of(json(connection)));

        // When
        registry.delete("c1");

        // Then
        verify(kvClient).srem("channel:room:connections", "c1");
        verify(kvClient).srem("channel:lobby:connections", "c1");
        verify(kvClient).del("conn:c1");
    }

    @Test
    void testRefresh_ExtendsExpiry() throws Exception {
        // Given
        Connection connection = connection("c1", now.plus(Duration.ofMinutes(1)), "room");
        when(kvClient.get("conn:c1")).thenReturn(Optional.of(json(connection)));

        when(kvClient.setIfPresent(eq("conn:c1"), anyString(), eq(Duration.ofHours(2)))).thenReturn(true);

        // When
        boolean refreshed = registry.refresh("c1", Duration.ofHours(2));

        // Then
        assertTrue(refreshed);
        verify(kvClient).setIfPresent(eq("conn:c1"), anyString(), eq(Duration.ofHours(2)));
        verify(kvClient, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void testRefresh_DeletedMidwayIsNotRecreated() throws Exception {
        // Given the key is deleted between the read and the write
        Connection connection = connection("c1", now.plus(Duration.ofMinutes(1)), "room");
        when(kvClient.get("conn:c1")).thenReturn(Optional.of(json(connection)));
        when(kvClient.setIfPresent(eq("conn:c1"), anyString(), eq(Duration.ofHours(2)))).thenReturn(false);

        // When
        boolean refreshed = registry.refresh("c1", Duration.ofHours(2));

        // Then
        assertFalse(refreshed);
        verify(kvClient, never()).set(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void testRefresh_UnknownConnection() {
        // Given
        when(kvClient.get("conn:ghost")).thenReturn(Optional.empty());

        // When / Then
        assertFalse(registry.refresh("ghost", Duration.ofHours(2)));
        verify(kvClient, never()).setIfPresent(anyString(), anyString(), any(Duration.class));
    }

    @Test
    void testSweepExpired_RemovesDanglingMembers() throws Exception {
        // Given
        when(kvClient.scan("channel:")).thenReturn(List.of("channel:room:connections"));
        when(kvClient.smembers("channel:room:connections")).thenReturn(new LinkedHashSet<>(List.of("c1", "c2")));
        Map<String, String> values = new HashMap<>();
        values.put("conn:c1", json(connection("c1", now.plus(Duration.ofHours(1)), "room")));
        when(kvClient.mget(anyList())).thenReturn(values);

        // When
        int removed = registry.sweepExpired();

        // Then
        assertEquals(1, removed);
        verify(kvClient).srem("channel:room:connections", "c2");
    }

    @Test
    void testSweepExpired_VisitsEveryIndexKey() {
        // Given more index keys than one SCAN page
        List<String> indexKeys = new ArrayList<>();
        for (int i = 0; i < 1500; i++) {
            indexKeys.add("channel:room-" + i + ":connections");
        }
        when(kvClient.scan("channel:")).thenReturn(indexKeys);
        when(kvClient.smembers(anyString())).thenAnswer(invocation ->
                "channel:room-1499:connections".equals(invocation.getArgument(0))
                        ? new LinkedHashSet<>(List.of("gone"))
                        : Set.of());
        when(kvClient.mget(List.of("conn:gone"))).thenReturn(new HashMap<>());

        // When
        int removed = registry.sweepExpired();

        // Then
        assertEquals(1, removed);
        verify(kvClient).srem("channel:room-1499:connections", "gone");
    }
}
