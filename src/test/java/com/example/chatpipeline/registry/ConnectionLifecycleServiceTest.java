package com.example.chatpipeline.registry;

import com.example.chatpipeline.error.ValidationException;
import com.example.chatpipeline.model.Connection;
import com.example.chatpipeline.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ConnectionLifecycleServiceTest {

    @Mock
    private ConnectionRegistry registry;

    private final Instant now = Instant.parse("2026-01-01T00:00:00Z");
    private ConnectionLifecycleService lifecycle;

    @BeforeEach
    void setUp() {
        lifecycle = new ConnectionLifecycleService(registry, Clock.fixed(now, ZoneOffset.UTC),
                TestProperties.with(TestProperties.registry(Duration.ofHours(2).toMillis())));
    }

    @Test
    void testOnConnect_RegistersWithTtl() {
        // When
        Connection connection = lifecycle.onConnect("c1", null, Arrays.asList("room", " lobby ", "", null));

        // Then
        ArgumentCaptor<Connection> stored = ArgumentCaptor.forClass(Connection.class);
        verify(registry).put(stored.capture());
        assertSame(connection, stored.getValue());
        assertEquals("anonymous", connection.getUserId());
        assertEquals(Set.of("room", "lobby"), connection.getChannelIds());
        assertEquals(now.plus(Duration.ofHours(2)), connection.getExpiresAt());
    }

    @Test
    void testOnConnect_RequiresConnectionId() {
        assertThrows(ValidationException.class, () -> lifecycle.onConnect(" ", "u", List.of("room")));
        verify(registry, never()).put(any(Connection.class));
    }

    @Test
    void testHeartbeat_RefreshesWithConfiguredTtl() {
        // Given
        when(registry.refresh("c1", Duration.ofHours(2))).thenReturn(true);

        // When / Then
        assertTrue(lifecycle.heartbeat("c1"));
    }

    @Test
    void testOnDisconnect_DeletesConnection() {
        lifecycle.onDisconnect("c1");

        verify(registry).delete("c1");
    }

    @Test
    void testSweep_SurvivesRegistryFailure() {
        // Given
        when(registry.sweepExpired()).thenThrow(new IllegalStateException("redis down"));

        // When / Then
        assertDoesNotThrow(() -> lifecycle.sweep());
    }
}
