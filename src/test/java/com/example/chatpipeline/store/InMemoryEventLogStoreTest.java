package com.example.chatpipeline.store;

import com.example.chatpipeline.error.DuplicateEventException;
import com.example.chatpipeline.model.ChatEvent;
import com.example.chatpipeline.model.Role;
import com.example.chatpipeline.support.Events;
import com.example.chatpipeline.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryEventLogStoreTest {

    private MutableClock clock;
    private InMemoryEventLogStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        store = new InMemoryEventLogStore(clock);
    }

    @Test
    void testAppend_AssignsIncreasingTsPerChannel() {
        // When
        ChatEvent first = store.append(Events.draft("room", "e1", Role.USER, "hi"));
        ChatEvent second = store.append(Events.draft("room", "e2", Role.USER, "again"));
        ChatEvent other = store.append(Events.draft("lobby", "e3", Role.USER, "elsewhere"));

        // Then
        assertEquals(1L, first.getTs());
        assertEquals(2L, second.getTs());
        assertEquals(1L, other.getTs());
        assertEquals("room:1", first.getId());
        assertEquals(clock.instant(), first.getCreatedAt());
    }

    @Test
    void testAppend_DuplicateEventIdKeepsStoredRecord() {
        // Given
        store.append(Events.draft("room", "e1", Role.USER, "hi"));

        // When
        DuplicateEventException e = assertThrows(DuplicateEventException.class,
                () -> store.append(Events.draft("room", "e1", Role.USER, "changed")));

        // Then
        assertEquals("hi", e.getExisting().getContent());
        assertEquals(1, store.list("room", 0, 10).items().size());
        assertEquals("hi", store.findByEventId("e1").orElseThrow().getContent());
    }

    @Test
    void testList_PagesAfterCursor() {
        // Given
        for (int i = 1; i <= 5; i++) {
            store.append(Events.draft("room", "e" + i, Role.USER, "m" + i));
        }

        // When
        EventPage first = store.list("room", 0, 2);
        EventPage second = store.list("room", first.nextCursor(), 2);
        EventPage last = store.list("room", second.nextCursor(), 2);

        // Then
        assertEquals(List.of(1L, 2L), first.items().stream().map(ChatEvent::getTs).toList());
        assertEquals(2L, first.nextCursor());
        assertEquals(List.of(3L, 4L), second.items().stream().map(ChatEvent::getTs).toList());
        assertEquals(List.of(5L), last.items().stream().map(ChatEvent::getTs).toList());
        assertNull(last.nextCursor());
    }

    @Test
    void testList_UnknownChannelIsEmpty() {
        EventPage page = store.list("nowhere", 0, 10);

        assertTrue(page.items().isEmpty());
        assertNull(page.nextCursor());
    }

    @Test
    void testChannelsActiveSince() {
        // Given
        store.append(Events.draft("old", "e1", Role.USER, "hi"));
        clock.advance(Duration.ofHours(2));
        store.append(Events.draft("new", "e2", Role.USER, "hi"));

        // When
        List<String> active = store.channelsActiveSince(clock.instant().minus(Duration.ofHours(1)));

        // Then
        assertEquals(List.of("new"), active);
    }
}
