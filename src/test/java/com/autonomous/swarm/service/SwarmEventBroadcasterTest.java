package com.autonomous.swarm.service;

import com.autonomous.swarm.model.SwarmEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SwarmEventBroadcasterTest {

    private SwarmEventBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new SwarmEventBroadcaster(Runnable::run);
    }

    @Test
    void shouldDeliverToEverySubscriber() {
        List<SwarmEvent> first = new ArrayList<>();
        List<SwarmEvent> second = new ArrayList<>();
        broadcaster.subscribe(first::add);
        broadcaster.subscribe(second::add);

        broadcaster.broadcast("blocked", "s1", Map.of("prompt", "Continue?"));

        assertEquals(1, first.size());
        assertEquals(1, second.size());
        assertEquals("blocked", first.get(0).getType());
        assertEquals("s1", first.get(0).getSessionId());
        assertNotNull(first.get(0).getTimestamp());
    }

    @Test
    void shouldIsolateFailingSubscribers() {
        List<SwarmEvent> received = new ArrayList<>();
        broadcaster.subscribe(event -> {
            throw new IllegalStateException("socket closed");
        });
        broadcaster.subscribe(received::add);

        assertDoesNotThrow(() -> broadcaster.broadcast("stopped", "s1", Map.of()));
        assertEquals(1, received.size());
    }

    @Test
    void shouldStopDeliveringAfterUnsubscribe() {
        List<SwarmEvent> received = new ArrayList<>();
        Runnable unsubscribe = broadcaster.subscribe(received::add);

        unsubscribe.run();
        broadcaster.broadcast("stopped", "s1", Map.of());

        assertTrue(received.isEmpty());
        assertEquals(0, broadcaster.getSubscriberCount());
    }

    @Test
    void shouldSendToSingleSubscriber() {
        List<SwarmEvent> target = new ArrayList<>();
        List<SwarmEvent> other = new ArrayList<>();
        broadcaster.subscribe(other::add);

        broadcaster.send(target::add, SwarmEvent.of("snapshot", SwarmEvent.ALL_SESSIONS, Map.of()));

        assertEquals(1, target.size());
        assertTrue(other.isEmpty());
    }

    @Test
    void shouldBuildPayloadWithoutNullValues() {
        Map<String, Object> data = SwarmEvent.data("action", "respond", "response", null, "keys", List.of("enter"));

        assertEquals(Map.of("action", "respond", "keys", List.of("enter")), data);
        assertThrows(IllegalArgumentException.class, () -> SwarmEvent.data("odd"));
    }
}
