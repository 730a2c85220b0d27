package com.starkiller.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link EventBus}.
 */
class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    // -- StarkillerEvent record tests -----------------------------------------

    @Nested
    @DisplayName("StarkillerEvent")
    class StarkillerEventTests {

        @Test
        @DisplayName("of stamps the event with the current time")
        void ofSetsTimestamp() {
            var event = StarkillerEvent.of("branch.changed", 3, "d-7", Map.of("to", "IMPERIUM_PATH"));

            assertEquals("branch.changed", event.eventType());
            assertEquals(3, event.day());
            assertEquals("d-7", event.subjectId());
            assertEquals(Map.of("to", "IMPERIUM_PATH"), event.payload());
            assertNotNull(event.timestamp());
        }

        @Test
        @DisplayName("allows null subjectId")
        void allowsNullSubject() {
            assertNull(StarkillerEvent.of("day.started", 2, null, Map.of()).subjectId());
        }
    }

    // -- Subscribe and publish tests ------------------------------------------

    @Nested
    @DisplayName("subscribe and publish")
    class SubscribeAndPublishTests {

        @Test
        @DisplayName("delivers events only to subscribers of their type")
        void deliversByType() {
            List<StarkillerEvent> branches = new ArrayList<>();
            List<StarkillerEvent> tags = new ArrayList<>();
            eventBus.subscribe("branch.changed", branches::add);
            eventBus.subscribe("story_tag.unlocked", tags::add);

            eventBus.publish(StarkillerEvent.of("branch.changed", 1, "d-1", Map.of()));

            assertEquals(1, branches.size());
            assertTrue(tags.isEmpty());
        }

        @Test
        @DisplayName("global subscribers receive every event after type subscribers")
        void globalAfterType() {
            List<String> order = new ArrayList<>();
            eventBus.subscribeAll(e -> order.add("global:" + e.eventType()));
            eventBus.subscribe("day.started", e -> order.add("typed:" + e.eventType()));

            eventBus.publish(StarkillerEvent.of("day.started", 2, null, Map.of()));
            eventBus.publish(StarkillerEvent.of("session.game_over", 2, null, Map.of()));

            assertEquals(List.of("typed:day.started", "global:day.started", "global:session.game_over"), order);
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribe() {
            List<StarkillerEvent> received = new ArrayList<>();
            EventBus.Subscription typed = eventBus.subscribe("day.started", received::add);
            EventBus.Subscription global = eventBus.subscribeAll(received::add);

            typed.unsubscribe();
            global.unsubscribe();
            eventBus.publish(StarkillerEvent.of("day.started", 2, null, Map.of()));

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("a failing subscriber does not stop delivery to the others")
        void failingSubscriber() {
            List<StarkillerEvent> received = new ArrayList<>();
            eventBus.subscribe("day.started", e -> {
                throw new IllegalStateException("boom");
            });
            eventBus.subscribe("day.started", received::add);

            assertDoesNotThrow(() -> eventBus.publish(StarkillerEvent.of("day.started", 2, null, Map.of())));
            assertEquals(1, received.size());
        }
    }
}
