package com.starkiller.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a shift is played, used by the CLI and by collaborators
 * that react to narrative changes.
 *
 * @param eventType event type (e.g. "branch.changed", "story_tag.unlocked", "consequence.triggered")
 * @param day       day the event happened on
 * @param subjectId id of what the event is about (decision, tag, token); nullable
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record StarkillerEvent(
    String eventType,
    int day,
    String subjectId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static StarkillerEvent of(String eventType, int day, String subjectId, Map<String, Object> payload) {
        return new StarkillerEvent(eventType, day, subjectId, payload, Instant.now());
    }
}
