package com.starkiller.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * One recorded player decision. Never mutated once appended to the history.
 *
 * @param id              decision identifier
 * @param timestamp       when the decision was recorded
 * @param imperialPoints  loyalty weight of the decision
 * @param insurgentPoints sympathy weight of the decision
 * @param category        decision category
 * @param pressure        narrative pressure
 * @param context         free-text description, scanned by branch classification
 * @param chainParentId   id of the chain this decision extends, or null
 */
public record DecisionRecord(
        String id,
        Instant timestamp,
        int imperialPoints,
        int insurgentPoints,
        DecisionCategory category,
        DecisionPressure pressure,
        String context,
        String chainParentId
) implements Serializable {

    public DecisionRecord {
        context = context == null ? "" : context;
    }
}
