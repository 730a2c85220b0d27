package com.starkiller.core.consequence;

import java.io.Serializable;

/**
 * A delayed effect of a past decision.
 *
 * @param id               ledger-unique identifier
 * @param sourceDecisionId decision that caused the consequence
 * @param dayCreated       day the token was added
 * @param triggerDay       first day the token may trigger
 * @param payload          effect to deliver
 * @param triggered        whether the token has been delivered
 * @param triggeredOnDay   day it was delivered, or -1
 */
public record ConsequenceToken(
        String id,
        String sourceDecisionId,
        int dayCreated,
        int triggerDay,
        ConsequencePayload payload,
        boolean triggered,
        int triggeredOnDay
) implements Serializable {

    public boolean isDue(int day) {
        return !triggered && triggerDay <= day;
    }

    ConsequenceToken markTriggered(int day) {
        return new ConsequenceToken(id, sourceDecisionId, dayCreated, triggerDay, payload, true, day);
    }
}
