package com.starkiller.core.consequence;

import java.io.Serializable;

/**
 * Effect delivered when a consequence token triggers. The ledger delivers it as
 * given; resolving {@code scenarioToTrigger} is up to the handlers.
 *
 * @param scenarioToTrigger scenario reference, nullable
 * @param newsHeadline      headline for the news feed, nullable
 * @param loyaltyImpact     change to imperial loyalty
 * @param suspicionIncrease change to suspicion
 * @param affectsFamily     whether the officer's family is affected
 */
public record ConsequencePayload(
        String scenarioToTrigger,
        String newsHeadline,
        int loyaltyImpact,
        int suspicionIncrease,
        boolean affectsFamily
) implements Serializable {

    /** Whether a delivery of this payload is severe enough to call for emphasis in the news. */
    public boolean isSevere() {
        return loyaltyImpact < -2 || suspicionIncrease > 3;
    }
}
