package com.starkiller.dispatch.cli;

import com.starkiller.core.encounter.GameRandom;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.model.PlayerDecision;

/**
 * How a simulated officer decides each encounter.
 */
public enum DecisionStrategy {

    /** Always follows the ground-truth verdict. */
    PERFECT,
    /** Waves every ship through. */
    LENIENT,
    /** Turns every ship away. */
    STRICT,
    /** Coin flip. */
    RANDOM,
    /** Takes every bribe offered, otherwise follows the verdict. */
    CORRUPT;

    public PlayerDecision choose(Encounter encounter, GameRandom random) {
        return switch (this) {
            case PERFECT -> encounter.shouldApprove() ? PlayerDecision.APPROVE : PlayerDecision.DENY;
            case LENIENT -> PlayerDecision.APPROVE;
            case STRICT -> PlayerDecision.DENY;
            case RANDOM -> random.chance(0.5) ? PlayerDecision.APPROVE : PlayerDecision.DENY;
            case CORRUPT -> {
                if (encounter.offersBribe()) {
                    yield PlayerDecision.ACCEPT_BRIBE;
                }
                yield encounter.shouldApprove() ? PlayerDecision.APPROVE : PlayerDecision.DENY;
            }
        };
    }
}
