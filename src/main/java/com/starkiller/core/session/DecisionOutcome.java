package com.starkiller.core.session;

import com.starkiller.core.consequence.ConsequenceToken;
import com.starkiller.core.model.DecisionRecord;
import com.starkiller.core.model.PlayerDecision;

import java.util.List;

/**
 * Result of deciding one encounter.
 *
 * @param encounterId encounter decided
 * @param decision    what the officer did
 * @param correct     whether it matched the ground-truth verdict
 * @param record      decision as recorded in the narrative history
 * @param scheduled   consequences scheduled by the decision
 * @param strikes     strikes after the decision
 * @param gameOver    whether the decision ended the game
 */
public record DecisionOutcome(
        String encounterId,
        PlayerDecision decision,
        boolean correct,
        DecisionRecord record,
        List<ConsequenceToken> scheduled,
        int strikes,
        boolean gameOver
) {}
