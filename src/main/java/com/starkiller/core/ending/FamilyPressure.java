package com.starkiller.core.ending;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.consequence.ConsequenceHandler;
import com.starkiller.core.consequence.ConsequenceToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Tracks expenses the officer's family incurs from consequences and turns them
 * into the family score used when choosing an ending.
 */
@Component
public class FamilyPressure implements FamilyStatusProvider, ConsequenceHandler {

    private static final Logger log = LoggerFactory.getLogger(FamilyPressure.class);

    private final StarkillerProperties.Ending settings;
    private int totalExpenses;

    public FamilyPressure(StarkillerProperties properties) {
        this.settings = properties.getEnding();
    }

    @Override
    public double familyScore() {
        double score = settings.getBaseFamilyScore() - (double) totalExpenses / settings.getFamilyExpenseScale();
        return Math.max(0.0, Math.min(1.0, score));
    }

    @Override
    public void onConsequence(ConsequenceToken token, int day) {
        if (!token.payload().affectsFamily()) {
            return;
        }
        int amount = expenseFor(token.sourceDecisionId());
        totalExpenses += amount;
        log.info("Family expense of {} credits from {} (total {})", amount, token.sourceDecisionId(), totalExpenses);
    }

    public int totalExpenses() {
        return totalExpenses;
    }

    public void reset() {
        totalExpenses = 0;
    }

    public void restore(int totalExpenses) {
        this.totalExpenses = totalExpenses;
    }

    static int expenseFor(String sourceDecisionId) {
        return switch (sourceDecisionId) {
            case "SMUGGLER_APPROVED" -> 75;
            case "REBEL_SYMPATHIZER_HELPED" -> 150;
            case "BRIBE_ACCEPTED" -> 100;
            default -> 50;
        };
    }
}
