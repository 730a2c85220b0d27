package com.starkiller.core.consequence;

/**
 * Receives consequence tokens as they trigger.
 */
@FunctionalInterface
public interface ConsequenceHandler {

    void onConsequence(ConsequenceToken token, int day);
}
