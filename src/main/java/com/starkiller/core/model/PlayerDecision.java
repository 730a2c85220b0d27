package com.starkiller.core.model;

/**
 * What the officer did with a ship.
 */
public enum PlayerDecision {
    APPROVE,
    DENY,
    ACCEPT_BRIBE;

    public boolean approves() {
        return this != DENY;
    }
}
