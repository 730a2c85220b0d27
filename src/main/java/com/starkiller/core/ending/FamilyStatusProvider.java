package com.starkiller.core.ending;

/**
 * Wellbeing of the officer's family, from 0 (in crisis) to 1 (secure).
 */
public interface FamilyStatusProvider {

    double familyScore();
}
