package com.starkiller.core.model;

/**
 * Narrative weight of a decision. {@link #HIGH} and above open decision chains.
 */
public enum DecisionPressure {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean isAtLeast(DecisionPressure other) {
        return compareTo(other) >= 0;
    }

    /**
     * Pressure implied by the magnitude of a decision's narrative points.
     */
    public static DecisionPressure fromImpact(int imperialPoints, int insurgentPoints) {
        int total = Math.abs(imperialPoints) + Math.abs(insurgentPoints);
        if (total >= 20) {
            return CRITICAL;
        }
        if (total >= 10) {
            return HIGH;
        }
        if (total >= 5) {
            return MEDIUM;
        }
        return LOW;
    }
}
