package com.starkiller.core.model;

/**
 * Permission tier carried by an access code. Each tier maps to the highest
 * manifest clearance it may carry; {@code UNRESTRICTED} carries any.
 */
public enum AccessLevel {
    LOW(ClearanceLevel.STANDARD),
    MEDIUM(ClearanceLevel.RESTRICTED),
    HIGH(ClearanceLevel.CLASSIFIED),
    UNRESTRICTED(ClearanceLevel.CLASSIFIED);

    private final ClearanceLevel maxClearance;

    AccessLevel(ClearanceLevel maxClearance) {
        this.maxClearance = maxClearance;
    }

    public ClearanceLevel maxClearance() {
        return maxClearance;
    }

    public boolean permits(ClearanceLevel required) {
        return this == UNRESTRICTED || required.compareTo(maxClearance) <= 0;
    }

    /**
     * Clearance check for a ship that may have no recognised access code at all.
     * Without a code only {@link ClearanceLevel#STANDARD} cargo is permitted.
     */
    public static boolean permits(AccessLevel level, ClearanceLevel required) {
        if (level == null) {
            return required == ClearanceLevel.STANDARD;
        }
        return level.permits(required);
    }
}
