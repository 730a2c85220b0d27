package com.starkiller.core.model;

/**
 * Why an encounter should be denied. Declaration order is the priority in which
 * failing checks are reported.
 */
public enum InvalidReason {
    MISSING_MANIFEST("No cargo manifest presented"),
    FACTION_NOT_AUTHORIZED("Manifest not authorized for ship faction"),
    OUTSIDE_VALID_DAYS("Manifest not valid on this day"),
    INSUFFICIENT_CLEARANCE("Access code clearance insufficient for cargo"),
    DAY_RULE_VIOLATION("Manifest violates today's security rules"),
    INVALID_ACCESS_CODE("Invalid access code");

    private final String displayText;

    InvalidReason(String displayText) {
        this.displayText = displayText;
    }

    public String displayText() {
        return displayText;
    }
}
