package com.starkiller.core.model;

public enum FactionRestriction {
    /** Any faction may carry the manifest. */
    UNIVERSAL,
    /** Only the listed factions may carry the manifest. */
    FACTION_SPECIFIC,
    /** Listed factions only, and the cargo is of interest to security. */
    RESTRICTED
}
