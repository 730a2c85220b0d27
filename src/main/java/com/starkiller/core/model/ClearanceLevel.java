package com.starkiller.core.model;

/**
 * Clearance a cargo manifest requires. Declaration order is the ordering:
 * STANDARD &lt; RESTRICTED &lt; CLASSIFIED.
 */
public enum ClearanceLevel {
    STANDARD,
    RESTRICTED,
    CLASSIFIED
}
