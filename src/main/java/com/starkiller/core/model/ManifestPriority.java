package com.starkiller.core.model;

/**
 * Selection weight of a manifest when several are eligible for a ship.
 */
public enum ManifestPriority {
    LOW(1),
    NORMAL(2),
    HIGH(3),
    CRITICAL(4);

    private final int weight;

    ManifestPriority(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }
}
