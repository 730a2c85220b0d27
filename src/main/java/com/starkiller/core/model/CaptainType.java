package com.starkiller.core.model;

import java.util.List;

/**
 * A kind of captain. {@code factions} is ordered; the first compatible faction
 * is the one a generated captain flies under.
 */
public record CaptainType(
        String typeName,
        List<String> factions,
        List<String> ranks,
        List<String> firstNames,
        List<String> lastNames,
        double briberyChance,
        int minBribeAmount,
        int maxBribeAmount
) {

    public CaptainType {
        factions = factions == null ? List.of() : List.copyOf(factions);
        ranks = ranks == null ? List.of() : List.copyOf(ranks);
        firstNames = firstNames == null ? List.of() : List.copyOf(firstNames);
        lastNames = lastNames == null ? List.of() : List.copyOf(lastNames);
        if (maxBribeAmount < minBribeAmount) {
            maxBribeAmount = minBribeAmount;
        }
    }
}
