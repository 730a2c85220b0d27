package com.starkiller.core.model;

import java.util.Collection;
import java.util.List;

/**
 * Declared cargo of a ship, with the facts security would find on inspection.
 *
 * @param manifestId             catalog identifier
 * @param description            free-text cargo description shown to the player
 * @param declaredItems          what the captain says is aboard
 * @param contrabandItems        what is actually hidden aboard, if anything
 * @param contrabandType         kind of hidden cargo
 * @param factionRestriction     who may carry this manifest
 * @param allowedFactions        factions accepted when the restriction is not universal
 * @param requiredShipCategories ship categories the manifest fits; empty means any
 * @param requiredClearance      minimum clearance the carrying ship must hold
 * @param firstAppearanceDay     first day the manifest is in circulation
 * @param lastAppearanceDay      last day it is in circulation, or -1 for no end
 * @param hasContraband          whether contraband is aboard
 * @param hasFalseEntries        whether the declared items are falsified
 * @param easilyDetectable       whether a forced inspection would find the contraband
 * @param suspiciousKeywords     terms compared against the wording of active day rules
 * @param priority               selection weight
 * @param maxDailyAppearances    how many ships per day may carry it, or 0 for no limit
 */
public record CargoManifest(
        String manifestId,
        String description,
        List<String> declaredItems,
        List<String> contrabandItems,
        ContrabandType contrabandType,
        FactionRestriction factionRestriction,
        List<String> allowedFactions,
        List<String> requiredShipCategories,
        ClearanceLevel requiredClearance,
        int firstAppearanceDay,
        int lastAppearanceDay,
        boolean hasContraband,
        boolean hasFalseEntries,
        boolean easilyDetectable,
        List<String> suspiciousKeywords,
        ManifestPriority priority,
        int maxDailyAppearances
) {

    public CargoManifest {
        declaredItems = declaredItems == null ? List.of() : List.copyOf(declaredItems);
        contrabandItems = contrabandItems == null ? List.of() : List.copyOf(contrabandItems);
        contrabandType = contrabandType == null ? ContrabandType.NONE : contrabandType;
        factionRestriction = factionRestriction == null ? FactionRestriction.UNIVERSAL : factionRestriction;
        allowedFactions = allowedFactions == null ? List.of() : List.copyOf(allowedFactions);
        requiredShipCategories = requiredShipCategories == null ? List.of() : List.copyOf(requiredShipCategories);
        requiredClearance = requiredClearance == null ? ClearanceLevel.STANDARD : requiredClearance;
        suspiciousKeywords = suspiciousKeywords == null ? List.of() : List.copyOf(suspiciousKeywords);
        priority = priority == null ? ManifestPriority.NORMAL : priority;
    }

    /**
     * Universal manifests accept any faction; otherwise the faction must be listed.
     */
    public boolean isValidForFaction(String faction) {
        if (factionRestriction == FactionRestriction.UNIVERSAL) {
            return true;
        }
        if (faction == null || allowedFactions.isEmpty()) {
            return false;
        }
        return allowedFactions.stream().anyMatch(f -> f.equalsIgnoreCase(faction));
    }

    public boolean isValidForDay(int day) {
        if (day < firstAppearanceDay) {
            return false;
        }
        return lastAppearanceDay <= 0 || day <= lastAppearanceDay;
    }

    public boolean isValidForCategory(String categoryName) {
        if (requiredShipCategories.isEmpty()) {
            return true;
        }
        return categoryName != null && requiredShipCategories.stream().anyMatch(c -> c.equalsIgnoreCase(categoryName));
    }

    /**
     * True when any of this manifest's suspicious keywords equals one of the given
     * words, ignoring case.
     */
    public boolean containsSuspiciousContent(Collection<String> words) {
        if (words == null || words.isEmpty()) {
            return false;
        }
        for (String keyword : suspiciousKeywords) {
            for (String word : words) {
                if (keyword.equalsIgnoreCase(word)) {
                    return true;
                }
            }
        }
        return false;
    }
}
