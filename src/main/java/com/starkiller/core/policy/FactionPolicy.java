package com.starkiller.core.policy;

import java.util.List;
import java.util.Locale;

/**
 * Compatibility rules of one ship category: which factions it flies for, which
 * captains may command it and which access-code prefixes it holds.
 *
 * @param categoryName              category name, e.g. "Imperium"
 * @param associatedFactions        factions the category flies for
 * @param compatibleCaptainFactions captain factions accepted; empty falls back to the associated factions
 * @param validAccessCodePrefixes   access-code prefixes issued to the category
 * @param suspicionBaseLevel        baseline suspicion of ships in the category
 * @param requiresSpecialClearance  whether the category needs special clearance
 * @param priorityAccess            whether the category is waved through ahead of others
 * @param canCarryContraband        whether contraband may be generated for the category
 * @param exemptFromRandomSearches  whether random searches skip the category
 */
public record FactionPolicy(
        String categoryName,
        List<String> associatedFactions,
        List<String> compatibleCaptainFactions,
        List<String> validAccessCodePrefixes,
        int suspicionBaseLevel,
        boolean requiresSpecialClearance,
        boolean priorityAccess,
        boolean canCarryContraband,
        boolean exemptFromRandomSearches
) {

    public FactionPolicy {
        associatedFactions = associatedFactions == null ? List.of() : List.copyOf(associatedFactions);
        compatibleCaptainFactions = compatibleCaptainFactions == null ? List.of() : List.copyOf(compatibleCaptainFactions);
        validAccessCodePrefixes = validAccessCodePrefixes == null ? List.of() : List.copyOf(validAccessCodePrefixes);
    }

    public boolean isFactionAssociated(String faction) {
        if (faction == null || associatedFactions.isEmpty()) {
            return false;
        }
        return associatedFactions.stream().anyMatch(f -> f.equalsIgnoreCase(faction));
    }

    /**
     * Categories configured without captain factions accept any captain of an
     * associated faction.
     */
    public boolean isCaptainCompatible(String captainFaction) {
        if (compatibleCaptainFactions.isEmpty()) {
            return isFactionAssociated(captainFaction);
        }
        return captainFaction != null
                && compatibleCaptainFactions.stream().anyMatch(f -> f.equalsIgnoreCase(captainFaction));
    }

    public boolean isAccessCodeValid(String code) {
        if (code == null || code.isEmpty() || validAccessCodePrefixes.isEmpty()) {
            return false;
        }
        String upper = code.toUpperCase(Locale.ROOT);
        return validAccessCodePrefixes.stream()
                .anyMatch(prefix -> upper.startsWith(prefix.toUpperCase(Locale.ROOT)));
    }

    public String primaryFaction() {
        if (!associatedFactions.isEmpty()) {
            return associatedFactions.get(0);
        }
        return categoryName == null ? "" : categoryName.toLowerCase(Locale.ROOT);
    }
}
