package com.starkiller.core.model;

import java.util.List;

/**
 * An issued checkpoint credential.
 *
 * @param code               the code string shown by the ship, e.g. "SK-4471"
 * @param level              permission tier
 * @param validFromDay       first day the code is accepted
 * @param validUntilDay      last day the code is accepted, or -1 for no expiry
 * @param revoked            whether command has revoked the code
 * @param authorizedFactions factions the code was issued to; empty means any
 */
public record AccessCode(
        String code,
        AccessLevel level,
        int validFromDay,
        int validUntilDay,
        boolean revoked,
        List<String> authorizedFactions
) {

    public AccessCode {
        authorizedFactions = authorizedFactions == null ? List.of() : List.copyOf(authorizedFactions);
    }

    public boolean isValidOnDay(int day) {
        if (revoked || day < validFromDay) {
            return false;
        }
        return validUntilDay < 0 || day <= validUntilDay;
    }

    public boolean isAuthorizedFor(String faction) {
        if (authorizedFactions.isEmpty()) {
            return true;
        }
        return faction != null && authorizedFactions.stream().anyMatch(f -> f.equalsIgnoreCase(faction));
    }
}
