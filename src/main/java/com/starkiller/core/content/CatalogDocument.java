package com.starkiller.core.content;

import com.starkiller.core.model.AccessLevel;
import com.starkiller.core.model.ClearanceLevel;
import com.starkiller.core.model.ContrabandType;
import com.starkiller.core.model.DayRuleType;
import com.starkiller.core.model.FactionRestriction;
import com.starkiller.core.model.ManifestPriority;

import java.util.List;

/**
 * JSON shape of the content catalog. Ship types and scenarios refer to other
 * entries by name; {@link ContentCatalogLoader} resolves those references.
 */
record CatalogDocument(
        List<Category> categories,
        List<Ship> shipTypes,
        List<Captain> captainTypes,
        List<Scenario> scenarios,
        List<Manifest> manifests,
        List<Code> accessCodes,
        List<Rule> dayRules
) {

    record Category(
            String name,
            List<String> associatedFactions,
            List<String> compatibleCaptainFactions,
            List<String> accessCodePrefixes,
            int suspicionBaseLevel,
            boolean requiresSpecialClearance,
            boolean priorityAccess,
            boolean canCarryContraband,
            boolean exemptFromRandomSearches
    ) {}

    record Ship(
            String name,
            String category,
            int minCrew,
            int maxCrew,
            List<String> origins,
            List<String> shipNames
    ) {}

    record Captain(
            String name,
            List<String> factions,
            List<String> ranks,
            List<String> firstNames,
            List<String> lastNames,
            double briberyChance,
            int minBribe,
            int maxBribe
    ) {}

    record Scenario(
            String id,
            String storyTag,
            List<String> shipTypes,
            Integer firstDay,
            Integer minImperialLoyalty,
            Integer minRebellionSympathy,
            String story,
            boolean offersBribe,
            int creditPenalty,
            int casualtiesIfWrong
    ) {}

    record Manifest(
            String id,
            String description,
            List<String> declaredItems,
            List<String> contrabandItems,
            ContrabandType contrabandType,
            FactionRestriction restriction,
            List<String> allowedFactions,
            List<String> shipCategories,
            ClearanceLevel clearance,
            Integer firstDay,
            Integer lastDay,
            boolean hasContraband,
            boolean hasFalseEntries,
            boolean easilyDetectable,
            List<String> suspiciousKeywords,
            ManifestPriority priority,
            int maxDailyAppearances
    ) {}

    record Code(
            String code,
            AccessLevel level,
            Integer validFrom,
            Integer validUntil,
            boolean revoked,
            List<String> factions
    ) {}

    record Rule(int day, DayRuleType type, String description) {}
}
