package com.starkiller.core;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.content.ContentCatalog;
import com.starkiller.core.content.ContentCatalogLoader;
import com.starkiller.core.model.AccessCode;
import com.starkiller.core.model.AccessLevel;
import com.starkiller.core.model.CaptainType;
import com.starkiller.core.model.CargoManifest;
import com.starkiller.core.model.ClearanceLevel;
import com.starkiller.core.model.ContrabandType;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.model.FactionRestriction;
import com.starkiller.core.model.ManifestPriority;
import com.starkiller.core.model.ShipType;
import com.starkiller.core.policy.FactionPolicy;

import java.util.List;

/**
 * Shared builders for domain values used across test classes.
 */
public final class TestFixtures {

    private TestFixtures() {
    }

    public static FactionPolicy imperium() {
        return new FactionPolicy("Imperium", List.of("imperium"), List.of("imperium"),
                List.of("SK-", "IM-"), 1, false, true, false, true);
    }

    public static FactionPolicy civilian() {
        return new FactionPolicy("Civilian", List.of("civilian"), List.of("civilian"),
                List.of("CV-"), 4, false, false, true, false);
    }

    public static CargoManifest manifest(String id, String faction, ClearanceLevel clearance) {
        return new CargoManifest(id, "Standard cargo", List.of("parts"), List.of(), ContrabandType.NONE,
                FactionRestriction.FACTION_SPECIFIC, List.of(faction), List.of(), clearance,
                1, -1, false, false, false, List.of(), ManifestPriority.NORMAL, 0);
    }

    public static CargoManifest contraband(String id, String faction, ContrabandType type, List<String> keywords) {
        return new CargoManifest(id, "Mixed cargo", List.of("crates"), List.of("hidden goods"), type,
                FactionRestriction.FACTION_SPECIFIC, List.of(faction), List.of(), ClearanceLevel.STANDARD,
                1, -1, true, true, true, keywords, ManifestPriority.NORMAL, 0);
    }

    public static AccessCode code(String code, AccessLevel level) {
        return new AccessCode(code, level, 1, -1, false, List.of());
    }

    public static ShipType ship(String name, FactionPolicy category) {
        return new ShipType(name, category, 2, 8, List.of("Home Port"), List.of());
    }

    public static CaptainType captain(String name, String... factions) {
        return new CaptainType(name, List.of(factions), List.of("Captain"), List.of("Test"), List.of("Pilot"),
                0.0, 0, 0);
    }

    /**
     * An ordinary ship that should be approved.
     */
    public static Encounter routine(String encounterId) {
        return encounter(encounterId, false, null, null, false, 0, 0, 0,
                manifest("M-" + encounterId, "imperium", ClearanceLevel.STANDARD), true);
    }

    public static Encounter story(String encounterId, String storyTag, String scenarioId,
                                  int creditPenalty, int casualties, boolean shouldApprove) {
        return encounter(encounterId, true, storyTag, scenarioId, false, 0, creditPenalty, casualties,
                manifest("M-" + encounterId, "imperium", ClearanceLevel.STANDARD), shouldApprove);
    }

    public static Encounter encounter(String encounterId, boolean storyShip, String storyTag, String scenarioId,
                                      boolean offersBribe, int bribeAmount, int creditPenalty, int casualties,
                                      CargoManifest manifest, boolean shouldApprove) {
        return new Encounter(encounterId, 1, "Imperial Shuttle", "Imperial Shuttle - Lambda Seven", imperium(),
                "imperium", 4, "Imperial Center", "Test Pilot", "Captain", "imperium", "SK-1001",
                code("SK-1001", AccessLevel.LOW), manifest,
                storyShip ? "The captain tells a story." : "Routine supply run to the base.",
                storyShip, storyTag, scenarioId, offersBribe, bribeAmount, creditPenalty, casualties,
                shouldApprove, null, false);
    }

    public static StarkillerProperties properties() {
        return new StarkillerProperties();
    }

    public static ContentCatalog emptyCatalog() {
        return new ContentCatalog(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of());
    }

    public static ContentCatalog bundledCatalog() {
        return new ContentCatalogLoader().load("classpath:content/catalog.json");
    }
}
