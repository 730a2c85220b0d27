package com.starkiller.core.encounter;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.content.ContentCatalog;
import com.starkiller.core.day.DayRuleProvider;
import com.starkiller.core.metrics.StarkillerMetrics;
import com.starkiller.core.model.AccessCode;
import com.starkiller.core.model.CaptainType;
import com.starkiller.core.model.CargoManifest;
import com.starkiller.core.model.DayRule;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.model.InvalidReason;
import com.starkiller.core.model.ShipScenario;
import com.starkiller.core.model.ShipType;
import com.starkiller.core.policy.FactionPolicy;
import com.starkiller.core.policy.ManifestPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Generates checkpoint encounters and decides whether each one should be approved.
 * <p>
 * A ship type is drawn first (story scenarios restrict the choice), then the
 * first compatible captain in catalog order is matched against the ship's
 * category. The verdict is the manifest policy's result combined with the
 * category's access-code prefix check; the reported reason is the first failing
 * check in priority order.
 */
@Service
public class EncounterClassifier {

    private static final Logger log = LoggerFactory.getLogger(EncounterClassifier.class);

    private static final List<String> SYSTEM_NAMES = List.of(
            "Control System", "Military One", "Defense Grid", "Command Center",
            "Security Hub", "Operations Base", "Tactical Unit", "Strategic Point",
            "Guardian Station", "Sentinel Post", "Watch Tower", "Alert System");

    private static final List<String> INVALID_ORIGINS = List.of(
            "Unregistered System", "Outer Rim", "Unknown Space", "Restricted Sector");

    private static final List<String> RED_HERRING_CODES = List.of(
            "M1L-1001", "8NT-8001", "TRO-6001", "V1P-9001", "ClV-3001", "ENG-0999", "5PL-7777", "1MP-2001");

    private static final List<String> INVALID_CODE_PREFIXES = List.of("XX-", "OLD-", "REJ-", "ERR-");

    private static final List<String> ROUTINE_STORIES = List.of(
            "Routine supply run to the base.",
            "Scheduled crew rotation, requesting docking clearance.",
            "Delivering parts for the hangar refit.",
            "Returning from patrol, requesting resupply.");

    private final ContentCatalog catalog;
    private final ManifestPolicy manifestPolicy;
    private final ManifestSelector manifestSelector;
    private final DayRuleProvider dayRuleProvider;
    private final GameRandom random;
    private final StarkillerProperties.Generation settings;
    private final StarkillerMetrics metrics;

    private final ShipType fallbackShipType;
    private final CaptainType fallbackCaptain;
    private final Deque<String> recentShipTypes = new ArrayDeque<>();
    private int encounterSequence = 0;

    public EncounterClassifier(ContentCatalog catalog,
                               ManifestPolicy manifestPolicy,
                               ManifestSelector manifestSelector,
                               DayRuleProvider dayRuleProvider,
                               GameRandom random,
                               StarkillerProperties properties,
                               @Autowired(required = false) StarkillerMetrics metrics) {
        this.catalog = catalog;
        this.manifestPolicy = manifestPolicy;
        this.manifestSelector = manifestSelector;
        this.dayRuleProvider = dayRuleProvider;
        this.random = random;
        this.settings = properties.getGeneration();
        this.metrics = metrics;
        this.fallbackShipType = resolveFallbackShipType();
        this.fallbackCaptain = resolveFallbackCaptain();
    }

    /**
     * Generates the next encounter for {@code day}. Loyalty and sympathy gate which
     * story scenarios may appear.
     */
    public Encounter generate(int day, int imperialLoyalty, int rebellionSympathy) {
        String encounterId = String.format("ENC-%02d-%04d", day, ++encounterSequence);

        ShipScenario scenario = pickScenario(day, imperialLoyalty, rebellionSympathy).orElse(null);
        ShipType shipType = pickShipType(scenario);

        ShipType resolvedShip = shipType;
        CaptainMatch captain = shipType == null ? null : firstCompatibleCaptain(shipType.category()).orElse(null);
        boolean degraded = false;
        if (captain == null) {
            log.warn("No compatible captain for ship type {} on {}; falling back to {} with {}",
                    shipType == null ? "<none>" : shipType.typeName(), encounterId,
                    fallbackShipType.typeName(), fallbackCaptain.typeName());
            resolvedShip = fallbackShipType;
            captain = new CaptainMatch(fallbackCaptain, fallbackCaptain.factions().isEmpty()
                    ? fallbackShipType.category().primaryFaction()
                    : fallbackCaptain.factions().get(0));
            degraded = true;
            if (metrics != null) {
                metrics.recordDegradedMatch();
            }
        }
        rememberShipType(resolvedShip.typeName());

        FactionPolicy category = resolvedShip.category();
        String faction = category.primaryFaction();
        List<DayRule> rules = dayRuleProvider.rulesFor(day);

        boolean intendedValid = random.chance(settings.getValidShipChance());
        boolean mismatchManifest = !intendedValid && random.chance(0.4);

        String accessCode;
        AccessCode accessCodeData = null;
        Optional<AccessCode> issued = intendedValid || mismatchManifest
                ? pickIssuedCode(category, faction, day)
                : Optional.empty();
        if (issued.isPresent()) {
            accessCode = issued.get().code();
            accessCodeData = issued.get();
        } else {
            accessCode = forgeCode();
        }

        CargoManifest manifest = null;
        if (mismatchManifest) {
            manifest = manifestSelector.selectMismatched(faction, day).orElse(null);
        }
        if (manifest == null) {
            manifest = manifestSelector.select(resolvedShip, faction, day);
        }

        Optional<InvalidReason> manifestFailure =
                manifestPolicy.firstFailure(manifest, faction, accessCodeData == null ? null : accessCodeData.level(),
                        day, rules);
        boolean codeValid = category.isAccessCodeValid(accessCode);
        boolean shouldApprove = manifestFailure.isEmpty() && codeValid;
        InvalidReason invalidReason = manifestFailure.orElse(codeValid ? null : InvalidReason.INVALID_ACCESS_CODE);

        CaptainType captainType = captain.type();
        boolean offersBribe = (scenario != null && scenario.offersBribe())
                || (!shouldApprove && random.chance(captainType.briberyChance()));
        int bribeAmount = offersBribe ? random.between(captainType.minBribeAmount(), captainType.maxBribeAmount()) : 0;

        Encounter encounter = new Encounter(
                encounterId,
                day,
                resolvedShip.typeName(),
                shipName(resolvedShip),
                category,
                faction,
                random.between(resolvedShip.minCrewSize(), resolvedShip.maxCrewSize()),
                origin(resolvedShip, intendedValid),
                captainName(captainType),
                captainType.ranks().isEmpty() ? "Captain" : random.pick(captainType.ranks()),
                captain.faction(),
                accessCode,
                accessCodeData,
                manifest,
                scenario != null && scenario.storyText() != null ? scenario.storyText() : random.pick(ROUTINE_STORIES),
                scenario != null,
                scenario == null ? null : scenario.storyTag(),
                scenario == null ? null : scenario.scenarioId(),
                offersBribe,
                bribeAmount,
                scenario == null ? 0 : scenario.creditPenalty(),
                scenario == null ? 0 : scenario.casualtiesIfWrong(),
                shouldApprove,
                invalidReason,
                degraded);

        log.info("Generated {}: {} ({}) captain {} [{}], code {}, manifest {} -> {}{}",
                encounterId, encounter.shipType(), faction, encounter.captainName(), encounter.captainFaction(),
                accessCode, manifest.manifestId(), shouldApprove ? "APPROVE" : "DENY",
                invalidReason == null ? "" : " (" + invalidReason.displayText() + ")");
        if (metrics != null) {
            metrics.recordEncounterGenerated(shouldApprove, encounter.storyShip());
            if (invalidReason != null) {
                metrics.recordInvalidReason(invalidReason.name());
            }
        }
        return encounter;
    }

    /**
     * Clears ship-type history and numbering for a new game.
     */
    public void reset() {
        recentShipTypes.clear();
        encounterSequence = 0;
        manifestSelector.reset();
    }

    /**
     * Continues numbering, ship-type history and manifest usage from a saved game.
     */
    public void restore(int sequence, List<String> recentTypes,
                        int manifestDay, Map<String, Integer> manifestUsage, int runtimeManifestSequence) {
        recentShipTypes.clear();
        recentShipTypes.addAll(recentTypes);
        encounterSequence = sequence;
        manifestSelector.restore(manifestDay, manifestUsage, runtimeManifestSequence);
    }

    public ManifestSelector manifestSelector() {
        return manifestSelector;
    }

    public int encounterSequence() {
        return encounterSequence;
    }

    /** Most recent ship types, oldest first. */
    public List<String> recentShipTypes() {
        return List.copyOf(recentShipTypes);
    }

    /**
     * First captain type, and first of its factions, that the category accepts.
     * Catalog order decides; later candidates are never considered once one matches.
     */
    Optional<CaptainMatch> firstCompatibleCaptain(FactionPolicy category) {
        for (CaptainType captain : catalog.captainTypes()) {
            for (String faction : captain.factions()) {
                if (category.isCaptainCompatible(faction)) {
                    return Optional.of(new CaptainMatch(captain, faction));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<ShipScenario> pickScenario(int day, int imperialLoyalty, int rebellionSympathy) {
        if (!random.chance(settings.getStoryShipChance())) {
            return Optional.empty();
        }
        List<ShipScenario> available = catalog.scenarios().stream()
                .filter(s -> s.isAvailable(day, imperialLoyalty, rebellionSympathy))
                .toList();
        if (available.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(random.pick(available));
    }

    private ShipType pickShipType(ShipScenario scenario) {
        List<ShipType> candidates = catalog.shipTypes();
        if (scenario != null && !scenario.shipTypes().isEmpty()) {
            candidates = scenario.shipTypes().stream()
                    .map(catalog::shipType)
                    .flatMap(Optional::stream)
                    .toList();
        }
        if (candidates.isEmpty()) {
            return null;
        }
        List<ShipType> fresh = candidates.stream()
                .filter(t -> !recentShipTypes.contains(t.typeName()))
                .toList();
        if (fresh.size() > settings.getMinShipTypeOptions()) {
            candidates = fresh;
        }
        return random.pick(candidates);
    }

    private void rememberShipType(String typeName) {
        recentShipTypes.addLast(typeName);
        while (recentShipTypes.size() > settings.getRecentShipTypeMemory()) {
            recentShipTypes.removeFirst();
        }
    }

    private Optional<AccessCode> pickIssuedCode(FactionPolicy category, String faction, int day) {
        List<AccessCode> dayCodes = dayRuleProvider.accessCodesFor(day);
        List<AccessCode> usable = dayCodes.stream()
                .filter(c -> category.isAccessCodeValid(c.code()) && c.isAuthorizedFor(faction))
                .toList();
        if (usable.isEmpty()) {
            usable = dayCodes.stream().filter(c -> category.isAccessCodeValid(c.code())).toList();
        }
        if (usable.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(random.pick(usable));
    }

    private String forgeCode() {
        if (random.chance(0.5)) {
            return random.pick(RED_HERRING_CODES);
        }
        return random.pick(INVALID_CODE_PREFIXES) + random.between(1000, 9999);
    }

    private String shipName(ShipType shipType) {
        String suffix = random.pick(SYSTEM_NAMES);
        if (!shipType.specificShipNames().isEmpty() && random.chance(0.3)) {
            suffix = random.pick(shipType.specificShipNames());
        }
        return shipType.typeName() + " - " + suffix;
    }

    private String origin(ShipType shipType, boolean intendedValid) {
        List<String> origins = shipType.commonOrigins();
        if (!intendedValid && (origins.isEmpty() || random.chance(0.4))) {
            return random.pick(INVALID_ORIGINS);
        }
        return origins.isEmpty() ? "Central Fleet" : random.pick(origins);
    }

    private String captainName(CaptainType captainType) {
        String first = captainType.firstNames().isEmpty() ? "" : random.pick(captainType.firstNames());
        String last = captainType.lastNames().isEmpty() ? "" : random.pick(captainType.lastNames());
        String name = (first + " " + last).trim();
        return name.isEmpty() ? captainType.typeName() : name;
    }

    private ShipType resolveFallbackShipType() {
        Optional<ShipType> configured = catalog.shipType(settings.getFallbackShipType());
        if (configured.isPresent()) {
            return configured.get();
        }
        FactionPolicy category = catalog.category(settings.getFallbackCategory())
                .orElseGet(() -> new FactionPolicy(settings.getFallbackCategory(),
                        List.of(settings.getFallbackCategory().toLowerCase(Locale.ROOT)),
                        List.of(), List.of(), 0, false, false, false, false));
        return new ShipType(settings.getFallbackShipType(), category, 5, 20, settings.getFallbackOrigins(), List.of());
    }

    private CaptainType resolveFallbackCaptain() {
        return catalog.captainType(settings.getFallbackCaptainType())
                .orElseGet(() -> new CaptainType(settings.getFallbackCaptainType(),
                        List.of(settings.getFallbackCaptainFaction()), List.of("Captain"),
                        List.of("Backup"), List.of("Officer"), 0.0, 0, 0));
    }

    record CaptainMatch(CaptainType type, String faction) {}
}
