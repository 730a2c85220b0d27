package com.starkiller.core.encounter;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.content.ContentCatalog;
import com.starkiller.core.model.CargoManifest;
import com.starkiller.core.model.ClearanceLevel;
import com.starkiller.core.model.ContrabandType;
import com.starkiller.core.model.FactionRestriction;
import com.starkiller.core.model.ManifestPriority;
import com.starkiller.core.model.ShipType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Chooses the cargo manifest a generated ship carries.
 * <p>
 * Faction-specific manifests valid for the ship's faction, category and day are
 * preferred; universal manifests are used when there are none. Manifests that
 * reached their daily appearance limit are skipped, the rest are drawn weighted
 * by priority. When nothing is eligible a manifest is generated on the spot.
 */
@Component
public class ManifestSelector {

    private static final Logger log = LoggerFactory.getLogger(ManifestSelector.class);

    private static final List<String> COMMON_CARGO = List.of(
            "Medical supplies", "Food rations", "Equipment parts", "Personnel transport",
            "Construction materials", "Communication equipment", "Power cells", "Standard supplies");

    private static final List<String> CONTRABAND_CARGO = List.of(
            "Unauthorized weapons", "Restricted technology", "Classified documents",
            "Illegal substances", "Smuggled goods", "Unregistered personnel");

    private final ContentCatalog catalog;
    private final GameRandom random;
    private final StarkillerProperties properties;

    private final Map<String, Integer> dailyUsage = new HashMap<>();
    private int usageDay = -1;
    private int runtimeSequence = 0;

    public ManifestSelector(ContentCatalog catalog, GameRandom random, StarkillerProperties properties) {
        this.catalog = catalog;
        this.random = random;
        this.properties = properties;
    }

    public CargoManifest select(ShipType shipType, String faction, int day) {
        rollUsageDay(day);
        String category = shipType.category().categoryName();

        List<CargoManifest> pool = catalog.manifests().stream()
                .filter(m -> m.factionRestriction() != FactionRestriction.UNIVERSAL)
                .filter(m -> m.isValidForFaction(faction) && m.isValidForCategory(category) && m.isValidForDay(day))
                .toList();
        if (pool.isEmpty()) {
            pool = catalog.manifests().stream()
                    .filter(m -> m.factionRestriction() == FactionRestriction.UNIVERSAL)
                    .filter(m -> m.isValidForCategory(category) && m.isValidForDay(day))
                    .toList();
        }

        List<CargoManifest> available = pool.stream().filter(this::underDailyLimit).toList();
        if (available.isEmpty()) {
            log.debug("No catalog manifest available for {} ({}) on day {}; generating one", faction, category, day);
            return createRuntimeManifest(shipType, faction);
        }

        CargoManifest selected = weightedPick(available);
        dailyUsage.merge(selected.manifestId(), 1, Integer::sum);
        return selected;
    }

    /**
     * A catalog manifest the ship should not be carrying: issued to another faction
     * or out of circulation on {@code day}. Empty when the catalog has none.
     */
    public Optional<CargoManifest> selectMismatched(String faction, int day) {
        List<CargoManifest> mismatched = catalog.manifests().stream()
                .filter(m -> !m.isValidForFaction(faction) || !m.isValidForDay(day))
                .toList();
        if (mismatched.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(random.pick(mismatched));
    }

    public void reset() {
        dailyUsage.clear();
        usageDay = -1;
        runtimeSequence = 0;
    }

    /**
     * Puts back the daily appearance counts and runtime numbering of a saved game.
     */
    public void restore(int day, Map<String, Integer> usage, int sequence) {
        reset();
        usageDay = day;
        dailyUsage.putAll(usage);
        runtimeSequence = sequence;
    }

    public int usageDay() {
        return usageDay;
    }

    public Map<String, Integer> dailyUsage() {
        return Map.copyOf(dailyUsage);
    }

    public int runtimeSequence() {
        return runtimeSequence;
    }

    private void rollUsageDay(int day) {
        if (day != usageDay) {
            dailyUsage.clear();
            usageDay = day;
        }
    }

    private boolean underDailyLimit(CargoManifest manifest) {
        if (manifest.maxDailyAppearances() <= 0) {
            return true;
        }
        return dailyUsage.getOrDefault(manifest.manifestId(), 0) < manifest.maxDailyAppearances();
    }

    private CargoManifest weightedPick(List<CargoManifest> manifests) {
        int total = manifests.stream().mapToInt(m -> m.priority().weight()).sum();
        int roll = random.nextInt(total);
        for (CargoManifest manifest : manifests) {
            roll -= manifest.priority().weight();
            if (roll < 0) {
                return manifest;
            }
        }
        return manifests.get(manifests.size() - 1);
    }

    CargoManifest createRuntimeManifest(ShipType shipType, String faction) {
        boolean contraband = random.chance(properties.getGeneration().getFallbackContrabandChance());

        List<String> contrabandItems = new ArrayList<>();
        if (contraband) {
            int count = random.between(1, 2);
            for (int i = 0; i < count; i++) {
                contrabandItems.add(random.pick(CONTRABAND_CARGO));
            }
        }

        Set<String> declared = new LinkedHashSet<>();
        int itemCount = random.between(2, 4);
        for (int i = 0; i < itemCount; i++) {
            declared.add(random.pick(COMMON_CARGO));
        }

        String description = String.join(", ", declared) + purposeSuffix(faction);
        String id = String.format("RUNTIME-%s-%04d", faction.toUpperCase(Locale.ROOT), ++runtimeSequence);

        return new CargoManifest(
                id,
                description,
                List.copyOf(declared),
                contrabandItems,
                contraband ? ContrabandType.WEAPONS : ContrabandType.NONE,
                FactionRestriction.FACTION_SPECIFIC,
                List.of(faction),
                List.of(shipType.category().categoryName()),
                ClearanceLevel.STANDARD,
                1,
                -1,
                contraband,
                false,
                !contraband,
                List.of(),
                ManifestPriority.NORMAL,
                0);
    }

    private static String purposeSuffix(String faction) {
        return switch (faction.toLowerCase(Locale.ROOT)) {
            case "imperium", "imperial" -> " for Imperial operations";
            case "insurgent", "rebel" -> " for resistance activities";
            default -> " for authorized operations";
        };
    }
}
