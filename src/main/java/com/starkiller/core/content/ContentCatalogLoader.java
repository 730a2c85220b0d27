package com.starkiller.core.content;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.starkiller.core.model.AccessCode;
import com.starkiller.core.model.CaptainType;
import com.starkiller.core.model.CargoManifest;
import com.starkiller.core.model.DayRule;
import com.starkiller.core.model.ShipScenario;
import com.starkiller.core.model.ShipType;
import com.starkiller.core.policy.FactionPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the content catalog from JSON and turns it into immutable domain values.
 * Locations use Spring resource syntax ({@code classpath:...}, {@code file:...}).
 */
@Component
public class ContentCatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(ContentCatalogLoader.class);

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    @Autowired
    public ContentCatalogLoader(ResourceLoader resourceLoader) {
        this.objectMapper = new ObjectMapper();
        this.resourceLoader = resourceLoader;
    }

    public ContentCatalogLoader() {
        this(new DefaultResourceLoader());
    }

    public ContentCatalog load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new ContentCatalogException("Content catalog not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            ContentCatalog catalog = read(in, location);
            log.info("Loaded content catalog from {}: {} categories, {} ship types, {} captain types, "
                            + "{} scenarios, {} manifests, {} access codes, {} day rules",
                    location, catalog.categories().size(), catalog.shipTypes().size(),
                    catalog.captainTypes().size(), catalog.scenarios().size(), catalog.manifests().size(),
                    catalog.accessCodes().size(), catalog.dayRules().size());
            return catalog;
        } catch (IOException e) {
            throw new ContentCatalogException("Failed to read content catalog " + location + ": " + e.getMessage(), e);
        }
    }

    ContentCatalog read(InputStream in, String source) throws IOException {
        CatalogDocument document = objectMapper.readValue(in, CatalogDocument.class);
        return resolve(document, source);
    }

    private ContentCatalog resolve(CatalogDocument document, String source) {
        Map<String, FactionPolicy> categories = new LinkedHashMap<>();
        for (CatalogDocument.Category c : nonNull(document.categories())) {
            requireName(c.name(), "category", source);
            categories.put(key(c.name()), new FactionPolicy(
                    c.name(), c.associatedFactions(), c.compatibleCaptainFactions(), c.accessCodePrefixes(),
                    c.suspicionBaseLevel(), c.requiresSpecialClearance(), c.priorityAccess(),
                    c.canCarryContraband(), c.exemptFromRandomSearches()));
        }

        Map<String, ShipType> shipTypes = new LinkedHashMap<>();
        for (CatalogDocument.Ship s : nonNull(document.shipTypes())) {
            requireName(s.name(), "ship type", source);
            FactionPolicy category = categories.get(key(s.category()));
            if (category == null) {
                throw new ContentCatalogException(String.format(
                        "Ship type '%s' in %s refers to unknown category '%s'", s.name(), source, s.category()));
            }
            shipTypes.put(key(s.name()),
                    new ShipType(s.name(), category, s.minCrew(), s.maxCrew(), s.origins(), s.shipNames()));
        }

        List<CaptainType> captainTypes = new ArrayList<>();
        for (CatalogDocument.Captain c : nonNull(document.captainTypes())) {
            requireName(c.name(), "captain type", source);
            captainTypes.add(new CaptainType(c.name(), c.factions(), c.ranks(), c.firstNames(), c.lastNames(),
                    c.briberyChance(), c.minBribe(), c.maxBribe()));
        }

        List<ShipScenario> scenarios = new ArrayList<>();
        for (CatalogDocument.Scenario s : nonNull(document.scenarios())) {
            requireName(s.id(), "scenario", source);
            for (String shipType : nonNull(s.shipTypes())) {
                if (!shipTypes.containsKey(key(shipType))) {
                    throw new ContentCatalogException(String.format(
                            "Scenario '%s' in %s refers to unknown ship type '%s'", s.id(), source, shipType));
                }
            }
            scenarios.add(new ShipScenario(s.id(), s.storyTag(), s.shipTypes(),
                    orDefault(s.firstDay(), 1),
                    orDefault(s.minImperialLoyalty(), Integer.MIN_VALUE),
                    orDefault(s.minRebellionSympathy(), Integer.MIN_VALUE),
                    s.story(), s.offersBribe(), s.creditPenalty(), s.casualtiesIfWrong()));
        }

        List<CargoManifest> manifests = new ArrayList<>();
        for (CatalogDocument.Manifest m : nonNull(document.manifests())) {
            requireName(m.id(), "manifest", source);
            manifests.add(new CargoManifest(m.id(), m.description(), m.declaredItems(), m.contrabandItems(),
                    m.contrabandType(), m.restriction(), m.allowedFactions(), m.shipCategories(), m.clearance(),
                    orDefault(m.firstDay(), 1), orDefault(m.lastDay(), -1),
                    m.hasContraband(), m.hasFalseEntries(), m.easilyDetectable(),
                    m.suspiciousKeywords(), m.priority(), m.maxDailyAppearances()));
        }

        List<AccessCode> accessCodes = new ArrayList<>();
        for (CatalogDocument.Code c : nonNull(document.accessCodes())) {
            requireName(c.code(), "access code", source);
            if (c.level() == null) {
                throw new ContentCatalogException(String.format(
                        "Access code '%s' in %s has no level", c.code(), source));
            }
            accessCodes.add(new AccessCode(c.code(), c.level(), orDefault(c.validFrom(), 1),
                    orDefault(c.validUntil(), -1), c.revoked(), c.factions()));
        }

        List<DayRule> dayRules = new ArrayList<>();
        for (CatalogDocument.Rule r : nonNull(document.dayRules())) {
            if (r.type() == null) {
                throw new ContentCatalogException("Day rule without a type in " + source + ": " + r.description());
            }
            dayRules.add(new DayRule(r.day(), r.type(), r.description()));
        }

        return new ContentCatalog(List.copyOf(categories.values()), List.copyOf(shipTypes.values()),
                captainTypes, scenarios, manifests, accessCodes, dayRules);
    }

    private static void requireName(String name, String kind, String source) {
        if (name == null || name.isBlank()) {
            throw new ContentCatalogException("Unnamed " + kind + " in " + source);
        }
    }

    private static String key(String name) {
        return name == null ? "" : name.toLowerCase(Locale.ROOT);
    }

    private static int orDefault(Integer value, int fallback) {
        return value == null ? fallback : value;
    }

    private static <T> List<T> nonNull(List<T> list) {
        return list == null ? List.of() : list;
    }
}
