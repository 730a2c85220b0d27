package com.starkiller.core.policy;

import com.starkiller.core.model.AccessLevel;
import com.starkiller.core.model.CargoManifest;
import com.starkiller.core.model.DayRule;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.model.InvalidReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a cargo manifest may pass the checkpoint.
 * <p>
 * A manifest passes only if every check passes, evaluated in order:
 * <ol>
 *   <li>faction authorization</li>
 *   <li>day validity</li>
 *   <li>clearance sufficiency</li>
 *   <li>day-rule compliance</li>
 * </ol>
 * A missing manifest never passes. Failures are outcomes, not errors.
 */
@Component
public class ManifestPolicy {

    private static final Logger log = LoggerFactory.getLogger(ManifestPolicy.class);

    public boolean validate(CargoManifest manifest, Encounter encounter, int currentDay, List<DayRule> dayRules) {
        return firstFailure(manifest, encounter.faction(), encounter.accessLevel(), currentDay, dayRules).isEmpty();
    }

    public boolean validate(CargoManifest manifest, String faction, AccessLevel accessLevel,
                            int currentDay, List<DayRule> dayRules) {
        return firstFailure(manifest, faction, accessLevel, currentDay, dayRules).isEmpty();
    }

    /**
     * Returns the first failing check, or empty when the manifest passes.
     *
     * @param accessLevel level of the ship's access code, null when it has none
     */
    public Optional<InvalidReason> firstFailure(CargoManifest manifest, String faction, AccessLevel accessLevel,
                                                int currentDay, List<DayRule> dayRules) {
        if (manifest == null) {
            return Optional.of(InvalidReason.MISSING_MANIFEST);
        }
        if (!isFactionAuthorized(manifest, faction)) {
            log.debug("Manifest {} not authorized for faction {}", manifest.manifestId(), faction);
            return Optional.of(InvalidReason.FACTION_NOT_AUTHORIZED);
        }
        if (!isValidForDay(manifest, currentDay)) {
            log.debug("Manifest {} not valid on day {}", manifest.manifestId(), currentDay);
            return Optional.of(InvalidReason.OUTSIDE_VALID_DAYS);
        }
        if (!hasSufficientClearance(manifest, accessLevel)) {
            log.debug("Manifest {} requires {} but access level is {}",
                    manifest.manifestId(), manifest.requiredClearance(), accessLevel);
            return Optional.of(InvalidReason.INSUFFICIENT_CLEARANCE);
        }
        if (!compliesWithDayRules(manifest, currentDay, dayRules)) {
            return Optional.of(InvalidReason.DAY_RULE_VIOLATION);
        }
        return Optional.empty();
    }

    public boolean isFactionAuthorized(CargoManifest manifest, String faction) {
        return manifest.isValidForFaction(faction);
    }

    public boolean isValidForDay(CargoManifest manifest, int currentDay) {
        return manifest.isValidForDay(currentDay);
    }

    public boolean hasSufficientClearance(CargoManifest manifest, AccessLevel accessLevel) {
        return AccessLevel.permits(accessLevel, manifest.requiredClearance());
    }

    /**
     * Every rule active on {@code currentDay} must pass. Besides the flag checks,
     * the words of all active rule descriptions are compared with the manifest's
     * suspicious keywords.
     */
    public boolean compliesWithDayRules(CargoManifest manifest, int currentDay, List<DayRule> dayRules) {
        if (dayRules == null || dayRules.isEmpty()) {
            return true;
        }
        List<DayRule> active = dayRules.stream().filter(rule -> rule.isActiveOn(currentDay)).toList();
        for (DayRule rule : active) {
            if (!passesRule(manifest, rule)) {
                log.debug("Manifest {} fails {} rule: {}", manifest.manifestId(), rule.type(), rule.description());
                return false;
            }
        }
        if (manifest.containsSuspiciousContent(ruleKeywords(active))) {
            log.debug("Manifest {} matches keywords of active rules", manifest.manifestId());
            return false;
        }
        return true;
    }

    private boolean passesRule(CargoManifest manifest, DayRule rule) {
        return switch (rule.type()) {
            case CHECK_FOR_CONTRABAND -> !manifest.hasContraband();
            case VERIFY_MANIFEST -> !manifest.hasFalseEntries();
            case FORCE_INSPECTION -> !(manifest.hasContraband() && manifest.easilyDetectable());
            case VERIFY_ORIGIN, CHECK_FOR_INTELLIGENCE, ACCESS_CODE_CHANGE -> true;
        };
    }

    /**
     * Lower-cased, space-separated words of the rule descriptions.
     */
    static Set<String> ruleKeywords(List<DayRule> rules) {
        Set<String> words = new LinkedHashSet<>();
        for (DayRule rule : rules) {
            for (String word : rule.description().toLowerCase(Locale.ROOT).split(" ")) {
                if (!word.isEmpty()) {
                    words.add(word);
                }
            }
        }
        return words;
    }
}
