package com.starkiller.core.day;

import com.starkiller.core.content.ContentCatalog;
import com.starkiller.core.model.AccessCode;
import com.starkiller.core.model.DayRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Owns the session's day counter. Rules accumulate: a rule stays in force from
 * its activation day onwards.
 */
@Component
public class DayProgression implements DayRuleProvider {

    private static final Logger log = LoggerFactory.getLogger(DayProgression.class);

    private final ContentCatalog catalog;
    private int currentDay = 1;

    public DayProgression(ContentCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public int currentDay() {
        return currentDay;
    }

    @Override
    public List<DayRule> rulesFor(int day) {
        return catalog.dayRules().stream().filter(rule -> rule.isActiveOn(day)).toList();
    }

    @Override
    public List<AccessCode> accessCodesFor(int day) {
        return catalog.accessCodes().stream().filter(code -> code.isValidOnDay(day)).toList();
    }

    /** Rules that come into force exactly on {@code day}, for the day's briefing. */
    public List<DayRule> newRulesOn(int day) {
        return catalog.dayRules().stream().filter(rule -> rule.activateOnDay() == day).toList();
    }

    public int advance() {
        currentDay++;
        log.info("Day {} begins: {} rules in force, {} access codes valid",
                currentDay, activeRules().size(), validAccessCodes().size());
        return currentDay;
    }

    public void reset() {
        currentDay = 1;
    }

    public void restoreDay(int day) {
        if (day < 1) {
            throw new IllegalArgumentException("Day must be at least 1, was " + day);
        }
        currentDay = day;
    }
}
