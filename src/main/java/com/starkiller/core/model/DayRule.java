package com.starkiller.core.model;

/**
 * A standing order issued in a day's briefing. Once active it stays active.
 *
 * @param activateOnDay first day the rule applies
 * @param type          what the rule instructs the officer to check
 * @param description   briefing wording; its words are scanned against manifests
 */
public record DayRule(int activateOnDay, DayRuleType type, String description) {

    public DayRule {
        description = description == null ? "" : description;
    }

    public boolean isActiveOn(int day) {
        return activateOnDay <= day;
    }
}
