package com.starkiller.core.day;

import com.starkiller.core.model.AccessCode;
import com.starkiller.core.model.DayRule;

import java.util.List;

/**
 * Source of the current day and of what each day's briefing says.
 */
public interface DayRuleProvider {

    int currentDay();

    /** Rules in force on {@code day}. */
    List<DayRule> rulesFor(int day);

    /** Access codes command accepts on {@code day}. */
    List<AccessCode> accessCodesFor(int day);

    default List<DayRule> activeRules() {
        return rulesFor(currentDay());
    }

    default List<AccessCode> validAccessCodes() {
        return accessCodesFor(currentDay());
    }
}
