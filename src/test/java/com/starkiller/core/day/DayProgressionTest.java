package com.starkiller.core.day;

import com.starkiller.core.content.ContentCatalog;
import com.starkiller.core.model.AccessCode;
import com.starkiller.core.model.AccessLevel;
import com.starkiller.core.model.DayRule;
import com.starkiller.core.model.DayRuleType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DayProgressionTest {

    private DayProgression days;

    @BeforeEach
    void setUp() {
        var catalog = new ContentCatalog(List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(new AccessCode("SK-1", AccessLevel.LOW, 1, 3, false, List.of()),
                        new AccessCode("SK-2", AccessLevel.MEDIUM, 2, -1, false, List.of()),
                        new AccessCode("SK-3", AccessLevel.HIGH, 1, -1, true, List.of())),
                List.of(new DayRule(1, DayRuleType.VERIFY_ORIGIN, "Verify origins"),
                        new DayRule(3, DayRuleType.CHECK_FOR_CONTRABAND, "Search holds")));
        days = new DayProgression(catalog);
    }

    @Test
    @DisplayName("starts on day one")
    void startsOnDayOne() {
        assertEquals(1, days.currentDay());
        assertEquals(1, days.activeRules().size());
    }

    @Test
    @DisplayName("rules accumulate from their activation day")
    void rulesAccumulate() {
        assertEquals(1, days.rulesFor(2).size());
        assertEquals(2, days.rulesFor(3).size());
        assertEquals(2, days.rulesFor(30).size());
        assertEquals(List.of(DayRuleType.CHECK_FOR_CONTRABAND),
                days.newRulesOn(3).stream().map(DayRule::type).toList());
        assertTrue(days.newRulesOn(4).isEmpty());
    }

    @Test
    @DisplayName("access codes follow their validity window and revocation")
    void accessCodeWindows() {
        assertEquals(List.of("SK-1"), days.accessCodesFor(1).stream().map(AccessCode::code).toList());
        assertEquals(List.of("SK-1", "SK-2"), days.accessCodesFor(3).stream().map(AccessCode::code).toList());
        assertEquals(List.of("SK-2"), days.accessCodesFor(4).stream().map(AccessCode::code).toList());
    }

    @Test
    @DisplayName("advance moves the current day and its rules")
    void advance() {
        assertEquals(2, days.advance());
        assertEquals(3, days.advance());
        assertEquals(2, days.activeRules().size());
        assertEquals(2, days.validAccessCodes().size());

        days.reset();
        assertEquals(1, days.currentDay());
    }

    @Test
    @DisplayName("restoring a day before the first is rejected")
    void restoreRejectsDayZero() {
        days.restoreDay(12);
        assertEquals(12, days.currentDay());

        assertThrows(IllegalArgumentException.class, () -> days.restoreDay(0));
    }
}
