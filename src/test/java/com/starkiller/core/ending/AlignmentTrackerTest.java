package com.starkiller.core.ending;

import com.starkiller.core.TestFixtures;
import com.starkiller.core.consequence.ConsequencePayload;
import com.starkiller.core.consequence.ConsequenceToken;
import com.starkiller.core.consequence.ConsequenceTokenLedger;
import com.starkiller.core.day.DayProgression;
import com.starkiller.core.events.EventBus;
import com.starkiller.core.model.EndingPath;
import com.starkiller.core.model.EndingType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link AlignmentTracker}.
 */
class AlignmentTrackerTest {

    private ConsequenceTokenLedger ledger;
    private double familyScore;
    private AlignmentTracker tracker;

    @BeforeEach
    void setUp() {
        ledger = new ConsequenceTokenLedger(new DayProgression(TestFixtures.emptyCatalog()), new EventBus(), null);
        familyScore = 0.5;
        tracker = new AlignmentTracker(ledger, () -> familyScore, TestFixtures.properties());
    }

    // -- Meters ---------------------------------------------------------------

    @Nested
    @DisplayName("meters")
    class MeterTests {

        @Test
        @DisplayName("alignment is clamped to plus or minus one hundred")
        void alignmentClamped() {
            tracker.updateAlignment(150, -150);

            assertEquals(100, tracker.imperialLoyalty());
            assertEquals(-100, tracker.rebellionSympathy());
        }

        @Test
        @DisplayName("heavy corruption draws suspicion")
        void corruptionDrawsSuspicion() {
            tracker.updateCorruption(50);
            assertEquals(0, tracker.suspicion());

            tracker.updateCorruption(5);
            assertEquals(55, tracker.corruption());
            assertEquals(1, tracker.suspicion());

            tracker.updateCorruption(-200);
            assertEquals(0, tracker.corruption());
        }

        @Test
        @DisplayName("a quiet day lowers suspicion by one")
        void quietDayLowersSuspicion() {
            tracker.updateSuspicion(3);

            tracker.onDayStarted(4, 0);
            assertEquals(2, tracker.suspicion());

            tracker.onDayStarted(5, 2);
            assertEquals(2, tracker.suspicion());
        }

        @Test
        @DisplayName("delivered consequences move loyalty and suspicion")
        void consequencesApply() {
            tracker.onConsequence(new ConsequenceToken("CT-0001", "SMUGGLER_APPROVED", 1, 3,
                    new ConsequencePayload(null, "Surge", -2, 4, true), true, 3), 3);

            assertEquals(-2, tracker.imperialLoyalty());
            assertEquals(4, tracker.suspicion());
        }
    }

    // -- Story beats and paths ------------------------------------------------

    @Nested
    @DisplayName("story beats")
    class StoryBeatTests {

        @Test
        @DisplayName("a beat applies its effect only once")
        void beatIsIdempotent() {
            assertTrue(tracker.recordStoryBeat("THE_DEFECTOR"));
            assertFalse(tracker.recordStoryBeat("THE_DEFECTOR"));

            assertEquals(-2, tracker.imperialLoyalty());
            assertEquals(5, tracker.rebellionSympathy());
            assertEquals(Set.of("THE_DEFECTOR"), tracker.completedStoryBeats());
        }

        @Test
        @DisplayName("the spy extraction locks the rebel path and schedules its consequence")
        void spyExtractionLocksRebelPath() {
            tracker.recordStoryBeat("THE_SPY_EXTRACTION");

            assertEquals(EndingPath.REBEL, tracker.lockedPath());
            assertTrue(ledger.hasActiveToken("ENDING_PATH_REBEL"));
            assertEquals(3, ledger.activeTokens().get(0).triggerDay());
        }

        @Test
        @DisplayName("only the first path lock takes effect")
        void firstLockWins() {
            tracker.recordStoryBeat("THE_SPY_EXTRACTION");
            tracker.recordStoryBeat("THE_FAMILY_BETRAYAL");

            assertEquals(EndingPath.REBEL, tracker.lockedPath());
            assertFalse(tracker.lockEndingPath(EndingPath.IMPERIAL));
            assertEquals(1, ledger.allTokens().size());
            assertEquals(3, tracker.imperialLoyalty());
            assertEquals(3, tracker.rebellionSympathy());
        }

        @Test
        @DisplayName("locking no path is ignored")
        void noneIsIgnored() {
            assertFalse(tracker.lockEndingPath(EndingPath.NONE));
            assertEquals(EndingPath.NONE, tracker.lockedPath());
        }

        @Test
        @DisplayName("unknown beats complete without effect")
        void unknownBeat() {
            assertTrue(tracker.recordStoryBeat("SIDE_QUEST"));
            assertEquals(0, tracker.imperialLoyalty());
        }
    }

    // -- Endings --------------------------------------------------------------

    @Nested
    @DisplayName("determineEnding")
    class EndingTests {

        @Test
        @DisplayName("a locked rebel path depends on the family")
        void lockedRebel() {
            tracker.lockEndingPath(EndingPath.REBEL);

            familyScore = 0.8;
            assertEquals(EndingType.FREEDOM_FIGHTER, tracker.determineEnding());
            familyScore = 0.5;
            assertEquals(EndingType.MARTYR, tracker.determineEnding());
        }

        @Test
        @DisplayName("a locked imperial path depends on corruption")
        void lockedImperial() {
            tracker.lockEndingPath(EndingPath.IMPERIAL);
            assertEquals(EndingType.IMPERIAL_HERO, tracker.determineEnding());

            tracker.updateCorruption(30);
            assertEquals(EndingType.BRIDGE_COMMANDER, tracker.determineEnding());
        }

        @Test
        @DisplayName("rebel leaning without a lock")
        void rebelLeaning() {
            tracker.updateAlignment(-100, 100);

            familyScore = 0.9;
            assertEquals(EndingType.FREEDOM_FIGHTER, tracker.determineEnding());
            familyScore = 0.5;
            assertEquals(EndingType.UNDERGROUND, tracker.determineEnding());
            familyScore = 0.3;
            assertEquals(EndingType.REFUGEE, tracker.determineEnding());
        }

        @Test
        @DisplayName("imperial leaning without a lock")
        void imperialLeaning() {
            tracker.updateAlignment(100, -100);

            familyScore = 0.7;
            assertEquals(EndingType.GOOD_SOLDIER, tracker.determineEnding());
            familyScore = 0.5;
            assertEquals(EndingType.TRUE_BELIEVER, tracker.determineEnding());

            tracker.updateCorruption(40);
            assertEquals(EndingType.BRIDGE_COMMANDER, tracker.determineEnding());
        }

        @Test
        @DisplayName("a balanced officer is a gray man unless suspected")
        void balanced() {
            assertEquals(EndingType.GRAY_MAN, tracker.determineEnding());

            tracker.updateSuspicion(60);
            assertEquals(EndingType.COMPROMISED, tracker.determineEnding());
        }

        @Test
        @DisplayName("heavy corruption overrides alignment")
        void corruptionOverrides() {
            tracker.updateAlignment(100, -100);
            tracker.restore(100, -100, 80, 0, EndingPath.NONE, Set.of());

            assertEquals(EndingType.COMPROMISED, tracker.determineEnding());
            assertEquals(EndingPath.CORRUPT, tracker.suggestedEndingPath());
        }

        @Test
        @DisplayName("eligibility checks the meters for special endings")
        void eligibility() {
            tracker.restore(80, 0, 10, 10, EndingPath.NONE, Set.of());

            assertTrue(tracker.isEligibleForEnding(EndingType.IMPERIAL_HERO));
            assertFalse(tracker.isEligibleForEnding(EndingType.BRIDGE_COMMANDER));
            assertFalse(tracker.isEligibleForEnding(EndingType.COMPROMISED));
            assertTrue(tracker.isEligibleForEnding(EndingType.GRAY_MAN));
        }

        @Test
        @DisplayName("suggested path follows alignment")
        void suggestedPath() {
            assertEquals(EndingPath.NEUTRAL, tracker.suggestedEndingPath());

            tracker.updateAlignment(-100, 100);
            assertEquals(EndingPath.REBEL, tracker.suggestedEndingPath());
        }
    }

    @Test
    @DisplayName("reset clears meters, path and beats")
    void resetClearsEverything() {
        tracker.recordStoryBeat("THE_SPY_EXTRACTION");
        tracker.updateCorruption(20);

        tracker.reset();

        assertEquals(0, tracker.imperialLoyalty());
        assertEquals(0, tracker.corruption());
        assertEquals(EndingPath.NONE, tracker.lockedPath());
        assertTrue(tracker.completedStoryBeats().isEmpty());
    }
}
