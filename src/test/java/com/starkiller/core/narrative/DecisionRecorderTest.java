package com.starkiller.core.narrative;

import com.starkiller.core.TestFixtures;
import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.day.DayProgression;
import com.starkiller.core.events.EventBus;
import com.starkiller.core.events.ReentrancyViolationException;
import com.starkiller.core.model.ClearanceLevel;
import com.starkiller.core.model.DecisionCategory;
import com.starkiller.core.model.DecisionPressure;
import com.starkiller.core.model.DecisionRecord;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.model.NarrativeBranch;
import com.starkiller.core.model.PlayerDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.starkiller.core.TestFixtures.encounter;
import static com.starkiller.core.TestFixtures.manifest;
import static com.starkiller.core.TestFixtures.routine;
import static com.starkiller.core.TestFixtures.story;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link DecisionRecorder}.
 */
class DecisionRecorderTest {

    private NarrativeState state;
    private EventBus eventBus;
    private DecisionRecorder recorder;

    @BeforeEach
    void setUp() {
        state = new NarrativeState();
        eventBus = new EventBus();
        StarkillerProperties properties = TestFixtures.properties();
        NarrativeClassifier classifier = new NarrativeClassifier(state, eventBus,
                new DayProgression(TestFixtures.emptyCatalog()), properties, null);
        recorder = new DecisionRecorder(state, classifier, properties);
    }

    // -- Recording ------------------------------------------------------------

    @Nested
    @DisplayName("record")
    class RecordTests {

        @Test
        @DisplayName("totals and branch are current when record returns")
        void synchronousUpdate() {
            recorder.record("d1", 30, 0, "Held the line", DecisionCategory.TACTICAL, DecisionPressure.LOW);

            assertEquals(30, state.imperialLoyalty());
            assertEquals(0, state.insurgentSympathy());
            assertEquals(NarrativeBranch.SILENT_DEFIANCE, state.currentBranch());
            assertEquals(1, state.history().size());

            recorder.record("d2", 25, 0, "Held the line again", DecisionCategory.TACTICAL, DecisionPressure.LOW);

            assertEquals(55, state.imperialLoyalty());
            assertEquals(NarrativeBranch.IMPERIUM_PATH, state.currentBranch());
        }

        @Test
        @DisplayName("history keeps insertion order")
        void historyInOrder() {
            recorder.record("a", 1, 0, "first");
            recorder.record("b", 0, 1, "second");
            recorder.record("c", 1, 1, "third");

            assertEquals(List.of("a", "b", "c"), state.history().stream().map(DecisionRecord::id).toList());
        }

        @Test
        @DisplayName("category and pressure are inferred when not given")
        void infersCategoryAndPressure() {
            DecisionRecord bribe = recorder.record("bribe_taken", 0, 3, "Took 200 credits");
            DecisionRecord big = recorder.record("rebel_support", -10, 12, "Let them through");

            assertEquals(DecisionCategory.FINANCIAL, bribe.category());
            assertEquals(DecisionPressure.LOW, bribe.pressure());
            assertEquals(DecisionCategory.POLITICAL, big.category());
            assertEquals(DecisionPressure.CRITICAL, big.pressure());
        }

        @Test
        @DisplayName("category inference checks money before morals before politics")
        void determineCategoryOrder() {
            assertEquals(DecisionCategory.FINANCIAL, DecisionRecorder.determineCategory("moral_bribe", ""));
            assertEquals(DecisionCategory.MORAL, DecisionRecorder.determineCategory("x", "my family"));
            assertEquals(DecisionCategory.POLITICAL, DecisionRecorder.determineCategory("imperium_choice", ""));
            assertEquals(DecisionCategory.TACTICAL, DecisionRecorder.determineCategory("patrol", "routine"));
            assertEquals(DecisionCategory.TACTICAL, DecisionRecorder.determineCategory(null, null));
        }
    }

    // -- Decision chains ------------------------------------------------------

    @Nested
    @DisplayName("decision chains")
    class ChainTests {

        @Test
        @DisplayName("a high-pressure decision opens a chain that later decisions extend")
        void chainOfFive() {
            DecisionRecord opener = recorder.record("opener", 2, 0, "Crisis", DecisionCategory.POLITICAL,
                    DecisionPressure.HIGH);
            assertNull(opener.chainParentId());
            assertEquals("opener", state.currentChainId());

            for (int i = 2; i <= 5; i++) {
                DecisionRecord next = recorder.record("d" + i, 0, 0, "follow up", DecisionCategory.TACTICAL,
                        DecisionPressure.MEDIUM);
                assertEquals("opener", next.chainParentId());
            }

            assertNull(state.currentChainId());
            assertEquals(0, state.chainLength());
        }

        @Test
        @DisplayName("a decision after a complete chain starts a new chain")
        void sixthStartsNewChain() {
            recorder.record("opener", 2, 0, "Crisis", DecisionCategory.POLITICAL, DecisionPressure.HIGH);
            for (int i = 2; i <= 5; i++) {
                recorder.record("d" + i, 0, 0, "follow up", DecisionCategory.TACTICAL, DecisionPressure.MEDIUM);
            }

            DecisionRecord sixth = recorder.record("d6", 0, 0, "New crisis", DecisionCategory.POLITICAL,
                    DecisionPressure.HIGH);

            assertNull(sixth.chainParentId());
            assertEquals("d6", state.currentChainId());
            assertEquals(1, state.chainLength());
        }

        @Test
        @DisplayName("low-pressure decisions outside a chain have no parent")
        void noChainNoParent() {
            DecisionRecord record = recorder.record("d1", 1, 0, "routine", DecisionCategory.TACTICAL,
                    DecisionPressure.LOW);

            assertNull(record.chainParentId());
            assertNull(state.currentChainId());
        }

        @Test
        @DisplayName("moving onto a committed path closes the open chain")
        void committedPathClosesChain() {
            recorder.record("opener", 5, 0, "Crisis", DecisionCategory.POLITICAL, DecisionPressure.HIGH);
            recorder.record("push", 50, 0, "Purge", DecisionCategory.POLITICAL, DecisionPressure.MEDIUM);

            assertEquals(NarrativeBranch.IMPERIUM_PATH, state.currentBranch());
            assertNull(state.currentChainId());
        }
    }

    // -- Re-entrancy ----------------------------------------------------------

    @Test
    @DisplayName("recording from a branch listener is rejected")
    void nestedRecordingRejected() {
        List<ReentrancyViolationException> rejected = new ArrayList<>();
        eventBus.subscribe(NarrativeClassifier.BRANCH_CHANGED, event -> {
            try {
                recorder.record("nested", 1, 0, "from listener");
            } catch (ReentrancyViolationException e) {
                rejected.add(e);
            }
        });

        recorder.record("outer", 0, 0, "routine");

        assertEquals(1, rejected.size());
        assertEquals(1, state.history().size());
        assertEquals("outer", state.history().get(0).id());

        recorder.record("after", 0, 0, "routine");
        assertEquals(2, state.history().size());
    }

    // -- Ship decisions -------------------------------------------------------

    @Nested
    @DisplayName("recordShipDecision")
    class ShipDecisionTests {

        @Test
        @DisplayName("routine ships carry no narrative points")
        void routineShipNoPoints() {
            DecisionRecord record = recorder.recordShipDecision(routine("ENC-01-0001"), PlayerDecision.APPROVE);

            assertEquals("ship_imperial_shuttle_approved_ENC-01-0001", record.id());
            assertEquals(0, record.imperialPoints());
            assertEquals(0, record.insurgentPoints());
            assertEquals(DecisionCategory.TACTICAL, record.category());
            assertEquals(DecisionPressure.MEDIUM, record.pressure());
            assertTrue(record.context().startsWith("Approved Imperial Shuttle - Lambda Seven: "));
        }

        @Test
        @DisplayName("insurgent story ships move the totals by the decision")
        void insurgentStoryPoints() {
            Encounter defector = story("ENC-02-0003", "insurgent", "THE_DEFECTOR", 25, 0, false);

            DecisionRecord approved = recorder.recordShipDecision(defector, PlayerDecision.APPROVE);
            assertEquals(-5, approved.imperialPoints());
            assertEquals(10, approved.insurgentPoints());
            assertEquals(DecisionCategory.POLITICAL, approved.category());
            assertEquals(DecisionPressure.HIGH, approved.pressure());

            DecisionRecord denied = recorder.recordShipDecision(defector, PlayerDecision.DENY);
            assertEquals("ship_imperial_shuttle_denied_ENC-02-0003", denied.id());
            assertEquals(10, denied.imperialPoints());
            assertEquals(-5, denied.insurgentPoints());
        }

        @Test
        @DisplayName("imperium story ships move the totals by the decision")
        void imperiumStoryPoints() {
            Encounter inspector = story("ENC-03-0001", "imperium", "THE_WEAPONS_INSPECTOR", 40, 0, true);

            DecisionRecord approved = recorder.recordShipDecision(inspector, PlayerDecision.APPROVE);
            DecisionRecord denied = recorder.recordShipDecision(inspector, PlayerDecision.DENY);

            assertEquals(10, approved.imperialPoints());
            assertEquals(-5, approved.insurgentPoints());
            assertEquals(-5, denied.imperialPoints());
            assertEquals(5, denied.insurgentPoints());
        }

        @Test
        @DisplayName("casualties make a decision critical")
        void casualtiesAreCritical() {
            Encounter transport = story("ENC-01-0002", "insurgent", "THE_CHILD_TRANSPORT", 10, 40, true);

            assertEquals(DecisionPressure.CRITICAL,
                    recorder.recordShipDecision(transport, PlayerDecision.DENY).pressure());
        }

        @Test
        @DisplayName("a taken bribe is a financial decision and names the amount")
        void bribeIsFinancial() {
            Encounter briber = encounter("ENC-04-0007", false, null, null, true, 150, 0, 0,
                    manifest("M-1", "imperium", ClearanceLevel.STANDARD), false);

            DecisionRecord record = recorder.recordShipDecision(briber, PlayerDecision.ACCEPT_BRIBE);

            assertEquals(DecisionCategory.FINANCIAL, record.category());
            assertTrue(record.id().contains("_approved_"));
            assertTrue(record.context().endsWith(" Accepted 150 credits."));
        }
    }
}
