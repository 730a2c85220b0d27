package com.starkiller.core.session;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.consequence.ConsequencePayload;
import com.starkiller.core.consequence.ConsequenceToken;
import com.starkiller.core.consequence.ConsequenceTokenLedger;
import com.starkiller.core.consequence.NewsFeed;
import com.starkiller.core.day.DayProgression;
import com.starkiller.core.encounter.EncounterClassifier;
import com.starkiller.core.encounter.GameRandom;
import com.starkiller.core.encounter.ManifestSelector;
import com.starkiller.core.ending.AlignmentTracker;
import com.starkiller.core.ending.FamilyPressure;
import com.starkiller.core.events.EventBus;
import com.starkiller.core.events.StarkillerEvent;
import com.starkiller.core.logging.MdcContext;
import com.starkiller.core.metrics.StarkillerMetrics;
import com.starkiller.core.model.CargoManifest;
import com.starkiller.core.model.ContrabandType;
import com.starkiller.core.model.DecisionRecord;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.model.EndingType;
import com.starkiller.core.model.PlayerDecision;
import com.starkiller.core.narrative.DecisionRecorder;
import com.starkiller.core.narrative.NarrativeClassifier;
import com.starkiller.core.narrative.NarrativeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One game: generates encounters, takes the officer's decisions and moves the days on.
 * <p>
 * Each call is one discrete step and leaves every collaborator consistent when it
 * returns. Starting a day delivers all consequences due that day before returning.
 */
@Service
public class GameSession {

    private static final Logger log = LoggerFactory.getLogger(GameSession.class);

    public static final String GAME_OVER = "session.game_over";
    public static final String DAY_STARTED = "day.started";

    private final EncounterClassifier encounterClassifier;
    private final DecisionRecorder decisionRecorder;
    private final NarrativeClassifier narrativeClassifier;
    private final NarrativeState narrativeState;
    private final ConsequenceTokenLedger ledger;
    private final AlignmentTracker alignment;
    private final FamilyPressure familyPressure;
    private final NewsFeed newsFeed;
    private final DayProgression days;
    private final GameRandom random;
    private final EventBus eventBus;
    private final StarkillerProperties.Session settings;
    private final StarkillerMetrics metrics;

    private final ShiftPerformance performance;
    private final Set<String> decidedEncounterIds = new LinkedHashSet<>();
    private String sessionId;
    private long gameSeed;

    public GameSession(EncounterClassifier encounterClassifier,
                       DecisionRecorder decisionRecorder,
                       NarrativeClassifier narrativeClassifier,
                       NarrativeState narrativeState,
                       ConsequenceTokenLedger ledger,
                       AlignmentTracker alignment,
                       FamilyPressure familyPressure,
                       NewsFeed newsFeed,
                       DayProgression days,
                       GameRandom random,
                       EventBus eventBus,
                       StarkillerProperties properties,
                       @Autowired(required = false) StarkillerMetrics metrics) {
        this.encounterClassifier = encounterClassifier;
        this.decisionRecorder = decisionRecorder;
        this.narrativeClassifier = narrativeClassifier;
        this.narrativeState = narrativeState;
        this.ledger = ledger;
        this.alignment = alignment;
        this.familyPressure = familyPressure;
        this.newsFeed = newsFeed;
        this.days = days;
        this.random = random;
        this.eventBus = eventBus;
        this.settings = properties.getSession();
        this.metrics = metrics;
        this.performance = new ShiftPerformance(settings.getMaxStrikes());
        this.gameSeed = random.seed();
        this.sessionId = sessionIdFor(gameSeed);

        ledger.registerHandler(newsFeed);
        ledger.registerHandler(alignment);
        ledger.registerHandler(familyPressure);
    }

    /**
     * Discards all progress and starts day 1 with a freshly seeded random source.
     */
    public void newGame(long seed) {
        random.reseed(seed);
        days.reset();
        encounterClassifier.reset();
        narrativeState.reset();
        ledger.reset();
        alignment.reset();
        familyPressure.reset();
        newsFeed.clear();
        performance.reset();
        decidedEncounterIds.clear();
        gameSeed = seed;
        sessionId = sessionIdFor(seed);
        MdcContext.setSession(sessionId);
        MdcContext.setDay(days.currentDay());
        log.info("New game {} started with seed {}", sessionId, seed);
    }

    public Encounter nextEncounter() {
        requireInProgress();
        return encounterClassifier.generate(days.currentDay(),
                narrativeState.imperialLoyalty(), narrativeState.insurgentSympathy());
    }

    public DecisionOutcome decide(Encounter encounter, PlayerDecision decision) {
        requireInProgress();
        if (decision == PlayerDecision.ACCEPT_BRIBE && !encounter.offersBribe()) {
            throw new IllegalArgumentException("Encounter " + encounter.encounterId() + " offers no bribe");
        }
        if (!decidedEncounterIds.add(encounter.encounterId())) {
            throw new IllegalStateException("Encounter " + encounter.encounterId() + " has already been decided");
        }
        MdcContext.setEncounter(encounter.day(), encounter.encounterId());
        try {
            boolean approved = decision.approves();
            boolean correct = approved == encounter.shouldApprove();
            performance.record(correct);
            if (decision == PlayerDecision.ACCEPT_BRIBE) {
                performance.adjustCredits(encounter.bribeAmount());
            }
            if (!correct) {
                performance.adjustCredits(-encounter.creditPenalty());
            }

            DecisionRecord record = decisionRecorder.recordShipDecision(encounter, decision);
            alignment.updateAlignment(record.imperialPoints(), record.insurgentPoints());
            if (decision == PlayerDecision.ACCEPT_BRIBE) {
                alignment.updateCorruption(settings.getBribeCorruption());
                if (metrics != null) {
                    metrics.recordBribe(encounter.bribeAmount());
                }
            }
            if (encounter.storyShip()) {
                narrativeClassifier.unlockStoryTag(encounter.storyTag());
                if (approved && encounter.scenarioId() != null) {
                    alignment.recordStoryBeat(encounter.scenarioId());
                }
            }
            List<ConsequenceToken> scheduled = scheduleConsequences(encounter, decision);

            log.info("{} {} -> {} ({})", decision, encounter.encounterId(),
                    correct ? "correct" : "wrong",
                    encounter.invalidReason() == null ? "valid" : encounter.invalidReason().displayText());
            if (metrics != null) {
                metrics.recordDecision(correct);
            }

            boolean gameOver = performance.isGameOver();
            if (gameOver) {
                log.warn("Strike limit reached ({}/{}); game over", performance.strikes(), performance.maxStrikes());
                eventBus.publish(StarkillerEvent.of(GAME_OVER, days.currentDay(), sessionId,
                        Map.of("strikes", performance.strikes())));
            }
            return new DecisionOutcome(encounter.encounterId(), decision, correct, record, scheduled,
                    performance.strikes(), gameOver);
        } finally {
            MdcContext.clearEncounter();
        }
    }

    /**
     * Begins the next day and delivers every consequence due on it.
     */
    public DayStart advanceDay() {
        requireInProgress();
        int day = days.advance();
        MdcContext.setDay(day);
        performance.startNewDay();

        List<ConsequenceToken> triggered = ledger.processDay(day);
        alignment.onDayStarted(day, triggered.size());

        eventBus.publish(StarkillerEvent.of(DAY_STARTED, day, sessionId, Map.of("triggered", triggered.size())));
        return new DayStart(day, days.newRulesOn(day), triggered, newsFeed.entriesOn(day));
    }

    public EndingType determineEnding() {
        return alignment.determineEnding();
    }

    public String generateReport() {
        return narrativeClassifier.generateReport() + "\n"
                + "Day: " + days.currentDay() + "\n"
                + performance.summary() + "\n"
                + String.format("Alignment: loyalty %d, sympathy %d, corruption %d, suspicion %d, path %s%n",
                alignment.imperialLoyalty(), alignment.rebellionSympathy(), alignment.corruption(),
                alignment.suspicion(), alignment.lockedPath())
                + "Pending consequences: " + ledger.activeTokens().size() + "\n"
                + "Projected ending: " + determineEnding();
    }

    public SessionSnapshot snapshot() {
        ManifestSelector manifests = encounterClassifier.manifestSelector();
        return new SessionSnapshot(
                sessionId,
                gameSeed,
                days.currentDay(),
                narrativeState.imperialLoyalty(),
                narrativeState.insurgentSympathy(),
                narrativeState.currentBranch(),
                narrativeState.progressionLevel(),
                new ArrayList<>(narrativeState.unlockedStoryTags()),
                narrativeState.history(),
                narrativeState.currentChainId(),
                narrativeState.chainLength(),
                ledger.allTokens(),
                alignment.imperialLoyalty(),
                alignment.rebellionSympathy(),
                alignment.corruption(),
                alignment.suspicion(),
                alignment.lockedPath(),
                new ArrayList<>(alignment.completedStoryBeats()),
                familyPressure.totalExpenses(),
                performance.correctDecisions(),
                performance.wrongDecisions(),
                performance.strikes(),
                performance.credits(),
                encounterClassifier.encounterSequence(),
                encounterClassifier.recentShipTypes(),
                manifests.usageDay(),
                manifests.dailyUsage(),
                manifests.runtimeSequence(),
                new ArrayList<>(decidedEncounterIds));
    }

    /**
     * Resumes a saved game. Encounter numbering carries on from the save and the random
     * source is reseeded from the saved seed and the number of decisions made.
     */
    public void restore(SessionSnapshot snapshot) {
        gameSeed = snapshot.seed();
        random.reseed(resumeSeed(gameSeed, snapshot.history().size()));
        encounterClassifier.reset();
        encounterClassifier.restore(snapshot.encounterSequence(), snapshot.recentShipTypes(),
                snapshot.manifestUsageDay(), snapshot.manifestUsage(), snapshot.runtimeManifestSequence());
        decidedEncounterIds.clear();
        decidedEncounterIds.addAll(snapshot.decidedEncounterIds());
        newsFeed.clear();
        days.restoreDay(snapshot.day());
        narrativeState.restore(snapshot.imperialLoyalty(), snapshot.insurgentSympathy(), snapshot.currentBranch(),
                snapshot.progressionLevel(), new LinkedHashSet<>(snapshot.unlockedStoryTags()), snapshot.history(),
                snapshot.currentChainId(), snapshot.chainLength());
        ledger.restore(snapshot.tokens());
        alignment.restore(snapshot.alignmentLoyalty(), snapshot.alignmentSympathy(), snapshot.corruption(),
                snapshot.suspicion(), snapshot.lockedEndingPath(), new LinkedHashSet<>(snapshot.completedStoryBeats()));
        familyPressure.restore(snapshot.familyExpenses());
        performance.restore(snapshot.correctDecisions(), snapshot.wrongDecisions(), snapshot.strikes(),
                snapshot.credits());
        sessionId = snapshot.sessionId();
        MdcContext.setSession(sessionId);
        MdcContext.setDay(snapshot.day());
        log.info("Restored game {} at day {} ({} decisions, {} tokens)",
                sessionId, snapshot.day(), snapshot.history().size(), snapshot.tokens().size());
    }

    public int currentDay() {
        return days.currentDay();
    }

    public boolean isGameOver() {
        return performance.isGameOver();
    }

    public ShiftPerformance performance() {
        return performance;
    }

    public String sessionId() {
        return sessionId;
    }

    private List<ConsequenceToken> scheduleConsequences(Encounter encounter, PlayerDecision decision) {
        List<ConsequenceToken> scheduled = new ArrayList<>();
        CargoManifest manifest = encounter.manifest();
        if (decision.approves() && manifest != null && manifest.hasContraband()) {
            if (manifest.contrabandType() == ContrabandType.MEDICAL_SUPPLIES) {
                scheduled.add(ledger.addToken("MEDICAL_SUPPLIES_APPROVED", 3, new ConsequencePayload(
                        null, "Medical Supply Shortages Reported in Outer Territories", 0, 1, false)));
            } else {
                scheduled.add(ledger.addToken("SMUGGLER_APPROVED", 2, new ConsequencePayload(
                        null, "Contraband Trafficking Surge at Outer Checkpoints", -2, 4, true)));
            }
        }
        if (decision == PlayerDecision.ACCEPT_BRIBE) {
            scheduled.add(ledger.addToken("BRIBE_ACCEPTED", 3, new ConsequencePayload(
                    null, "Internal Affairs Reviews Checkpoint Irregularities", -1, 6, true)));
        }
        if (decision.approves() && encounter.hasStoryTag("insurgent")) {
            scheduled.add(ledger.addToken("REBEL_SYMPATHIZER_HELPED", 2, new ConsequencePayload(
                    "REBEL_FOLLOWUP", "Rebel Supply Lines Remain Active", -3, 4, true)));
        }
        return scheduled;
    }

    private void requireInProgress() {
        if (performance.isGameOver()) {
            throw new IllegalStateException("Game " + sessionId + " is over after "
                    + performance.strikes() + " strikes; start a new game");
        }
    }

    private static long resumeSeed(long seed, int decisions) {
        return seed ^ (0x9E3779B97F4A7C15L * (decisions + 1));
    }

    private static String sessionIdFor(long seed) {
        return String.format("SKB-%08X", seed & 0xFFFFFFFFL);
    }
}
