package com.starkiller.core.ending;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.consequence.ConsequenceHandler;
import com.starkiller.core.consequence.ConsequencePayload;
import com.starkiller.core.consequence.ConsequenceToken;
import com.starkiller.core.consequence.ConsequenceTokenLedger;
import com.starkiller.core.model.EndingPath;
import com.starkiller.core.model.EndingType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * The officer's standing with both sides, how corrupt they have become and how
 * much attention they draw. Decides the ending.
 * <p>
 * Loyalty and sympathy stay within [-100, 100]; corruption and suspicion within
 * [0, 100]. Locking an ending path is final for the game and schedules a
 * consequence announcing it.
 */
@Component
public class AlignmentTracker implements ConsequenceHandler {

    private static final Logger log = LoggerFactory.getLogger(AlignmentTracker.class);

    private final ConsequenceTokenLedger ledger;
    private final FamilyStatusProvider familyStatus;
    private final StarkillerProperties.Ending settings;

    private int imperialLoyalty;
    private int rebellionSympathy;
    private int corruption;
    private int suspicion;
    private EndingPath lockedPath = EndingPath.NONE;
    private final Set<String> completedStoryBeats = new LinkedHashSet<>();

    public AlignmentTracker(ConsequenceTokenLedger ledger,
                            FamilyStatusProvider familyStatus,
                            StarkillerProperties properties) {
        this.ledger = ledger;
        this.familyStatus = familyStatus;
        this.settings = properties.getEnding();
    }

    public void updateAlignment(int imperialChange, int rebellionChange) {
        int oldImperial = imperialLoyalty;
        int oldRebellion = rebellionSympathy;
        imperialLoyalty = clamp(imperialLoyalty + imperialChange, -100, 100);
        rebellionSympathy = clamp(rebellionSympathy + rebellionChange, -100, 100);
        log.debug("Alignment updated - imperial: {} -> {}, rebellion: {} -> {}",
                oldImperial, imperialLoyalty, oldRebellion, rebellionSympathy);
    }

    /**
     * Corruption above 50 also draws one point of suspicion per update.
     */
    public void updateCorruption(int change) {
        corruption = clamp(corruption + change, 0, 100);
        if (corruption > 50) {
            updateSuspicion(1);
        }
    }

    public void updateSuspicion(int change) {
        suspicion = clamp(suspicion + change, 0, 100);
        if (suspicion > 75) {
            log.info("Suspicion at {}: investigation likely", suspicion);
        }
    }

    /**
     * Completes a story beat once; repeated calls have no effect.
     *
     * @return true when the beat was newly completed
     */
    public boolean recordStoryBeat(String beatId) {
        if (!completedStoryBeats.add(beatId)) {
            return false;
        }
        log.info("Story beat completed: {}", beatId);
        switch (beatId) {
            case "THE_DEFECTOR" -> updateAlignment(-2, 5);
            case "THE_PURGE_ORDER" -> updateAlignment(5, -2);
            case "THE_CHILD_TRANSPORT" -> updateAlignment(-1, 3);
            case "THE_WEAPONS_INSPECTOR" -> updateAlignment(3, -1);
            case "THE_SPY_EXTRACTION" -> {
                updateAlignment(-5, 8);
                lockEndingPath(EndingPath.REBEL);
            }
            case "THE_FAMILY_BETRAYAL" -> {
                updateAlignment(8, -5);
                lockEndingPath(EndingPath.IMPERIAL);
            }
            default -> log.debug("No alignment effect defined for story beat {}", beatId);
        }
        return true;
    }

    /**
     * Locks the ending path. Only the first lock of a game takes effect.
     *
     * @return true when this call locked the path
     */
    public boolean lockEndingPath(EndingPath path) {
        if (path == EndingPath.NONE || lockedPath != EndingPath.NONE) {
            return false;
        }
        lockedPath = path;
        log.info("Ending path locked: {}", path);
        ledger.addToken("ENDING_PATH_" + path.name(), settings.getEndingPathTokenDelay(), endingPathConsequence(path));
        return true;
    }

    public EndingType determineEnding() {
        double family = familyStatus.familyScore();
        if (lockedPath != EndingPath.NONE) {
            return switch (lockedPath) {
                case REBEL -> family > 0.7 ? EndingType.FREEDOM_FIGHTER : EndingType.MARTYR;
                case IMPERIAL -> corruption < 30 ? EndingType.IMPERIAL_HERO : EndingType.BRIDGE_COMMANDER;
                case NEUTRAL -> suspicion < 50 ? EndingType.GRAY_MAN : EndingType.COMPROMISED;
                case CORRUPT -> EndingType.COMPROMISED;
                case NONE -> EndingType.GRAY_MAN;
            };
        }

        double alignment = alignmentScore();
        double corruptionScore = corruption / 100.0;

        if (corruptionScore > 0.7) {
            return EndingType.COMPROMISED;
        }
        if (alignment < -0.6) {
            if (family > 0.8) {
                return EndingType.FREEDOM_FIGHTER;
            }
            return family > 0.4 ? EndingType.UNDERGROUND : EndingType.REFUGEE;
        }
        if (alignment > 0.6) {
            if (corruptionScore < 0.2 && family > 0.6) {
                return EndingType.GOOD_SOLDIER;
            }
            return corruptionScore < 0.3 ? EndingType.TRUE_BELIEVER : EndingType.BRIDGE_COMMANDER;
        }
        if (alignment < -0.2) {
            return family > 0.5 ? EndingType.REFUGEE : EndingType.UNDERGROUND;
        }
        if (alignment > 0.2) {
            return family > 0.5 ? EndingType.GOOD_SOLDIER : EndingType.TRUE_BELIEVER;
        }
        return suspicion > 50 ? EndingType.COMPROMISED : EndingType.GRAY_MAN;
    }

    public boolean isEligibleForEnding(EndingType ending) {
        double family = familyStatus.familyScore();
        return switch (ending) {
            case FREEDOM_FIGHTER -> rebellionSympathy > 60 && family > 0.7 && suspicion < 50;
            case MARTYR -> rebellionSympathy > 70 && family < 0.5;
            case IMPERIAL_HERO -> imperialLoyalty > 70 && corruption < 20 && suspicion < 30;
            case BRIDGE_COMMANDER -> imperialLoyalty > 60 && corruption > 40;
            case COMPROMISED -> corruption > 60 || suspicion > 70;
            default -> true;
        };
    }

    public EndingPath suggestedEndingPath() {
        double alignment = alignmentScore();
        if (corruption > 60) {
            return EndingPath.CORRUPT;
        }
        if (alignment < -0.5) {
            return EndingPath.REBEL;
        }
        if (alignment > 0.5) {
            return EndingPath.IMPERIAL;
        }
        return EndingPath.NEUTRAL;
    }

    /**
     * Start-of-day bookkeeping. Inside the point-of-no-return window the suggested
     * path is announced; a day without incidents lowers suspicion by one.
     *
     * @param incidentsToday consequences delivered at the start of this day
     */
    public void onDayStarted(int day, int incidentsToday) {
        if (lockedPath == EndingPath.NONE
                && day >= settings.getPointOfNoReturnStartDay()
                && day <= settings.getPointOfNoReturnEndDay()) {
            log.info("Point of no return opportunity on day {}: {} path", day, suggestedEndingPath());
        }
        if (incidentsToday == 0) {
            suspicion = Math.max(0, suspicion - 1);
        }
    }

    @Override
    public void onConsequence(ConsequenceToken token, int day) {
        ConsequencePayload payload = token.payload();
        if (payload.loyaltyImpact() != 0) {
            updateAlignment(payload.loyaltyImpact(), 0);
        }
        if (payload.suspicionIncrease() != 0) {
            updateSuspicion(payload.suspicionIncrease());
        }
    }

    public int imperialLoyalty() {
        return imperialLoyalty;
    }

    public int rebellionSympathy() {
        return rebellionSympathy;
    }

    public int corruption() {
        return corruption;
    }

    public int suspicion() {
        return suspicion;
    }

    public EndingPath lockedPath() {
        return lockedPath;
    }

    public Set<String> completedStoryBeats() {
        return Collections.unmodifiableSet(completedStoryBeats);
    }

    public void reset() {
        imperialLoyalty = 0;
        rebellionSympathy = 0;
        corruption = 0;
        suspicion = 0;
        lockedPath = EndingPath.NONE;
        completedStoryBeats.clear();
    }

    /**
     * Restores persisted meters without scheduling anything.
     */
    public void restore(int imperialLoyalty, int rebellionSympathy, int corruption, int suspicion,
                        EndingPath lockedPath, Set<String> completedStoryBeats) {
        reset();
        this.imperialLoyalty = clamp(imperialLoyalty, -100, 100);
        this.rebellionSympathy = clamp(rebellionSympathy, -100, 100);
        this.corruption = clamp(corruption, 0, 100);
        this.suspicion = clamp(suspicion, 0, 100);
        this.lockedPath = lockedPath == null ? EndingPath.NONE : lockedPath;
        this.completedStoryBeats.addAll(completedStoryBeats);
    }

    private double alignmentScore() {
        return (imperialLoyalty - rebellionSympathy) / 200.0;
    }

    private static ConsequencePayload endingPathConsequence(EndingPath path) {
        return switch (path) {
            case REBEL -> new ConsequencePayload(null,
                    "Security Alert: Increased Rebel Activity Detected", -3, 10, true);
            case IMPERIAL -> new ConsequencePayload(null,
                    "Command Commends Loyalty: Exemplary Service Recognized", 3, 0, false);
            case NEUTRAL -> new ConsequencePayload(null,
                    "Personnel Review: Standard Performance Evaluation", 0, 2, false);
            case CORRUPT -> new ConsequencePayload(null,
                    "Internal Affairs: Random Audit Procedures Implemented", -1, 15, true);
            case NONE -> throw new IllegalArgumentException("No consequence for an unlocked path");
        };
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
