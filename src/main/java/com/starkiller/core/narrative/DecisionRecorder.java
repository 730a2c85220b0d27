package com.starkiller.core.narrative;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.events.ReentrancyViolationException;
import com.starkiller.core.model.DecisionCategory;
import com.starkiller.core.model.DecisionPressure;
import com.starkiller.core.model.DecisionRecord;
import com.starkiller.core.model.Encounter;
import com.starkiller.core.model.NarrativeBranch;
import com.starkiller.core.model.PlayerDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * Appends player decisions to the narrative history.
 * <p>
 * Recording is synchronous: totals, branch, progression level and decision chain
 * are all up to date when {@link #record} returns. Recording must not be nested,
 * including from a listener of the events it raises.
 * <p>
 * Decision chains: a {@link DecisionPressure#HIGH} or {@link DecisionPressure#CRITICAL}
 * decision opens a chain named after itself. Later decisions extend the open chain
 * and name it as their parent until the chain reaches its maximum length, a new
 * chain is opened, or the branch moves onto the Imperium or Insurgent path.
 */
@Service
public class DecisionRecorder {

    private static final Logger log = LoggerFactory.getLogger(DecisionRecorder.class);

    private final NarrativeState state;
    private final NarrativeClassifier classifier;
    private final int maxChainLength;

    private boolean recording;

    public DecisionRecorder(NarrativeState state, NarrativeClassifier classifier, StarkillerProperties properties) {
        this.state = state;
        this.classifier = classifier;
        this.maxChainLength = properties.getNarrative().getMaxChainLength();
    }

    public DecisionRecord record(String id, int imperialPoints, int insurgentPoints, String context,
                                 DecisionCategory category, DecisionPressure pressure) {
        if (recording) {
            throw new ReentrancyViolationException("Decision " + id + " recorded while another decision is being recorded");
        }
        recording = true;
        try {
            boolean opensChain = pressure.isAtLeast(DecisionPressure.HIGH);
            String parent = opensChain ? null : state.currentChainId();
            DecisionRecord record = new DecisionRecord(id, Instant.now(), imperialPoints, insurgentPoints,
                    category, pressure, context, parent);
            state.append(record);
            log.info("Recorded decision {} ({}, {}): imperial {}, insurgent {}",
                    id, category, pressure, imperialPoints, insurgentPoints);

            Optional<NarrativeBranch> changed = classifier.reevaluate();
            if (changed.isPresent() && isCommittedPath(changed.get()) && state.currentChainId() != null) {
                log.debug("Branch moved to {}; closing decision chain {}", changed.get(), state.currentChainId());
                state.closeChain();
            }
            updateChain(record);
            return record;
        } finally {
            recording = false;
        }
    }

    /**
     * Records a decision whose category and pressure are inferred from its id,
     * context and point magnitude.
     */
    public DecisionRecord record(String id, int imperialPoints, int insurgentPoints, String context) {
        return record(id, imperialPoints, insurgentPoints, context,
                determineCategory(id, context), DecisionPressure.fromImpact(imperialPoints, insurgentPoints));
    }

    /**
     * Records the officer's call on a checkpoint encounter. Story ships tagged
     * "imperium" or "insurgent" carry narrative points; ordinary ships do not.
     */
    public DecisionRecord recordShipDecision(Encounter encounter, PlayerDecision decision) {
        boolean approved = decision.approves();
        boolean bribeTaken = decision == PlayerDecision.ACCEPT_BRIBE;

        String id = String.format("ship_%s_%s_%s",
                encounter.shipType().toLowerCase(Locale.ROOT).replace(' ', '_'),
                approved ? "approved" : "denied",
                encounter.encounterId());

        int imperial = 0;
        int insurgent = 0;
        if (encounter.hasStoryTag("imperium")) {
            imperial = approved ? 10 : -5;
            insurgent = approved ? -5 : 5;
        } else if (encounter.hasStoryTag("insurgent")) {
            imperial = approved ? -5 : 10;
            insurgent = approved ? 10 : -5;
        }

        DecisionCategory category;
        if (bribeTaken) {
            category = DecisionCategory.FINANCIAL;
        } else if (encounter.storyShip()) {
            category = DecisionCategory.POLITICAL;
        } else {
            category = DecisionCategory.TACTICAL;
        }

        DecisionPressure pressure = DecisionPressure.MEDIUM;
        if (encounter.storyShip() || encounter.creditPenalty() > 20) {
            pressure = DecisionPressure.HIGH;
        }
        if (encounter.casualtiesIfWrong() > 0) {
            pressure = DecisionPressure.CRITICAL;
        }

        StringBuilder context = new StringBuilder()
                .append(approved ? "Approved " : "Denied ")
                .append(encounter.shipName())
                .append(": ")
                .append(encounter.story());
        if (bribeTaken) {
            context.append(" Accepted ").append(encounter.bribeAmount()).append(" credits.");
        }

        return record(id, imperial, insurgent, context.toString(), category, pressure);
    }

    /**
     * Category implied by a decision's id and context.
     */
    public static DecisionCategory determineCategory(String id, String context) {
        String lowerId = id == null ? "" : id.toLowerCase(Locale.ROOT);
        String lowerContext = context == null ? "" : context.toLowerCase(Locale.ROOT);
        if (lowerId.contains("bribe") || lowerContext.contains("credits")) {
            return DecisionCategory.FINANCIAL;
        }
        if (lowerId.contains("moral") || lowerContext.contains("family")) {
            return DecisionCategory.MORAL;
        }
        if (lowerId.contains("imperium") || lowerId.contains("insurgent") || lowerId.contains("rebel")) {
            return DecisionCategory.POLITICAL;
        }
        return DecisionCategory.TACTICAL;
    }

    private void updateChain(DecisionRecord record) {
        if (record.pressure().isAtLeast(DecisionPressure.HIGH)) {
            state.openChain(record.id());
            return;
        }
        if (state.currentChainId() == null) {
            return;
        }
        state.extendChain();
        if (state.chainLength() >= maxChainLength) {
            log.debug("Decision chain {} complete at length {}", state.currentChainId(), state.chainLength());
            state.closeChain();
        }
    }

    private static boolean isCommittedPath(NarrativeBranch branch) {
        return branch == NarrativeBranch.IMPERIUM_PATH || branch == NarrativeBranch.INSURGENT_PATH;
    }
}
