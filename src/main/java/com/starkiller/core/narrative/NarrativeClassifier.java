package com.starkiller.core.narrative;

import com.starkiller.core.config.StarkillerProperties;
import com.starkiller.core.day.DayRuleProvider;
import com.starkiller.core.events.EventBus;
import com.starkiller.core.events.StarkillerEvent;
import com.starkiller.core.metrics.StarkillerMetrics;
import com.starkiller.core.model.NarrativeBranch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Derives the story branch from the accumulated decision totals and unlocks story tags.
 * <p>
 * Branch rules are evaluated in a fixed order and the first that applies wins:
 * <ol>
 *   <li>difference inside the neutral band: {@code NEUTRAL}</li>
 *   <li>difference above the loyalty threshold: {@code IMPERIUM_PATH}</li>
 *   <li>difference below the sympathy threshold: {@code INSURGENT_PATH}</li>
 *   <li>difference inside the complex-resistance band: {@code DOUBLE_CROSS} when a recent
 *       decision mentions betrayal or manipulation, else {@code COMPLEX_RESISTANCE}</li>
 *   <li>otherwise {@code SILENT_DEFIANCE}</li>
 * </ol>
 * Overlapping thresholds are not rejected; the order above resolves them.
 */
@Service
public class NarrativeClassifier {

    private static final Logger log = LoggerFactory.getLogger(NarrativeClassifier.class);

    public static final String BRANCH_CHANGED = "branch.changed";
    public static final String STORY_TAG_UNLOCKED = "story_tag.unlocked";

    private final NarrativeState state;
    private final EventBus eventBus;
    private final DayRuleProvider dayRuleProvider;
    private final StarkillerProperties.Narrative thresholds;
    private final StarkillerMetrics metrics;

    public NarrativeClassifier(NarrativeState state,
                               EventBus eventBus,
                               DayRuleProvider dayRuleProvider,
                               StarkillerProperties properties,
                               @Autowired(required = false) StarkillerMetrics metrics) {
        this.state = state;
        this.eventBus = eventBus;
        this.dayRuleProvider = dayRuleProvider;
        this.thresholds = properties.getNarrative();
        this.metrics = metrics;
    }

    public NarrativeBranch determineBranch(NarrativeState state) {
        return determineBranch(state.imperialLoyalty(), state.insurgentSympathy(),
                state.recentContexts(thresholds.getContextWindow()));
    }

    /**
     * Pure branch evaluation.
     *
     * @param recentContexts contexts of decisions, oldest first; only the last window is scanned
     */
    public NarrativeBranch determineBranch(int imperialLoyalty, int insurgentSympathy, List<String> recentContexts) {
        int diff = imperialLoyalty - insurgentSympathy;
        if (Math.abs(diff) < thresholds.getNeutralBand()) {
            return NarrativeBranch.NEUTRAL;
        }
        if (diff > thresholds.getImperialLoyaltyThreshold()) {
            return NarrativeBranch.IMPERIUM_PATH;
        }
        if (diff < thresholds.getInsurgentSympathyThreshold()) {
            return NarrativeBranch.INSURGENT_PATH;
        }
        if (Math.abs(diff) < thresholds.getComplexResistanceThreshold()) {
            return mentionsDoubleCross(recentContexts)
                    ? NarrativeBranch.DOUBLE_CROSS
                    : NarrativeBranch.COMPLEX_RESISTANCE;
        }
        return NarrativeBranch.SILENT_DEFIANCE;
    }

    /**
     * Re-classifies the authoritative state. On a change the progression level
     * goes up by one and a single {@value #BRANCH_CHANGED} event is published.
     *
     * @return the new branch when it changed, empty otherwise
     */
    public Optional<NarrativeBranch> reevaluate() {
        NarrativeBranch previous = state.currentBranch();
        NarrativeBranch next = determineBranch(state);
        if (next == previous) {
            return Optional.empty();
        }
        state.changeBranch(next);
        log.info("Narrative branch changed: {} -> {} (loyalty {}, sympathy {}, progression {})",
                previous, next, state.imperialLoyalty(), state.insurgentSympathy(), state.progressionLevel());

        Map<String, Object> payload = new HashMap<>();
        payload.put("from", previous == null ? "NONE" : previous.name());
        payload.put("to", next.name());
        payload.put("progressionLevel", state.progressionLevel());
        eventBus.publish(StarkillerEvent.of(BRANCH_CHANGED, dayRuleProvider.currentDay(), next.name(), payload));
        if (metrics != null) {
            metrics.recordBranchChange(next.name());
        }
        return Optional.of(next);
    }

    /**
     * Unlocks a story tag. Publishes {@value #STORY_TAG_UNLOCKED} only the first time.
     *
     * @return true when the tag was newly unlocked
     */
    public boolean unlockStoryTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return false;
        }
        if (!state.addStoryTag(tag)) {
            return false;
        }
        log.info("Story tag unlocked: {}", tag);
        eventBus.publish(StarkillerEvent.of(STORY_TAG_UNLOCKED, dayRuleProvider.currentDay(), tag, Map.of("tag", tag)));
        return true;
    }

    public boolean isStoryTagUnlocked(String tag) {
        return state.unlockedStoryTags().contains(tag);
    }

    /**
     * Debug summary of the narrative state. Not a stable format.
     */
    public String generateReport() {
        NarrativeBranch branch = state.currentBranch();
        return "Narrative Report:\n"
                + "Branch: " + (branch == null ? "NONE" : branch.name()) + "\n"
                + "Progression Level: " + state.progressionLevel() + "\n"
                + "Imperial Loyalty: " + state.imperialLoyalty() + "\n"
                + "Insurgent Sympathy: " + state.insurgentSympathy() + "\n"
                + "Unlocked Story Tags: " + String.join(", ", state.unlockedStoryTags()) + "\n"
                + "Recent Decisions: " + Math.min(3, state.history().size());
    }

    private boolean mentionsDoubleCross(List<String> contexts) {
        int from = Math.max(0, contexts.size() - thresholds.getContextWindow());
        // plain substring match: "no betrayal" counts
        for (String context : contexts.subList(from, contexts.size())) {
            String lower = context.toLowerCase(Locale.ROOT);
            for (String keyword : thresholds.getDoubleCrossKeywords()) {
                if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return true;
                }
            }
        }
        return false;
    }
}
