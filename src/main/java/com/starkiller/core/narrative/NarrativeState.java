package com.starkiller.core.narrative;

import com.starkiller.core.model.DecisionRecord;
import com.starkiller.core.model.NarrativeBranch;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The session's one authoritative narrative state. Only {@link DecisionRecorder}
 * and {@link NarrativeClassifier} mutate it; everything else reads.
 */
@Component
public class NarrativeState {

    private int imperialLoyalty;
    private int insurgentSympathy;
    private NarrativeBranch currentBranch;
    private int progressionLevel;
    private final Set<String> unlockedStoryTags = new LinkedHashSet<>();
    private final List<DecisionRecord> history = new ArrayList<>();

    private String currentChainId;
    private int chainLength;

    public int imperialLoyalty() {
        return imperialLoyalty;
    }

    public int insurgentSympathy() {
        return insurgentSympathy;
    }

    /** Loyalty minus sympathy. */
    public int difference() {
        return imperialLoyalty - insurgentSympathy;
    }

    /** Null until the first decision has been classified. */
    public NarrativeBranch currentBranch() {
        return currentBranch;
    }

    public int progressionLevel() {
        return progressionLevel;
    }

    public Set<String> unlockedStoryTags() {
        return Collections.unmodifiableSet(unlockedStoryTags);
    }

    public List<DecisionRecord> history() {
        return Collections.unmodifiableList(history);
    }

    /** Contexts of the last {@code count} decisions, oldest first. */
    public List<String> recentContexts(int count) {
        int from = Math.max(0, history.size() - count);
        return history.subList(from, history.size()).stream().map(DecisionRecord::context).toList();
    }

    public String currentChainId() {
        return currentChainId;
    }

    public int chainLength() {
        return chainLength;
    }

    void append(DecisionRecord record) {
        history.add(record);
        imperialLoyalty += record.imperialPoints();
        insurgentSympathy += record.insurgentPoints();
    }

    void changeBranch(NarrativeBranch branch) {
        currentBranch = branch;
        progressionLevel++;
    }

    boolean addStoryTag(String tag) {
        return unlockedStoryTags.add(tag);
    }

    void openChain(String chainId) {
        currentChainId = chainId;
        chainLength = 1;
    }

    void extendChain() {
        chainLength++;
    }

    void closeChain() {
        currentChainId = null;
        chainLength = 0;
    }

    /**
     * Starts a new game.
     */
    public void reset() {
        imperialLoyalty = 0;
        insurgentSympathy = 0;
        currentBranch = null;
        progressionLevel = 0;
        unlockedStoryTags.clear();
        history.clear();
        closeChain();
    }

    /**
     * Replaces the whole state with persisted values. Totals are taken as stored,
     * not recomputed from the history.
     */
    public void restore(int imperialLoyalty, int insurgentSympathy, NarrativeBranch currentBranch,
                        int progressionLevel, Set<String> unlockedStoryTags, List<DecisionRecord> history,
                        String currentChainId, int chainLength) {
        reset();
        this.imperialLoyalty = imperialLoyalty;
        this.insurgentSympathy = insurgentSympathy;
        this.currentBranch = currentBranch;
        this.progressionLevel = progressionLevel;
        this.unlockedStoryTags.addAll(unlockedStoryTags);
        this.history.addAll(history);
        this.currentChainId = currentChainId;
        this.chainLength = currentChainId == null ? 0 : chainLength;
    }
}
