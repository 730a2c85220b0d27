package com.starkiller.core.session;

import com.starkiller.core.consequence.ConsequenceToken;
import com.starkiller.core.model.DecisionRecord;
import com.starkiller.core.model.EndingPath;
import com.starkiller.core.model.NarrativeBranch;

import java.util.List;
import java.util.Map;

/**
 * Everything needed to resume a game.
 */
public record SessionSnapshot(
        String sessionId,
        long seed,
        int day,
        int imperialLoyalty,
        int insurgentSympathy,
        NarrativeBranch currentBranch,
        int progressionLevel,
        List<String> unlockedStoryTags,
        List<DecisionRecord> history,
        String currentChainId,
        int chainLength,
        List<ConsequenceToken> tokens,
        int alignmentLoyalty,
        int alignmentSympathy,
        int corruption,
        int suspicion,
        EndingPath lockedEndingPath,
        List<String> completedStoryBeats,
        int familyExpenses,
        int correctDecisions,
        int wrongDecisions,
        int strikes,
        int credits,
        int encounterSequence,
        List<String> recentShipTypes,
        int manifestUsageDay,
        Map<String, Integer> manifestUsage,
        int runtimeManifestSequence,
        List<String> decidedEncounterIds
) {

    public SessionSnapshot {
        unlockedStoryTags = unlockedStoryTags == null ? List.of() : List.copyOf(unlockedStoryTags);
        history = history == null ? List.of() : List.copyOf(history);
        tokens = tokens == null ? List.of() : List.copyOf(tokens);
        completedStoryBeats = completedStoryBeats == null ? List.of() : List.copyOf(completedStoryBeats);
        recentShipTypes = recentShipTypes == null ? List.of() : List.copyOf(recentShipTypes);
        manifestUsage = manifestUsage == null ? Map.of() : Map.copyOf(manifestUsage);
        decidedEncounterIds = decidedEncounterIds == null ? List.of() : List.copyOf(decidedEncounterIds);
    }
}
