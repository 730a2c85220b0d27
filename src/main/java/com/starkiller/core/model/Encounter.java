package com.starkiller.core.model;

import com.starkiller.core.policy.FactionPolicy;

/**
 * A generated ship at the checkpoint, together with the ground-truth verdict.
 *
 * @param encounterId       session-unique identifier
 * @param day               day the encounter was generated for
 * @param shipType          ship type name
 * @param shipName          hull name
 * @param category          policy of the ship's category
 * @param faction           faction the ship flies under
 * @param crewSize          crew complement
 * @param origin            declared departure system
 * @param captainName       captain's full name
 * @param captainRank       captain's rank
 * @param captainFaction    faction the captain was matched under
 * @param accessCode        code presented, possibly forged
 * @param accessCodeData    issued code data when the presented code is a real one, else null
 * @param manifest          cargo manifest, null when none was presented
 * @param story             captain's story
 * @param storyShip         whether this is a scripted story encounter
 * @param storyTag          story tag, null for ordinary ships
 * @param scenarioId        story scenario the encounter plays out, null for ordinary ships
 * @param offersBribe       whether the captain offers a bribe
 * @param bribeAmount       credits offered
 * @param creditPenalty     credits lost for a wrong call
 * @param casualtiesIfWrong casualties caused by a wrong call
 * @param shouldApprove     ground-truth verdict
 * @param invalidReason     first failing check, null when the ship should be approved
 * @param degradedMatch     whether generation fell back to the default ship and captain
 */
public record Encounter(
        String encounterId,
        int day,
        String shipType,
        String shipName,
        FactionPolicy category,
        String faction,
        int crewSize,
        String origin,
        String captainName,
        String captainRank,
        String captainFaction,
        String accessCode,
        AccessCode accessCodeData,
        CargoManifest manifest,
        String story,
        boolean storyShip,
        String storyTag,
        String scenarioId,
        boolean offersBribe,
        int bribeAmount,
        int creditPenalty,
        int casualtiesIfWrong,
        boolean shouldApprove,
        InvalidReason invalidReason,
        boolean degradedMatch
) {

    /** Access level of the presented code, or null when the code was not issued by command. */
    public AccessLevel accessLevel() {
        return accessCodeData == null ? null : accessCodeData.level();
    }

    public boolean hasStoryTag(String tag) {
        return storyShip && storyTag != null && storyTag.equalsIgnoreCase(tag);
    }
}
