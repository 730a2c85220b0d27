package com.starkiller.core.model;

import java.util.List;

/**
 * A scripted story encounter. It becomes available on {@code firstDay} once the
 * player's alignment has reached both minimums.
 *
 * @param scenarioId           catalog identifier
 * @param storyTag             narrative tag unlocked when the encounter is decided
 * @param shipTypes            names of ship types that may carry the scenario; empty means any
 * @param firstDay             first day the scenario may appear
 * @param minImperialLoyalty   loyalty required before the scenario appears
 * @param minRebellionSympathy sympathy required before the scenario appears
 * @param storyText            what the captain tells the officer
 * @param offersBribe          whether the captain always offers a bribe
 * @param creditPenalty        credits lost for a wrong call
 * @param casualtiesIfWrong    casualties caused by a wrong call
 */
public record ShipScenario(
        String scenarioId,
        String storyTag,
        List<String> shipTypes,
        int firstDay,
        int minImperialLoyalty,
        int minRebellionSympathy,
        String storyText,
        boolean offersBribe,
        int creditPenalty,
        int casualtiesIfWrong
) {

    public ShipScenario {
        shipTypes = shipTypes == null ? List.of() : List.copyOf(shipTypes);
    }

    public boolean isAvailable(int day, int imperialLoyalty, int rebellionSympathy) {
        return firstDay <= day
                && imperialLoyalty >= minImperialLoyalty
                && rebellionSympathy >= minRebellionSympathy;
    }
}
