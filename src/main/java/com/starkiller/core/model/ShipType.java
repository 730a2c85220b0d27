package com.starkiller.core.model;

import com.starkiller.core.policy.FactionPolicy;

import java.util.List;

/**
 * A class of vessel that can arrive at the checkpoint.
 *
 * @param typeName          display name, e.g. "Imperial Shuttle"
 * @param category          policy of the category the vessel belongs to
 * @param minCrewSize       smallest crew complement
 * @param maxCrewSize       largest crew complement
 * @param commonOrigins     systems such vessels usually depart from
 * @param specificShipNames registered hull names, occasionally used instead of a generated name
 */
public record ShipType(
        String typeName,
        FactionPolicy category,
        int minCrewSize,
        int maxCrewSize,
        List<String> commonOrigins,
        List<String> specificShipNames
) {

    public ShipType {
        commonOrigins = commonOrigins == null ? List.of() : List.copyOf(commonOrigins);
        specificShipNames = specificShipNames == null ? List.of() : List.copyOf(specificShipNames);
        if (maxCrewSize < minCrewSize) {
            maxCrewSize = minCrewSize;
        }
    }
}
