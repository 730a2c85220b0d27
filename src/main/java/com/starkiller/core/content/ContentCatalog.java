package com.starkiller.core.content;

import com.starkiller.core.model.AccessCode;
import com.starkiller.core.model.CaptainType;
import com.starkiller.core.model.CargoManifest;
import com.starkiller.core.model.DayRule;
import com.starkiller.core.model.ShipScenario;
import com.starkiller.core.model.ShipType;
import com.starkiller.core.policy.FactionPolicy;

import java.util.List;
import java.util.Optional;

/**
 * Immutable game content: categories, vessels, captains, story scenarios,
 * manifests, issued access codes and the briefing rules of every day.
 * List order is declaration order and is significant for captain matching.
 */
public record ContentCatalog(
        List<FactionPolicy> categories,
        List<ShipType> shipTypes,
        List<CaptainType> captainTypes,
        List<ShipScenario> scenarios,
        List<CargoManifest> manifests,
        List<AccessCode> accessCodes,
        List<DayRule> dayRules
) {

    public ContentCatalog {
        categories = List.copyOf(categories);
        shipTypes = List.copyOf(shipTypes);
        captainTypes = List.copyOf(captainTypes);
        scenarios = List.copyOf(scenarios);
        manifests = List.copyOf(manifests);
        accessCodes = List.copyOf(accessCodes);
        dayRules = List.copyOf(dayRules);
    }

    public Optional<FactionPolicy> category(String name) {
        return categories.stream().filter(c -> c.categoryName().equalsIgnoreCase(name)).findFirst();
    }

    public Optional<ShipType> shipType(String typeName) {
        return shipTypes.stream().filter(t -> t.typeName().equalsIgnoreCase(typeName)).findFirst();
    }

    public Optional<CaptainType> captainType(String typeName) {
        return captainTypes.stream().filter(t -> t.typeName().equalsIgnoreCase(typeName)).findFirst();
    }

    public Optional<AccessCode> accessCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        return accessCodes.stream().filter(c -> c.code().equalsIgnoreCase(code)).findFirst();
    }
}
