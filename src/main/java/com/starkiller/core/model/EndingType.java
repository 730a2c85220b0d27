package com.starkiller.core.model;

public enum EndingType {
    FREEDOM_FIGHTER,
    MARTYR,
    REFUGEE,
    UNDERGROUND,
    GRAY_MAN,
    COMPROMISED,
    GOOD_SOLDIER,
    TRUE_BELIEVER,
    BRIDGE_COMMANDER,
    IMPERIAL_HERO
}
