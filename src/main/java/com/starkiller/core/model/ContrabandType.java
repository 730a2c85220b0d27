package com.starkiller.core.model;

public enum ContrabandType {
    NONE,
    WEAPONS,
    NARCOTICS,
    STOLEN_GOODS,
    REBEL_SUPPLIES,
    INTELLIGENCE,
    MEDICAL_SUPPLIES
}
