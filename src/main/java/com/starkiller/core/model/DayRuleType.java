package com.starkiller.core.model;

public enum DayRuleType {
    VERIFY_ORIGIN,
    VERIFY_MANIFEST,
    CHECK_FOR_CONTRABAND,
    CHECK_FOR_INTELLIGENCE,
    FORCE_INSPECTION,
    ACCESS_CODE_CHANGE
}
