package com.starkiller.core.model;

public enum NarrativeBranch {
    NEUTRAL,
    IMPERIUM_PATH,
    INSURGENT_PATH,
    DOUBLE_CROSS,
    COMPLEX_RESISTANCE,
    SILENT_DEFIANCE
}
