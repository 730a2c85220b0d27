package com.starkiller.core.model;

public enum EndingPath {
    NONE,
    REBEL,
    IMPERIAL,
    NEUTRAL,
    CORRUPT
}
