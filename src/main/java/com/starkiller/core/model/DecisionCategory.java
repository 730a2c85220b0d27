package com.starkiller.core.model;

public enum DecisionCategory {
    TACTICAL,
    FINANCIAL,
    POLITICAL,
    MORAL
}
