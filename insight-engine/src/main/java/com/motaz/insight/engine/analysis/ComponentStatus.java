package com.motaz.insight.engine.analysis;

public enum ComponentStatus {
    COMPLETED,
    DATA_INSUFFICIENT,
    SKIPPED,
    UNAVAILABLE
}
