package com.motaz.insight.engine.aggregate;

public enum RunOutcome {
    SUCCESS,
    SUCCESS_WITH_WARNINGS,
    FAILURE
}
