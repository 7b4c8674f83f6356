package com.motaz.insight.engine.config;

public enum MissingValueStrategy {
    DROP_RECORD,
    IMPUTE_MEAN,
    IMPUTE_MEDIAN,
    IMPUTE_CONSTANT
}
