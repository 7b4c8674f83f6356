package com.motaz.insight.engine.config;

public enum Aggregation {
    MEAN,
    SUM,
    MIN,
    MAX,
    COUNT,
    STDDEV
}
