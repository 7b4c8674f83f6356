package com.motaz.insight.engine.config;

public enum TransformKind {
    SCALE,
    ONE_HOT,
    WINDOWED_AGGREGATE,
    DATE_PART
}
