package com.motaz.insight.engine.model;

public enum FindingKind {
    ANOMALY,
    CLUSTER,
    TREND
}
