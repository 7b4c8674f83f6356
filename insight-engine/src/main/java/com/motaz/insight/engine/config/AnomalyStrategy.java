package com.motaz.insight.engine.config;

public enum AnomalyStrategy {
    STATISTICAL,
    ISOLATION
}
