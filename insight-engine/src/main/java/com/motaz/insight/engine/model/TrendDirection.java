package com.motaz.insight.engine.model;

public enum TrendDirection {
    UP,
    DOWN,
    FLAT
}
