package com.motaz.insight.engine.config;

public enum Scaling {
    Z_SCORE,
    MIN_MAX
}
