package com.motaz.insight.engine.config;

public enum OutlierStrategy {
    NONE,
    CLIP_TO_PERCENTILE,
    DROP_RECORD
}
