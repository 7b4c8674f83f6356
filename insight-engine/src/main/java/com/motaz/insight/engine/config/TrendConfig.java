package com.motaz.insight.engine.config;

import java.time.Duration;
import java.util.List;

public record TrendConfig(
        List<String> features,
        Integer minPoints,
        Double seasonalityThreshold,
        Integer maxPeriod,
        Double flatThreshold,
        Duration bucket
) {

    public TrendConfig {
        features = features == null ? List.of() : List.copyOf(features);
    }
}
