package com.motaz.insight.engine.config;

import java.util.List;

public record AnomalyConfig(
        AnomalyStrategy strategy,
        Double threshold,
        Double stdDevs,
        Integer trees,
        Integer subsampleSize,
        Long seed,
        List<String> features
) {

    public AnomalyConfig {
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static AnomalyConfig statistical(double threshold, double stdDevs) {
        return new AnomalyConfig(AnomalyStrategy.STATISTICAL, threshold, stdDevs, null, null, null, List.of());
    }

    public static AnomalyConfig isolation(double threshold, int trees, int subsampleSize, long seed) {
        return new AnomalyConfig(AnomalyStrategy.ISOLATION, threshold, null, trees, subsampleSize, seed, List.of());
    }
}
