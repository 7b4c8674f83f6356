package com.motaz.insight.engine.config;

import java.util.List;

public record ClusterConfig(
        Integer clusters,
        Integer minClusters,
        Integer maxClusters,
        Integer maxIterations,
        Double epsilon,
        Long seed,
        List<String> features
) {

    public ClusterConfig {
        features = features == null ? List.of() : List.copyOf(features);
    }

    public static ClusterConfig fixed(int clusters, int maxIterations, double epsilon, long seed) {
        return new ClusterConfig(clusters, null, null, maxIterations, epsilon, seed, List.of());
    }

    public static ClusterConfig auto(int minClusters, int maxClusters, int maxIterations, double epsilon, long seed) {
        return new ClusterConfig(null, minClusters, maxClusters, maxIterations, epsilon, seed, List.of());
    }

    public boolean autoSelect() {
        return clusters == null;
    }
}
