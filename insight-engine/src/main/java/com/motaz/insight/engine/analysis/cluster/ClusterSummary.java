package com.motaz.insight.engine.analysis.cluster;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ClusterSummary {

    int clusters;
    List<String> features;
    List<List<Double>> centroids;
    List<Integer> sizes;
    int iterations;
    boolean converged;
    Double silhouette;
}
