package com.motaz.insight.engine.analysis.cluster;

import com.motaz.insight.engine.config.ClusterConfig;
import com.motaz.insight.engine.error.ConvergenceWarning;
import com.motaz.insight.engine.error.DataInsufficientError;
import com.motaz.insight.engine.feature.FeatureSet;
import com.motaz.insight.engine.model.ClusterFinding;
import lombok.extern.slf4j.Slf4j;
import smile.math.MathEx;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Segments feature vectors with seeded k-means. With a cluster range, every k
 * in the range is fit from the same seed and the best mean silhouette wins.
 */
@Slf4j
public class ClusterAnalyzer {

    public ClusterAnalysis analyze(FeatureSet features, ClusterConfig config) {
        List<String> names = features.outputsOf(config.features());
        int minimum = config.autoSelect() ? config.minClusters() : config.clusters();
        if (features.size() < minimum) {
            throw new DataInsufficientError("clustering", minimum, features.size());
        }
        if (names.isEmpty()) {
            throw new DataInsufficientError("clustering features", 1, 0);
        }
        double[][] data = features.matrix(names);

        KMeans model;
        Double silhouette = null;
        if (config.autoSelect()) {
            model = null;
            int upper = Math.min(config.maxClusters(), data.length);
            for (int k = config.minClusters(); k <= upper; k++) {
                KMeans candidate = fit(data, k, config);
                double score = KMeans.silhouette(data, candidate.labels, k);
                log.info("k-means candidate k={} silhouette={}", k, String.format("%.4f", score));
                if (silhouette == null || score > silhouette) {
                    model = candidate;
                    silhouette = score;
                }
            }
        } else {
            model = fit(data, config.clusters(), config);
        }

        int k = model.centroids.length;
        ConvergenceWarning warning = null;
        if (!model.converged) {
            warning = new ConvergenceWarning(k, model.iterations, model.lastShift, config.epsilon());
            log.warn("stage=cluster action=convergence_warning reason=\"{}\"", warning.message());
        }

        List<ClusterFinding> findings = new ArrayList<>(data.length);
        for (int i = 0; i < data.length; i++) {
            findings.add(finding(features.getVectors().get(i).getRecordId(), data[i], model.labels[i], model));
        }
        ClusterSummary summary = ClusterSummary.builder()
                .clusters(k)
                .features(names)
                .centroids(Arrays.stream(model.centroids).map(ClusterAnalyzer::boxed).toList())
                .sizes(Arrays.stream(model.sizes()).boxed().toList())
                .iterations(model.iterations)
                .converged(model.converged)
                .silhouette(silhouette)
                .build();
        log.info("Clustered {} vectors into {} clusters, sizes={}, iterations={}",
                data.length, k, summary.getSizes(), model.iterations);
        return new ClusterAnalysis(findings, summary, warning);
    }

    private static KMeans fit(double[][] data, int k, ClusterConfig config) {
        return KMeans.fit(data, k, config.maxIterations(), config.epsilon(), new Random(config.seed()));
    }

    private static ClusterFinding finding(String recordId, double[] point, int label, KMeans model) {
        double nearest = MathEx.distance(point, model.centroids[label]);
        double runnerUp = Double.POSITIVE_INFINITY;
        for (int c = 0; c < model.centroids.length; c++) {
            if (c != label) {
                runnerUp = Math.min(runnerUp, MathEx.distance(point, model.centroids[c]));
            }
        }
        double confidence;
        if (runnerUp == Double.POSITIVE_INFINITY) {
            confidence = 1.0;
        } else {
            confidence = runnerUp == 0.0 ? 0.0 : (runnerUp - nearest) / runnerUp;
        }
        return ClusterFinding.builder()
                .recordId(recordId)
                .clusterId(label)
                .distance(nearest)
                .confidence(confidence)
                .build();
    }

    private static List<Double> boxed(double[] values) {
        return Arrays.stream(values).boxed().toList();
    }
}
