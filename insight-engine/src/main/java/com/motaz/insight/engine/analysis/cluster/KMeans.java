package com.motaz.insight.engine.analysis.cluster;

import smile.math.MathEx;

import java.util.Random;

/**
 * Lloyd's k-means with k-means++ seeding. All randomness comes from the
 * caller's {@link Random}; a cluster that loses every member keeps its
 * previous centroid.
 */
final class KMeans {

    final double[][] centroids;
    final int[] labels;
    final int iterations;
    final boolean converged;
    final double lastShift;

    private KMeans(double[][] centroids, int[] labels, int iterations, boolean converged, double lastShift) {
        this.centroids = centroids;
        this.labels = labels;
        this.iterations = iterations;
        this.converged = converged;
        this.lastShift = lastShift;
    }

    static KMeans fit(double[][] data, int k, int maxIterations, double epsilon, Random random) {
        double[][] centroids = seed(data, k, random);
        int[] labels = new int[data.length];
        int iterations = 0;
        double shift = Double.POSITIVE_INFINITY;
        boolean converged = false;
        while (iterations < maxIterations) {
            iterations++;
            assign(data, centroids, labels);
            double[][] updated = update(data, labels, centroids);
            shift = 0.0;
            for (int c = 0; c < k; c++) {
                shift = Math.max(shift, MathEx.distance(centroids[c], updated[c]));
            }
            centroids = updated;
            if (shift < epsilon) {
                converged = true;
                break;
            }
        }
        assign(data, centroids, labels);
        return new KMeans(centroids, labels, iterations, converged, shift);
    }

    int[] sizes() {
        int[] sizes = new int[centroids.length];
        for (int label : labels) {
            sizes[label]++;
        }
        return sizes;
    }

    private static double[][] seed(double[][] data, int k, Random random) {
        double[][] centroids = new double[k][];
        centroids[0] = data[random.nextInt(data.length)].clone();
        double[] nearest = new double[data.length];
        for (int c = 1; c < k; c++) {
            double total = 0.0;
            for (int i = 0; i < data.length; i++) {
                double best = Double.POSITIVE_INFINITY;
                for (int j = 0; j < c; j++) {
                    best = Math.min(best, MathEx.squaredDistance(data[i], centroids[j]));
                }
                nearest[i] = best;
                total += best;
            }
            int pick;
            if (total == 0.0) {
                pick = random.nextInt(data.length);
            } else {
                double target = random.nextDouble() * total;
                pick = data.length - 1;
                double cumulative = 0.0;
                for (int i = 0; i < data.length; i++) {
                    cumulative += nearest[i];
                    if (cumulative > target) {
                        pick = i;
                        break;
                    }
                }
            }
            centroids[c] = data[pick].clone();
        }
        return centroids;
    }

    static void assign(double[][] data, double[][] centroids, int[] labels) {
        for (int i = 0; i < data.length; i++) {
            labels[i] = nearest(data[i], centroids);
        }
    }

    static int nearest(double[] point, double[][] centroids) {
        int best = 0;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int c = 0; c < centroids.length; c++) {
            double distance = MathEx.squaredDistance(point, centroids[c]);
            if (distance < bestDistance) {
                bestDistance = distance;
                best = c;
            }
        }
        return best;
    }

    private static double[][] update(double[][] data, int[] labels, double[][] previous) {
        int k = previous.length;
        int dims = previous[0].length;
        double[][] sums = new double[k][dims];
        int[] counts = new int[k];
        for (int i = 0; i < data.length; i++) {
            counts[labels[i]]++;
            for (int d = 0; d < dims; d++) {
                sums[labels[i]][d] += data[i][d];
            }
        }
        for (int c = 0; c < k; c++) {
            if (counts[c] == 0) {
                sums[c] = previous[c].clone();
            } else {
                for (int d = 0; d < dims; d++) {
                    sums[c][d] /= counts[c];
                }
            }
        }
        return sums;
    }

    /** Mean silhouette over all points; 0 for singleton members. */
    static double silhouette(double[][] data, int[] labels, int k) {
        if (data.length < 2) {
            return 0.0;
        }
        double total = 0.0;
        for (int i = 0; i < data.length; i++) {
            double[] sums = new double[k];
            int[] counts = new int[k];
            for (int j = 0; j < data.length; j++) {
                if (i != j) {
                    sums[labels[j]] += MathEx.distance(data[i], data[j]);
                    counts[labels[j]]++;
                }
            }
            int own = labels[i];
            if (counts[own] == 0) {
                continue;
            }
            double a = sums[own] / counts[own];
            double b = Double.POSITIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                if (c != own && counts[c] > 0) {
                    b = Math.min(b, sums[c] / counts[c]);
                }
            }
            if (b == Double.POSITIVE_INFINITY) {
                continue;
            }
            double max = Math.max(a, b);
            total += max == 0.0 ? 0.0 : (b - a) / max;
        }
        return total / data.length;
    }
}
