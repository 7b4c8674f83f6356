package com.motaz.insight.engine.stats;

import smile.math.MathEx;

import java.util.Arrays;
import java.util.Collection;

/**
 * Batch statistics shared by the cleaning, feature and analysis stages.
 */
public final class Stats {

    private Stats() {
    }

    public static double[] toArray(Collection<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    public static double mean(double[] values) {
        return values.length == 0 ? 0.0 : MathEx.mean(values);
    }

    /** Population standard deviation (divides by n). */
    public static double populationStd(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double mean = mean(values);
        double sum = 0.0;
        for (double value : values) {
            double delta = value - mean;
            sum += delta * delta;
        }
        return Math.sqrt(sum / values.length);
    }

    /** Sample standard deviation (divides by n - 1); 0 below two values. */
    public static double sampleStd(double[] values) {
        return values.length < 2 ? 0.0 : MathEx.sd(values);
    }

    public static double median(double[] values) {
        return percentile(sorted(values), 50);
    }

    public static double[] sorted(double[] values) {
        double[] copy = values.clone();
        Arrays.sort(copy);
        return copy;
    }

    /**
     * Linear-interpolation percentile of an ascending array, {@code percentile}
     * in [0, 100].
     */
    public static double percentile(double[] sortedValues, double percentile) {
        if (sortedValues.length == 0) {
            return 0.0;
        }
        double index = percentile / 100.0 * (sortedValues.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sortedValues[lower];
        }
        double weight = index - lower;
        return sortedValues[lower] * (1 - weight) + sortedValues[upper] * weight;
    }

    /** Pearson correlation, or {@code null} when either side has no spread. */
    public static Double correlation(double[] x, double[] y) {
        if (x.length < 2 || populationStd(x) == 0.0 || populationStd(y) == 0.0) {
            return null;
        }
        return MathEx.cor(x, y);
    }

    public static double min(double[] values) {
        return values.length == 0 ? 0.0 : MathEx.min(values);
    }

    public static double max(double[] values) {
        return values.length == 0 ? 0.0 : MathEx.max(values);
    }
}
