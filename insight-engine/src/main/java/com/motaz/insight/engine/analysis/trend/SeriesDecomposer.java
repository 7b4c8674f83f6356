package com.motaz.insight.engine.analysis.trend;

import com.motaz.insight.engine.stats.Stats;

/**
 * Least-squares trend over the point index, then autocorrelation of the
 * detrended residuals to find a seasonal period.
 */
public class SeriesDecomposer {

    static final int MIN_LAG = 2;

    public Decomposition decompose(double[] series, int maxPeriod, double seasonalityThreshold) {
        int n = series.length;
        double meanX = (n - 1) / 2.0;
        double meanY = Stats.mean(series);
        double sxy = 0.0;
        double sxx = 0.0;
        for (int i = 0; i < n; i++) {
            sxy += (i - meanX) * (series[i] - meanY);
            sxx += (i - meanX) * (i - meanX);
        }
        double slope = sxx == 0.0 ? 0.0 : sxy / sxx;
        double intercept = meanY - slope * meanX;

        double[] trend = new double[n];
        double[] detrended = new double[n];
        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < n; i++) {
            trend[i] = intercept + slope * i;
            detrended[i] = series[i] - trend[i];
            ssRes += detrended[i] * detrended[i];
            ssTot += (series[i] - meanY) * (series[i] - meanY);
        }
        double rSquared = ssTot == 0.0 ? 0.0 : Math.max(0.0, 1.0 - ssRes / ssTot);

        Integer period = null;
        double best = 0.0;
        int maxLag = Math.min(maxPeriod, n / 2);
        for (int lag = MIN_LAG; lag <= maxLag; lag++) {
            double acf = autocorrelation(detrended, lag);
            if (acf >= seasonalityThreshold && acf > best) {
                best = acf;
                period = lag;
            }
        }

        double[] seasonal = new double[n];
        double[] residual = detrended.clone();
        if (period != null) {
            double[] phaseMeans = phaseMeans(detrended, period);
            for (int i = 0; i < n; i++) {
                seasonal[i] = phaseMeans[i % period];
                residual[i] = detrended[i] - seasonal[i];
            }
        }
        return new Decomposition(intercept, slope, rSquared, trend, seasonal, residual, period, best);
    }

    static double autocorrelation(double[] values, int lag) {
        double mean = Stats.mean(values);
        double denominator = 0.0;
        for (double value : values) {
            denominator += (value - mean) * (value - mean);
        }
        if (denominator == 0.0) {
            return 0.0;
        }
        double numerator = 0.0;
        for (int i = 0; i + lag < values.length; i++) {
            numerator += (values[i] - mean) * (values[i + lag] - mean);
        }
        return numerator / denominator;
    }

    private static double[] phaseMeans(double[] values, int period) {
        double[] sums = new double[period];
        int[] counts = new int[period];
        for (int i = 0; i < values.length; i++) {
            sums[i % period] += values[i];
            counts[i % period]++;
        }
        for (int p = 0; p < period; p++) {
            sums[p] = counts[p] == 0 ? 0.0 : sums[p] / counts[p];
        }
        return sums;
    }
}
