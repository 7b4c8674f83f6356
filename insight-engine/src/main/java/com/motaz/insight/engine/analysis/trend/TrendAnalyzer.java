package com.motaz.insight.engine.analysis.trend;

import com.motaz.insight.engine.config.TrendConfig;
import com.motaz.insight.engine.error.DataInsufficientError;
import com.motaz.insight.engine.feature.FeatureSet;
import com.motaz.insight.engine.model.FeatureVector;
import com.motaz.insight.engine.model.TrendDirection;
import com.motaz.insight.engine.model.TrendFinding;
import com.motaz.insight.engine.stats.Stats;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Trend direction and seasonality of each configured feature over the
 * time-ordered vectors. Vectors without a timestamp are left out.
 */
@Slf4j
public class TrendAnalyzer {

    private final SeriesDecomposer decomposer = new SeriesDecomposer();

    public List<TrendFinding> analyze(FeatureSet features, TrendConfig config) {
        List<FeatureVector> timed = features.getVectors().stream()
                .filter(vector -> vector.getTimestamp() != null)
                .toList();
        List<String> names = features.outputsOf(config.features());
        List<TrendFinding> findings = new ArrayList<>();
        for (String name : names) {
            Series series = config.bucket() == null ? raw(timed, name) : bucketed(timed, name, config.bucket());
            if (series.values.length < config.minPoints()) {
                throw new DataInsufficientError("trend analysis of " + name, config.minPoints(), series.values.length);
            }
            findings.add(analyze(name, series, timed, config));
        }
        return findings;
    }

    private TrendFinding analyze(String name, Series series, List<FeatureVector> timed, TrendConfig config) {
        double[] values = series.values;
        int n = values.length;
        Decomposition decomposition = decomposer.decompose(values, config.maxPeriod(), config.seasonalityThreshold());

        double change = Math.abs(decomposition.getSlope() * (n - 1));
        double spread = Stats.populationStd(values);
        TrendDirection direction;
        if (change <= config.flatThreshold() * spread) {
            direction = TrendDirection.FLAT;
        } else {
            direction = decomposition.getSlope() > 0 ? TrendDirection.UP : TrendDirection.DOWN;
        }

        FeatureVector first = timed.get(0);
        FeatureVector last = timed.get(timed.size() - 1);
        TrendFinding finding = TrendFinding.builder()
                .feature(name)
                .firstRecordId(first.getRecordId())
                .lastRecordId(last.getRecordId())
                .from(first.getTimestamp())
                .to(last.getTimestamp())
                .points(n)
                .direction(direction)
                .slope(decomposition.getSlope())
                .score(decomposition.getRSquared())
                .seasonalityPeriod(decomposition.getPeriod())
                .seasonalityConfidence(decomposition.getPeriodAutocorrelation())
                .build();
        log.info("Trend of {} over {} points: direction={}, slope={}, r2={}, period={}",
                name, n, direction, String.format("%.6f", decomposition.getSlope()),
                String.format("%.4f", decomposition.getRSquared()), decomposition.getPeriod());
        return finding;
    }

    private static Series raw(List<FeatureVector> timed, String name) {
        return new Series(timed.stream().mapToDouble(vector -> vector.get(name)).toArray());
    }

    /** Averages values into {@code bucket}-wide windows from the first timestamp; empty windows are skipped. */
    private static Series bucketed(List<FeatureVector> timed, String name, Duration bucket) {
        if (timed.isEmpty()) {
            return new Series(new double[0]);
        }
        Instant origin = timed.get(0).getTimestamp();
        long width = bucket.toMillis();
        List<Double> means = new ArrayList<>();
        long current = -1;
        double sum = 0.0;
        int count = 0;
        for (FeatureVector vector : timed) {
            long index = Duration.between(origin, vector.getTimestamp()).toMillis() / width;
            if (index != current && count > 0) {
                means.add(sum / count);
                sum = 0.0;
                count = 0;
            }
            current = index;
            sum += vector.get(name);
            count++;
        }
        means.add(sum / count);
        return new Series(Stats.toArray(means));
    }

    private record Series(double[] values) {
    }
}
