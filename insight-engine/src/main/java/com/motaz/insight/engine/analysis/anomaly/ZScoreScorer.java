package com.motaz.insight.engine.analysis.anomaly;

import com.motaz.insight.engine.config.AnomalyConfig;
import com.motaz.insight.engine.config.AnomalyStrategy;
import com.motaz.insight.engine.stats.Stats;

import java.util.ArrayList;
import java.util.List;

public class ZScoreScorer implements AnomalyScorer {

    @Override
    public AnomalyStrategy strategy() {
        return AnomalyStrategy.STATISTICAL;
    }

    @Override
    public List<Score> score(double[][] rows, List<String> features, AnomalyConfig config) {
        int columns = features.size();
        double[] means = new double[columns];
        double[] stds = new double[columns];
        for (int j = 0; j < columns; j++) {
            double[] column = column(rows, j);
            means[j] = Stats.mean(column);
            stds[j] = Stats.populationStd(column);
        }

        double stdDevs = config.stdDevs();
        List<Score> scores = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            double worst = 0.0;
            String top = null;
            for (int j = 0; j < columns; j++) {
                double z = stds[j] == 0.0 ? 0.0 : Math.abs(row[j] - means[j]) / stds[j];
                if (top == null || z > worst) {
                    worst = z;
                    top = features.get(j);
                }
            }
            scores.add(new Score(worst / (worst + stdDevs), top));
        }
        return scores;
    }

    private static double[] column(double[][] rows, int j) {
        double[] column = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            column[i] = rows[i][j];
        }
        return column;
    }
}
