package com.motaz.insight.engine.analysis.anomaly;

import com.motaz.insight.engine.config.AnomalyConfig;
import com.motaz.insight.engine.config.AnomalyStrategy;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class IsolationForestScorer implements AnomalyScorer {

    @Override
    public AnomalyStrategy strategy() {
        return AnomalyStrategy.ISOLATION;
    }

    @Override
    public List<Score> score(double[][] rows, List<String> features, AnomalyConfig config) {
        log.info("Training isolation forest: trees={}, subsample={}, seed={}, rows={}",
                config.trees(), config.subsampleSize(), config.seed(), rows.length);
        IsolationForest forest = IsolationForest.fit(rows, config.trees(), config.subsampleSize(), config.seed());
        List<Score> scores = new ArrayList<>(rows.length);
        for (double[] row : rows) {
            scores.add(new Score(forest.score(row), null));
        }
        return scores;
    }
}
