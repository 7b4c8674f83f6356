package com.motaz.insight.engine.analysis.anomaly;

import com.motaz.insight.engine.config.AnomalyConfig;
import com.motaz.insight.engine.config.AnomalyStrategy;

import java.util.List;

public interface AnomalyScorer {

    AnomalyStrategy strategy();

    List<Score> score(double[][] rows, List<String> features, AnomalyConfig config);

    record Score(double value, String topFeature) {
    }
}
