package com.motaz.insight.engine.analysis.anomaly;

import com.motaz.insight.engine.config.AnomalyConfig;
import com.motaz.insight.engine.config.AnomalyStrategy;
import com.motaz.insight.engine.error.ConfigurationError;
import com.motaz.insight.engine.error.DataInsufficientError;
import com.motaz.insight.engine.feature.FeatureSet;
import com.motaz.insight.engine.model.AnomalyFinding;
import com.motaz.insight.engine.model.FeatureVector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scores every feature vector with the configured strategy and flags those at
 * or above the threshold. One finding per vector, flagged or not.
 */
@Slf4j
public class AnomalyDetector {

    static final int MIN_VECTORS = 2;

    private final Map<AnomalyStrategy, AnomalyScorer> scorers = new EnumMap<>(AnomalyStrategy.class);

    public AnomalyDetector() {
        this(List.of(new ZScoreScorer(), new IsolationForestScorer()));
    }

    public AnomalyDetector(List<AnomalyScorer> scorers) {
        scorers.forEach(scorer -> this.scorers.put(scorer.strategy(), scorer));
    }

    public List<AnomalyFinding> detect(FeatureSet features, AnomalyConfig config) {
        AnomalyScorer scorer = scorers.get(config.strategy());
        if (scorer == null) {
            throw new ConfigurationError("no anomaly scorer for strategy " + config.strategy());
        }
        if (features.size() < MIN_VECTORS) {
            throw new DataInsufficientError("anomaly detection", MIN_VECTORS, features.size());
        }
        List<String> names = features.outputsOf(config.features());
        if (names.isEmpty()) {
            throw new DataInsufficientError("anomaly detection features", 1, 0);
        }

        List<AnomalyScorer.Score> scores = scorer.score(features.matrix(names), names, config);
        double threshold = config.threshold();
        List<AnomalyFinding> findings = new ArrayList<>(scores.size());
        int flagged = 0;
        for (int i = 0; i < scores.size(); i++) {
            FeatureVector vector = features.getVectors().get(i);
            AnomalyScorer.Score score = scores.get(i);
            boolean anomalous = score.value() >= threshold;
            if (anomalous) {
                flagged++;
                log.info("stage=anomaly record={} action=flag reason=score_{}_above_{} top_feature={}",
                        vector.getRecordId(), String.format("%.4f", score.value()), threshold, score.topFeature());
            }
            findings.add(AnomalyFinding.builder()
                    .recordId(vector.getRecordId())
                    .score(score.value())
                    .threshold(threshold)
                    .flagged(anomalous)
                    .strategy(config.strategy())
                    .topFeature(score.topFeature())
                    .build());
        }
        log.info("Anomaly detection ({}) scored {} vectors, {} flagged", config.strategy(), findings.size(), flagged);
        return findings;
    }
}
