package com.motaz.insight.engine.model;

import com.motaz.insight.engine.config.AnomalyStrategy;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public final class AnomalyFinding implements Finding {

    String recordId;
    double score;
    double threshold;
    boolean flagged;
    AnomalyStrategy strategy;
    String topFeature;

    @Override
    public FindingKind getKind() {
        return FindingKind.ANOMALY;
    }

    @Override
    public List<String> getSubjectKeys() {
        return List.of(recordId);
    }
}
