package com.motaz.insight.engine.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public final class TrendFinding implements Finding {

    String feature;
    String firstRecordId;
    String lastRecordId;
    Instant from;
    Instant to;
    int points;
    TrendDirection direction;
    double slope;
    double score;
    Integer seasonalityPeriod;
    double seasonalityConfidence;

    public boolean isSeasonal() {
        return seasonalityPeriod != null;
    }

    @Override
    public FindingKind getKind() {
        return FindingKind.TREND;
    }

    @Override
    public List<String> getSubjectKeys() {
        return List.of(firstRecordId, lastRecordId);
    }
}
