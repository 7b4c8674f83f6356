package com.motaz.insight.engine.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public final class ClusterFinding implements Finding {

    String recordId;
    int clusterId;
    double distance;
    double confidence;

    @Override
    public FindingKind getKind() {
        return FindingKind.CLUSTER;
    }

    @Override
    public List<String> getSubjectKeys() {
        return List.of(recordId);
    }

    @Override
    public double getScore() {
        return confidence;
    }
}
