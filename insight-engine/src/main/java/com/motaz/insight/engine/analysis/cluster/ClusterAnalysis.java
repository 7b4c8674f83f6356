package com.motaz.insight.engine.analysis.cluster;

import com.motaz.insight.engine.error.ConvergenceWarning;
import com.motaz.insight.engine.model.ClusterFinding;
import lombok.Value;

import java.util.List;
import java.util.Optional;

@Value
public class ClusterAnalysis {

    List<ClusterFinding> findings;
    ClusterSummary summary;
    ConvergenceWarning warning;

    public Optional<ConvergenceWarning> convergenceWarning() {
        return Optional.ofNullable(warning);
    }
}
