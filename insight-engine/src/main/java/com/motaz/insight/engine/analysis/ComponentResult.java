package com.motaz.insight.engine.analysis;

import com.motaz.insight.engine.analysis.cluster.ClusterSummary;
import com.motaz.insight.engine.error.ConvergenceWarning;
import com.motaz.insight.engine.model.Finding;
import com.motaz.insight.engine.model.FindingKind;
import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ComponentResult {

    FindingKind kind;
    ComponentStatus status;
    String reason;
    @Builder.Default
    List<? extends Finding> findings = List.of();
    @Builder.Default
    List<ConvergenceWarning> warnings = List.of();
    ClusterSummary clusterSummary;

    public static ComponentResult completed(FindingKind kind, List<? extends Finding> findings) {
        return ComponentResult.builder().kind(kind).status(ComponentStatus.COMPLETED).findings(List.copyOf(findings)).build();
    }

    public static ComponentResult insufficient(FindingKind kind, String reason) {
        return ComponentResult.builder().kind(kind).status(ComponentStatus.DATA_INSUFFICIENT).reason(reason).build();
    }

    public static ComponentResult skipped(FindingKind kind, String reason) {
        return ComponentResult.builder().kind(kind).status(ComponentStatus.SKIPPED).reason(reason).build();
    }

    public static ComponentResult unavailable(FindingKind kind, String reason) {
        return ComponentResult.builder().kind(kind).status(ComponentStatus.UNAVAILABLE).reason(reason).build();
    }
}
