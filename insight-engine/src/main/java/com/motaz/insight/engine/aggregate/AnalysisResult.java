package com.motaz.insight.engine.aggregate;

import com.motaz.insight.engine.analysis.cluster.ClusterSummary;
import com.motaz.insight.engine.clean.CleaningReport;
import com.motaz.insight.engine.error.ParseError;
import com.motaz.insight.engine.error.QualityWarning;
import com.motaz.insight.engine.model.Finding;
import com.motaz.insight.engine.model.FindingKind;
import com.motaz.insight.engine.profile.DatasetProfile;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class AnalysisResult {

    String runId;
    String source;
    Instant startedAt;
    Instant finishedAt;
    List<Finding> findings;
    CleaningReport cleaningReport;
    List<ParseError> parseErrors;
    DatasetProfile profile;
    ClusterSummary clusterSummary;
    List<ComponentReport> components;
    List<QualityWarning> warnings;
    RunSummary summary;

    public List<Finding> findingsOf(FindingKind kind) {
        return findings.stream().filter(finding -> finding.getKind() == kind).toList();
    }
}
