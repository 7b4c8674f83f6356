package com.motaz.insight.engine.aggregate;

import com.motaz.insight.engine.analysis.ComponentResult;
import com.motaz.insight.engine.analysis.ComponentStatus;
import com.motaz.insight.engine.analysis.cluster.ClusterSummary;
import com.motaz.insight.engine.error.QualityWarning;
import com.motaz.insight.engine.model.AnomalyFinding;
import com.motaz.insight.engine.model.Finding;
import com.motaz.insight.engine.model.TrendDirection;
import com.motaz.insight.engine.model.TrendFinding;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Merges the analyzer outputs into one {@link AnalysisResult} and decides the
 * run outcome. A mandatory analyzer that is UNAVAILABLE fails the run; any
 * other warning downgrades it to SUCCESS_WITH_WARNINGS.
 */
@Slf4j
public class AnalysisAggregator {

    private final Clock clock;

    public AnalysisAggregator() {
        this(Clock.systemUTC());
    }

    public AnalysisAggregator(Clock clock) {
        this.clock = clock;
    }

    public RunReport aggregate(StageOutputs outputs) {
        List<ComponentResult> components = outputs.getComponents().stream()
                .sorted(Comparator.comparing(ComponentResult::getKind))
                .toList();

        List<String> failedMandatory = components.stream()
                .filter(component -> component.getStatus() == ComponentStatus.UNAVAILABLE)
                .filter(component -> outputs.getMandatory().contains(component.getKind()))
                .map(component -> component.getKind() + ": " + component.getReason())
                .toList();
        if (!failedMandatory.isEmpty()) {
            String reason = "mandatory analysis unavailable (" + String.join("; ", failedMandatory) + ")";
            log.error("Run {} failed: {}", outputs.getRunId(), reason);
            return RunReport.failure(outputs.getRunId(), reason);
        }

        List<Finding> findings = new ArrayList<>();
        List<QualityWarning> warnings = new ArrayList<>();
        List<ComponentReport> reports = new ArrayList<>();
        ClusterSummary clusterSummary = null;
        for (ComponentResult component : components) {
            findings.addAll(component.getFindings());
            component.getWarnings().forEach(warning -> warnings.add(QualityWarning.of(warning)));
            if (component.getStatus() == ComponentStatus.UNAVAILABLE) {
                warnings.add(QualityWarning.unavailable(component.getKind(), component.getReason()));
            }
            if (component.getClusterSummary() != null) {
                clusterSummary = component.getClusterSummary();
            }
            reports.add(new ComponentReport(component.getKind(), component.getStatus(), component.getReason(),
                    component.getFindings().size(), outputs.getMandatory().contains(component.getKind())));
        }

        RunSummary summary = RunSummary.builder()
                .recordsIn(outputs.getRecordsIn())
                .recordsWithInvalidFields((int) outputs.getNormalized().stream().filter(r -> r.hasInvalidFields()).count())
                .recordsCleaned(outputs.getCleaning().getReport().getRecordsOut())
                .recordsDropped(outputs.getCleaning().getReport().droppedTotal())
                .featureVectors(outputs.getFeatures().size())
                .anomaliesFlagged((int) findings.stream()
                        .filter(f -> f instanceof AnomalyFinding anomaly && anomaly.isFlagged()).count())
                .clustersFound(clusterSummary == null ? 0 : clusterSummary.getClusters())
                .trendsDetected((int) findings.stream()
                        .filter(f -> f instanceof TrendFinding trend
                                && (trend.getDirection() != TrendDirection.FLAT || trend.isSeasonal()))
                        .count())
                .warnings(warnings.size())
                .build();

        AnalysisResult result = AnalysisResult.builder()
                .runId(outputs.getRunId())
                .source(outputs.getSource())
                .startedAt(outputs.getStartedAt())
                .finishedAt(clock.instant())
                .findings(List.copyOf(findings))
                .cleaningReport(outputs.getCleaning().getReport())
                .parseErrors(outputs.getParseErrors().entries())
                .profile(outputs.getProfile())
                .clusterSummary(clusterSummary)
                .components(List.copyOf(reports))
                .warnings(List.copyOf(warnings))
                .summary(summary)
                .build();

        RunOutcome outcome = warnings.isEmpty() ? RunOutcome.SUCCESS : RunOutcome.SUCCESS_WITH_WARNINGS;
        String reason = warnings.isEmpty() ? null
                : warnings.stream().map(QualityWarning::getMessage).collect(Collectors.joining("; "));
        log.info("Run {} finished with {}: {}", outputs.getRunId(), outcome, summary);
        return new RunReport(outputs.getRunId(), outcome, reason, result);
    }
}
