package com.motaz.insight.engine.publish;

import com.motaz.insight.engine.aggregate.AnalysisResult;
import com.motaz.insight.engine.aggregate.RunReport;
import com.motaz.insight.engine.aggregate.RunSummary;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class LoggingResultPublisher implements ResultPublisher {

    @Override
    public void publish(RunReport report) {
        if (report.isFailure()) {
            log.error("Run {} FAILED: {}", report.getRunId(), report.getReason());
            return;
        }
        AnalysisResult result = report.getResult();
        RunSummary summary = result.getSummary();
        log.info("Run {} on {} finished {}: in={}, cleaned={}, dropped={}, vectors={}, anomalies={}, clusters={}, trends={}",
                report.getRunId(), result.getSource(), report.getOutcome(), summary.getRecordsIn(),
                summary.getRecordsCleaned(), summary.getRecordsDropped(), summary.getFeatureVectors(),
                summary.getAnomaliesFlagged(), summary.getClustersFound(), summary.getTrendsDetected());
        result.getWarnings().forEach(warning -> log.warn("Run {} warning: {}", report.getRunId(), warning.getMessage()));
    }
}
