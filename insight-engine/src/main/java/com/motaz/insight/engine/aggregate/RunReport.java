package com.motaz.insight.engine.aggregate;

import lombok.Value;

@Value
public class RunReport {

    String runId;
    RunOutcome outcome;
    String reason;
    AnalysisResult result;

    public static RunReport failure(String runId, String reason) {
        return new RunReport(runId, RunOutcome.FAILURE, reason, null);
    }

    public boolean isFailure() {
        return outcome == RunOutcome.FAILURE;
    }
}
