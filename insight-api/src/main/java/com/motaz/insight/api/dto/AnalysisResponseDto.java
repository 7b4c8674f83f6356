package com.motaz.insight.api.dto;

import com.motaz.insight.engine.aggregate.AnalysisResult;
import com.motaz.insight.engine.aggregate.RunOutcome;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class AnalysisResponseDto {
    private String runId;
    private RunOutcome outcome;
    private String reason;
    private AnalysisResult result;
}
