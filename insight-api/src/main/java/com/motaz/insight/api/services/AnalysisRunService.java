package com.motaz.insight.api.services;

import com.motaz.insight.api.dto.AnalysisRequestDto;
import com.motaz.insight.api.dto.AnalysisResponseDto;
import com.motaz.insight.engine.aggregate.RunReport;
import com.motaz.insight.engine.config.PipelineConfig;
import com.motaz.insight.engine.model.RawRecord;
import com.motaz.insight.engine.pipeline.AnalysisPipeline;
import com.motaz.insight.engine.publish.ResultPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Slf4j
@Service
@RequiredArgsConstructor
public class AnalysisRunService {

    private final AnalysisPipeline pipeline;
    private final PipelineConfig pipelineConfig;
    private final List<ResultPublisher> publishers;

    public AnalysisResponseDto analyze(AnalysisRequestDto request) {
        log.info("---Start analysis of {} rows from source {}", request.getRows().size(), request.getSource());
        pipelineConfig.validate();

        Instant ingestedAt = Instant.now();
        List<RawRecord> records = new ArrayList<>(request.getRows().size());
        for (int i = 0; i < request.getRows().size(); i++) {
            Map<String, Object> row = request.getRows().get(i);
            records.add(new RawRecord(request.getSource(), i + 1, ingestedAt, row == null ? Map.of() : row));
        }

        RunReport report = pipeline.run(request.getSource(), records, pipelineConfig);
        publishers.forEach(publisher -> publisher.publish(report));
        return AnalysisResponseDto.builder()
                .runId(report.getRunId())
                .outcome(report.getOutcome())
                .reason(report.getReason())
                .result(report.getResult())
                .build();
    }
}
