package com.motaz.insight.api.controller;

import com.motaz.insight.api.dto.AnalysisRequestDto;
import com.motaz.insight.api.dto.AnalysisResponseDto;
import com.motaz.insight.api.services.AnalysisRunService;
import com.motaz.insight.engine.aggregate.RunOutcome;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/analysis")
@RequiredArgsConstructor
public class AnalysisController {
    private final AnalysisRunService analysisRunService;

    @Operation(summary = "Normalize, clean and analyze a batch of rows",
            description = "Returns 200 with the analysis result, or 422 when the run failed")
    @PostMapping("/runs")
    public ResponseEntity<AnalysisResponseDto> run(
            @Parameter(description = "Rows keyed by field name plus their source tag", required = true)
            @Valid @RequestBody AnalysisRequestDto request) {
        AnalysisResponseDto response = analysisRunService.analyze(request);
        HttpStatus status = response.getOutcome() == RunOutcome.FAILURE ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }
}
