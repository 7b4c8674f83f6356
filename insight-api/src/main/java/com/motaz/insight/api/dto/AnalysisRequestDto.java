package com.motaz.insight.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;

import java.util.List;
import java.util.Map;

@Data
public class AnalysisRequestDto {
    @NotBlank
    private String source;
    @NotEmpty
    private List<Map<String, Object>> rows;
}
