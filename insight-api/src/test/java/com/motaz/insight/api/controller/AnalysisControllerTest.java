package com.motaz.insight.api.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motaz.insight.api.config.TraceIdFilter;
import com.motaz.insight.api.dto.AnalysisRequestDto;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.notNullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@AutoConfigureMockMvc
class AnalysisControllerTest {

    static final DateTimeFormatter TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Test
    void analyzesPostedRows() throws Exception {
        mockMvc.perform(post("/api/v1/analysis/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("line-3", readings(12)))))
                .andExpect(status().isOk())
                .andExpect(header().exists(TraceIdFilter.TRACE_ID_HEADER))
                .andExpect(jsonPath("$.runId", notNullValue()))
                .andExpect(jsonPath("$.outcome").value("SUCCESS"))
                .andExpect(jsonPath("$.result.source").value("line-3"))
                .andExpect(jsonPath("$.result.summary.recordsIn").value(12))
                .andExpect(jsonPath("$.result.components", hasSize(3)))
                .andExpect(jsonPath("$.result.components[0].component").value("ANOMALY"));
    }

    @Test
    void badRowsAreReportedNotRejected() throws Exception {
        List<Map<String, Object>> rows = readings(12);
        rows.get(4).put("value", "n/a");

        mockMvc.perform(post("/api/v1/analysis/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("line-3", rows))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.result.parseErrors", hasSize(1)))
                .andExpect(jsonPath("$.result.parseErrors[0].recordId").value("line-3#5"))
                .andExpect(jsonPath("$.result.cleaningReport.imputations").value(1));
    }

    @Test
    void emptyBatchIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/analysis/runs")
                        .header(TraceIdFilter.TRACE_ID_HEADER, "req-7")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(request("line-3", List.of()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.details.rows", notNullValue()))
                .andExpect(jsonPath("$.traceId").value("req-7"));
    }

    @Test
    void unreadableBodyIsAValidationError() throws Exception {
        mockMvc.perform(post("/api/v1/analysis/runs")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"source\": \"line-3\", \"rows\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }

    static AnalysisRequestDto request(String source, List<Map<String, Object>> rows) {
        AnalysisRequestDto request = new AnalysisRequestDto();
        request.setSource(source);
        request.setRows(rows);
        return request;
    }

    static List<Map<String, Object>> readings(int count) {
        LocalDateTime start = LocalDateTime.of(2024, 1, 1, 0, 0);
        List<Map<String, Object>> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            Map<String, Object> row = new LinkedHashMap<>();
            row.put("reading_id", "R" + i);
            row.put("sensor", i % 2 == 0 ? "a" : "b");
            row.put("value", 20.0 + (i % 4));
            row.put("ts", start.plusHours(i).format(TS));
            rows.add(row);
        }
        return rows;
    }
}
