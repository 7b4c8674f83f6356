package com.motaz.insight.engine.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.motaz.insight.engine.config.InsightProperties;
import com.motaz.insight.engine.config.PipelineConfig;
import com.motaz.insight.engine.pipeline.AnalysisPipeline;
import com.motaz.insight.engine.publish.JsonFileResultPublisher;
import com.motaz.insight.engine.publish.ResultPublisher;
import com.motaz.insight.engine.source.CsvRecordSource;
import com.motaz.insight.engine.source.RecordSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConditionalOnProperty(prefix = "insight.runner", name = "enabled", havingValue = "true")
public class BatchRunnerConfig {

    @Bean
    public BatchRunner batchRunner(AnalysisPipeline pipeline, PipelineConfig pipelineConfig,
                                   InsightProperties properties, List<ResultPublisher> publishers,
                                   ObjectMapper objectMapper) {
        List<RecordSource> sources = new ArrayList<>();
        properties.runner().sources().forEach((name, path) -> sources.add(new CsvRecordSource(name, Path.of(path))));

        List<ResultPublisher> allPublishers = new ArrayList<>(publishers);
        String reportDir = properties.runner().reportDir();
        if (reportDir != null && !reportDir.isBlank()) {
            allPublishers.add(new JsonFileResultPublisher(Path.of(reportDir), objectMapper));
        }
        return new BatchRunner(pipeline, pipelineConfig, sources, allPublishers);
    }
}
