package com.motaz.insight.engine.runner;

import com.motaz.insight.engine.aggregate.RunOutcome;
import com.motaz.insight.engine.aggregate.RunReport;
import com.motaz.insight.engine.config.PipelineConfig;
import com.motaz.insight.engine.model.RawRecord;
import com.motaz.insight.engine.pipeline.AnalysisPipeline;
import com.motaz.insight.engine.publish.ResultPublisher;
import com.motaz.insight.engine.source.RecordSource;
import com.motaz.insight.engine.source.SourceReadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;

import java.util.ArrayList;
import java.util.List;

@Slf4j
@RequiredArgsConstructor
public class BatchRunner implements ApplicationRunner, ExitCodeGenerator {

    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_WARNINGS = 2;

    private final AnalysisPipeline pipeline;
    private final PipelineConfig pipelineConfig;
    private final List<RecordSource> sources;
    private final List<ResultPublisher> publishers;

    private final List<String> succeeded = new ArrayList<>();
    private final List<String> failed = new ArrayList<>();
    private boolean warnings;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Batch run over {} sources...", sources.size());
        for (RecordSource source : sources) {
            runSource(source);
        }
        log.info("Batch run completed. Success: {} Failed: {}",
                succeeded.isEmpty() ? "None" : succeeded, failed.isEmpty() ? "None" : failed);
    }

    private void runSource(RecordSource source) {
        List<RawRecord> records;
        try {
            records = source.read();
        } catch (SourceReadException e) {
            log.error("Source {} could not be read", source.name(), e);
            failed.add(source.name() + " (read)");
            return;
        }

        RunReport report = pipeline.run(source.name(), records, pipelineConfig);
        boolean published = publish(report);
        if (report.isFailure() || !published) {
            failed.add(source.name() + (report.isFailure() ? " (analysis)" : " (publish)"));
            return;
        }
        warnings |= report.getOutcome() == RunOutcome.SUCCESS_WITH_WARNINGS;
        succeeded.add(source.name());
    }

    private boolean publish(RunReport report) {
        boolean ok = true;
        for (ResultPublisher publisher : publishers) {
            try {
                publisher.publish(report);
            } catch (RuntimeException e) {
                log.error("Publisher {} failed for run {}", publisher.getClass().getSimpleName(), report.getRunId(), e);
                ok = false;
            }
        }
        return ok;
    }

    @Override
    public int getExitCode() {
        if (!failed.isEmpty()) {
            return EXIT_FAILURE;
        }
        return warnings ? EXIT_WARNINGS : EXIT_SUCCESS;
    }

    List<String> succeededSources() {
        return List.copyOf(succeeded);
    }

    List<String> failedSources() {
        return List.copyOf(failed);
    }
}
