package com.motaz.insight.engine.pipeline;

import com.motaz.insight.engine.aggregate.AnalysisAggregator;
import com.motaz.insight.engine.aggregate.RunReport;
import com.motaz.insight.engine.aggregate.StageOutputs;
import com.motaz.insight.engine.analysis.ComponentResult;
import com.motaz.insight.engine.analysis.ComponentStatus;
import com.motaz.insight.engine.analysis.anomaly.AnomalyDetector;
import com.motaz.insight.engine.analysis.cluster.ClusterAnalysis;
import com.motaz.insight.engine.analysis.cluster.ClusterAnalyzer;
import com.motaz.insight.engine.analysis.trend.TrendAnalyzer;
import com.motaz.insight.engine.clean.CleaningResult;
import com.motaz.insight.engine.clean.QualityCleaner;
import com.motaz.insight.engine.config.PipelineConfig;
import com.motaz.insight.engine.error.ConfigurationError;
import com.motaz.insight.engine.error.DataInsufficientError;
import com.motaz.insight.engine.error.ParseErrorLog;
import com.motaz.insight.engine.feature.FeatureSet;
import com.motaz.insight.engine.feature.FeatureTransformer;
import com.motaz.insight.engine.model.FindingKind;
import com.motaz.insight.engine.model.NormalizedRecord;
import com.motaz.insight.engine.model.RawRecord;
import com.motaz.insight.engine.normalize.RecordNormalizer;
import com.motaz.insight.engine.profile.DatasetProfile;
import com.motaz.insight.engine.profile.DatasetProfiler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.function.Supplier;

/**
 * Runs normalize, clean, profile and transform in order, then the three
 * analyzers concurrently, and hands everything to the aggregator. Stages
 * share nothing mutable: each one gets the previous stage's output and the
 * run's {@link PipelineConfig}.
 */
@Slf4j
@RequiredArgsConstructor
public class AnalysisPipeline {

    public static final String MDC_RUN_ID = "runId";

    private final RecordNormalizer normalizer;
    private final QualityCleaner cleaner;
    private final DatasetProfiler profiler;
    private final FeatureTransformer transformer;
    private final AnomalyDetector anomalyDetector;
    private final ClusterAnalyzer clusterAnalyzer;
    private final TrendAnalyzer trendAnalyzer;
    private final AnalysisAggregator aggregator;
    private final ExecutorService executor;

    public RunReport run(String source, List<RawRecord> records, PipelineConfig config) {
        String runId = UUID.randomUUID().toString();
        MDC.put(MDC_RUN_ID, runId);
        try {
            return execute(runId, source, records, config);
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    private RunReport execute(String runId, String source, List<RawRecord> records, PipelineConfig config) {
        Instant startedAt = Instant.now();
        log.info("Starting analysis run {} for source {} with {} records", runId, source, records.size());
        try {
            config.validate();
        } catch (ConfigurationError e) {
            log.error("Run {} rejected: {}", runId, e.getMessage());
            return RunReport.failure(runId, e.getMessage());
        }

        ParseErrorLog parseErrors = new ParseErrorLog();
        List<NormalizedRecord> normalized;
        CleaningResult cleaning;
        DatasetProfile profile;
        FeatureSet features;
        try {
            normalized = normalizer.normalizeAll(records, config.schema(), parseErrors);
            cleaning = cleaner.clean(normalized, config.schema(), config.cleaning());
            profile = profiler.profile(normalized, cleaning.getRecords(), config.schema());
            features = transformer.transform(cleaning.getRecords(), config.schema(), config.features());
        } catch (RuntimeException e) {
            log.error("Run {} failed before analysis", runId, e);
            return RunReport.failure(runId, "preparation failed: " + e.getMessage());
        }

        CompletableFuture<ComponentResult> anomaly = fork(FindingKind.ANOMALY, () -> analyzeAnomalies(features, config));
        CompletableFuture<ComponentResult> cluster = fork(FindingKind.CLUSTER, () -> analyzeClusters(features, config));
        CompletableFuture<ComponentResult> trend = fork(FindingKind.TREND, () -> analyzeTrends(features, config));
        CompletableFuture.allOf(anomaly, cluster, trend).join();

        StageOutputs outputs = StageOutputs.builder()
                .runId(runId)
                .source(source)
                .startedAt(startedAt)
                .recordsIn(records.size())
                .normalized(normalized)
                .parseErrors(parseErrors)
                .cleaning(cleaning)
                .profile(profile)
                .features(features)
                .components(List.of(anomaly.join(), cluster.join(), trend.join()))
                .mandatory(config.mandatory())
                .build();
        return aggregator.aggregate(outputs);
    }

    private ComponentResult analyzeAnomalies(FeatureSet features, PipelineConfig config) {
        if (config.anomaly() == null) {
            return ComponentResult.skipped(FindingKind.ANOMALY, "not configured");
        }
        return ComponentResult.completed(FindingKind.ANOMALY, anomalyDetector.detect(features, config.anomaly()));
    }

    private ComponentResult analyzeClusters(FeatureSet features, PipelineConfig config) {
        if (config.cluster() == null) {
            return ComponentResult.skipped(FindingKind.CLUSTER, "not configured");
        }
        ClusterAnalysis analysis = clusterAnalyzer.analyze(features, config.cluster());
        return ComponentResult.builder()
                .kind(FindingKind.CLUSTER)
                .status(ComponentStatus.COMPLETED)
                .findings(analysis.getFindings())
                .warnings(analysis.convergenceWarning().map(List::of).orElse(List.of()))
                .clusterSummary(analysis.getSummary())
                .build();
    }

    private ComponentResult analyzeTrends(FeatureSet features, PipelineConfig config) {
        if (config.trend() == null) {
            return ComponentResult.skipped(FindingKind.TREND, "not configured");
        }
        if (config.schema().resolveTimeField().isEmpty()) {
            log.info("stage=trend action=skip reason=no_time_axis");
            return ComponentResult.skipped(FindingKind.TREND, "no time axis");
        }
        return ComponentResult.completed(FindingKind.TREND, trendAnalyzer.analyze(features, config.trend()));
    }

    /**
     * Runs one analyzer on the executor with the caller's MDC. Too little data
     * becomes DATA_INSUFFICIENT and any other fault UNAVAILABLE; the future
     * itself never completes exceptionally.
     */
    private CompletableFuture<ComponentResult> fork(FindingKind kind, Supplier<ComponentResult> analysis) {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return CompletableFuture.supplyAsync(() -> {
            if (context != null) {
                MDC.setContextMap(context);
            }
            try {
                return analysis.get();
            } catch (DataInsufficientError e) {
                log.warn("stage={} action=data_insufficient reason=\"{}\"", stage(kind), e.getMessage());
                return ComponentResult.insufficient(kind, e.getMessage());
            } catch (RuntimeException e) {
                log.error("stage={} action=unavailable reason=\"{}\"", stage(kind), e.getMessage(), e);
                return ComponentResult.unavailable(kind, e.getClass().getSimpleName() + ": " + e.getMessage());
            } finally {
                MDC.clear();
            }
        }, executor).exceptionally(e -> {
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("stage={} action=unavailable reason=\"{}\"", stage(kind), cause.getMessage(), cause);
            return ComponentResult.unavailable(kind, cause.getClass().getSimpleName() + ": " + cause.getMessage());
        });
    }

    private static String stage(FindingKind kind) {
        return kind.name().toLowerCase();
    }
}
