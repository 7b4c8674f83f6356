package com.motaz.insight.engine;

import com.motaz.insight.engine.aggregate.AnalysisAggregator;
import com.motaz.insight.engine.analysis.anomaly.AnomalyDetector;
import com.motaz.insight.engine.analysis.cluster.ClusterAnalyzer;
import com.motaz.insight.engine.analysis.trend.TrendAnalyzer;
import com.motaz.insight.engine.clean.QualityCleaner;
import com.motaz.insight.engine.config.InsightProperties;
import com.motaz.insight.engine.config.PipelineConfig;
import com.motaz.insight.engine.error.ConfigurationError;
import com.motaz.insight.engine.feature.FeatureTransformer;
import com.motaz.insight.engine.normalize.RecordNormalizer;
import com.motaz.insight.engine.pipeline.AnalysisPipeline;
import com.motaz.insight.engine.profile.DatasetProfiler;
import com.motaz.insight.engine.publish.LoggingResultPublisher;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(InsightProperties.class)
public class EngineConfig {

    static final int ANALYSIS_THREADS = 3;

    @Bean
    public RecordNormalizer recordNormalizer() {
        return new RecordNormalizer();
    }

    @Bean
    public QualityCleaner qualityCleaner() {
        return new QualityCleaner();
    }

    @Bean
    public DatasetProfiler datasetProfiler() {
        return new DatasetProfiler();
    }

    @Bean
    public FeatureTransformer featureTransformer() {
        return new FeatureTransformer();
    }

    @Bean
    public AnomalyDetector anomalyDetector() {
        return new AnomalyDetector();
    }

    @Bean
    public ClusterAnalyzer clusterAnalyzer() {
        return new ClusterAnalyzer();
    }

    @Bean
    public TrendAnalyzer trendAnalyzer() {
        return new TrendAnalyzer();
    }

    @Bean
    public AnalysisAggregator analysisAggregator() {
        return new AnalysisAggregator();
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService analysisExecutor() {
        return Executors.newFixedThreadPool(ANALYSIS_THREADS, new CustomizableThreadFactory("analysis-"));
    }

    @Bean
    public AnalysisPipeline analysisPipeline(RecordNormalizer normalizer, QualityCleaner cleaner,
                                             DatasetProfiler profiler, FeatureTransformer transformer,
                                             AnomalyDetector anomalyDetector, ClusterAnalyzer clusterAnalyzer,
                                             TrendAnalyzer trendAnalyzer, AnalysisAggregator aggregator,
                                             ExecutorService analysisExecutor) {
        return new AnalysisPipeline(normalizer, cleaner, profiler, transformer, anomalyDetector,
                clusterAnalyzer, trendAnalyzer, aggregator, analysisExecutor);
    }

    @Bean
    public PipelineConfig pipelineConfig(InsightProperties properties) {
        if (properties.pipeline() == null) {
            throw new ConfigurationError("insight.pipeline must be configured");
        }
        return properties.pipeline();
    }

    @Bean
    public LoggingResultPublisher loggingResultPublisher() {
        return new LoggingResultPublisher();
    }
}
