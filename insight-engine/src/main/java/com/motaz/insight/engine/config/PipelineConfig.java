package com.motaz.insight.engine.config;

import com.motaz.insight.engine.error.ConfigurationError;
import com.motaz.insight.engine.model.FindingKind;

import java.util.List;
import java.util.Set;

/**
 * Everything one run needs, passed explicitly to every stage. An absent
 * analysis section disables that analyzer.
 */
public record PipelineConfig(
        RecordSchema schema,
        CleaningPolicy cleaning,
        List<FeatureSpec> features,
        AnomalyConfig anomaly,
        ClusterConfig cluster,
        TrendConfig trend,
        Set<FindingKind> mandatory
) {

    public PipelineConfig {
        features = features == null ? List.of() : List.copyOf(features);
        mandatory = mandatory == null ? Set.of() : Set.copyOf(mandatory);
    }

    public boolean isMandatory(FindingKind kind) {
        return mandatory.contains(kind);
    }

    /**
     * @throws ConfigurationError listing every problem found
     */
    public void validate() {
        List<String> problems = new ConfigValidator(this).problems();
        if (!problems.isEmpty()) {
            throw new ConfigurationError(problems);
        }
    }
}
