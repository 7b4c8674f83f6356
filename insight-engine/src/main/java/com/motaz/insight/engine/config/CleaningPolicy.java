package com.motaz.insight.engine.config;

import java.util.List;
import java.util.Map;

public record CleaningPolicy(
        MissingValueStrategy missingValueStrategy,
        DuplicateKey duplicateKey,
        OutlierStrategy outlierStrategy,
        Double outlierPercentile,
        Boolean clipLowerTail,
        List<String> outlierFields,
        Map<String, String> constants
) {

    public CleaningPolicy {
        outlierFields = outlierFields == null ? List.of() : List.copyOf(outlierFields);
        constants = constants == null ? Map.of() : Map.copyOf(constants);
    }

    public boolean lowerTailClipped() {
        return Boolean.TRUE.equals(clipLowerTail);
    }
}
