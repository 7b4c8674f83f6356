package com.motaz.insight.engine.config;

import java.util.List;

public record FeatureSpec(
        String name,
        List<String> sources,
        TransformKind kind,
        Scaling scaling,
        Aggregation aggregation,
        Integer windowSize,
        DatePart datePart
) {

    public FeatureSpec {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }

    public static FeatureSpec scale(String name, String source, Scaling scaling) {
        return new FeatureSpec(name, List.of(source), TransformKind.SCALE, scaling, null, null, null);
    }

    public static FeatureSpec oneHot(String name, String source) {
        return new FeatureSpec(name, List.of(source), TransformKind.ONE_HOT, null, null, null, null);
    }

    public static FeatureSpec windowed(String name, String source, Aggregation aggregation, int windowSize) {
        return new FeatureSpec(name, List.of(source), TransformKind.WINDOWED_AGGREGATE, null, aggregation, windowSize, null);
    }

    public static FeatureSpec datePart(String name, String source, DatePart part) {
        return new FeatureSpec(name, List.of(source), TransformKind.DATE_PART, null, null, null, part);
    }
}
