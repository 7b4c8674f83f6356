package com.motaz.insight.engine.config;

import com.motaz.insight.engine.model.FieldType;
import com.motaz.insight.engine.model.FindingKind;
import com.motaz.insight.engine.normalize.ValueCoercer;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects every inconsistency of a {@link PipelineConfig}. Nothing here has
 * a default: a setting the selected strategy needs must be present.
 */
class ConfigValidator {

    private final PipelineConfig config;
    private final List<String> problems = new ArrayList<>();

    ConfigValidator(PipelineConfig config) {
        this.config = config;
    }

    List<String> problems() {
        RecordSchema schema = config.schema();
        if (schema == null) {
            problems.add("schema must be provided");
            return problems;
        }
        validateSchema(schema);
        if (config.cleaning() == null) {
            problems.add("cleaning policy must be provided");
        } else {
            validateCleaning(schema, config.cleaning());
        }
        Set<String> specNames = validateFeatures(schema);
        if (config.anomaly() != null) {
            validateAnomaly(config.anomaly(), specNames);
        }
        if (config.cluster() != null) {
            validateCluster(config.cluster(), specNames);
        }
        if (config.trend() != null) {
            validateTrend(config.trend(), specNames);
        }
        for (FindingKind kind : config.mandatory()) {
            boolean configured = switch (kind) {
                case ANOMALY -> config.anomaly() != null;
                case CLUSTER -> config.cluster() != null;
                case TREND -> config.trend() != null;
            };
            if (!configured) {
                problems.add(kind + " is mandatory but not configured");
            }
        }
        return problems;
    }

    private void validateSchema(RecordSchema schema) {
        if (schema.fields().isEmpty()) {
            problems.add("schema must declare at least one field");
        }
        Set<String> names = new HashSet<>();
        for (FieldDefinition field : schema.fields()) {
            if (field.name() == null || field.name().isBlank()) {
                problems.add("schema field without a name");
                continue;
            }
            if (!names.add(field.name())) {
                problems.add("schema field " + field.name() + " declared twice");
            }
            if (field.type() == null) {
                problems.add("schema field " + field.name() + " has no type");
            }
        }
        for (String key : schema.keyFields()) {
            if (!schema.declares(key)) {
                problems.add("key field " + key + " is not declared in the schema");
            }
        }
        if (schema.timeField() != null && !schema.timeField().isBlank()) {
            requireType(schema, schema.timeField(), "time field", EnumSet.of(FieldType.TIMESTAMP));
        }
        if (!schema.fieldsOfType(FieldType.TIMESTAMP).isEmpty() && schema.timestampFormats().isEmpty()) {
            problems.add("timestampFormats must be provided when TIMESTAMP fields are declared");
        }
        for (String pattern : schema.timestampFormats()) {
            try {
                DateTimeFormatter.ofPattern(pattern);
            } catch (IllegalArgumentException e) {
                problems.add("timestamp format '" + pattern + "' is invalid: " + e.getMessage());
            }
        }
    }

    private void validateCleaning(RecordSchema schema, CleaningPolicy policy) {
        if (policy.missingValueStrategy() == null) {
            problems.add("cleaning.missingValueStrategy must be provided");
        }
        if (policy.duplicateKey() == null) {
            problems.add("cleaning.duplicateKey must be provided");
        } else if (policy.duplicateKey() == DuplicateKey.EXPLICIT_KEY_FIELDS && schema.keyFields().isEmpty()) {
            problems.add("duplicateKey EXPLICIT_KEY_FIELDS requires schema.keyFields");
        }
        if (policy.outlierStrategy() == null) {
            problems.add("cleaning.outlierStrategy must be provided");
        } else if (policy.outlierStrategy() != OutlierStrategy.NONE) {
            Double percentile = policy.outlierPercentile();
            if (percentile == null || percentile <= 50 || percentile >= 100) {
                problems.add("cleaning.outlierPercentile must be in (50, 100) for " + policy.outlierStrategy());
            }
        }
        for (String field : policy.outlierFields()) {
            requireType(schema, field, "outlier field", EnumSet.of(FieldType.NUMERIC));
        }
        if (policy.missingValueStrategy() == MissingValueStrategy.IMPUTE_CONSTANT) {
            ValueCoercer coercer = new ValueCoercer(List.of());
            for (FieldDefinition field : schema.fields()) {
                if (field.type() == FieldType.TIMESTAMP || field.type() == null) {
                    continue;
                }
                String constant = policy.constants().get(field.name());
                if (constant == null) {
                    problems.add("IMPUTE_CONSTANT requires a constant for field " + field.name());
                } else if (!coercer.coerce(field.type(), constant).isPresent()) {
                    problems.add("constant '" + constant + "' is not a valid " + field.type() + " for field " + field.name());
                }
            }
        }
    }

    private Set<String> validateFeatures(RecordSchema schema) {
        Set<String> names = new HashSet<>();
        Map<String, String> outputs = new HashMap<>();
        if (config.features().isEmpty()) {
            problems.add("at least one feature must be specified");
        }
        for (FeatureSpec spec : config.features()) {
            String label = "feature " + spec.name();
            if (spec.name() == null || spec.name().isBlank()) {
                problems.add("feature without a name");
                continue;
            }
            if (!names.add(spec.name())) {
                problems.add(label + " specified twice");
            }
            if (spec.kind() == null) {
                problems.add(label + " has no kind");
                continue;
            }
            if (spec.sources().isEmpty()) {
                problems.add(label + " has no source field");
            }
            switch (spec.kind()) {
                case SCALE -> {
                    if (spec.scaling() == null) {
                        problems.add(label + " needs a scaling method");
                    }
                    spec.sources().forEach(source ->
                            requireType(schema, source, label + " source", EnumSet.of(FieldType.NUMERIC, FieldType.BOOLEAN)));
                }
                case ONE_HOT -> {
                    requireSingleSource(spec, label);
                    spec.sources().forEach(source ->
                            requireType(schema, source, label + " source", EnumSet.of(FieldType.CATEGORICAL, FieldType.BOOLEAN)));
                }
                case WINDOWED_AGGREGATE -> {
                    if (spec.aggregation() == null) {
                        problems.add(label + " needs an aggregation");
                    }
                    if (spec.windowSize() == null || spec.windowSize() < 1) {
                        problems.add(label + " needs a windowSize of at least 1");
                    }
                    if (schema.resolveTimeField().isEmpty()) {
                        problems.add(label + " is windowed but the schema declares no time field");
                    }
                    spec.sources().forEach(source ->
                            requireType(schema, source, label + " source", EnumSet.of(FieldType.NUMERIC, FieldType.BOOLEAN)));
                }
                case DATE_PART -> {
                    requireSingleSource(spec, label);
                    if (spec.datePart() == null) {
                        problems.add(label + " needs a datePart");
                    }
                    spec.sources().forEach(source ->
                            requireType(schema, source, label + " source", EnumSet.of(FieldType.TIMESTAMP)));
                }
            }
            for (String output : outputNames(spec)) {
                String owner = outputs.putIfAbsent(output, spec.name());
                if (owner != null && !owner.equals(spec.name())) {
                    problems.add(label + " output " + output + " collides with feature " + owner);
                }
            }
        }
        return names;
    }

    /** Output columns known before the data is seen; one-hot columns depend on the categories found. */
    private static List<String> outputNames(FeatureSpec spec) {
        return switch (spec.kind()) {
            case ONE_HOT -> List.of();
            case DATE_PART -> List.of(spec.name());
            case SCALE, WINDOWED_AGGREGATE -> spec.sources().size() == 1
                    ? List.of(spec.name())
                    : spec.sources().stream().map(source -> spec.name() + "_" + source).toList();
        };
    }

    private void validateAnomaly(AnomalyConfig anomaly, Set<String> specNames) {
        if (anomaly.strategy() == null) {
            problems.add("anomaly.strategy must be provided");
        }
        if (anomaly.threshold() == null || anomaly.threshold() < 0 || anomaly.threshold() > 1) {
            problems.add("anomaly.threshold must be provided within [0, 1]");
        }
        if (anomaly.strategy() == AnomalyStrategy.STATISTICAL) {
            if (anomaly.stdDevs() == null || anomaly.stdDevs() <= 0) {
                problems.add("anomaly.stdDevs must be positive for STATISTICAL");
            }
        }
        if (anomaly.strategy() == AnomalyStrategy.ISOLATION) {
            if (anomaly.trees() == null || anomaly.trees() < 1) {
                problems.add("anomaly.trees must be at least 1 for ISOLATION");
            }
            if (anomaly.subsampleSize() == null || anomaly.subsampleSize() < 2) {
                problems.add("anomaly.subsampleSize must be at least 2 for ISOLATION");
            }
            if (anomaly.seed() == null) {
                problems.add("anomaly.seed must be provided for ISOLATION");
            }
        }
        requireKnownFeatures("anomaly", anomaly.features(), specNames);
    }

    private void validateCluster(ClusterConfig cluster, Set<String> specNames) {
        if (cluster.autoSelect()) {
            Integer min = cluster.minClusters();
            Integer max = cluster.maxClusters();
            if (min == null || max == null || min < 2 || max < min) {
                problems.add("cluster needs clusters >= 1 or 2 <= minClusters <= maxClusters");
            }
        } else if (cluster.clusters() < 1) {
            problems.add("cluster.clusters must be at least 1");
        }
        if (cluster.maxIterations() == null || cluster.maxIterations() < 1) {
            problems.add("cluster.maxIterations must be at least 1");
        }
        if (cluster.epsilon() == null || cluster.epsilon() <= 0) {
            problems.add("cluster.epsilon must be positive");
        }
        if (cluster.seed() == null) {
            problems.add("cluster.seed must be provided");
        }
        requireKnownFeatures("cluster", cluster.features(), specNames);
    }

    private void validateTrend(TrendConfig trend, Set<String> specNames) {
        if (trend.features().isEmpty()) {
            problems.add("trend.features must name at least one feature");
        }
        requireKnownFeatures("trend", trend.features(), specNames);
        if (trend.minPoints() == null || trend.minPoints() < 4) {
            problems.add("trend.minPoints must be at least 4");
        }
        if (trend.seasonalityThreshold() == null || trend.seasonalityThreshold() <= 0 || trend.seasonalityThreshold() > 1) {
            problems.add("trend.seasonalityThreshold must be within (0, 1]");
        }
        if (trend.maxPeriod() == null || trend.maxPeriod() < 2) {
            problems.add("trend.maxPeriod must be at least 2");
        }
        if (trend.flatThreshold() == null || trend.flatThreshold() < 0) {
            problems.add("trend.flatThreshold must be zero or positive");
        }
        if (trend.bucket() != null && (trend.bucket().isNegative() || trend.bucket().isZero())) {
            problems.add("trend.bucket must be a positive duration");
        }
    }

    private void requireType(RecordSchema schema, String field, String label, Set<FieldType> allowed) {
        schema.field(field).ifPresentOrElse(definition -> {
            if (definition.type() != null && !allowed.contains(definition.type())) {
                problems.add(label + " " + field + " must be one of " + allowed + " but is " + definition.type());
            }
        }, () -> problems.add(label + " " + field + " is not declared in the schema"));
    }

    private void requireSingleSource(FeatureSpec spec, String label) {
        if (spec.sources().size() > 1) {
            problems.add(label + " takes exactly one source field");
        }
    }

    private void requireKnownFeatures(String section, List<String> features, Set<String> specNames) {
        for (String feature : features) {
            if (!specNames.contains(feature)) {
                problems.add(section + " refers to unknown feature " + feature);
            }
        }
    }
}
