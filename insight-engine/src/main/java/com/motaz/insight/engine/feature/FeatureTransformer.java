package com.motaz.insight.engine.feature;

import com.motaz.insight.engine.config.Aggregation;
import com.motaz.insight.engine.config.FeatureSpec;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.config.TransformKind;
import com.motaz.insight.engine.error.ConfigurationError;
import com.motaz.insight.engine.model.CleanedRecord;
import com.motaz.insight.engine.model.FeatureVector;
import com.motaz.insight.engine.model.FieldValue;
import com.motaz.insight.engine.stats.Stats;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Derives numeric feature vectors from cleaned records. Scaling statistics and
 * category sets are fit once over the whole batch; vectors come out in time
 * order when the schema has a time axis.
 */
@Slf4j
public class FeatureTransformer {

    public FeatureSet transform(List<CleanedRecord> records, RecordSchema schema, List<FeatureSpec> specs) {
        Optional<String> timeField = schema.resolveTimeField();
        boolean windowed = specs.stream().anyMatch(spec -> spec.kind() == TransformKind.WINDOWED_AGGREGATE);
        if (windowed && timeField.isEmpty()) {
            throw new ConfigurationError("windowed features need a time field in the schema");
        }
        List<CleanedRecord> ordered = timeField.map(field -> byTime(records, field)).orElse(records);

        Map<String, double[]> columns = new LinkedHashMap<>();
        Map<String, List<String>> outputsBySpec = new LinkedHashMap<>();
        Map<String, ScalingParams> scaling = new LinkedHashMap<>();
        for (FeatureSpec spec : specs) {
            Map<String, double[]> produced = switch (spec.kind()) {
                case SCALE -> scale(spec, ordered, scaling);
                case ONE_HOT -> oneHot(spec, ordered);
                case WINDOWED_AGGREGATE -> windowed(spec, ordered);
                case DATE_PART -> datePart(spec, ordered);
            };
            for (Map.Entry<String, double[]> column : produced.entrySet()) {
                if (columns.putIfAbsent(column.getKey(), column.getValue()) != null) {
                    throw new ConfigurationError("feature " + spec.name() + " produces " + column.getKey()
                            + " which an earlier feature already produced");
                }
            }
            outputsBySpec.put(spec.name(), List.copyOf(produced.keySet()));
        }

        List<String> names = List.copyOf(columns.keySet());
        List<FeatureVector> vectors = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            CleanedRecord record = ordered.get(i);
            Map<String, Double> features = new LinkedHashMap<>();
            for (String name : names) {
                features.put(name, columns.get(name)[i]);
            }
            Instant timestamp = timeField.map(record::instant).orElse(null);
            vectors.add(new FeatureVector(record.getRecordId(), timestamp, features));
        }
        log.info("Built {} feature vectors with {} features {}", vectors.size(), names.size(), names);
        return new FeatureSet(vectors, names, outputsBySpec, scaling);
    }

    private static List<CleanedRecord> byTime(List<CleanedRecord> records, String timeField) {
        Comparator<CleanedRecord> byInstant = Comparator.comparing(
                (CleanedRecord record) -> record.instant(timeField),
                Comparator.nullsLast(Comparator.naturalOrder()));
        return records.stream()
                .sorted(byInstant.thenComparing(CleanedRecord::getRecordId))
                .toList();
    }

    private Map<String, double[]> scale(FeatureSpec spec, List<CleanedRecord> records, Map<String, ScalingParams> params) {
        Map<String, double[]> out = new LinkedHashMap<>();
        for (String source : spec.sources()) {
            double[] values = meanFilled(records, source);
            ScalingParams fit = new ScalingParams(source, spec.scaling(), Stats.mean(values),
                    Stats.populationStd(values), Stats.min(values), Stats.max(values));
            String name = outputName(spec, source);
            params.put(name, fit);
            out.put(name, Arrays.stream(values).map(fit::apply).toArray());
        }
        return out;
    }

    private Map<String, double[]> oneHot(FeatureSpec spec, List<CleanedRecord> records) {
        String source = spec.sources().get(0);
        TreeSet<String> categories = new TreeSet<>();
        for (CleanedRecord record : records) {
            FieldValue value = record.field(source);
            if (value != null && value.isPresent()) {
                categories.add(value.canonical());
            }
        }
        Map<String, double[]> out = new LinkedHashMap<>();
        for (String category : categories) {
            double[] column = new double[records.size()];
            for (int i = 0; i < records.size(); i++) {
                FieldValue value = records.get(i).field(source);
                column[i] = value != null && value.isPresent() && category.equals(value.canonical()) ? 1.0 : 0.0;
            }
            out.put(spec.name() + "_" + category, column);
        }
        return out;
    }

    private Map<String, double[]> windowed(FeatureSpec spec, List<CleanedRecord> records) {
        Map<String, double[]> out = new LinkedHashMap<>();
        int size = spec.windowSize();
        for (String source : spec.sources()) {
            double[] values = meanFilled(records, source);
            double[] column = new double[values.length];
            for (int i = 0; i < values.length; i++) {
                int from = Math.max(0, i - size + 1);
                double[] window = Arrays.copyOfRange(values, from, i + 1);
                column[i] = spec.aggregation() == Aggregation.COUNT
                        ? presentCount(records, source, from, i + 1)
                        : aggregate(spec.aggregation(), window);
            }
            out.put(outputName(spec, source), column);
        }
        return out;
    }

    private Map<String, double[]> datePart(FeatureSpec spec, List<CleanedRecord> records) {
        String source = spec.sources().get(0);
        Double[] parts = new Double[records.size()];
        List<Double> present = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            Instant instant = records.get(i).instant(source);
            if (instant != null) {
                ZonedDateTime utc = instant.atZone(ZoneOffset.UTC);
                double part = switch (spec.datePart()) {
                    case YEAR -> utc.getYear();
                    case MONTH -> utc.getMonthValue();
                    case DAY_OF_MONTH -> utc.getDayOfMonth();
                    case DAY_OF_WEEK -> utc.getDayOfWeek().getValue();
                    case HOUR -> utc.getHour();
                };
                parts[i] = part;
                present.add(part);
            }
        }
        return Map.of(spec.name(), fill(parts, Stats.mean(Stats.toArray(present))));
    }

    private static double aggregate(Aggregation aggregation, double[] window) {
        return switch (aggregation) {
            case MEAN -> Stats.mean(window);
            case SUM -> Arrays.stream(window).sum();
            case MIN -> Stats.min(window);
            case MAX -> Stats.max(window);
            case STDDEV -> Stats.sampleStd(window);
            case COUNT -> window.length;
        };
    }

    private static double presentCount(List<CleanedRecord> records, String source, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            FieldValue value = records.get(i).field(source);
            if (value != null && value.isPresent()) {
                count++;
            }
        }
        return count;
    }

    /** Source column with absent values replaced by the column mean. */
    private static double[] meanFilled(List<CleanedRecord> records, String source) {
        Double[] raw = new Double[records.size()];
        List<Double> present = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            raw[i] = records.get(i).number(source);
            if (raw[i] != null) {
                present.add(raw[i]);
            }
        }
        return fill(raw, Stats.mean(Stats.toArray(present)));
    }

    private static double[] fill(Double[] raw, double replacement) {
        double[] filled = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            filled[i] = raw[i] == null ? replacement : raw[i];
        }
        return filled;
    }

    private static String outputName(FeatureSpec spec, String source) {
        return spec.sources().size() == 1 ? spec.name() : spec.name() + "_" + source;
    }
}
