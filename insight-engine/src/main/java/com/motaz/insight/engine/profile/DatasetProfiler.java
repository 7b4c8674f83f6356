package com.motaz.insight.engine.profile;

import com.motaz.insight.engine.config.FieldDefinition;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.model.CleanedRecord;
import com.motaz.insight.engine.model.FieldType;
import com.motaz.insight.engine.model.FieldValue;
import com.motaz.insight.engine.model.NormalizedRecord;
import com.motaz.insight.engine.stats.Stats;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class DatasetProfiler {

    public DatasetProfile profile(List<NormalizedRecord> normalized, List<CleanedRecord> cleaned, RecordSchema schema) {
        List<FieldProfile> fields = new ArrayList<>();
        List<String> numericFields = new ArrayList<>();
        for (FieldDefinition definition : schema.fields()) {
            String name = definition.name();
            int missing = 0;
            int invalid = 0;
            for (NormalizedRecord record : normalized) {
                FieldValue value = record.field(name);
                if (value.getValue() == null && value.getRawText() == null) {
                    missing++;
                } else if (!value.isValid()) {
                    invalid++;
                }
            }
            FieldProfile.NumericSummary summary = null;
            if (definition.type() == FieldType.NUMERIC) {
                double[] values = cleaned.stream()
                        .map(record -> record.number(name))
                        .filter(value -> value != null)
                        .mapToDouble(Double::doubleValue)
                        .toArray();
                summary = new FieldProfile.NumericSummary(values.length, Stats.mean(values),
                        Stats.sampleStd(values), Stats.min(values), Stats.max(values));
                numericFields.add(name);
            }
            fields.add(FieldProfile.builder()
                    .field(name)
                    .type(definition.type())
                    .missing(missing)
                    .invalid(invalid)
                    .numeric(summary)
                    .build());
        }
        return new DatasetProfile(fields, correlations(cleaned, numericFields));
    }

    private static Map<String, Map<String, Double>> correlations(List<CleanedRecord> cleaned, List<String> numeric) {
        Map<String, Map<String, Double>> matrix = new LinkedHashMap<>();
        for (String left : numeric) {
            Map<String, Double> row = new LinkedHashMap<>();
            for (String right : numeric) {
                List<double[]> pairs = new ArrayList<>();
                for (CleanedRecord record : cleaned) {
                    Double x = record.number(left);
                    Double y = record.number(right);
                    if (x != null && y != null) {
                        pairs.add(new double[]{x, y});
                    }
                }
                double[] xs = pairs.stream().mapToDouble(pair -> pair[0]).toArray();
                double[] ys = pairs.stream().mapToDouble(pair -> pair[1]).toArray();
                row.put(right, Stats.correlation(xs, ys));
            }
            matrix.put(left, row);
        }
        log.debug("Correlation matrix over {} numeric fields", numeric.size());
        return matrix;
    }
}
