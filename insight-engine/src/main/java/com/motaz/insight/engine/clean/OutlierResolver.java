package com.motaz.insight.engine.clean;

import com.motaz.insight.engine.config.CleaningPolicy;
import com.motaz.insight.engine.config.FieldDefinition;
import com.motaz.insight.engine.config.OutlierStrategy;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.model.FieldType;
import com.motaz.insight.engine.model.FieldValue;
import com.motaz.insight.engine.model.NormalizedRecord;
import com.motaz.insight.engine.stats.Stats;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Clips or drops numeric values outside percentile bounds. Bounds are taken
 * from the batch after duplicate and missing-value resolution.
 */
class OutlierResolver {

    List<NormalizedRecord> resolve(List<NormalizedRecord> records, RecordSchema schema, CleaningPolicy policy,
                                   CleaningLedger ledger) {
        if (policy.outlierStrategy() == OutlierStrategy.NONE || records.isEmpty()) {
            return records;
        }
        Map<String, double[]> bounds = new LinkedHashMap<>();
        for (String field : outlierFields(schema, policy)) {
            double[] sorted = Stats.sorted(records.stream()
                    .map(record -> record.field(field))
                    .filter(FieldValue::isPresent)
                    .mapToDouble(FieldValue::asNumber)
                    .toArray());
            if (sorted.length == 0) {
                continue;
            }
            double percentile = policy.outlierPercentile();
            double upper = Stats.percentile(sorted, percentile);
            double lower = policy.lowerTailClipped() ? Stats.percentile(sorted, 100 - percentile) : Double.NEGATIVE_INFINITY;
            bounds.put(field, new double[]{lower, upper});
        }

        List<NormalizedRecord> kept = new ArrayList<>(records.size());
        for (NormalizedRecord record : records) {
            NormalizedRecord current = record;
            boolean dropped = false;
            for (Map.Entry<String, double[]> entry : bounds.entrySet()) {
                String field = entry.getKey();
                FieldValue value = current.field(field);
                if (!value.isPresent()) {
                    continue;
                }
                double lower = entry.getValue()[0];
                double upper = entry.getValue()[1];
                double number = value.asNumber();
                if (number >= lower && number <= upper) {
                    continue;
                }
                String detail = String.format("outside [%s, %s] at p%s", lower, upper, policy.outlierPercentile());
                if (policy.outlierStrategy() == OutlierStrategy.DROP_RECORD) {
                    ledger.drop(record.getRecordId(), field, DropReason.OUTLIER, number + " " + detail);
                    dropped = true;
                    break;
                }
                double bound = number > upper ? upper : lower;
                current = current.withField(field, FieldValue.valid(FieldType.NUMERIC, bound, value.getRawText()));
                ledger.clipped(record.getRecordId(), field, number, bound, detail);
            }
            if (!dropped) {
                kept.add(current);
            }
        }
        return kept;
    }

    private static List<String> outlierFields(RecordSchema schema, CleaningPolicy policy) {
        if (!policy.outlierFields().isEmpty()) {
            return policy.outlierFields();
        }
        return schema.fieldsOfType(FieldType.NUMERIC).stream()
                .map(FieldDefinition::name)
                .filter(name -> !schema.keyFields().contains(name))
                .toList();
    }
}
