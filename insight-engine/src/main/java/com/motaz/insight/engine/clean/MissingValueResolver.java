package com.motaz.insight.engine.clean;

import com.motaz.insight.engine.config.CleaningPolicy;
import com.motaz.insight.engine.config.FieldDefinition;
import com.motaz.insight.engine.config.MissingValueStrategy;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.model.FieldType;
import com.motaz.insight.engine.model.FieldValue;
import com.motaz.insight.engine.model.NormalizedRecord;
import com.motaz.insight.engine.normalize.ValueCoercer;
import com.motaz.insight.engine.stats.Stats;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves every invalid field. Imputed statistics come from the valid values
 * of the batch being cleaned, so they are deterministic per batch. Key fields
 * are never imputed: a record whose key is invalid is dropped.
 */
class MissingValueResolver {

    List<NormalizedRecord> resolve(List<NormalizedRecord> records, RecordSchema schema, CleaningPolicy policy,
                                   CleaningLedger ledger) {
        MissingValueStrategy strategy = policy.missingValueStrategy();
        if (strategy == MissingValueStrategy.DROP_RECORD) {
            return dropIncomplete(records, ledger);
        }

        Map<String, FieldValue> fills = new HashMap<>();
        for (FieldDefinition definition : schema.fields()) {
            if (schema.keyFields().contains(definition.name())) {
                continue;
            }
            fill(definition, records, strategy, policy).ifPresent(value -> fills.put(definition.name(), value));
        }

        List<NormalizedRecord> resolved = new ArrayList<>(records.size());
        for (NormalizedRecord record : records) {
            if (!record.hasInvalidFields()) {
                resolved.add(record);
                continue;
            }
            List<String> invalid = record.invalidFields();
            Optional<String> unresolvable = invalid.stream()
                    .filter(field -> !fills.containsKey(field))
                    .filter(field -> schema.keyFields().contains(field)
                            || schema.field(field).map(FieldDefinition::required).orElse(false))
                    .findFirst();
            if (unresolvable.isPresent()) {
                String field = unresolvable.get();
                ledger.drop(record.getRecordId(), field, DropReason.UNRESOLVABLE_FIELD,
                        schema.keyFields().contains(field) ? "key field cannot be imputed"
                                : "no " + strategy + " value available for required field");
                continue;
            }
            NormalizedRecord current = record;
            for (String field : invalid) {
                FieldValue before = current.field(field);
                FieldValue fill = fills.get(field);
                if (fill != null) {
                    current = current.withField(field, fill);
                    ledger.imputed(record.getRecordId(), field, before.getRawText(), fill.canonical(), strategy.name());
                } else {
                    current = current.withField(field, FieldValue.absent(before.getType()));
                    ledger.cleared(record.getRecordId(), field, before.getRawText(),
                            "no " + strategy + " value available for optional field");
                }
            }
            resolved.add(current);
        }
        return resolved;
    }

    private List<NormalizedRecord> dropIncomplete(List<NormalizedRecord> records, CleaningLedger ledger) {
        List<NormalizedRecord> kept = new ArrayList<>(records.size());
        for (NormalizedRecord record : records) {
            if (record.hasInvalidFields()) {
                ledger.drop(record.getRecordId(), null, DropReason.MISSING_VALUE,
                        "invalid fields " + record.invalidFields());
            } else {
                kept.add(record);
            }
        }
        return kept;
    }

    private Optional<FieldValue> fill(FieldDefinition definition, List<NormalizedRecord> records,
                                      MissingValueStrategy strategy, CleaningPolicy policy) {
        FieldType type = definition.type();
        if (type == FieldType.TIMESTAMP) {
            return Optional.empty();
        }
        if (strategy == MissingValueStrategy.IMPUTE_CONSTANT) {
            FieldValue constant = new ValueCoercer(List.of()).coerce(type, policy.constants().get(definition.name()));
            return constant.isPresent() ? Optional.of(constant) : Optional.empty();
        }
        List<FieldValue> present = records.stream()
                .map(record -> record.field(definition.name()))
                .filter(FieldValue::isPresent)
                .toList();
        if (present.isEmpty()) {
            return Optional.empty();
        }
        if (type == FieldType.NUMERIC) {
            double[] values = present.stream().mapToDouble(FieldValue::asNumber).toArray();
            double statistic = strategy == MissingValueStrategy.IMPUTE_MEDIAN ? Stats.median(values) : Stats.mean(values);
            return Optional.of(FieldValue.valid(type, statistic, null));
        }
        return Optional.of(mode(present));
    }

    /** Most frequent value; ties go to the value seen first. */
    private static FieldValue mode(List<FieldValue> values) {
        Map<Object, Integer> counts = new LinkedHashMap<>();
        values.forEach(value -> counts.merge(value.getValue(), 1, Integer::sum));
        Object best = null;
        int bestCount = 0;
        for (Map.Entry<Object, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return FieldValue.valid(values.get(0).getType(), best, null);
    }
}
