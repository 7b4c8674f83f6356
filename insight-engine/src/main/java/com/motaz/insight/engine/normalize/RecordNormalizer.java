package com.motaz.insight.engine.normalize;

import com.motaz.insight.engine.config.FieldDefinition;
import com.motaz.insight.engine.config.RecordSchema;
import com.motaz.insight.engine.error.ParseError;
import com.motaz.insight.engine.error.ParseErrorLog;
import com.motaz.insight.engine.model.FieldValue;
import com.motaz.insight.engine.model.NormalizedRecord;
import com.motaz.insight.engine.model.RawRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Promotes raw rows to the active schema. Always yields exactly one record per
 * input row: bad values are flagged invalid, never thrown, and unknown raw
 * fields are dropped.
 */
@Slf4j
public class RecordNormalizer {

    private static final String STAGE = "normalize";

    private final Map<List<String>, ValueCoercer> coercers = new ConcurrentHashMap<>();

    public List<NormalizedRecord> normalizeAll(List<RawRecord> records, RecordSchema schema, ParseErrorLog errors) {
        List<NormalizedRecord> normalized = new ArrayList<>(records.size());
        Map<String, Integer> unknownFields = new TreeMap<>();
        for (RawRecord raw : records) {
            raw.getValues().keySet().stream()
                    .filter(name -> !schema.declares(name))
                    .forEach(name -> unknownFields.merge(name, 1, Integer::sum));
            normalized.add(normalize(raw, schema, errors));
        }
        unknownFields.forEach((name, count) ->
                log.info("stage={} field={} action=drop_field reason=not_in_schema records={}", STAGE, name, count));
        log.info("Normalized {} records, {} with invalid fields", normalized.size(), errors.size());
        return normalized;
    }

    public NormalizedRecord normalize(RawRecord raw, RecordSchema schema, ParseErrorLog errors) {
        ValueCoercer coercer = coercers.computeIfAbsent(schema.timestampFormats(), ValueCoercer::new);
        String recordId = raw.recordId();
        Map<String, FieldValue> fields = new LinkedHashMap<>();
        List<ParseError.InvalidField> invalid = new ArrayList<>();

        for (FieldDefinition definition : schema.fields()) {
            boolean present = raw.getValues().containsKey(definition.name());
            FieldValue value = coercer.coerce(definition.type(), raw.getValues().get(definition.name()));
            if (!value.isValid()) {
                invalid.add(new ParseError.InvalidField(definition.name(), definition.type(), value.getRawText(),
                        "not a valid " + definition.type()));
            } else if (value.getValue() == null && definition.required()) {
                value = FieldValue.invalid(definition.type(), null);
                invalid.add(new ParseError.InvalidField(definition.name(), definition.type(), null,
                        present ? "required field is empty" : "required field is missing"));
            }
            fields.put(definition.name(), value);
        }

        for (String name : raw.getValues().keySet()) {
            if (!schema.declares(name)) {
                log.debug("stage={} record={} field={} action=drop_field reason=not_in_schema", STAGE, recordId, name);
            }
        }
        if (!invalid.isEmpty()) {
            errors.append(new ParseError(recordId, raw.getSource(), invalid));
            invalid.forEach(field -> log.info("stage={} record={} field={} action=mark_invalid reason=\"{}\" raw={}",
                    STAGE, recordId, field.getField(), field.getReason(), field.getRawValue()));
        }
        return new NormalizedRecord(recordId, raw.getSource(), raw.getIngestedAt(), fields);
    }
}
