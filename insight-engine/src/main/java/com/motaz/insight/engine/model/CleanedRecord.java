package com.motaz.insight.engine.model;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class CleanedRecord {

    String recordId;
    String source;
    Instant ingestedAt;
    Map<String, FieldValue> fields;

    public CleanedRecord(String recordId, String source, Instant ingestedAt, Map<String, FieldValue> fields) {
        if (fields.values().stream().anyMatch(value -> !value.isValid())) {
            throw new IllegalArgumentException("cleaned record " + recordId + " still carries invalid fields");
        }
        this.recordId = recordId;
        this.source = source;
        this.ingestedAt = ingestedAt;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public FieldValue field(String name) {
        return fields.get(name);
    }

    public Double number(String name) {
        FieldValue value = fields.get(name);
        return value == null ? null : value.asNumber();
    }

    public Instant instant(String name) {
        FieldValue value = fields.get(name);
        return value == null ? null : value.asInstant();
    }

    public NormalizedRecord asNormalized() {
        return new NormalizedRecord(recordId, source, ingestedAt, fields);
    }
}
