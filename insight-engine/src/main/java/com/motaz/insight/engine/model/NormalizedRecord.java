package com.motaz.insight.engine.model;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
public class NormalizedRecord {

    String recordId;
    String source;
    Instant ingestedAt;
    Map<String, FieldValue> fields;

    public NormalizedRecord(String recordId, String source, Instant ingestedAt, Map<String, FieldValue> fields) {
        this.recordId = recordId;
        this.source = source;
        this.ingestedAt = ingestedAt;
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public FieldValue field(String name) {
        return fields.get(name);
    }

    public boolean hasInvalidFields() {
        return fields.values().stream().anyMatch(value -> !value.isValid());
    }

    public List<String> invalidFields() {
        return fields.entrySet().stream()
                .filter(entry -> !entry.getValue().isValid())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    public NormalizedRecord withField(String name, FieldValue value) {
        Map<String, FieldValue> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        return new NormalizedRecord(recordId, source, ingestedAt, copy);
    }

    public CleanedRecord toCleaned() {
        return new CleanedRecord(recordId, source, ingestedAt, fields);
    }
}
