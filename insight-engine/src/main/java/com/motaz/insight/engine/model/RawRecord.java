package com.motaz.insight.engine.model;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
public class RawRecord {

    String source;
    long rowNumber;
    Instant ingestedAt;
    Map<String, Object> values;

    public RawRecord(String source, long rowNumber, Instant ingestedAt, Map<String, Object> values) {
        this.source = source;
        this.rowNumber = rowNumber;
        this.ingestedAt = ingestedAt;
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static RawRecord of(String source, long rowNumber, Map<String, Object> values) {
        return new RawRecord(source, rowNumber, Instant.now(), values);
    }

    public String recordId() {
        return source + "#" + rowNumber;
    }
}
