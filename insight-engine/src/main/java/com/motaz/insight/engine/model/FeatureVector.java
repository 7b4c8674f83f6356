package com.motaz.insight.engine.model;

import lombok.Value;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class FeatureVector {

    String recordId;
    Instant timestamp;
    Map<String, Double> features;

    public FeatureVector(String recordId, Instant timestamp, Map<String, Double> features) {
        this.recordId = recordId;
        this.timestamp = timestamp;
        this.features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    public double get(String name) {
        Double value = features.get(name);
        if (value == null) {
            throw new IllegalArgumentException("unknown feature " + name + " on " + recordId);
        }
        return value;
    }

    public double[] toArray(List<String> names) {
        double[] row = new double[names.size()];
        for (int i = 0; i < names.size(); i++) {
            row[i] = get(names.get(i));
        }
        return row;
    }
}
