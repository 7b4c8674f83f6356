package com.motaz.insight.engine.feature;

import com.motaz.insight.engine.model.FeatureVector;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class FeatureSet {

    List<FeatureVector> vectors;
    List<String> featureNames;
    Map<String, List<String>> outputsBySpec;
    Map<String, ScalingParams> scaling;

    public FeatureSet(List<FeatureVector> vectors, List<String> featureNames,
                      Map<String, List<String>> outputsBySpec, Map<String, ScalingParams> scaling) {
        this.vectors = List.copyOf(vectors);
        this.featureNames = List.copyOf(featureNames);
        this.outputsBySpec = Collections.unmodifiableMap(new LinkedHashMap<>(outputsBySpec));
        this.scaling = Collections.unmodifiableMap(new LinkedHashMap<>(scaling));
    }

    public List<String> outputsOf(List<String> specNames) {
        if (specNames.isEmpty()) {
            return featureNames;
        }
        List<String> outputs = new ArrayList<>();
        for (String spec : specNames) {
            outputs.addAll(outputsBySpec.getOrDefault(spec, List.of()));
        }
        return outputs;
    }

    public double[][] matrix(List<String> names) {
        double[][] rows = new double[vectors.size()][];
        for (int i = 0; i < vectors.size(); i++) {
            rows[i] = vectors.get(i).toArray(names);
        }
        return rows;
    }

    public int size() {
        return vectors.size();
    }
}
