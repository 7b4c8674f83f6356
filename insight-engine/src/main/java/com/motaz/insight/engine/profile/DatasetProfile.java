package com.motaz.insight.engine.profile;

import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
public class DatasetProfile {

    List<FieldProfile> fields;
    Map<String, Map<String, Double>> correlations;
}
