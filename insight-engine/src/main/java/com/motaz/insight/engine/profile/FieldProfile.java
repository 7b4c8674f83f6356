package com.motaz.insight.engine.profile;

import com.motaz.insight.engine.model.FieldType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class FieldProfile {

    String field;
    FieldType type;
    int missing;
    int invalid;
    NumericSummary numeric;

    @Value
    public static class NumericSummary {
        int count;
        double mean;
        double std;
        double min;
        double max;
    }
}
