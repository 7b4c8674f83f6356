package com.motaz.insight.engine.aggregate;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RunSummary {

    int recordsIn;
    int recordsWithInvalidFields;
    int recordsCleaned;
    int recordsDropped;
    int featureVectors;
    int anomaliesFlagged;
    int clustersFound;
    int trendsDetected;
    int warnings;
}
