package com.motaz.insight.engine.aggregate;

import com.motaz.insight.engine.analysis.ComponentResult;
import com.motaz.insight.engine.clean.CleaningResult;
import com.motaz.insight.engine.error.ParseErrorLog;
import com.motaz.insight.engine.feature.FeatureSet;
import com.motaz.insight.engine.model.FindingKind;
import com.motaz.insight.engine.model.NormalizedRecord;
import com.motaz.insight.engine.profile.DatasetProfile;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Set;

@Value
@Builder
public class StageOutputs {

    String runId;
    String source;
    Instant startedAt;
    int recordsIn;
    List<NormalizedRecord> normalized;
    ParseErrorLog parseErrors;
    CleaningResult cleaning;
    DatasetProfile profile;
    FeatureSet features;
    List<ComponentResult> components;
    Set<FindingKind> mandatory;
}
