package com.motaz.insight.engine.aggregate;

import com.motaz.insight.engine.analysis.ComponentStatus;
import com.motaz.insight.engine.model.FindingKind;
import lombok.Value;

@Value
public class ComponentReport {

    FindingKind component;
    ComponentStatus status;
    String reason;
    int findings;
    boolean mandatory;
}
