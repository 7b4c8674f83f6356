package com.motaz.insight.engine.error;

import com.motaz.insight.engine.model.FindingKind;
import lombok.Value;

@Value
public class QualityWarning {

    public enum Type {
        CONVERGENCE,
        COMPONENT_UNAVAILABLE
    }

    Type type;
    FindingKind component;
    String message;

    public static QualityWarning of(ConvergenceWarning warning) {
        return new QualityWarning(Type.CONVERGENCE, FindingKind.CLUSTER, warning.message());
    }

    public static QualityWarning unavailable(FindingKind component, String reason) {
        return new QualityWarning(Type.COMPONENT_UNAVAILABLE, component, component + " findings unavailable: " + reason);
    }
}
