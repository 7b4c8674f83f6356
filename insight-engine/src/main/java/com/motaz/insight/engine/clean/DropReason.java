package com.motaz.insight.engine.clean;

public enum DropReason {
    DUPLICATE,
    MISSING_VALUE,
    UNRESOLVABLE_FIELD,
    OUTLIER
}
