package com.motaz.insight.engine.clean;

import lombok.Value;

@Value
public class CleaningAction {

    public enum Type {
        DUPLICATE_DROPPED,
        RECORD_DROPPED,
        VALUE_IMPUTED,
        VALUE_CLEARED,
        VALUE_CLIPPED
    }

    String recordId;
    String field;
    Type type;
    DropReason reason;
    String before;
    String after;
    String detail;
}
