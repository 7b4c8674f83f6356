package com.motaz.insight.engine.error;

import com.motaz.insight.engine.model.FieldType;
import lombok.Value;

import java.util.List;

@Value
public class ParseError {

    String recordId;
    String source;
    List<InvalidField> fields;

    @Value
    public static class InvalidField {
        String field;
        FieldType expectedType;
        String rawValue;
        String reason;
    }
}
