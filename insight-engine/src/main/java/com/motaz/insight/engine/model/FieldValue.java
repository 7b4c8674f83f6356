package com.motaz.insight.engine.model;

import lombok.Value;

import java.time.Instant;

/**
 * A typed field value with its validity flag. {@code value} holds a
 * {@link Double}, {@link String}, {@link Instant} or {@link Boolean}
 * depending on {@link #type}, or {@code null} when the field is absent or invalid.
 */
@Value
public class FieldValue {

    FieldType type;
    Object value;
    String rawText;
    boolean valid;

    public static FieldValue valid(FieldType type, Object value, String rawText) {
        return new FieldValue(type, value, rawText, true);
    }

    public static FieldValue absent(FieldType type) {
        return new FieldValue(type, null, null, true);
    }

    public static FieldValue invalid(FieldType type, String rawText) {
        return new FieldValue(type, null, rawText, false);
    }

    public boolean isPresent() {
        return valid && value != null;
    }

    public Double asNumber() {
        if (value instanceof Double d) {
            return d;
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        return null;
    }

    public Instant asInstant() {
        return value instanceof Instant instant ? instant : null;
    }

    /** Stable text form used for identity keys, categories and audit entries. */
    public String canonical() {
        if (!valid) {
            return "invalid:" + rawText;
        }
        if (value == null) {
            return "<absent>";
        }
        return String.valueOf(value);
    }
}
