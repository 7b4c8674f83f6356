package com.motaz.insight.engine.config;

import com.motaz.insight.engine.model.FieldType;

import java.util.List;
import java.util.Optional;

/**
 * Active schema of a run: the declared fields in order, the fields forming the
 * duplicate key, the time axis and the accepted timestamp patterns.
 */
public record RecordSchema(
        List<FieldDefinition> fields,
        List<String> keyFields,
        String timeField,
        List<String> timestampFormats
) {

    public RecordSchema {
        fields = fields == null ? List.of() : List.copyOf(fields);
        keyFields = keyFields == null ? List.of() : List.copyOf(keyFields);
        timestampFormats = timestampFormats == null ? List.of() : List.copyOf(timestampFormats);
    }

    public Optional<FieldDefinition> field(String name) {
        return fields.stream().filter(field -> field.name().equals(name)).findFirst();
    }

    public boolean declares(String name) {
        return field(name).isPresent();
    }

    /**
     * The time axis: the explicit {@code timeField}, otherwise the only
     * TIMESTAMP field when exactly one is declared.
     */
    public Optional<String> resolveTimeField() {
        if (timeField != null && !timeField.isBlank()) {
            return Optional.of(timeField);
        }
        List<FieldDefinition> timestamps = fieldsOfType(FieldType.TIMESTAMP);
        return timestamps.size() == 1 ? Optional.of(timestamps.get(0).name()) : Optional.empty();
    }

    public List<FieldDefinition> fieldsOfType(FieldType type) {
        return fields.stream().filter(field -> field.type() == type).toList();
    }
}
