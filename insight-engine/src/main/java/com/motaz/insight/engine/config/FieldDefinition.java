package com.motaz.insight.engine.config;

import com.motaz.insight.engine.model.FieldType;

public record FieldDefinition(String name, FieldType type, boolean required) {
}
