package com.motaz.insight.engine.model;

public enum FieldType {
    NUMERIC,
    CATEGORICAL,
    TIMESTAMP,
    BOOLEAN
}
