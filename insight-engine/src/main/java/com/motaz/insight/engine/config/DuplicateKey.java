package com.motaz.insight.engine.config;

public enum DuplicateKey {
    FULL_ROW,
    EXPLICIT_KEY_FIELDS
}
