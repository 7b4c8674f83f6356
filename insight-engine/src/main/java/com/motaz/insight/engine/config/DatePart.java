package com.motaz.insight.engine.config;

public enum DatePart {
    YEAR,
    MONTH,
    DAY_OF_MONTH,
    DAY_OF_WEEK,
    HOUR
}
