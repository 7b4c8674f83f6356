package com.motaz.insight.engine.error;

public class DataInsufficientError extends RuntimeException {

    private final int required;
    private final int available;

    public DataInsufficientError(String analysis, int required, int available) {
        super(analysis + " needs at least " + required + " points but only " + available + " are available");
        this.required = required;
        this.available = available;
    }

    public int getRequired() {
        return required;
    }

    public int getAvailable() {
        return available;
    }
}
