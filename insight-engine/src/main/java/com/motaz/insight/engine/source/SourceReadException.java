package com.motaz.insight.engine.source;

public class SourceReadException extends RuntimeException {

    public SourceReadException(String message) {
        super(message);
    }

    public SourceReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
