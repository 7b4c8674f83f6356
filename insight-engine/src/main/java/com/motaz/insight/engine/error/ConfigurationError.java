package com.motaz.insight.engine.error;

import java.util.List;

public class ConfigurationError extends RuntimeException {

    private final List<String> problems;

    public ConfigurationError(List<String> problems) {
        super("Invalid pipeline configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public ConfigurationError(String problem) {
        this(List.of(problem));
    }

    public List<String> getProblems() {
        return problems;
    }
}
