package com.motaz.insight.engine.error;

import lombok.Value;

@Value
public class ConvergenceWarning {

    int clusters;
    int iterations;
    double lastShift;
    double epsilon;

    public String message() {
        return String.format("k-means with k=%d did not converge after %d iterations (last shift %.6f > epsilon %.6f)",
                clusters, iterations, lastShift, epsilon);
    }
}
