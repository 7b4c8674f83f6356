package com.motaz.insight.engine.analysis.trend;

import lombok.Value;

@Value
public class Decomposition {

    double intercept;
    double slope;
    double rSquared;
    double[] trend;
    double[] seasonal;
    double[] residual;
    Integer period;
    double periodAutocorrelation;
}
