package com.motaz.insight.engine.feature;

import com.motaz.insight.engine.config.Scaling;

public record ScalingParams(String source, Scaling scaling, double mean, double std, double min, double max) {

    double apply(double value) {
        if (scaling == Scaling.Z_SCORE) {
            return std == 0.0 ? 0.0 : (value - mean) / std;
        }
        double range = max - min;
        return range == 0.0 ? 0.0 : (value - min) / range;
    }
}
