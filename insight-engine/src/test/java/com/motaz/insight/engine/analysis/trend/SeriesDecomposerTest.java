package com.motaz.insight.engine.analysis.trend;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeriesDecomposerTest {

    private final SeriesDecomposer decomposer = new SeriesDecomposer();

    @Test
    void perfectLineHasNoResidualAndNoSeason() {
        double[] line = new double[20];
        for (int i = 0; i < line.length; i++) {
            line[i] = 3 + 2 * i;
        }

        Decomposition decomposition = decomposer.decompose(line, 6, 0.5);

        assertThat(decomposition.getSlope()).isCloseTo(2.0, within(1e-9));
        assertThat(decomposition.getIntercept()).isCloseTo(3.0, within(1e-9));
        assertThat(decomposition.getRSquared()).isCloseTo(1.0, within(1e-9));
        assertThat(decomposition.getPeriod()).isNull();
    }

    @Test
    void findsThePeriodOfASeasonalSeries() {
        double[] series = new double[48];
        for (int i = 0; i < series.length; i++) {
            series[i] = 10 * Math.sin(2 * Math.PI * i / 6) + 0.5 * i;
        }

        Decomposition decomposition = decomposer.decompose(series, 12, 0.5);

        assertThat(decomposition.getPeriod()).isEqualTo(6);
        assertThat(decomposition.getPeriodAutocorrelation()).isGreaterThan(0.5);
        assertThat(decomposition.getSeasonal()[1]).isCloseTo(decomposition.getSeasonal()[7], within(1e-9));
        assertThat(decomposition.getSlope()).isGreaterThan(0);
    }

    @Test
    void constantSeriesHasZeroScore() {
        Decomposition decomposition = decomposer.decompose(new double[]{4, 4, 4, 4, 4, 4}, 3, 0.5);

        assertThat(decomposition.getRSquared()).isZero();
        assertThat(decomposition.getSlope()).isZero();
        assertThat(decomposition.getPeriod()).isNull();
    }
}
