package io.github.jakubt4.lumen.signal;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SpectralMathTest {

    @Test
    void logspaceKeepsBothEndPointsExactly() {
        final var grid = SpectralMath.logspace(0.45, 2.2, 6000);

        assertThat(grid).hasSize(6000);
        assertThat(grid[0]).isEqualTo(0.45);
        assertThat(grid[5999]).isEqualTo(2.2);
        assertThat(grid[1] / grid[0]).isCloseTo(grid[5999] / grid[5998], within(1e-12));
    }

    @Test
    void trapzIsExactForLinearFunctions() {
        final var x = SpectralMath.linspace(1.0, 3.0, 11);
        final var y = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            y[i] = 2.0 * x[i] + 1.0;
        }

        assertThat(SpectralMath.trapz(y, x)).isCloseTo(10.0, within(1e-12));
    }

    @Test
    void interpolateUsesFillOutsideRange() {
        final var values = SpectralMath.interpolate(
                new double[]{1.0, 2.0}, new double[]{10.0, 20.0}, new double[]{0.5, 1.5, 2.0, 2.5}, -1.0);

        assertThat(values).containsExactly(-1.0, 15.0, 20.0, -1.0);
    }

    @Test
    void interpolateAcceptsUnsortedAbscissae() {
        final var values = SpectralMath.interpolate(
                new double[]{3.0, 1.0, 2.0}, new double[]{30.0, 10.0, 20.0}, new double[]{2.5}, 0.0);

        assertThat(values[0]).isCloseTo(25.0, within(1e-12));
    }

    @Test
    void interpolateExtrapolateExtendsEndSegments() {
        final var values = SpectralMath.interpolateExtrapolate(
                new double[]{1.0, 2.0, 4.0}, new double[]{0.0, 1.0, 5.0}, new double[]{0.0, 5.0});

        assertThat(values[0]).isCloseTo(-1.0, within(1e-12));
        assertThat(values[1]).isCloseTo(7.0, within(1e-12));
    }

    @Test
    void rebinAveragesFinerSourceGrid() {
        final var xp = SpectralMath.linspace(0.95, 3.05, 2101);
        final var fp = new double[xp.length];
        Arrays.fill(fp, 4.0);

        final var out = SpectralMath.rebin(new double[]{1.0, 2.0, 3.0}, xp, fp);

        assertThat(out).containsExactly(4.0, 4.0, 4.0);
    }

    @Test
    void rebinInterpolatesCoarserSourceGridWithZeroFill() {
        final var out = SpectralMath.rebin(
                SpectralMath.linspace(1.0, 2.0, 101), new double[]{1.0, 1.5}, new double[]{2.0, 3.0});

        assertThat(out[0]).isEqualTo(2.0);
        assertThat(out[25]).isCloseTo(2.5, within(1e-12));
        assertThat(out[100]).isEqualTo(0.0);
    }

    @Test
    void binAverageUsesTheBinEdges() {
        final var xp = new double[]{1.0, 1.2, 1.4, 1.6, 1.8};
        final var fp = new double[]{1.0, 2.0, 3.0, 4.0, 5.0};

        final var out = SpectralMath.binAverage(new double[]{1.0, 1.5, 1.05, 2.5}, new double[]{1.5, 2.0, 1.15, 3.0},
                xp, fp, 7.0);

        assertThat(out[0]).isCloseTo(2.0, within(1e-12));
        assertThat(out[1]).isCloseTo(4.5, within(1e-12));
        // no sample inside: centre value, then fill outside the sampled range
        assertThat(out[2]).isCloseTo(1.5, within(1e-12));
        assertThat(out[3]).isEqualTo(7.0);
    }

    @Test
    void convolveSameKeepsLengthAndCentresKernel() {
        final var out = SpectralMath.convolveSame(new double[]{0.0, 0.0, 1.0, 0.0, 0.0}, new double[]{1.0, 1.0, 1.0});

        assertThat(out).containsExactly(0.0, 1.0, 1.0, 1.0, 0.0);
    }

    @Test
    void cubicFallsBackForFewPoints() {
        assertThat(SpectralMath.cubic(new double[]{1.0}, new double[]{3.0}, new double[]{0.0, 5.0}))
                .containsExactly(3.0, 3.0);
        assertThat(SpectralMath.cubic(new double[]{1.0, 2.0}, new double[]{1.0, 2.0}, new double[]{1.5})[0])
                .isCloseTo(1.5, within(1e-12));
    }

    @Test
    void cubicUsesNaturalEndConditions() {
        // a not-a-knot spline would reproduce the parabola exactly, 0.25 at x = 0.5
        final var out = SpectralMath.cubic(new double[]{0.0, 1.0, 2.0, 3.0}, new double[]{0.0, 1.0, 4.0, 9.0},
                new double[]{0.5, 2.0, 4.0});

        assertThat(out[0]).isCloseTo(0.35, within(1e-12));
        assertThat(out[1]).isCloseTo(4.0, within(1e-12));
        assertThat(out[2]).isCloseTo(9.0, within(1e-12));
    }

    @Test
    void mismatchedLengthsAreRejected() {
        assertThatThrownBy(() -> SpectralMath.trapz(new double[]{1.0}, new double[]{1.0, 2.0}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
