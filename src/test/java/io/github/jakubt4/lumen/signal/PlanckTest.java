package io.github.jakubt4.lumen.signal;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

class PlanckTest {

    @Test
    void peakFollowsWienLaw() {
        final var wl = SpectralMath.linspace(0.3, 1.0, 7001);
        final var spectrum = Planck.spectrum(wl, 5772.0).data();
        var peak = 0;
        for (int i = 1; i < spectrum.length; i++) {
            if (spectrum[i] > spectrum[peak]) {
                peak = i;
            }
        }

        assertThat(wl[peak]).isCloseTo(2897.77 / 5772.0, within(1e-3));
    }

    @Test
    void integratedRadianceMatchesStefanBoltzmann() {
        final var wl = SpectralMath.logspace(0.05, 500.0, 20000);
        final var total = Planck.spectrum(wl, 1000.0).integrate();

        assertThat(Math.PI * total / (PhysicalConstants.STEFAN_BOLTZMANN * 1.0e12)).isCloseTo(1.0, within(1e-3));
    }

    @Test
    void radiationConstantsFollowTheExactSiValues() {
        assertThat(Planck.FIRST_RADIATION_CONSTANT).isCloseTo(1.191042972e8, within(1.0));
        assertThat(Planck.SECOND_RADIATION_CONSTANT).isCloseTo(14387.768775, within(1e-5));
        assertThat(Planck.radiance(10.0, 300.0)).isCloseTo(
                1.191042972e8 / 1.0e5 / Math.expm1(14387.768775 / 3000.0), withinPercentage(1e-6));
    }

    @Test
    void coldOrNegligibleEmissionIsZero() {
        assertThat(Planck.radiance(1.0, 0.0)).isZero();
        assertThat(Planck.radiance(0.1, 3.0)).isZero();
    }
}
