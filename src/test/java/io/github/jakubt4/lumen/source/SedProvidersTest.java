package io.github.jakubt4.lumen.source;

import io.github.jakubt4.lumen.Fixtures;
import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.SourceDescription;
import io.github.jakubt4.lumen.description.TabulatedData;
import io.github.jakubt4.lumen.signal.Planck;
import io.github.jakubt4.lumen.signal.SpectralMath;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.withinPercentage;

class SedProvidersTest {

    private static final double[] GRID = SpectralMath.linspace(0.5, 2.5, 21);

    @Test
    void planckIsTheDefault() {
        assertThat(SedProviders.forDescription(null)).isInstanceOf(PlanckSedProvider.class);
        assertThat(SedProviders.forDescription(new SourceDescription(null, null)).model()).isEqualTo("Planck");
        assertThat(SedProviders.forDescription(SourceDescription.planck())).isInstanceOf(PlanckSedProvider.class);
    }

    @Test
    void unsupportedModelFallsBackToPlanck() {
        assertThat(SedProviders.forDescription(new SourceDescription("phoenix", null)))
                .isInstanceOf(PlanckSedProvider.class);
    }

    @Test
    void planckSedIsTheDilutedSurfaceFlux() {
        final var star = Fixtures.sunLike("sun").star();

        final var sed = new PlanckSedProvider().sed(star, GRID);

        final var i = 5;
        assertThat(sed.valueAt(i))
                .isCloseTo(Math.PI * star.dilution() * Planck.radiance(GRID[i], 5772.0), withinPercentage(1e-10));
    }

    @Test
    void customSedIsInterpolatedAndDiluted() {
        final var data = TabulatedData.of("Wavelength", new double[]{1.0, 2.0}, "Sed", new double[]{4.0e7, 2.0e7});
        final var provider = SedProviders.forDescription(new SourceDescription("Custom", data));
        final var star = Fixtures.sunLike("sun").star();

        final var sed = provider.sed(star, GRID);

        assertThat(provider.model()).isEqualTo("custom");
        // GRID[10] = 1.5
        assertThat(sed.valueAt(10)).isCloseTo(3.0e7 * star.dilution(), withinPercentage(1e-9));
        assertThat(sed.valueAt(0)).isZero();
        assertThat(sed.valueAt(20)).isZero();
    }

    @Test
    void customSedNeedsATable() {
        assertThatThrownBy(() -> SedProviders.forDescription(new SourceDescription("custom", null)))
                .isInstanceOf(ConfigurationException.class);
    }
}
