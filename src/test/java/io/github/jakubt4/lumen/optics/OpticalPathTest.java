package io.github.jakubt4.lumen.optics;

import io.github.jakubt4.lumen.Fixtures;
import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.DetectorDescription;
import io.github.jakubt4.lumen.description.OpticalElementDescription;
import io.github.jakubt4.lumen.signal.PhysicalConstants;
import io.github.jakubt4.lumen.signal.Planck;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.assertj.core.api.Assertions.withinPercentage;

class OpticalPathTest {

    private static final double[] GRID = SpectralMath.linspace(1.0, 2.0, 11);
    private static final DetectorDescription DETECTOR = Fixtures.detector(0.9, 2.3).build();

    private static OpticalElementDescription filter(final String name, final double transmission) {
        return OpticalElementDescription.builder()
                .name(name)
                .type(ElementType.FILTER)
                .transmission(transmission)
                .build();
    }

    private static OpticalElementDescription slit(final Double width) {
        return OpticalElementDescription.builder()
                .name("slit")
                .type(ElementType.SLIT)
                .width(width)
                .build();
    }

    @Test
    void singleWavelengthIsRefinedToTheDetectorGrid() {
        final var path = new OpticalPath(List.of(), new double[]{1.5}, DETECTOR);

        final var grid = path.wavelength();
        assertThat(grid).hasSize(OpticalPath.GRID_POINTS);
        assertThat(grid[0]).isCloseTo(0.9, within(1e-12));
        assertThat(grid[grid.length - 1]).isCloseTo(2.3, within(1e-12));
    }

    @Test
    void chainedRadianceIsAttenuatedByDownstreamElements() {
        final var path = new OpticalPath(List.of(Fixtures.mirror("M1", 300.0), filter("F1", 0.5)), GRID, DETECTOR);

        final var radiances = path.chain();

        assertThat(radiances).hasSize(1);
        final var m1 = radiances.get(0);
        assertThat(m1.elementName()).isEqualTo("M1");
        assertThat(m1.position()).isEqualTo(ElementPosition.PATH);
        assertThat(m1.slitAffected()).isFalse();
        for (int i = 0; i < GRID.length; i++) {
            final var expected = 0.03 * Planck.radiance(GRID[i], 300.0) * 0.5;
            assertThat(m1.radiance().valueAt(i)).isCloseTo(expected, withinPercentage(1e-10));
        }
    }

    @Test
    void elementsWithoutTemperatureDoNotEmit() {
        final var path = new OpticalPath(List.of(filter("F1", 0.5), filter("F2", 0.8)), GRID, DETECTOR);

        assertThat(path.chain()).isEmpty();
        assertThat(path.slitWidth()).isEmpty();
    }

    @Test
    void totalTransmissionDoesNotDependOnOrder() {
        final var forward = new OpticalPath(
                List.of(Fixtures.mirror("M1", 80.0), filter("F1", 0.5), filter("F2", 0.8)), GRID, DETECTOR);
        final var backward = new OpticalPath(
                List.of(filter("F2", 0.8), filter("F1", 0.5), Fixtures.mirror("M1", 80.0)), GRID, DETECTOR);

        final var a = forward.buildTransmissionTable();
        final var b = backward.buildTransmissionTable();

        assertThat(a.elements()).containsOnlyKeys("M1", "F1", "F2");
        for (int i = 0; i < GRID.length; i++) {
            assertThat(a.total().valueAt(i)).isCloseTo(0.97 * 0.5 * 0.8, within(1e-15));
            assertThat(b.total().valueAt(i)).isCloseTo(a.total().valueAt(i), within(1e-15));
        }
    }

    @Test
    void slitWithoutWidthIsRejected() {
        final var path = new OpticalPath(List.of(Fixtures.mirror("M1", 80.0), slit(null)), GRID, DETECTOR);

        assertThatThrownBy(path::chain)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("no width");
    }

    @Test
    void onlyElementsUpstreamOfTheSlitAreSlitAffected() {
        final var path = new OpticalPath(
                List.of(Fixtures.mirror("M1", 80.0), slit(36.0), Fixtures.mirror("M2", 80.0)), GRID, DETECTOR);

        final var radiances = path.chain();

        assertThat(radiances).extracting(InstrumentRadiance::elementName).containsExactly("M1", "M2");
        assertThat(radiances.get(0).slitAffected()).isTrue();
        assertThat(radiances.get(0).slitWidth()).isEqualTo(36.0);
        assertThat(radiances.get(1).slitAffected()).isFalse();
        assertThat(radiances.get(1).slitWidth()).isNull();
        assertThat(path.slitWidth()).contains(36.0);
    }

    @Test
    void prependedElementsComeFirstAndLocalNamesWin() {
        final var upstream = new OpticalPath(List.of(filter("A", 0.9), filter("B", 0.9)), GRID, DETECTOR);
        final var path = new OpticalPath(List.of(filter("B", 0.5), filter("C", 0.7)), GRID, DETECTOR);

        path.prependOpticalElements(upstream);

        assertThat(path.elements()).containsOnlyKeys("A", "B", "C");
        assertThat(path.elements().keySet()).containsExactly("A", "B", "C");
        assertThat(path.elements().get("B").transmission().valueAt(0)).isEqualTo(0.5);
    }

    @Test
    void prependedElementsAreResampledOnThePathGrid() {
        final var upstream = new OpticalPath(List.of(filter("A", 0.9)),
                SpectralMath.linspace(0.5, 2.5, 41), DETECTOR);
        final var path = new OpticalPath(List.of(filter("B", 0.5)), GRID, DETECTOR);

        path.prependOpticalElements(upstream);

        assertThat(path.elements().get("A").transmission().wavelength()).containsExactly(GRID);
        assertThat(path.elements().get("A").transmission().valueAt(5)).isCloseTo(0.9, within(1e-12));
    }

    @Test
    void detectorBoxEmitsOverTheHemisphere() {
        assertSingleEmitterMatchesClosedForm(ElementType.DETECTOR_BOX, Math.PI);
    }

    @Test
    void opticsBoxEmitsOutsideTheBeam() {
        assertSingleEmitterMatchesClosedForm(ElementType.OPTICS_BOX, Math.PI - SolidAngle.omegaPix(15.0, 15.0));
    }

    @Test
    void pathElementEmitsThroughThePixelSolidAngle() {
        assertSingleEmitterMatchesClosedForm(ElementType.SURFACE, SolidAngle.omegaPix(15.0, 15.0));
    }

    /**
     * ε·B(T)·Ω·A·QE·λ/hc integrated over the grid, times the window size.
     */
    private static void assertSingleEmitterMatchesClosedForm(final ElementType type, final double acceptance) {
        final var element = OpticalElementDescription.builder()
                .name("E")
                .type(type)
                .temperature(300.0)
                .emissivity(0.5)
                .build();
        final var path = new OpticalPath(List.of(element), GRID, DETECTOR);
        path.chain();

        final var emission = path.computeSignal(context(), singleBin(), Optional.empty());

        final var density = new double[GRID.length];
        for (int i = 0; i < GRID.length; i++) {
            density[i] = 0.5 * Planck.radiance(GRID[i], 300.0) * acceptance * DETECTOR.pixelArea() * 0.7
                    * PhysicalConstants.photonsPerJoule(GRID[i]);
        }
        final var perPixel = SpectralMath.trapz(density, GRID);
        assertThat(emission.elements()).containsOnlyKeys("E");
        assertThat(emission.total().maxSignalInPixel()[0]).isCloseTo(perPixel, withinPercentage(1e-9));
        assertThat(emission.total().signal()[0]).isCloseTo(4.0 * perPixel, withinPercentage(1e-9));
    }

    @Test
    void selfEmissionDoesNotDependOnTheOrderOfTransparentElements() {
        final var forward = new OpticalPath(List.of(filter("W1", 1.0), Fixtures.mirror("M1", 300.0),
                filter("F", 0.5), filter("W2", 1.0), Fixtures.mirror("M2", 250.0)), GRID, DETECTOR);
        final var shuffled = new OpticalPath(List.of(Fixtures.mirror("M1", 300.0), filter("W2", 1.0),
                filter("F", 0.5), Fixtures.mirror("M2", 250.0), filter("W1", 1.0)), GRID, DETECTOR);
        forward.chain();
        shuffled.chain();

        final var a = forward.computeSignal(context(), singleBin(), Optional.empty());
        final var b = shuffled.computeSignal(context(), singleBin(), Optional.empty());

        assertThat(a.elements()).containsOnlyKeys("M1", "M2");
        assertThat(b.elements().get("M1").signal()[0])
                .isCloseTo(a.elements().get("M1").signal()[0], withinPercentage(1e-10));
        assertThat(b.elements().get("M2").signal()[0])
                .isCloseTo(a.elements().get("M2").signal()[0], withinPercentage(1e-10));
        assertThat(b.total().signal()[0]).isCloseTo(a.total().signal()[0], withinPercentage(1e-10));
    }

    private static DiffuseLightContext context() {
        return new DiffuseLightContext(DETECTOR.pixelArea(), SolidAngle.omegaPix(15.0, 15.0),
                Signal.constant(GRID, 0.7), Signal.constant(GRID, 1.0));
    }

    private static SpectralBins singleBin() {
        return new SpectralBins(new double[]{1.5}, new double[]{1.0}, new double[]{2.0}, new double[]{4.0});
    }

    @Test
    void totalSelfEmissionIsTheSumOfTheElements() {
        final var path = new OpticalPath(
                List.of(Fixtures.mirror("M1", 250.0), Fixtures.mirror("M2", 300.0)), GRID, DETECTOR);
        path.chain();
        final var context = new DiffuseLightContext(DETECTOR.pixelArea(), SolidAngle.omegaPix(15.0, 15.0),
                Signal.constant(GRID, 0.7), Signal.constant(GRID, 1.0));
        final var bins = new SpectralBins(new double[]{1.5}, new double[]{1.0}, new double[]{2.0},
                new double[]{4.0});

        final var emission = path.computeSignal(context, bins, Optional.empty());

        final var m1 = emission.elements().get("M1").signal()[0];
        final var m2 = emission.elements().get("M2").signal()[0];
        assertThat(m1).isPositive();
        assertThat(m2).isGreaterThan(m1);
        assertThat(emission.total().signal()[0]).isCloseTo(m1 + m2, withinPercentage(1e-10));
        assertThat(emission.total().maxSignalInPixel()[0]).isCloseTo((m1 + m2) / 4.0, withinPercentage(1e-10));
        assertThat(path.selfEmission()).containsSame(emission);
    }
}
