package io.github.jakubt4.lumen.target;

import io.github.jakubt4.lumen.Fixtures;
import io.github.jakubt4.lumen.foreground.Foreground;
import io.github.jakubt4.lumen.foreground.SkyForeground;
import io.github.jakubt4.lumen.foreground.ZodiacalForeground;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;
import io.github.jakubt4.lumen.table.ChannelTable;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class TargetObservationTest {

    private static final double[] GRID = SpectralMath.linspace(1.0, 2.0, 11);

    private static SkyForeground sky(final String name, final double transmission) {
        return new SkyForeground(name, Signal.constant(GRID, 0.0), Signal.constant(GRID, transmission));
    }

    private static TargetObservation observation() {
        return new TargetObservation(Fixtures.sunLike("t1"), ChannelTable.forChannel("Phot", 1));
    }

    @Test
    void foregroundsKeepTheirRegistrationOrder() {
        final var observation = observation();
        observation.registerForeground(sky("air", 0.5));
        observation.registerForeground(ZodiacalForeground.of("zodi", GRID, 1.0));

        assertThat(observation.foregrounds()).extracting(Foreground::name).containsExactly("air", "zodi");
    }

    @Test
    void skyTransmissionAccumulatesOverAbsorbingForegrounds() {
        final var observation = observation();
        assertThat(observation.skyTransmission()).isEmpty();

        observation.registerForeground(sky("air", 0.5));
        observation.registerForeground(ZodiacalForeground.of("zodi", GRID, 1.0));
        observation.registerForeground(sky("cloud", 0.8));

        assertThat(observation.skyTransmission()).isPresent();
        for (final var value : observation.skyTransmission().get().data()) {
            assertThat(value).isCloseTo(0.4, within(1e-12));
        }
    }

    @Test
    void sedMustBeLoadedBeforeUse() {
        final var observation = observation();

        assertThatThrownBy(observation::sed)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("t1");

        observation.setSed(Signal.constant(GRID, 1.0));
        assertThat(observation.sed().size()).isEqualTo(GRID.length);
    }

    @Test
    void tableUpdatesMergeColumnsAndMetadata() {
        final var observation = observation();

        observation.updateTable(ChannelTable.forChannel("Phot", 1).with("starSignal", new double[]{1.0}));
        observation.updateTable(ChannelTable.forChannel("Phot", 1).with("starSignal", new double[]{2.0}));
        observation.addMetadata("starName", "t1");

        assertThat(observation.getTable().column("starSignal")).containsExactly(2.0);
        assertThat(observation.getTable().metadata()).containsEntry("starName", "t1");
    }
}
