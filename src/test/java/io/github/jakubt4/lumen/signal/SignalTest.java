package io.github.jakubt4.lumen.signal;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SignalTest {

    private static final double[] GRID = {1.0, 2.0, 3.0};

    @Test
    void isImmutable() {
        final var data = new double[]{1.0, 2.0, 3.0};
        final var signal = new Signal(GRID, data);
        data[0] = 42.0;
        signal.data()[1] = 42.0;

        assertThat(signal.data()).containsExactly(1.0, 2.0, 3.0);
    }

    @Test
    void productsRequireTheSameGrid() {
        final var signal = Signal.constant(GRID, 2.0);

        assertThat(signal.times(Signal.constant(GRID, 3.0)).data()).containsExactly(6.0, 6.0, 6.0);
        assertThatThrownBy(() -> signal.times(Signal.constant(new double[]{1.0, 2.0, 4.0}, 3.0)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void zeroOutsideKeepsTheInclusiveRange() {
        final var signal = Signal.constant(GRID, 1.0).zeroOutside(2.0, 3.0);

        assertThat(signal.data()).containsExactly(0.0, 1.0, 1.0);
    }

    @Test
    void integrateUsesTrapezoids() {
        assertThat(new Signal(GRID, new double[]{0.0, 1.0, 0.0}).integrate()).isEqualTo(1.0);
    }
}
