package io.github.jakubt4.lumen.optics;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class SolidAngleTest {

    @Test
    void circularApertureMatchesClosedForm() {
        for (final var fnum : new double[]{1.0, 5.0, 15.0, 40.0}) {
            assertThat(SolidAngle.omegaPix(fnum, fnum))
                    .isCloseTo(SolidAngle.omegaPixCircular(fnum), within(1e-12));
        }
    }

    @Test
    void ellipticalApertureMatchesDirectIntegration() {
        // integral of dx dy / (1 + x^2 + y^2)^(3/2) over the ellipse of semi-axes 1/20 and 1/40
        assertThat(SolidAngle.omegaPix(10.0, 20.0)).isCloseTo(3.92241e-3, within(1e-7));
    }

    @Test
    void ellipticalApertureIsSymmetricInItsAxes() {
        assertThat(SolidAngle.omegaPix(10.0, 20.0)).isCloseTo(SolidAngle.omegaPix(20.0, 10.0), within(1e-15));
    }

    @Test
    void ellipticalApertureLiesBetweenTheBoundingCircles() {
        final var omega = SolidAngle.omegaPix(8.0, 12.0);

        assertThat(omega).isBetween(SolidAngle.omegaPixCircular(12.0), SolidAngle.omegaPixCircular(8.0));
    }

    @Test
    void rejectsNonPositiveFNumbers() {
        assertThatThrownBy(() -> SolidAngle.omegaPix(0.0, 10.0)).isInstanceOf(IllegalArgumentException.class);
    }
}
