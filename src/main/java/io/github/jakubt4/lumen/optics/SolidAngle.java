package io.github.jakubt4.lumen.optics;

import org.hipparchus.special.elliptic.legendre.LegendreEllipticIntegral;

/**
 * Solid angle subtended on-axis by an elliptical aperture, following J. T. Conway,
 * Nucl. Instrum. Methods A 614 (2010) 17-27, eq. 56.
 */
public final class SolidAngle {

    private SolidAngle() {
    }

    /**
     * @param fnumX F-number along the dispersion direction
     * @param fnumY F-number across the dispersion direction
     * @return pixel solid angle [sr]
     */
    public static double omegaPix(final double fnumX, final double fnumY) {
        if (!(fnumX > 0.0) || !(fnumY > 0.0)) {
            throw new IllegalArgumentException("F-numbers must be positive: " + fnumX + ", " + fnumY);
        }
        // a is the larger semi-axis of the aperture seen from unit distance
        final double a;
        final double b;
        if (fnumX > fnumY) {
            a = 0.5 / fnumY;
            b = 0.5 / fnumX;
        } else {
            a = 0.5 / fnumX;
            b = 0.5 / fnumY;
        }
        final var h = 1.0;
        final var scale = 4.0 * h * b / (a * Math.sqrt(h * h + a * a));
        // elliptic parameter m = k^2 and characteristic n = alpha^2
        final var m = (a * a - b * b) / (h * h + a * a);
        final var n = 1.0 - (b / a) * (b / a);

        return 2.0 * Math.PI - scale * LegendreEllipticIntegral.bigPi(n, m);
    }

    /**
     * Closed form for a circular aperture, 2π(1 - cos(atan(1/2F))).
     */
    public static double omegaPixCircular(final double fnum) {
        return 2.0 * Math.PI * (1.0 - Math.cos(Math.atan(0.5 / fnum)));
    }
}
