package io.github.jakubt4.lumen.instrument;

import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.signal.SpectralMath;
import lombok.extern.slf4j.Slf4j;
import org.hipparchus.special.BesselJ;

import java.util.Arrays;

/**
 * Analytic Airy point spread function binned by the detector pixel response.
 *
 * <p>The PSF is sampled on a {@value #GRID_SIZE}×{@value #GRID_SIZE} grid spanning
 * ±{@value #HALF_WIDTH} in units of λF along each axis, so that the pixel spacing of the
 * grid, in physical units, is {@code F·λ·dx} with a different F on each axis.
 */
@Slf4j
public final class PointSpreadFunction {

    public static final int GRID_SIZE = 256;
    public static final double HALF_WIDTH = 4.0;

    private static final double RADIUS_STEP = 0.05;

    private PointSpreadFunction() {
    }

    /**
     * @param prf           PSF convolved with the pixel response, normalised before the convolution
     * @param pixelResponse pixel response kernel, with fractional edge weights
     * @param extent        physical extent of the grid (xmin, xmax, ymin, ymax) [µm]
     * @param dx            grid spacing [λF]
     */
    public record BinnedPsf(double[][] prf, double[][] pixelResponse, double[] extent, double dx) {

        public double peak() {
            return peakOf(prf);
        }

        public double total() {
            var sum = 0.0;
            for (final var row : prf) {
                for (final var value : row) {
                    sum += value;
                }
            }
            return sum;
        }

        /**
         * Largest energy collected by one detector column, relative to the largest column
         * sum of the pixel response.
         */
        public double columnGain() {
            return maxColumnSum(prf) / maxColumnSum(pixelResponse);
        }

        private static double maxColumnSum(final double[][] image) {
            final var sums = new double[image[0].length];
            for (final var row : image) {
                for (int j = 0; j < row.length; j++) {
                    sums[j] += row[j];
                }
            }
            return SpectralMath.max(sums);
        }
    }

    /**
     * Airy PSF at {@code wavelength}, convolved with a box the size of one detector pixel.
     *
     * @param fnumX      F-number along x
     * @param fnumY      F-number along y
     * @param wavelength wavelength [µm]
     * @param deltaPix   pixel pitch [µm]
     */
    public static BinnedPsf airy(final double fnumX, final double fnumY, final double wavelength,
                                 final double deltaPix) {
        final var x = SpectralMath.linspace(-HALF_WIDTH, HALF_WIDTH, GRID_SIZE);
        final var dx = x[1] - x[0];
        final var image = airyImage(x);

        final var kx = deltaPix / (fnumX * wavelength * dx);
        final var ky = deltaPix / (fnumY * wavelength * dx);
        final var weightsX = boxWeights(kx);
        final var weightsY = boxWeights(ky);

        // the pixel kernel is the outer product of the two box profiles
        final var kernel = new double[weightsY.length][weightsX.length];
        for (int i = 0; i < weightsY.length; i++) {
            for (int j = 0; j < weightsX.length; j++) {
                kernel[i][j] = weightsY[i] * weightsX[j];
            }
        }
        final var prf = convolveSeparable(image, weightsY, weightsX);

        final var half = GRID_SIZE / 2;
        final var extent = new double[]{
                -half * fnumX * wavelength * dx, half * fnumX * wavelength * dx,
                -half * fnumY * wavelength * dx, half * fnumY * wavelength * dx};
        log.debug("Airy PSF at {} um: kernel {}x{} samples", wavelength, weightsY.length, weightsX.length);
        return new BinnedPsf(prf, kernel, extent, dx);
    }

    /**
     * Largest value of a PSF image.
     */
    public static double peakOf(final double[][] image) {
        var max = Double.NEGATIVE_INFINITY;
        for (final var row : image) {
            max = Math.max(max, SpectralMath.max(row));
        }
        return max;
    }

    /**
     * Fraction of the PSF energy inside a circle of {@code radius} λF around the grid centre.
     */
    public static double encircledEnergy(final BinnedPsf psf, final double radius) {
        final var centre = (GRID_SIZE - 1) / 2.0;
        final var radiusPix = radius / psf.dx();
        final var limit = radiusPix * radiusPix;
        var inside = 0.0;
        final var prf = psf.prf();
        for (int i = 0; i < prf.length; i++) {
            final var di = i - centre;
            for (int j = 0; j < prf[i].length; j++) {
                final var dj = j - centre;
                if (di * di + dj * dj <= limit) {
                    inside += prf[i][j];
                }
            }
        }
        return inside / psf.total();
    }

    /**
     * Aperture radius [λF] enclosing {@code encircledEnergy} of the PSF, found by stepping
     * outward from the centre and interpolating between the last two steps.
     *
     * @throws ConfigurationException if the fraction is not reached inside the sampled grid
     */
    public static double apertureRadius(final BinnedPsf psf, final double encircledEnergy) {
        if (!(encircledEnergy > 0.0 && encircledEnergy < 1.0)) {
            throw new ConfigurationException("encircled energy must be in (0, 1), got " + encircledEnergy);
        }
        var previousRadius = 0.0;
        var previousEnergy = 0.0;
        for (var radius = RADIUS_STEP; radius <= HALF_WIDTH; radius += RADIUS_STEP) {
            final var energy = encircledEnergy(psf, radius);
            if (energy >= encircledEnergy) {
                if (energy == previousEnergy) {
                    return radius;
                }
                return previousRadius + (encircledEnergy - previousEnergy)
                        * (radius - previousRadius) / (energy - previousEnergy);
            }
            previousRadius = radius;
            previousEnergy = energy;
        }
        throw new ConfigurationException("encircled energy " + encircledEnergy
                + " is not reached within " + HALF_WIDTH + " lambda*F");
    }

    private static double[][] airyImage(final double[] x) {
        final var n = x.length;
        final var image = new double[n][n];
        var total = 0.0;
        // the grid is symmetric about its centre, so one quadrant is enough
        for (int i = 0; i < (n + 1) / 2; i++) {
            for (int j = 0; j < (n + 1) / 2; j++) {
                final var r = Math.PI * Math.sqrt(x[i] * x[i] + x[j] * x[j]) + 1.0e-10;
                final var amplitude = 2.0 * BesselJ.value(1, r) / r;
                final var value = amplitude * amplitude;
                image[i][j] = value;
                image[n - 1 - i][j] = value;
                image[i][n - 1 - j] = value;
                image[n - 1 - i][n - 1 - j] = value;
            }
        }
        for (final var row : image) {
            for (final var value : row) {
                total += value;
            }
        }
        for (final var row : image) {
            for (int j = 0; j < n; j++) {
                row[j] /= total;
            }
        }
        return image;
    }

    /**
     * Box profile covering {@code k} samples: the integer part at weight 1, plus one sample on
     * each side carrying half of the fractional part.
     */
    private static double[] boxWeights(final double k) {
        final var whole = (int) Math.floor(k);
        final var fraction = k - whole;
        final var weights = new double[whole + 2];
        Arrays.fill(weights, 1.0);
        weights[0] = 0.5 * fraction;
        weights[weights.length - 1] = 0.5 * fraction;
        return weights;
    }

    private static double[][] convolveSeparable(final double[][] image, final double[] weightsY,
                                                final double[] weightsX) {
        final var rows = image.length;
        final var cols = image[0].length;
        final var horizontal = new double[rows][];
        for (int i = 0; i < rows; i++) {
            horizontal[i] = SpectralMath.convolveSame(image[i], weightsX);
        }
        final var out = new double[rows][cols];
        final var column = new double[rows];
        for (int j = 0; j < cols; j++) {
            for (int i = 0; i < rows; i++) {
                column[i] = horizontal[i][j];
            }
            final var convolved = SpectralMath.convolveSame(column, weightsY);
            for (int i = 0; i < rows; i++) {
                out[i][j] = convolved[i];
            }
        }
        return out;
    }
}
