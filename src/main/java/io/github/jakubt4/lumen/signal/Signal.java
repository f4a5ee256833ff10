package io.github.jakubt4.lumen.signal;

import java.util.Arrays;

/**
 * Immutable spectrum sampled on a wavelength grid.
 *
 * <p>The unit of {@link #data()} depends on what the signal carries (transmission,
 * radiance, SED, ...); wavelengths are always in microns.
 */
public final class Signal {

    private final double[] wavelength;
    private final double[] data;

    public Signal(final double[] wavelength, final double[] data) {
        if (wavelength.length != data.length) {
            throw new IllegalArgumentException(
                    "wavelength and data lengths must match: " + wavelength.length + " != " + data.length);
        }
        this.wavelength = wavelength.clone();
        this.data = data.clone();
    }

    public static Signal constant(final double[] wavelength, final double value) {
        final var data = new double[wavelength.length];
        Arrays.fill(data, value);
        return new Signal(wavelength, data);
    }

    public double[] wavelength() {
        return wavelength.clone();
    }

    public double[] data() {
        return data.clone();
    }

    public int size() {
        return data.length;
    }

    public double valueAt(final int index) {
        return data[index];
    }

    public double wavelengthAt(final int index) {
        return wavelength[index];
    }

    /**
     * Resampled copy on {@code grid}, see {@link SpectralMath#rebin}.
     */
    public Signal rebin(final double[] grid) {
        return new Signal(grid, SpectralMath.rebin(grid, wavelength, data));
    }

    /**
     * Linearly interpolated values at {@code grid}, {@code fill} outside the sampled range.
     */
    public double[] interpolate(final double[] grid, final double fill) {
        return SpectralMath.interpolate(wavelength, data, grid, fill);
    }

    public Signal times(final double[] factors) {
        return new Signal(wavelength, SpectralMath.multiply(data, factors));
    }

    /**
     * Sample-wise product; both signals must share the same grid.
     */
    public Signal times(final Signal other) {
        requireSameGrid(other);
        return times(other.data);
    }

    public Signal times(final double factor) {
        return new Signal(wavelength, SpectralMath.scale(data, factor));
    }

    public Signal plus(final Signal other) {
        requireSameGrid(other);
        return new Signal(wavelength, SpectralMath.add(data, other.data));
    }

    /**
     * Copy with every sample outside {@code [min, max]} set to zero.
     */
    public Signal zeroOutside(final double min, final double max) {
        final var out = data.clone();
        for (int i = 0; i < out.length; i++) {
            if (wavelength[i] < min || wavelength[i] > max) {
                out[i] = 0.0;
            }
        }
        return new Signal(wavelength, out);
    }

    public double integrate() {
        return SpectralMath.trapz(data, wavelength);
    }

    private void requireSameGrid(final Signal other) {
        if (!Arrays.equals(wavelength, other.wavelength)) {
            throw new IllegalArgumentException("signals are sampled on different wavelength grids");
        }
    }

    @Override
    public String toString() {
        return "Signal[" + data.length + " samples, "
                + (wavelength.length == 0 ? "empty" : wavelength[0] + "-" + wavelength[wavelength.length - 1] + " um")
                + "]";
    }
}
