package io.github.jakubt4.lumen.optics;

/**
 * Output wavelength bins of a channel.
 *
 * @param wavelength bin centres [µm]
 * @param left       left bin edges [µm], inclusive
 * @param right      right bin edges [µm], exclusive
 * @param windowSize photometric window size of each bin [pixels]
 */
public record SpectralBins(double[] wavelength, double[] left, double[] right, double[] windowSize) {

    public SpectralBins {
        if (left.length != wavelength.length || right.length != wavelength.length
                || windowSize.length != wavelength.length) {
            throw new IllegalArgumentException("bin arrays must have the same length");
        }
    }

    public int size() {
        return wavelength.length;
    }

    public boolean contains(final int bin, final double value) {
        return value >= left[bin] && value < right[bin];
    }
}
