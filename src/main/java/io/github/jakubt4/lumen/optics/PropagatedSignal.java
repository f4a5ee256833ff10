package io.github.jakubt4.lumen.optics;

import io.github.jakubt4.lumen.signal.SpectralMath;

/**
 * Detected signal per output bin.
 *
 * @param signal           signal in the photometric window [ct/s]
 * @param maxSignalInPixel signal in the brightest pixel [ct/s]
 */
public record PropagatedSignal(double[] signal, double[] maxSignalInPixel) {

    public static PropagatedSignal zero(final int bins) {
        return new PropagatedSignal(new double[bins], new double[bins]);
    }

    public PropagatedSignal plus(final PropagatedSignal other) {
        return new PropagatedSignal(SpectralMath.add(signal, other.signal),
                SpectralMath.add(maxSignalInPixel, other.maxSignalInPixel));
    }
}
