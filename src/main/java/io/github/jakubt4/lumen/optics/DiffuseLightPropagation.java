package io.github.jakubt4.lumen.optics;

import io.github.jakubt4.lumen.description.DetectorDescription;
import io.github.jakubt4.lumen.signal.PhysicalConstants;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;
import lombok.extern.slf4j.Slf4j;

import java.util.Arrays;

/**
 * Conversion of diffuse radiance into detected photoelectrons, shared by instrument
 * self-emission and by the diffuse foregrounds.
 */
@Slf4j
public final class DiffuseLightPropagation {

    private DiffuseLightPropagation() {
    }

    /**
     * Gathers the pixel area, the pixel solid angle and the channel QE and transmission.
     */
    public static DiffuseLightContext prepare(final DetectorDescription detector, final double fnumX,
                                              final double fnumY, final Signal qe, final Signal transmission) {
        final var omegaPix = SolidAngle.omegaPix(fnumX, fnumY);
        log.debug("Pixel solid angle {} sr for F/{} x F/{}", omegaPix, fnumX, fnumY);
        return new DiffuseLightContext(detector.pixelArea(), omegaPix, qe, transmission);
    }

    /**
     * Photoelectron rate density [ct/s/µm] of a radiance seen through {@code solidAngle}:
     * radiance × A × Ω × QE × λ/(hc), with the QE resampled on the radiance grid.
     */
    public static Signal photonRate(final DiffuseLightContext context, final Signal radiance,
                                    final double solidAngle) {
        final var wavelength = radiance.wavelength();
        final var qe = context.qe().rebin(wavelength);
        final var factor = new double[wavelength.length];
        for (int i = 0; i < wavelength.length; i++) {
            factor[i] = context.pixelArea() * solidAngle * qe.valueAt(i)
                    * PhysicalConstants.photonsPerJoule(wavelength[i]);
        }
        return radiance.times(factor);
    }

    /**
     * Diffuse light through a slit: the radiance is moved onto the detector pixels, convolved
     * with the slit image (a box {@link SlitSampling#kernelWidth()} pixels wide) and summed
     * within each output bin, then scaled by the bin spatial window width.
     *
     * @param radiance radiance at the detector [W m^-2 µm^-1 sr^-1]
     */
    public static PropagatedSignal convolveWithSlit(final DiffuseLightContext context, final SpectralBins bins,
                                                    final SlitSampling sampling, final Signal radiance) {
        final var wlPix = sampling.wlPixCenter();
        final var dwlPix = sampling.pixelBandwidth();
        final var pixelRadiance = radiance.rebin(wlPix);
        final var qe = context.qe().interpolate(wlPix, 0.0);

        final var perPixel = new double[wlPix.length];
        for (int i = 0; i < wlPix.length; i++) {
            perPixel[i] = pixelRadiance.valueAt(i) * context.omegaPix() * context.pixelArea() * qe[i]
                    * PhysicalConstants.photonsPerJoule(wlPix[i]) * dwlPix[i];
        }
        final var kernel = new double[sampling.kernelWidth()];
        Arrays.fill(kernel, 1.0);
        final var convolved = SpectralMath.convolveSame(perPixel, kernel);

        final var signal = new double[bins.size()];
        final var max = new double[bins.size()];
        for (int bin = 0; bin < bins.size(); bin++) {
            var sum = 0.0;
            var peak = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < wlPix.length; i++) {
                if (bins.contains(bin, wlPix[i])) {
                    sum += convolved[i];
                    peak = Math.max(peak, convolved[i]);
                }
            }
            if (peak == Double.NEGATIVE_INFINITY) {
                log.debug("No pixel falls in bin {} [{}, {}) um", bin, bins.left()[bin], bins.right()[bin]);
                peak = 0.0;
            }
            signal[bin] = sum * sampling.windowSpatialWidth()[bin];
            max[bin] = peak;
        }
        return new PropagatedSignal(signal, max);
    }

    /**
     * Integrates a photoelectron rate density over wavelength. The result is the signal in one
     * pixel; the window signal is that times the window size of each bin.
     *
     * @param rate photoelectron rate density [ct/s/µm]
     */
    public static PropagatedSignal integrateLight(final Signal rate, final SpectralBins bins) {
        final var perPixel = rate.integrate();
        final var signal = new double[bins.size()];
        final var max = new double[bins.size()];
        for (int bin = 0; bin < bins.size(); bin++) {
            signal[bin] = perPixel * bins.windowSize()[bin];
            max[bin] = perPixel;
        }
        return new PropagatedSignal(signal, max);
    }
}
