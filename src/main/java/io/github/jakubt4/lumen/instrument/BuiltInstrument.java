package io.github.jakubt4.lumen.instrument;

import io.github.jakubt4.lumen.optics.SelfEmission;
import io.github.jakubt4.lumen.optics.SlitSampling;
import io.github.jakubt4.lumen.optics.TransmissionTable;
import io.github.jakubt4.lumen.output.OutputGroup;
import io.github.jakubt4.lumen.signal.Signal;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.util.Optional;

/**
 * Artifacts produced when a channel is built, needed later to propagate targets and
 * foregrounds. Fields that do not apply to a channel kind are {@code null}.
 *
 * <p>A built channel serves concurrent targets, so array getters hand out copies.
 */
@Getter
@Builder(toBuilder = true)
public final class BuiltInstrument {

    /** Detector QE on its native grid. */
    private final Signal qeData;
    /** Total channel transmission on the detector grid. */
    private final Signal transmissionData;
    /** Window size of each bin [pixels]. */
    @Getter(AccessLevel.NONE)
    private final double[] windowSizePx;
    /** Width of the slit seen by the chained elements [µm]. */
    private final Double slitWidth;

    // photometer PSF
    @Getter(AccessLevel.NONE)
    private final double[][] prf;
    @Getter(AccessLevel.NONE)
    private final double[][] pixelResponse;
    @Getter(AccessLevel.NONE)
    private final double[] extent;

    // spectrometer sampling
    @Getter(AccessLevel.NONE)
    private final double[] pixCenter;
    @Getter(AccessLevel.NONE)
    private final double[] wlPixCenter;
    @Getter(AccessLevel.NONE)
    private final double[] pixelBandwidth;
    @Getter(AccessLevel.NONE)
    private final double[] wlBinEdges;
    private final Signal wavelengthSolution;
    @Getter(AccessLevel.NONE)
    private final double[] windowSpectralWidth;
    @Getter(AccessLevel.NONE)
    private final double[] windowSpatialWidth;
    private final Signal gainPrf;

    private final TransmissionTable transmissionTable;
    private final SelfEmission selfEmission;

    public double[] getWindowSizePx() {
        return copy(windowSizePx);
    }

    public double[][] getPrf() {
        return copy(prf);
    }

    public double[][] getPixelResponse() {
        return copy(pixelResponse);
    }

    public double[] getExtent() {
        return copy(extent);
    }

    public double[] getPixCenter() {
        return copy(pixCenter);
    }

    public double[] getWlPixCenter() {
        return copy(wlPixCenter);
    }

    public double[] getPixelBandwidth() {
        return copy(pixelBandwidth);
    }

    public double[] getWlBinEdges() {
        return copy(wlBinEdges);
    }

    public double[] getWindowSpectralWidth() {
        return copy(windowSpectralWidth);
    }

    public double[] getWindowSpatialWidth() {
        return copy(windowSpatialWidth);
    }

    /**
     * Largest value of the pixel response function, without copying it.
     */
    public double prfPeak() {
        return PointSpreadFunction.peakOf(prf);
    }

    /**
     * Slit sampling when the channel has a slit downstream of emitting elements and a pixel
     * wavelength solution.
     */
    public Optional<SlitSampling> slitSampling(final double deltaPix) {
        if (slitWidth == null || wlPixCenter == null) {
            return Optional.empty();
        }
        return Optional.of(new SlitSampling(copy(wlPixCenter), copy(pixelBandwidth),
                copy(windowSpatialWidth), deltaPix, slitWidth));
    }

    /**
     * Writes every non-null artifact to {@code group}.
     */
    public void write(final OutputGroup group) {
        writeSignal(group, "qe_data", qeData);
        writeSignal(group, "transmission_data", transmissionData);
        writeArray(group, "window_size_px", windowSizePx);
        if (slitWidth != null) {
            group.writeScalar("slit_width", slitWidth);
        }
        if (prf != null) {
            group.writeArray("PRF", prf);
            group.writeArray("pixelRF", pixelResponse);
            group.writeArray("extent", extent);
        }
        writeArray(group, "pix_center", pixCenter);
        writeArray(group, "wl_pix_center", wlPixCenter);
        writeArray(group, "pixel_bandwidth", pixelBandwidth);
        writeArray(group, "wl_bin_edges", wlBinEdges);
        writeSignal(group, "wl_solution", wavelengthSolution);
        writeArray(group, "window_spectral_width", windowSpectralWidth);
        writeArray(group, "window_spatial_width", windowSpatialWidth);
        writeSignal(group, "gain_prf", gainPrf);
        if (transmissionTable != null) {
            final var transmission = group.createGroup("transmission");
            transmissionTable.elements().forEach((name, signal) -> transmission.writeArray(name, signal.data()));
            transmission.writeArray("total", transmissionTable.total().data());
        }
        if (selfEmission != null) {
            final var emission = group.createGroup("self_emission");
            selfEmission.elements().forEach((name, signal) -> {
                emission.writeArray(name + "_signal", signal.signal());
                emission.writeArray(name + "_MaxSignal_inPixel", signal.maxSignalInPixel());
            });
        }
    }

    private static double[] copy(final double[] values) {
        return values == null ? null : values.clone();
    }

    private static double[][] copy(final double[][] values) {
        if (values == null) {
            return null;
        }
        final var out = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[i].clone();
        }
        return out;
    }

    private static void writeArray(final OutputGroup group, final String name, final double[] values) {
        if (values != null) {
            group.writeArray(name, values);
        }
    }

    private static void writeSignal(final OutputGroup group, final String name, final Signal signal) {
        if (signal != null) {
            final var child = group.createGroup(name);
            child.writeArray("wavelength", signal.wavelength());
            child.writeArray("data", signal.data());
        }
    }
}
