package io.github.jakubt4.lumen.instrument;

import io.github.jakubt4.lumen.description.ChannelDescription;
import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.PayloadDescription;
import io.github.jakubt4.lumen.description.ResolvingPowerDescription;
import io.github.jakubt4.lumen.signal.PhysicalConstants;
import io.github.jakubt4.lumen.signal.Signal;
import io.github.jakubt4.lumen.signal.SpectralMath;
import io.github.jakubt4.lumen.table.ChannelTable;
import io.github.jakubt4.lumen.target.TargetObservation;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;

/**
 * Dispersive channel. The detector wavelength solution maps pixel positions to
 * wavelengths; output bins follow either the pixels themselves or a requested resolving
 * power.
 */
@Slf4j
public class Spectrometer extends Instrument {

    private static final double DEFAULT_APERTURE_RADIUS = 1.22;
    private static final int GAIN_SAMPLES = 10;

    Spectrometer(final ChannelDescription description, final PayloadDescription payload) {
        super(description, payload);
    }

    Spectrometer(final ChannelDescription description, final PayloadDescription payload, final ChannelTable table,
                 final BuiltInstrument built) {
        super(description, payload, table, built);
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.SPECTROMETER;
    }

    @Override
    protected Layout layout() {
        final var solution = wavelengthSolution();
        final var wlSolution = solution.wavelength();
        final var xSolution = solution.data();
        final var deltaPix = description.detector().deltaPix();

        // pixel centres covering the band, ordered by increasing wavelength
        var first = SpectralMath.interpolateExtrapolate(wlSolution, xSolution, description.wlMin());
        var last = SpectralMath.interpolateExtrapolate(wlSolution, xSolution, description.wlMax());
        if (first > last) {
            final var swap = first;
            first = last;
            last = swap;
        }
        final var pixels = (int) Math.ceil((last - first) / deltaPix);
        if (pixels < 1) {
            throw new ConfigurationException("spectrometer [" + name() + "] band covers no detector pixel");
        }
        var pixCenter = new double[pixels];
        for (int i = 0; i < pixels; i++) {
            pixCenter[i] = first + i * deltaPix;
        }
        var wlPixCenter = SpectralMath.interpolateExtrapolate(xSolution, wlSolution, pixCenter);
        final var descending = pixels > 1 && wlPixCenter[0] > wlPixCenter[pixels - 1];
        if (descending) {
            pixCenter = reversed(pixCenter);
            wlPixCenter = reversed(wlPixCenter);
        }
        final var pixelBandwidth = new double[pixels];
        for (int i = 0; i < pixels; i++) {
            final var lower = SpectralMath.interpolateExtrapolate(xSolution, wlSolution, pixCenter[i] - 0.5 * deltaPix);
            final var upper = SpectralMath.interpolateExtrapolate(xSolution, wlSolution, pixCenter[i] + 0.5 * deltaPix);
            pixelBandwidth[i] = Math.abs(lower - upper);
        }

        final var edges = binEdges(pixCenter, xSolution, wlSolution, deltaPix);
        final var bins = edges.length - 1;
        final var centres = new double[bins];
        final var bandwidth = new double[bins];
        final var left = new double[bins];
        final var right = new double[bins];
        for (int k = 0; k < bins; k++) {
            left[k] = edges[k];
            right[k] = edges[k + 1];
            bandwidth[k] = edges[k + 1] - edges[k];
            centres[k] = 0.5 * (edges[k] + edges[k + 1]);
        }
        if (targetR().mode() == ResolvingPowerDescription.Mode.NATIVE) {
            System.arraycopy(wlPixCenter, 0, centres, 0, bins);
        }

        final var qeData = loadQe();

        final var pixelWindowEdge = SpectralMath.interpolateExtrapolate(wlSolution, xSolution, edges);
        final var spectralWidth = new double[bins];
        final var spatialWidth = new double[bins];
        final var windowSize = new double[bins];
        final var radius = apertureRadius(centres);
        final var spatialScale = description.windowSpatialScale() != null ? description.windowSpatialScale() : 1.0;
        for (int k = 0; k < bins; k++) {
            spectralWidth[k] = Math.abs(pixelWindowEdge[k + 1] - pixelWindowEdge[k]) / deltaPix;
            spatialWidth[k] = 2.0 * radius[k] * description.fnumY() * centres[k] / deltaPix * spatialScale;
            windowSize[k] = spectralWidth[k] * spatialWidth[k];
        }

        final var gain = gainCurve(wlPixCenter);
        log.debug("Spectrometer [{}]: {} pixels, {} bins", name(), pixels, bins);

        final var table = ChannelTable.forChannel(name(), bins)
                .with(WAVELENGTH, centres)
                .with(BANDWIDTH, bandwidth)
                .with(LEFT_BIN_EDGE, left)
                .with(RIGHT_BIN_EDGE, right)
                .with("QE", qeData.interpolate(centres, 0.0))
                .with(WINDOW_SIZE, windowSize);

        final var artifacts = BuiltInstrument.builder()
                .qeData(qeData)
                .pixCenter(pixCenter)
                .wlPixCenter(wlPixCenter)
                .pixelBandwidth(pixelBandwidth)
                .wlBinEdges(edges)
                .wavelengthSolution(solution)
                .windowSpectralWidth(spectralWidth)
                .windowSpatialWidth(spatialWidth)
                .windowSizePx(windowSize)
                .gainPrf(gain);
        return new Layout(table, artifacts);
    }

    /**
     * Pixel position {@code x} [µm] against wavelength, as a signal over wavelength.
     */
    private Signal wavelengthSolution() {
        final var data = description.wlSolution();
        if (data == null || !data.has(WAVELENGTH) || !data.has("x")) {
            throw new ConfigurationException("spectrometer [" + name() + "] needs a wlSolution with "
                    + "'Wavelength' and 'x' columns");
        }
        return new Signal(data.column(WAVELENGTH), data.column("x"));
    }

    private ResolvingPowerDescription targetR() {
        return description.targetR() != null ? description.targetR() : ResolvingPowerDescription.nativeSampling();
    }

    /**
     * Increasing, contiguous bin edges [µm] for the requested resolving power.
     */
    private double[] binEdges(final double[] pixCenter, final double[] xSolution, final double[] wlSolution,
                              final double deltaPix) {
        final var resolvingPower = description.targetR();
        if (resolvingPower == null) {
            log.warn("Spectrometer [{}] has no targetR, using native pixel sampling", name());
        }
        final var wlMin = description.wlMin();
        final var wlMax = description.wlMax();
        return switch (targetR().mode()) {
            case NATIVE -> {
                // pixel boundaries, walking the pixels in wavelength order
                final var direction = pixCenter.length > 1 && pixCenter[1] < pixCenter[0] ? -1.0 : 1.0;
                final var boundaries = new double[pixCenter.length + 1];
                boundaries[0] = pixCenter[0] - 0.5 * deltaPix * direction;
                for (int i = 0; i < pixCenter.length; i++) {
                    boundaries[i + 1] = pixCenter[i] + 0.5 * deltaPix * direction;
                }
                final var edges = SpectralMath.interpolateExtrapolate(xSolution, wlSolution, boundaries);
                yield edges[0] > edges[edges.length - 1] ? reversed(edges) : edges;
            }
            case FIXED -> {
                final var step = 1.0 + 1.0 / targetR().value();
                final var count = (int) Math.ceil(Math.log(wlMax / wlMin) / Math.log(step)) + 1;
                final var edges = new double[count];
                for (int k = 0; k < count; k++) {
                    edges[k] = wlMin * Math.pow(step, k);
                }
                yield edges;
            }
            case TABULATED -> {
                final var table = targetR().data();
                final var wl = table.column(table.firstPresent(WAVELENGTH, "wavelength")
                        .orElseThrow(() -> new ConfigurationException(
                                "targetR table of [" + name() + "] has no wavelength column")));
                final var r = table.column(table.firstPresent("R", "resolution")
                        .orElseThrow(() -> new ConfigurationException(
                                "targetR table of [" + name() + "] has no 'R' column")));
                final var edges = new ArrayList<Double>();
                var edge = wlMin;
                edges.add(edge);
                while (edge < wlMax) {
                    final var local = SpectralMath.interpolateExtrapolate(wl, r, edge);
                    if (!(local > 0.0) || Double.isInfinite(local)) {
                        throw new ConfigurationException("targetR of [" + name() + "] is not positive and finite at "
                                + edge + ": " + local);
                    }
                    final var next = edge * (1.0 + 1.0 / local);
                    if (!(next > edge)) {
                        throw new ConfigurationException("targetR of [" + name() + "] is too large to step past "
                                + edge + ": " + local);
                    }
                    edge = next;
                    edges.add(edge);
                }
                yield edges.stream().mapToDouble(Double::doubleValue).toArray();
            }
        };
    }

    /**
     * Aperture radius [λF] per bin, from the encircled-energy solution when present.
     */
    private double[] apertureRadius(final double[] centres) {
        final var solution = description.encircledEnergySolution();
        if (solution == null) {
            final var radius = new double[centres.length];
            Arrays.fill(radius, DEFAULT_APERTURE_RADIUS);
            return radius;
        }
        final var wl = solution.column(WAVELENGTH);
        final var r = solution.column(solution.firstPresent("r", "radius")
                .orElseThrow(() -> new ConfigurationException(
                        "encircledEnergySolution of [" + name() + "] has no 'r' column")));
        return SpectralMath.interpolateExtrapolate(wl, r, centres);
    }

    /**
     * Fraction of the PSF collected by the brightest pixel column, sampled across the band
     * and degraded by the Strehl ratio of the wavefront error.
     */
    private Signal gainCurve(final double[] wlPixCenter) {
        if (description.psf() != null && !description.psf().isAiry()) {
            throw new ConfigurationException("channel [" + name() + "]: PSF format '" + description.psf().format()
                    + "' is not supported, only the analytic airy model is available");
        }
        final var wl = SpectralMath.linspace(SpectralMath.min(wlPixCenter), SpectralMath.max(wlPixCenter),
                GAIN_SAMPLES);
        final var gain = new double[wl.length];
        for (int i = 0; i < wl.length; i++) {
            final var psf = PointSpreadFunction.airy(description.fnumX(), description.fnumY(), wl[i],
                    description.detector().deltaPix());
            gain[i] = psf.columnGain();
            if (description.wfeRms() != null) {
                final var phase = 2.0 * Math.PI * description.wfeRms() / wl[i];
                gain[i] *= Math.exp(-phase * phase);
            }
        }
        return new Signal(wl, gain);
    }

    @Override
    public ChannelTable propagateTarget(final TargetObservation target) {
        final var sed = target.sed();
        final var wl = sed.wavelength();
        final var flux = sed.data();
        final var efficiency = efficiency(wl, target);
        final var qe = efficiency.qe();
        final var transmission = efficiency.transmission();
        final var window = new double[wl.length];
        for (int i = 0; i < wl.length; i++) {
            window[i] = 1.0;
            if (forceChannelEdges() && (wl[i] < description.wlMin() || wl[i] > description.wlMax())) {
                transmission[i] = 0.0;
                window[i] = 0.0;
            }
        }
        final var area = payload.telescopeArea();
        final var density = new double[wl.length];
        for (int i = 0; i < wl.length; i++) {
            density[i] = area * transmission[i] * qe[i] * flux[i] * PhysicalConstants.photonsPerJoule(wl[i]);
        }

        final var bins = bins();
        final var starFlux = new double[bins.size()];
        final var starSignal = new double[bins.size()];
        final var maskedFlux = new double[wl.length];
        final var maskedDensity = new double[wl.length];
        for (int k = 0; k < bins.size(); k++) {
            for (int i = 0; i < wl.length; i++) {
                final var inside = bins.contains(k, wl[i]);
                maskedFlux[i] = inside ? window[i] * flux[i] : 0.0;
                maskedDensity[i] = inside ? density[i] : 0.0;
            }
            starFlux[k] = SpectralMath.trapz(maskedFlux, wl);
            starSignal[k] = SpectralMath.trapz(maskedDensity, wl);
        }

        final var built = built();
        final var wlPix = built.getWlPixCenter();
        final var pixelDensity = SpectralMath.rebin(wlPix, wl, density);
        final var gain = SpectralMath.cubic(built.getGainPrf().wavelength(), built.getGainPrf().data(), wlPix);
        final var pixelBandwidth = built.getPixelBandwidth();
        final var maxInPixel = new double[bins.size()];
        for (int k = 0; k < bins.size(); k++) {
            var peak = 0.0;
            for (int i = 0; i < wlPix.length; i++) {
                if (bins.contains(k, wlPix[i])) {
                    peak = Math.max(peak, pixelDensity[i] * pixelBandwidth[i] * gain[i]);
                }
            }
            maxInPixel[k] = peak;
        }
        log.debug("Target [{}] in [{}]: {} bins propagated", target.name(), name(), bins.size());

        var out = ChannelTable.forChannel(name(), bins.size());
        final var skyTransmission = foregroundTransmission(target);
        if (skyTransmission.isPresent()) {
            out = out.with("foreground_transmission", skyTransmission.get());
        }
        return out.with("starFlux", starFlux)
                .with("starSignal", starSignal)
                .with("star_signal_inAperture", starSignal)
                .with("star_MaxSignal_inPixel", maxInPixel);
    }

    private static double[] reversed(final double[] values) {
        final var out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = values[values.length - 1 - i];
        }
        return out;
    }
}
