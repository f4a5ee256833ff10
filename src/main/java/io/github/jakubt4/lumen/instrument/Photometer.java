package io.github.jakubt4.lumen.instrument;

import io.github.jakubt4.lumen.description.ChannelDescription;
import io.github.jakubt4.lumen.description.ConfigurationException;
import io.github.jakubt4.lumen.description.PayloadDescription;
import io.github.jakubt4.lumen.signal.PhysicalConstants;
import io.github.jakubt4.lumen.signal.SpectralMath;
import io.github.jakubt4.lumen.table.ChannelTable;
import io.github.jakubt4.lumen.target.TargetObservation;
import lombok.extern.slf4j.Slf4j;

/**
 * Broadband channel with a single output bin covering the whole band.
 */
@Slf4j
public class Photometer extends Instrument {

    Photometer(final ChannelDescription description, final PayloadDescription payload) {
        super(description, payload);
    }

    Photometer(final ChannelDescription description, final PayloadDescription payload, final ChannelTable table,
               final BuiltInstrument built) {
        super(description, payload, table, built);
    }

    @Override
    public ChannelKind kind() {
        return ChannelKind.PHOTOMETER;
    }

    @Override
    protected Layout layout() {
        final var wlMin = description.wlMin();
        final var wlMax = description.wlMax();
        final var centre = 0.5 * (wlMin + wlMax);

        final var qeData = loadQe();
        final var psf = psf(centre);
        final var windowSize = windowSize(psf, centre);
        log.debug("Photometer [{}]: centre {} um, window {} px", name(), centre, windowSize);

        final var table = ChannelTable.forChannel(name(), 1)
                .with(WAVELENGTH, new double[]{centre})
                .with(BANDWIDTH, new double[]{wlMax - wlMin})
                .with(LEFT_BIN_EDGE, new double[]{wlMin})
                .with(RIGHT_BIN_EDGE, new double[]{wlMax})
                .with("QE", qeData.interpolate(new double[]{centre}, 0.0))
                .with(WINDOW_SIZE, new double[]{windowSize});

        final var artifacts = BuiltInstrument.builder()
                .qeData(qeData)
                .prf(psf.prf())
                .pixelResponse(psf.pixelResponse())
                .extent(psf.extent())
                .windowSizePx(new double[]{windowSize});
        return new Layout(table, artifacts);
    }

    private PointSpreadFunction.BinnedPsf psf(final double wavelength) {
        if (description.psf() != null && !description.psf().isAiry()) {
            throw new ConfigurationException("channel [" + name() + "]: PSF format '" + description.psf().format()
                    + "' is not supported, only the analytic airy model is available");
        }
        return PointSpreadFunction.airy(description.fnumX(), description.fnumY(), wavelength,
                description.detector().deltaPix());
    }

    /**
     * Photometric window [pixels] from the aperture radius, given directly or found from the
     * requested encircled energy.
     */
    private double windowSize(final PointSpreadFunction.BinnedPsf psf, final double wavelength) {
        final var aperture = description.aperture();
        if (aperture == null) {
            throw new ConfigurationException("photometer [" + name() + "] has no aperture");
        }
        final var deltaPix = description.detector().deltaPix();
        final var footprint = description.fnumX() * wavelength * description.fnumY() * wavelength
                / (deltaPix * deltaPix);
        if (aperture.radius() != null) {
            return aperture.radius() * aperture.radius() * footprint;
        }
        if (aperture.encircledEnergy() != null) {
            final var radius = PointSpreadFunction.apertureRadius(psf, aperture.encircledEnergy());
            log.debug("Photometer [{}]: {} encircled energy within {} lambda*F", name(),
                    aperture.encircledEnergy(), radius);
            return Math.PI * radius * radius * footprint;
        }
        throw new ConfigurationException("photometer [" + name() + "] aperture needs radius or EnE");
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

        final var starFlux = SpectralMath.trapz(SpectralMath.multiply(window, flux), wl);
        final var density = new double[wl.length];
        for (int i = 0; i < wl.length; i++) {
            density[i] = qe[i] * flux[i] * transmission[i] * PhysicalConstants.photonsPerJoule(wl[i]);
        }
        final var starSignal = payload.telescopeArea() * SpectralMath.trapz(density, wl);

        final var aperture = description.aperture();
        final double inAperture;
        if (aperture.apertureCorrection() != null) {
            inAperture = starSignal * aperture.apertureCorrection();
        } else if (aperture.encircledEnergy() != null) {
            inAperture = starSignal * aperture.encircledEnergy();
        } else {
            inAperture = starSignal;
        }
        final var maxInPixel = built().prfPeak() * starSignal;
        log.debug("Target [{}] in [{}]: star signal {} ct/s, in aperture {} ct/s", target.name(), name(),
                starSignal, inAperture);

        var out = ChannelTable.forChannel(name(), 1);
        final var skyTransmission = foregroundTransmission(target);
        if (skyTransmission.isPresent()) {
            out = out.with("foreground_transmission", skyTransmission.get());
        }
        return out.with("starFlux", new double[]{starFlux})
                .with("starSignal", new double[]{starSignal})
                .with("star_signal_inAperture", new double[]{inAperture})
                .with("star_MaxSignal_inPixel", new double[]{maxInPixel});
    }
}
