package io.github.jakubt4.lumen.description;

import io.github.jakubt4.lumen.instrument.ChannelKind;
import lombok.Builder;

import java.util.List;

/**
 * One instrument channel as written in the payload.
 *
 * @param name                     channel name, unique in the payload
 * @param kind                     photometer or spectrometer
 * @param wlMin                    channel band lower edge [µm]
 * @param wlMax                    channel band upper edge [µm]
 * @param targetR                  spectral binning, spectrometers only
 * @param wlSolution               pixel position ({@code x} [µm]) against {@code Wavelength}, spectrometers only
 * @param detector                 detector properties
 * @param fnumX                    F-number along the dispersion direction
 * @param fnumY                    F-number across the dispersion direction
 * @param aperture                 photometric aperture, photometers only
 * @param psf                      PSF source
 * @param encircledEnergySolution  aperture radius ({@code r}, λF units) against {@code Wavelength}
 * @param windowSpatialScale       multiplier of the spatial window width
 * @param wfeRms                   rms wavefront error [µm] entering the Strehl ratio
 * @param noiseX                   fractional photon-noise excess
 * @param customNoise              channel specific extra noise terms
 * @param optics                   channel optical elements
 */
@Builder
public record ChannelDescription(
        String name,
        ChannelKind kind,
        Double wlMin,
        Double wlMax,
        ResolvingPowerDescription targetR,
        TabulatedData wlSolution,
        DetectorDescription detector,
        Double fnumX,
        Double fnumY,
        ApertureDescription aperture,
        PsfDescription psf,
        TabulatedData encircledEnergySolution,
        Double windowSpatialScale,
        Double wfeRms,
        Double noiseX,
        List<CustomNoiseDescription> customNoise,
        OpticsDescription optics) {

    public ChannelDescription {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("channel without a name");
        }
        if (kind == null) {
            throw new ConfigurationException("channel '" + name + "' has no kind");
        }
        if (wlMin == null || wlMax == null || wlMin >= wlMax) {
            throw new ConfigurationException("channel '" + name + "' needs wlMin < wlMax");
        }
        if (detector == null) {
            throw new ConfigurationException("channel '" + name + "' has no detector");
        }
        if (fnumX == null) {
            throw new ConfigurationException("channel '" + name + "' has no fnumX");
        }
        if (fnumY == null) {
            fnumY = fnumX;
        }
        customNoise = customNoise == null ? List.of() : List.copyOf(customNoise);
        optics = optics == null ? OpticsDescription.empty() : optics;
    }
}
