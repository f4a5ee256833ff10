package io.github.jakubt4.lumen.description;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * Detector properties of a channel.
 *
 * @param wlMin          shortest wavelength the detector responds to [µm]
 * @param cutOff         cut-off wavelength [µm]
 * @param deltaPix       pixel pitch [µm]
 * @param qe             quantum efficiency
 * @param wellDepth      full well [ct]
 * @param wellDepthFraction fraction of the well used to set the frame time
 * @param frameTime      fixed frame time [s], overrides the well-depth rule
 * @param ndrFrequency   non-destructive read frequency [Hz]
 * @param darkCurrent    dark current [ct/s/pixel]
 * @param readNoise      read noise [ct]
 * @param multiaccumM    reads averaged per group, 1 when absent
 * @param groupFrameTime time spent reading one group [s], 0 when absent
 */
@Builder
public record DetectorDescription(
        Double wlMin,
        Double cutOff,
        Double deltaPix,
        QuantumEfficiencyDescription qe,
        Double wellDepth,
        @JsonProperty("fWellDepth") Double wellDepthFraction,
        Double frameTime,
        @JsonProperty("freqNDR") Double ndrFrequency,
        Double darkCurrent,
        Double readNoise,
        Integer multiaccumM,
        Double groupFrameTime) {

    public DetectorDescription {
        if (wlMin == null || cutOff == null) {
            throw new ConfigurationException("detector wlMin and cutOff are required");
        }
        if (deltaPix == null || deltaPix <= 0.0) {
            throw new ConfigurationException("detector deltaPix must be positive");
        }
    }

    /**
     * Pixel area [m^2].
     */
    public double pixelArea() {
        final var side = deltaPix * 1.0e-6;
        return side * side;
    }
}
