package io.github.jakubt4.lumen.description;

import lombok.Builder;

import java.util.List;

/**
 * Payload wide settings shared by every channel and target.
 *
 * @param wlMin          shortest wavelength simulated [µm]
 * @param wlMax          longest wavelength simulated [µm]
 * @param sourceSpectrum stellar spectrum model
 * @param foregrounds    diffuse foregrounds in registration order, farthest from the aperture first
 * @param customNoise    extra noise terms applied to every channel
 */
@Builder
public record CommonDescription(Double wlMin, Double wlMax, SourceDescription sourceSpectrum,
                                List<ForegroundDescription> foregrounds,
                                List<CustomNoiseDescription> customNoise) {

    public CommonDescription {
        if (wlMin == null || wlMax == null || wlMin >= wlMax) {
            throw new ConfigurationException("common wlMin < wlMax is required");
        }
        sourceSpectrum = sourceSpectrum == null ? SourceDescription.planck() : sourceSpectrum;
        foregrounds = foregrounds == null ? List.of() : List.copyOf(foregrounds);
        customNoise = customNoise == null ? List.of() : List.copyOf(customNoise);
    }
}
