package io.github.jakubt4.lumen.description;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Photometric aperture: either a fixed radius (in λF units) or a target encircled energy.
 */
public record ApertureDescription(Double radius,
                                  @JsonProperty("EnE") Double encircledEnergy,
                                  Double apertureCorrection) {

    public static ApertureDescription ofRadius(final double radius) {
        return new ApertureDescription(radius, null, null);
    }

    public static ApertureDescription ofEncircledEnergy(final double encircledEnergy) {
        return new ApertureDescription(null, encircledEnergy, null);
    }
}
